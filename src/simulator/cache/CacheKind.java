package simulator.cache;

/** Cache organizations selectable from the command line. */
public enum CacheKind {
	FULLY("fully"), SET("set"), DIRECT("direct");

	private final String knob;

	CacheKind(String knob) {
		this.knob = knob;
	}

	public Cache build(CacheConfiguration config) {
		switch (this) {
		case FULLY:
			return new FullyAssociativeCache(config);
		case SET:
			return new SetAssociativeCache(config);
		case DIRECT:
			return new DirectMappedCache(config);
		default:
			throw new IllegalStateException("unhandled cache kind " + this);
		}
	}

	public static CacheKind fromKnob(String knob) {
		for (CacheKind k : values()) {
			if (k.knob.equals(knob)) {
				return k;
			}
		}
		throw new IllegalArgumentException("Invalid cache kind: " + knob);
	}
}
