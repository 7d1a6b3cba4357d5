package simulator.cache;

/** Replacement policies selectable from the command line. */
public enum ReplacementKind {
	PLRU("plru"), LRU("lru"), INVALID_FIRST("invalid-first"), RANDOM("random");

	private final String knob;

	ReplacementKind(String knob) {
		this.knob = knob;
	}

	public ReplacementPolicy.Factory factory(long seed) {
		switch (this) {
		case PLRU:
			return PseudoLruReplacement.FACTORY;
		case LRU:
			return LruReplacement.FACTORY;
		case INVALID_FIRST:
			return InvalidFirstReplacement.FACTORY;
		case RANDOM:
			return RandomReplacement.factory(seed);
		default:
			throw new IllegalStateException("unhandled replacement kind " + this);
		}
	}

	public static ReplacementKind fromKnob(String knob) {
		for (ReplacementKind k : values()) {
			if (k.knob.equals(knob)) {
				return k;
			}
		}
		throw new IllegalArgumentException("Invalid replacement policy: " + knob);
	}
}
