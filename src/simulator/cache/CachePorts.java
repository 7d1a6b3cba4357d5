package simulator.cache;

/** A lookup presented on one read port. */
final class ReadRequest {
	private static final ReadRequest IDLE = new ReadRequest(false, 0, false);

	final boolean enable;
	final long address;
	/** On a hit, remove the entry at the step boundary. */
	final boolean invalidateOnHit;

	private ReadRequest(boolean enable, long address, boolean invalidateOnHit) {
		this.enable = enable;
		this.address = address;
		this.invalidateOnHit = invalidateOnHit;
	}

	static ReadRequest idle() {
		return IDLE;
	}

	static ReadRequest lookup(long address) {
		return new ReadRequest(true, address, false);
	}

	static ReadRequest lookupAndInvalidate(long address) {
		return new ReadRequest(true, address, true);
	}

	@Override
	public String toString() {
		if (!enable) {
			return "rd(idle)";
		}
		return (invalidateOnHit ? "rwi(0x" : "rd(0x") + Long.toHexString(address) + ")";
	}
}

/** A store or invalidate presented on one fill port. */
final class FillRequest {
	private static final FillRequest IDLE = new FillRequest(false, 0, 0, false);

	final boolean enable;
	final long address;
	final long data;
	/** Store when set, invalidate otherwise. */
	final boolean store;

	private FillRequest(boolean enable, long address, long data, boolean store) {
		this.enable = enable;
		this.address = address;
		this.data = data;
		this.store = store;
	}

	static FillRequest idle() {
		return IDLE;
	}

	static FillRequest store(long address, long data) {
		return new FillRequest(true, address, data, true);
	}

	static FillRequest invalidate(long address) {
		return new FillRequest(true, address, 0, false);
	}

	@Override
	public String toString() {
		if (!enable) {
			return "fill(idle)";
		}
		if (store) {
			return "fill(0x" + Long.toHexString(address) + "=0x" + Long.toHexString(data) + ")";
		}
		return "inv(0x" + Long.toHexString(address) + ")";
	}
}

/** What a read port saw this step. */
final class ReadResult {
	static final ReadResult MISS = new ReadResult(false, 0, -1);

	final boolean valid;
	final long data;
	/** Way that matched, or -1 on a miss. */
	final int way;

	ReadResult(boolean valid, long data, int way) {
		this.valid = valid;
		this.data = data;
		this.way = way;
	}

	@Override
	public String toString() {
		return valid ? "hit(way=" + way + ", 0x" + Long.toHexString(data) + ")" : "miss";
	}
}

/** An entry pushed out of a cache. */
final class Eviction {
	static final Eviction NONE = new Eviction(false, 0, 0);

	final boolean valid;
	final long address;
	final long data;

	Eviction(boolean valid, long address, long data) {
		this.valid = valid;
		this.address = address;
		this.data = data;
	}

	@Override
	public String toString() {
		return valid ? "evict(0x" + Long.toHexString(address) + "=0x" + Long.toHexString(data) + ")" : "none";
	}
}

/** What a fill port did this step. */
final class FillResult {
	static final FillResult IDLE = new FillResult(true, false, -1, Eviction.NONE);
	static final FillResult REJECTED = new FillResult(false, false, -1, Eviction.NONE);

	/** False when a lower-numbered port already claimed the way or tag this step. */
	final boolean accepted;
	/** The address was present before this step. */
	final boolean hit;
	/** Way written or invalidated, or -1 when nothing changed. */
	final int way;
	final Eviction eviction;

	FillResult(boolean accepted, boolean hit, int way, Eviction eviction) {
		this.accepted = accepted;
		this.hit = hit;
		this.way = way;
		this.eviction = eviction;
	}

	@Override
	public String toString() {
		if (!accepted) {
			return "rejected";
		}
		return (hit ? "hit" : "miss") + "(way=" + way + ", " + eviction + ")";
	}
}
