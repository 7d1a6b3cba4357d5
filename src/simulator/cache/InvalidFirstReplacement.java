package simulator.cache;

import java.util.BitSet;

import com.google.common.base.Preconditions;

/**
 * Picks the lowest-numbered way not currently holding an entry. Occupancy is
 * rebuilt from the event stream alone: a hit marks a way occupied and an
 * invalidate frees it. When every way is occupied the victim is way 0.
 */
public final class InvalidFirstReplacement implements ReplacementPolicy {

	public static final ReplacementPolicy.Factory FACTORY = new ReplacementPolicy.Factory() {
		@Override
		public ReplacementPolicy create(int ways) {
			return new InvalidFirstReplacement(ways);
		}
	};

	private final int ways;
	private BitSet committed;
	private BitSet working;

	public InvalidFirstReplacement(int ways) {
		Preconditions.checkArgument(ways >= 1, "need at least 1 way, got %s", ways);
		this.ways = ways;
		this.committed = new BitSet(ways);
		this.working = new BitSet(ways);
	}

	@Override
	public int ways() {
		return ways;
	}

	@Override
	public void hit(int way) {
		assert way >= 0 && way < ways;
		working.set(way);
	}

	@Override
	public void invalidate(int way) {
		assert way >= 0 && way < ways;
		working.clear(way);
	}

	@Override
	public int allocate() {
		int free = working.nextClearBit(0);
		return free < ways ? free : 0;
	}

	@Override
	public void commit() {
		committed = (BitSet) working.clone();
	}

	@Override
	public void reset() {
		committed = new BitSet(ways);
		working = new BitSet(ways);
	}

	@Override
	public String toString() {
		return "invalid-first" + committed;
	}
}
