package simulator.cache;

import java.util.LinkedList;

import com.google.common.base.Preconditions;

/**
 * True LRU. Ways are kept in a list ordered from MRU (front) to LRU (back); out
 * of reset the order is 0, 1, ..., ways-1 so the highest way goes first.
 */
public final class LruReplacement implements ReplacementPolicy {

	public static final ReplacementPolicy.Factory FACTORY = new ReplacementPolicy.Factory() {
		@Override
		public ReplacementPolicy create(int ways) {
			return new LruReplacement(ways);
		}
	};

	private final int ways;
	private LinkedList<Integer> committed;
	private LinkedList<Integer> working;

	public LruReplacement(int ways) {
		Preconditions.checkArgument(ways >= 1, "LRU needs at least 1 way, got %s", ways);
		this.ways = ways;
		reset();
	}

	@Override
	public int ways() {
		return ways;
	}

	@Override
	public void hit(int way) {
		checkWay(way);
		working.remove(Integer.valueOf(way));
		working.addFirst(way);
	}

	@Override
	public void invalidate(int way) {
		checkWay(way);
		working.remove(Integer.valueOf(way));
		working.addLast(way);
	}

	@Override
	public int allocate() {
		return working.getLast();
	}

	@Override
	public void commit() {
		committed = new LinkedList<Integer>(working);
	}

	@Override
	public void reset() {
		committed = new LinkedList<Integer>();
		for (int w = 0; w < ways; w++) {
			committed.add(w);
		}
		working = new LinkedList<Integer>(committed);
	}

	private void checkWay(int way) {
		assert way >= 0 && way < ways : "way " + way + " out of range";
	}

	@Override
	public String toString() {
		return "lru" + committed;
	}
}
