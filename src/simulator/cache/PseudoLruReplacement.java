package simulator.cache;

import java.util.BitSet;

import com.google.common.base.Preconditions;

/**
 * Tree pseudo-LRU over a power-of-two number of ways.
 *
 * The tree has {@code ways - 1} internal nodes kept in heap order: node 0 is
 * the root and node n has children 2n+1 (left) and 2n+2 (right). Leaves are the
 * ways, left to right. A node bit of 0 means the right subtree holds the
 * less-recently-used way; 1 means the left subtree does. All bits start at 0,
 * so the first victim out of reset is the rightmost way.
 */
public final class PseudoLruReplacement implements ReplacementPolicy {

	public static final ReplacementPolicy.Factory FACTORY = new ReplacementPolicy.Factory() {
		@Override
		public ReplacementPolicy create(int ways) {
			return new PseudoLruReplacement(ways);
		}
	};

	private final int ways;
	private final int depth;

	private BitSet committed;
	private BitSet working;

	public PseudoLruReplacement(int ways) {
		Preconditions.checkArgument(ways >= 2, "pseudo-LRU needs at least 2 ways, got %s", ways);
		Preconditions.checkArgument(BitTwiddle.isPowerOf2(ways), "pseudo-LRU ways must be a power of 2, got %s",
				ways);
		this.ways = ways;
		this.depth = BitTwiddle.floorLog2(ways);
		this.committed = new BitSet(ways - 1);
		this.working = new BitSet(ways - 1);
	}

	@Override
	public int ways() {
		return ways;
	}

	@Override
	public void hit(int way) {
		working = touch(working, depth, way, false);
	}

	@Override
	public void invalidate(int way) {
		working = touch(working, depth, way, true);
	}

	@Override
	public int allocate() {
		return victim(working, depth);
	}

	@Override
	public void commit() {
		committed = (BitSet) working.clone();
	}

	@Override
	public void reset() {
		committed = new BitSet(ways - 1);
		working = new BitSet(ways - 1);
	}

	/** Tree bits as of the last step boundary. */
	BitSet committedTree() {
		return (BitSet) committed.clone();
	}

	/**
	 * Return a copy of {@code tree} with every node on the path to {@code way}
	 * pointing toward it (when {@code toward} is set) or away from it.
	 */
	static BitSet touch(BitSet tree, int depth, int way, boolean toward) {
		assert way >= 0 && way < (1 << depth) : "way " + way + " out of range";
		BitSet next = (BitSet) tree.clone();
		int node = 0;
		for (int level = depth - 1; level >= 0; level--) {
			boolean goesRight = ((way >> level) & 1) == 1;
			// bit set means left is LRU-ward
			next.set(node, goesRight != toward);
			node = goesRight ? 2 * node + 2 : 2 * node + 1;
		}
		return next;
	}

	/** Follow the tree bits from the root to the least-recently-used leaf. */
	static int victim(BitSet tree, int depth) {
		int node = 0;
		int way = 0;
		for (int level = 0; level < depth; level++) {
			boolean left = tree.get(node);
			way = (way << 1) | (left ? 0 : 1);
			node = left ? 2 * node + 1 : 2 * node + 2;
		}
		return way;
	}

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder("plru[");
		for (int i = 0; i < ways - 1; i++) {
			s.append(committed.get(i) ? '1' : '0');
		}
		return s.append(']').toString();
	}
}
