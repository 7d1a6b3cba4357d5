package simulator.cache;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Pseudo-random victim selection. The victim is a murmur3 hash of a draw
 * counter, so runs with the same seed are reproducible. Every hit or invalidate
 * advances the counter, which keeps same-step allocations from landing on the
 * same way twice in a row.
 */
public final class RandomReplacement implements ReplacementPolicy {

	/** Each instance made by the factory gets its own seed derived from {@code seed}. */
	public static ReplacementPolicy.Factory factory(final long seed) {
		return new ReplacementPolicy.Factory() {
			private int instances = 0;

			@Override
			public ReplacementPolicy create(int ways) {
				return new RandomReplacement(ways, (int) seed + 31 * instances++);
			}
		};
	}

	private final int ways;
	private final HashFunction hash;
	private long committedDraws;
	private long draws;

	public RandomReplacement(int ways, int seed) {
		Preconditions.checkArgument(ways >= 1, "need at least 1 way, got %s", ways);
		this.ways = ways;
		this.hash = Hashing.murmur3_32_fixed(seed);
	}

	@Override
	public int ways() {
		return ways;
	}

	@Override
	public void hit(int way) {
		draws++;
	}

	@Override
	public void invalidate(int way) {
		draws++;
	}

	@Override
	public int allocate() {
		int h = hash.hashLong(draws).asInt();
		return Math.floorMod(h, ways);
	}

	@Override
	public void commit() {
		committedDraws = draws;
	}

	@Override
	public void reset() {
		committedDraws = 0;
		draws = 0;
	}

	@Override
	public String toString() {
		return "random[" + committedDraws + "]";
	}
}
