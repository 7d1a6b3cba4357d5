package simulator.cache;

import java.util.Random;

import com.google.common.base.Preconditions;

/**
 * Synthetic traffic: {@code hotFraction} of requests go to a small set of hot
 * addresses and the rest are uniform over the address space. Ids are handed out
 * round-robin.
 */
final class RandomRequestSource extends RequestSource {

	private final Random rng;
	private final int total;
	private final int ids;
	private final long addressSpace;
	private final long[] hot;
	private final double hotFraction;

	private int issued = 0;
	private Request current;

	RandomRequestSource(long seed, int total, int ids, long addressSpace, int hotAddresses, double hotFraction) {
		Preconditions.checkArgument(total >= 0, "negative request count %s", total);
		Preconditions.checkArgument(ids >= 1, "need at least one id, got %s", ids);
		Preconditions.checkArgument(addressSpace >= 1, "address space must be positive, got %s", addressSpace);
		Preconditions.checkArgument(hotAddresses >= 0, "negative hot address count %s", hotAddresses);
		Preconditions.checkArgument(hotFraction >= 0 && hotFraction <= 1, "hot fraction %s not in [0,1]",
				hotFraction);
		this.rng = new Random(seed);
		this.total = total;
		this.ids = ids;
		this.addressSpace = addressSpace;
		this.hotFraction = hotAddresses == 0 ? 0 : hotFraction;
		this.hot = new long[hotAddresses];
		for (int i = 0; i < hotAddresses; i++) {
			hot[i] = nextAddress();
		}
		current = generate();
	}

	private long nextAddress() {
		return (rng.nextLong() & Long.MAX_VALUE) % addressSpace;
	}

	private Request generate() {
		if (issued >= total) {
			return null;
		}
		long address = rng.nextDouble() < hotFraction ? hot[rng.nextInt(hot.length)] : nextAddress();
		return new Request(issued % ids, address);
	}

	@Override
	Request peek() {
		return current;
	}

	@Override
	void advance() {
		assert current != null;
		issued++;
		current = generate();
	}
}
