package simulator.cache;

import java.util.ArrayDeque;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Downstream responder for the simulator. Answers every request in arrival
 * order, {@code latency} steps after accepting it. The value at an address is a
 * fixed hash of the address, so any cached copy can be checked against it.
 */
final class BackingMemory {

	private static final class InFlight {
		final Response response;
		final long readyAt;

		InFlight(Response response, long readyAt) {
			this.response = response;
			this.readyAt = readyAt;
		}
	}

	private final HashFunction contents;
	private final int latency;
	private final int nonCacheableEvery;
	private final ArrayDeque<InFlight> inFlight = new ArrayDeque<InFlight>();
	private long served = 0;

	/**
	 * @param nonCacheableEvery mark every n-th response non-cacheable; 0 for
	 *                          never
	 */
	BackingMemory(long seed, int latency, int nonCacheableEvery) {
		Preconditions.checkArgument(latency >= 1, "memory latency must be at least 1, got %s", latency);
		Preconditions.checkArgument(nonCacheableEvery >= 0, "negative non-cacheable period %s", nonCacheableEvery);
		this.contents = Hashing.murmur3_128((int) seed);
		this.latency = latency;
		this.nonCacheableEvery = nonCacheableEvery;
	}

	long valueAt(long address) {
		return contents.hashLong(address).asLong();
	}

	void accept(Request r, long now) {
		served++;
		boolean nonCacheable = nonCacheableEvery > 0 && served % nonCacheableEvery == 0;
		inFlight.addLast(new InFlight(new Response(r.id, valueAt(r.address), nonCacheable), now + latency));
	}

	/** Oldest response whose latency has elapsed, or null. */
	Response peek(long now) {
		InFlight head = inFlight.peekFirst();
		if (head == null || head.readyAt > now) {
			return null;
		}
		return head.response;
	}

	void pop() {
		inFlight.removeFirst();
	}

	boolean idle() {
		return inFlight.isEmpty();
	}

	int outstanding() {
		return inFlight.size();
	}
}
