package simulator.cache;

import java.io.IOException;
import java.io.Writer;

/**
 * Drives one channel between a request source and a backing memory, one step
 * at a time, and checks every response that comes back.
 */
public class Simulation {

	public enum ChannelKind {
		CACHED, BUFFERED
	}

	/**
	 * Arguments to the Simulation ctor. We encode these values as abstract
	 * methods so that we can't forget to initialize one of them. The values get
	 * initialized by creating an anonymous subclass that is forced to override all
	 * these methods.
	 */
	static abstract class SimulationParams {
		abstract ChannelKind channelKind();

		abstract CacheKind cacheKind();

		/** Geometry and policy of the channel's data cache */
		abstract CacheConfiguration cacheConfig();

		abstract int trackerWays();

		abstract int responseBufferDepth();

		/** Only used by the buffered channel */
		abstract int requestBufferDepth();

		abstract int downstreamLatency();

		/** Every n-th memory response is non-cacheable; 0 disables */
		abstract int nonCacheableEvery();

		abstract long seed();

		/** Give up if the run has not drained after this many steps */
		abstract long maxSteps();

		abstract RequestSource requests();
	}

	final SimulationParams params;
	final RequestResponseChannel channel;
	final BackingMemory memory;
	final RequestSource source;
	final ResponseChecker checker = new ResponseChecker();

	private long now = 0;

	public Simulation(SimulationParams params) {
		this.params = params;
		this.source = params.requests();
		this.memory = new BackingMemory(params.seed(), params.downstreamLatency(), params.nonCacheableEvery());
		switch (params.channelKind()) {
		case CACHED:
			channel = new CachedRequestResponseChannel("channel", params.cacheKind().build(params.cacheConfig()),
					params.trackerWays(), InvalidFirstReplacement.FACTORY, params.responseBufferDepth());
			break;
		case BUFFERED:
			channel = new BufferedRequestResponseChannel("channel", params.requestBufferDepth(),
					params.responseBufferDepth());
			break;
		default:
			throw new IllegalStateException("unhandled channel kind " + params.channelKind());
		}
	}

	public long now() {
		return now;
	}

	public RequestResponseChannel channel() {
		return channel;
	}

	public long delivered() {
		return checker.delivered();
	}

	public long mismatches() {
		return checker.mismatches();
	}

	boolean finished() {
		return source.exhausted() && checker.outstanding() == 0 && memory.idle() && channel.idle();
	}

	/** Step until every request has been answered. Returns the number of steps taken. */
	public long run() {
		while (!finished()) {
			if (now >= params.maxSteps()) {
				throw new IllegalStateException("simulation did not drain after " + now + " steps: "
						+ checker.outstanding() + " responses outstanding, " + memory.outstanding()
						+ " in memory" + System.getProperty("line.separator") + channel);
			}
			step();
		}
		return now;
	}

	void step() {
		Request offer = source.peek();
		Response fromMemory = memory.peek(now);

		ChannelOutputs out = channel.step(new ChannelInputs().upstreamRequest(offer).downstreamRequestReady(true)
				.downstreamResponse(fromMemory).upstreamResponseReady(true));

		if (offer != null && out.upstreamRequestReady) {
			checker.expect(offer.id, memory.valueAt(offer.address));
			source.advance();
		}
		if (fromMemory != null && out.downstreamResponseReady) {
			memory.pop();
		}
		if (out.downstreamRequest != null) {
			memory.accept(out.downstreamRequest, now);
		}
		if (out.upstreamResponse != null && !checker.deliver(out.upstreamResponse)) {
			System.err.println(CacheSim.prefix + "step " + now + ": unexpected " + out.upstreamResponse);
		}
		now++;
	}

	public void dumpStats(Writer wr, String prefix, String suffix) throws IOException {
		channel.stats().dumpCounters(wr, prefix, suffix);
		wr.write(prefix + "'component': 'simulation', 'Steps': " + (double) now + suffix);
		wr.write(prefix + "'component': 'simulation', 'Delivered': " + (double) checker.delivered() + suffix);
		wr.write(prefix + "'component': 'simulation', 'Mismatches': " + (double) checker.mismatches() + suffix);
		wr.write(prefix + "'component': 'simulation', 'HitRate': " + channel.stats().hitRate() + suffix);
	}
}
