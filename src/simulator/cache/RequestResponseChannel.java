package simulator.cache;

/**
 * A component sitting between an upstream requester and a downstream memory.
 * Requests flow down, responses flow back up, each over a ready/valid
 * handshake. Every call to {@link #step(ChannelInputs)} evaluates one clock
 * cycle and commits its state at the end.
 */
public abstract class RequestResponseChannel {

	protected final String name;
	protected final ChannelStats stats;
	private long steps = 0;

	protected RequestResponseChannel(String name) {
		this.name = name;
		this.stats = new ChannelStats(name);
	}

	public String name() {
		return name;
	}

	public ChannelStats stats() {
		return stats;
	}

	public long steps() {
		return steps;
	}

	public final ChannelOutputs step(ChannelInputs in) {
		ChannelOutputs out = evaluateAndCommit(in);
		steps++;
		stats.pc_Steps.incr();
		if (in.upstreamRequest != null) {
			stats.pc_UpstreamOffers.incr();
		}
		if (out.downstreamRequest != null) {
			stats.pc_ForwardedRequests.incr();
		}
		if (out.upstreamResponse != null) {
			stats.pc_UpstreamResponses.incr();
		}
		return out;
	}

	protected abstract ChannelOutputs evaluateAndCommit(ChannelInputs in);

	/** True when no request is in flight inside the channel. */
	public abstract boolean idle();
}
