package simulator.cache;

/**
 * A channel without a cache: requests and responses each pass through their
 * own FIFO, adding one step of latency in each direction. Cache writes and
 * cache resets are not accepted.
 */
public class BufferedRequestResponseChannel extends RequestResponseChannel {

	protected final ReadyValidFifo<Request> requestBuffer;
	protected final ReadyValidFifo<Response> responseBuffer;

	public BufferedRequestResponseChannel(String name, int requestBufferDepth, int responseBufferDepth) {
		super(name);
		this.requestBuffer = new ReadyValidFifo<Request>(name + ".requests", requestBufferDepth);
		this.responseBuffer = new ReadyValidFifo<Response>(name + ".responses", responseBufferDepth);
	}

	@Override
	public boolean idle() {
		return requestBuffer.empty() && responseBuffer.empty();
	}

	@Override
	protected ChannelOutputs evaluateAndCommit(ChannelInputs in) {
		boolean upstreamReady = requestBuffer.ready();
		if (in.upstreamRequest != null) {
			if (upstreamReady) {
				requestBuffer.push(in.upstreamRequest);
				stats.pc_CacheMisses.incr();
			} else {
				stats.pc_StallRequestBufferFull.incr();
			}
		}
		Request downstreamRequest = in.downstreamRequestReady ? requestBuffer.pop() : null;

		boolean downstreamReady = responseBuffer.ready();
		if (in.downstreamResponse != null && downstreamReady) {
			responseBuffer.push(in.downstreamResponse);
			stats.pc_DownstreamResponses.incr();
		}
		Response upstreamResponse = in.upstreamResponseReady ? responseBuffer.pop() : null;

		requestBuffer.commit();
		responseBuffer.commit();

		stats.max_RequestBufferOccupancy.observe(requestBuffer.occupancy());
		stats.max_ResponseBufferOccupancy.observe(responseBuffer.occupancy());

		return new ChannelOutputs(upstreamReady, downstreamRequest, downstreamReady, upstreamResponse, false);
	}

	@Override
	public String toString() {
		return name + " " + requestBuffer + " " + responseBuffer;
	}
}
