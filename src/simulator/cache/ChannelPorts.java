package simulator.cache;

/**
 * Everything driven into a channel for one step. A null payload means the
 * corresponding valid signal is low.
 */
final class ChannelInputs {
	Request upstreamRequest = null;
	boolean downstreamRequestReady = false;
	Response downstreamResponse = null;
	boolean upstreamResponseReady = false;
	CacheWrite cacheWrite = null;
	boolean resetCache = false;

	static ChannelInputs idle() {
		return new ChannelInputs();
	}

	ChannelInputs upstreamRequest(Request r) {
		upstreamRequest = r;
		return this;
	}

	ChannelInputs downstreamRequestReady(boolean ready) {
		downstreamRequestReady = ready;
		return this;
	}

	ChannelInputs downstreamResponse(Response r) {
		downstreamResponse = r;
		return this;
	}

	ChannelInputs upstreamResponseReady(boolean ready) {
		upstreamResponseReady = ready;
		return this;
	}

	ChannelInputs cacheWrite(CacheWrite w) {
		cacheWrite = w;
		return this;
	}

	ChannelInputs resetCache(boolean reset) {
		resetCache = reset;
		return this;
	}
}

/**
 * What a channel drove during one step. Payloads are non-null exactly when a
 * transfer happened (valid and ready both high).
 */
final class ChannelOutputs {
	boolean upstreamRequestReady;
	Request downstreamRequest;
	boolean downstreamResponseReady;
	Response upstreamResponse;
	boolean cacheWriteReady;

	ChannelOutputs(boolean upstreamRequestReady, Request downstreamRequest, boolean downstreamResponseReady,
			Response upstreamResponse, boolean cacheWriteReady) {
		this.upstreamRequestReady = upstreamRequestReady;
		this.downstreamRequest = downstreamRequest;
		this.downstreamResponseReady = downstreamResponseReady;
		this.upstreamResponse = upstreamResponse;
		this.cacheWriteReady = cacheWriteReady;
	}

	@Override
	public String toString() {
		return "upRdy=" + upstreamRequestReady + " down=" + downstreamRequest + " downRspRdy="
				+ downstreamResponseReady + " up=" + upstreamResponse;
	}
}
