package simulator.cache;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedList;
import java.util.List;

/** Per-channel event counts. */
public class ChannelStats {

	/** List of all the stats that have been created for this channel. */
	protected final List<Counter> AllCounters = new LinkedList<Counter>();

	private final String component;

	final SumCounter pc_Steps = sum("pc_Steps");
	final SumCounter pc_UpstreamOffers = sum("pc_UpstreamOffers");
	final SumCounter pc_CacheHits = sum("pc_CacheHits");
	final SumCounter pc_CacheMisses = sum("pc_CacheMisses");

	// why an offered upstream request was not accepted
	final SumCounter pc_StallResponseBufferFull = sum("pc_StallResponseBufferFull");
	final SumCounter pc_StallRequestBufferFull = sum("pc_StallRequestBufferFull");
	final SumCounter pc_StallTrackerFull = sum("pc_StallTrackerFull");
	final SumCounter pc_StallIdPending = sum("pc_StallIdPending");
	final SumCounter pc_StallDownstreamNotReady = sum("pc_StallDownstreamNotReady");
	final SumCounter pc_StallCacheWrite = sum("pc_StallCacheWrite");
	final SumCounter pc_StallDownstreamResponse = sum("pc_StallDownstreamResponse");

	final SumCounter pc_ForwardedRequests = sum("pc_ForwardedRequests");
	final SumCounter pc_DownstreamResponses = sum("pc_DownstreamResponses");
	final SumCounter pc_UnmatchedResponses = sum("pc_UnmatchedResponses");
	final SumCounter pc_NonCacheableResponses = sum("pc_NonCacheableResponses");
	final SumCounter pc_UpstreamResponses = sum("pc_UpstreamResponses");
	final SumCounter pc_CacheFills = sum("pc_CacheFills");
	final SumCounter pc_CacheEvictions = sum("pc_CacheEvictions");
	final SumCounter pc_CacheWrites = sum("pc_CacheWrites");
	final SumCounter pc_CacheResets = sum("pc_CacheResets");

	final MaxCounter max_TrackerOccupancy = max("max_TrackerOccupancy");
	final MaxCounter max_ResponseBufferOccupancy = max("max_ResponseBufferOccupancy");
	final MaxCounter max_RequestBufferOccupancy = max("max_RequestBufferOccupancy");

	ChannelStats(String component) {
		this.component = component;
	}

	private SumCounter sum(String name) {
		SumCounter c = new SumCounter(name);
		AllCounters.add(c);
		return c;
	}

	private MaxCounter max(String name) {
		MaxCounter c = new MaxCounter(name);
		AllCounters.add(c);
		return c;
	}

	public String component() {
		return component;
	}

	/** Fraction of accepted upstream requests served from the cache. */
	public double hitRate() {
		double accesses = pc_CacheHits.get() + pc_CacheMisses.get();
		return accesses == 0 ? 0 : pc_CacheHits.get() / accesses;
	}

	public void dumpCounters(Writer wr, String prefix, String suffix) throws IOException {
		for (Counter c : AllCounters) {
			wr.write(prefix + "'component': '" + component + "', '" + c.name + "': " + c.stat + suffix);
		}
	}

	@Override
	public String toString() {
		return component + AllCounters;
	}
}
