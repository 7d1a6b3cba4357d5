package simulator.cache;

import com.google.common.base.Preconditions;

/**
 * A request/response channel that answers repeated reads from a local cache and
 * forwards misses downstream.
 *
 * Each step resolves at most one upstream request and at most one downstream
 * response:
 * <ul>
 * <li>a downstream response whose id is pending retires its tracker entry,
 * fills the cache with the data at the pending address and is queued for
 * upstream; it has priority over a cache hit for the single response-buffer
 * write;</li>
 * <li>an upstream request that hits is answered from the cache when the buffer
 * has room;</li>
 * <li>an upstream request that misses is forwarded downstream and recorded in
 * the tracker, provided the tracker has a free way (counting one freed this
 * step) and its id is not already pending.</li>
 * </ul>
 * A direct cache write, when present, takes the cache's fill port for the step
 * and holds off both the upstream request and the downstream response.
 */
public class CachedRequestResponseChannel extends RequestResponseChannel {

	protected final Cache cache;
	protected final PendingRequestTracker tracker;
	protected final ReadyValidFifo<Response> responseBuffer;

	/** Defaults: fully-associative pseudo-LRU cache, invalid-first tracker. */
	public CachedRequestResponseChannel(final String channelName, final int cacheWays, int trackerWays,
			int responseBufferDepth) {
		this(channelName, new FullyAssociativeCache(new CacheConfiguration() {
			{
				name = channelName + ".cache";
				ways = cacheWays;
				evictionPorts = 1;
			}
		}), trackerWays, InvalidFirstReplacement.FACTORY, responseBufferDepth);
	}

	public CachedRequestResponseChannel(String name, Cache cache, int trackerWays,
			ReplacementPolicy.Factory trackerPolicy, int responseBufferDepth) {
		super(name);
		Preconditions.checkNotNull(cache);
		this.cache = cache;
		this.tracker = new PendingRequestTracker(name + ".tracker", trackerWays, trackerPolicy);
		this.responseBuffer = new ReadyValidFifo<Response>(name + ".responses", responseBufferDepth);
	}

	public Cache cache() {
		return cache;
	}

	public PendingRequestTracker tracker() {
		return tracker;
	}

	public ReadyValidFifo<Response> responseBuffer() {
		return responseBuffer;
	}

	@Override
	public boolean idle() {
		return tracker.empty() && responseBuffer.empty();
	}

	@Override
	protected ChannelOutputs evaluateAndCommit(ChannelInputs in) {
		final Request up = in.upstreamRequest;
		final Response down = in.downstreamResponse;
		final CacheWrite write = in.cacheWrite;
		final boolean writeActive = write != null;

		Cache.CacheStep cacheStep = cache.step();
		PendingRequestTracker.TrackerStep trackerStep = tracker.step();

		final boolean bufferHasRoom = responseBuffer.ready();

		ReadResult cached = cacheStep.read(up != null ? ReadRequest.lookup(up.address) : ReadRequest.idle());
		final boolean cacheHit = cached.valid && !in.resetCache;

		// only a response we actually take may retire its tracker entry
		final boolean downstreamReady = bufferHasRoom && !writeActive;
		final boolean takeResponse = down != null && downstreamReady;
		ReadResult pending = takeResponse ? trackerStep.retire(down.id) : ReadResult.MISS;
		final boolean respondFromDownstream = takeResponse && pending.valid;
		if (takeResponse && !pending.valid) {
			stats.pc_UnmatchedResponses.incr();
			System.err.println("[" + name + "] dropped downstream response for unknown id " + down.id);
		}

		final boolean idPending = up != null && trackerStep.pending(up.id);
		final boolean trackerHasRoom = !tracker.full() || respondFromDownstream;
		final boolean acceptHit = up != null && cacheHit && bufferHasRoom && !respondFromDownstream && !idPending
				&& !writeActive;
		final boolean acceptMiss = up != null && !cacheHit && in.downstreamRequestReady && trackerHasRoom
				&& !idPending && !writeActive;

		Request downstreamRequest = null;
		if (acceptMiss) {
			downstreamRequest = up;
			trackerStep.insert(up.id, up.address);
			stats.pc_CacheMisses.incr();
		} else if (acceptHit) {
			stats.pc_CacheHits.incr();
		} else if (up != null) {
			countStall(in, cacheHit, bufferHasRoom, respondFromDownstream, idPending, trackerHasRoom);
		}

		if (writeActive) {
			FillResult r = cacheStep.fill(write.invalidate ? FillRequest.invalidate(write.address)
					: FillRequest.store(write.address, write.data));
			assert r.accepted;
			if (!write.invalidate && r.eviction.valid) {
				stats.pc_CacheEvictions.incr();
			}
			stats.pc_CacheWrites.incr();
		} else if (respondFromDownstream) {
			stats.pc_DownstreamResponses.incr();
			if (down.nonCacheable) {
				stats.pc_NonCacheableResponses.incr();
			} else if (!in.resetCache) {
				FillResult r = cacheStep.fill(FillRequest.store(pending.data, down.data));
				assert r.accepted;
				stats.pc_CacheFills.incr();
				if (r.eviction.valid) {
					stats.pc_CacheEvictions.incr();
				}
			}
		}

		if (respondFromDownstream) {
			boolean pushed = responseBuffer.push(new Response(down.id, down.data, down.nonCacheable));
			assert pushed;
		} else if (acceptHit) {
			boolean pushed = responseBuffer.push(new Response(up.id, cached.data));
			assert pushed;
		}

		Response upstreamResponse = in.upstreamResponseReady ? responseBuffer.pop() : null;

		if (in.resetCache) {
			cacheStep.requestReset();
			stats.pc_CacheResets.incr();
		}

		cacheStep.commit();
		trackerStep.commit();
		responseBuffer.commit();

		stats.max_TrackerOccupancy.observe(tracker.occupancy());
		stats.max_ResponseBufferOccupancy.observe(responseBuffer.occupancy());

		return new ChannelOutputs(acceptHit || acceptMiss, downstreamRequest, downstreamReady, upstreamResponse,
				true);
	}

	private void countStall(ChannelInputs in, boolean cacheHit, boolean bufferHasRoom,
			boolean respondFromDownstream, boolean idPending, boolean trackerHasRoom) {
		if (in.cacheWrite != null) {
			stats.pc_StallCacheWrite.incr();
		} else if (idPending) {
			stats.pc_StallIdPending.incr();
		} else if (cacheHit) {
			if (!bufferHasRoom) {
				stats.pc_StallResponseBufferFull.incr();
			} else {
				assert respondFromDownstream;
				stats.pc_StallDownstreamResponse.incr();
			}
		} else if (!trackerHasRoom) {
			stats.pc_StallTrackerFull.incr();
		} else {
			assert !in.downstreamRequestReady;
			stats.pc_StallDownstreamNotReady.incr();
		}
	}

	@Override
	public String toString() {
		return name + " " + responseBuffer + System.getProperty("line.separator") + cache + tracker;
	}
}
