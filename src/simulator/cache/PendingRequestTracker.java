package simulator.cache;

/**
 * Remembers the address of every request sent downstream, keyed by transaction
 * id, until its response comes back. Backed by a fully-associative cache whose
 * tag is the id and whose data is the address; a response retires its entry
 * with a read-with-invalidate, so the way is free again in the same step.
 */
public final class PendingRequestTracker {

	private final FullyAssociativeCache cam;

	public PendingRequestTracker(final String trackerName, final int trackerWays,
			final ReplacementPolicy.Factory policy) {
		cam = new FullyAssociativeCache(new CacheConfiguration() {
			{
				name = trackerName;
				ways = trackerWays;
				readPorts = 1;
				fillPorts = 1;
				evictionPorts = 1;
				replacement = policy;
			}
		});
	}

	public int ways() {
		return cam.ways();
	}

	public int occupancy() {
		return cam.occupancy();
	}

	public boolean full() {
		return cam.full();
	}

	public boolean empty() {
		return cam.empty();
	}

	/** Committed lookup outside of a step. */
	public boolean isPending(long id) {
		return cam.lookup(id).valid;
	}

	public TrackerStep step() {
		return new TrackerStep(cam.step());
	}

	public final class TrackerStep {
		private final Cache.CacheStep step;

		private TrackerStep(Cache.CacheStep step) {
			this.step = step;
		}

		/**
		 * Look up {@code id} and, if present, remove it at the end of this step.
		 * Returns the pending address on a hit.
		 */
		public ReadResult retire(long id) {
			return step.read(ReadRequest.lookupAndInvalidate(id));
		}

		/** Whether {@code id} is pending as of the start of this step. */
		public boolean pending(long id) {
			return step.probe(id);
		}

		/** Record a request sent downstream this step. */
		public void insert(long id, long address) {
			FillResult r = step.fill(FillRequest.store(id, address));
			assert r.accepted : cam.name() + ": insert of id " + id + " rejected";
			assert !r.eviction.valid : cam.name() + ": live entry for id " + r.eviction.address
					+ " displaced by id " + id;
		}

		public void commit() {
			step.commit();
		}
	}

	@Override
	public String toString() {
		return cam.toString();
	}
}
