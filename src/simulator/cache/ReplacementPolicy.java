package simulator.cache;

/**
 * Chooses the victim way in one line of a cache.
 *
 * The cache reports every access as an event. Within a step the events arrive
 * in a fixed order: all invalidates, then all hits, then each allocation in
 * port order. An allocation is reported as {@link #allocate()} followed by
 * {@link #hit(int)} on the returned way, so a second allocation in the same
 * step sees the first one and picks a different way.
 *
 * Updates go to a working copy, and {@link #allocate()} reads the working
 * copy. {@link #commit()} only snapshots it for {@code toString()} and state
 * dumps; nothing rolls the working copy back.
 */
public interface ReplacementPolicy {

	interface Factory {
		ReplacementPolicy create(int ways);
	}

	int ways();

	/** Move the way away from eviction. */
	void hit(int way);

	/** Move the way toward eviction. */
	void invalidate(int way);

	/** Return the way the next allocation should fill. Does not change state. */
	int allocate();

	/** Snapshot the working state at the step boundary, for inspection. */
	void commit();

	/** Return to the power-on state. */
	void reset();
}
