package simulator.cache;

public final class MaxCounter extends Counter {

	MaxCounter(String name) {
		super(name);
	}

	/** Keep the larger of the current maximum and {@code v}. */
	public void observe(double v) {
		stat = Math.max(stat, v);
	}
}
