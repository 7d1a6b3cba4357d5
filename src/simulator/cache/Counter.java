package simulator.cache;

public abstract class Counter {
	protected double stat;
	protected final String name;

	Counter(String n) {
		this.name = n;
	}

	public String name() {
		return name;
	}

	public double get() {
		return stat;
	}

	public void set(double v) {
		stat = v;
	}

	@Override
	public String toString() {
		return name + "=" + stat;
	}
}
