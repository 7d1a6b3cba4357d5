package simulator.cache;

public class SumCounter extends Counter {

	SumCounter(String name) {
		super(name);
	}

	public void incr() {
		stat++;
	}

	public void incr(double a) {
		assert a >= 0 : name + " incr " + a;
		stat += a;
	}
}
