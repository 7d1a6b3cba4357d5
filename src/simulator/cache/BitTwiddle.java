package simulator.cache;

public class BitTwiddle {
	public static boolean isPowerOf2(long n) {
		// thank you, Hacker's Delight!
		return n > 0 && 0 == (n & (n - 1));
	}

	public static int floorLog2(long n) {
		if (n <= 0)
			return -1;
		return 63 - Long.numberOfLeadingZeros(n);
	}
}
