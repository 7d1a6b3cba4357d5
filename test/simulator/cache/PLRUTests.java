package simulator.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

public final class PLRUTests {

	PseudoLruReplacement plru;

	@Before
	public void setUp() throws Exception {
		plru = new PseudoLruReplacement(4);
	}

	/** A miss: take the victim and mark it used, as the cache does. */
	private static int allocate(ReplacementPolicy p) {
		int w = p.allocate();
		p.hit(w);
		p.commit();
		return w;
	}

	@Test
	public void testAllocationOrderFromReset() {
		assertEquals(3, allocate(plru));
		assertEquals(1, allocate(plru));
		assertEquals(2, allocate(plru));
		assertEquals(0, allocate(plru));
	}

	@Test
	public void testAllocateDoesNotChangeState() {
		int first = plru.allocate();
		assertEquals(first, plru.allocate());
		assertEquals(first, plru.allocate());
	}

	@Test
	public void testEveryWayAllocatedOnce() {
		for (int ways = 2; ways <= 32; ways *= 2) {
			PseudoLruReplacement p = new PseudoLruReplacement(ways);
			Set<Integer> seen = new HashSet<Integer>();
			for (int i = 0; i < ways; i++) {
				assertTrue("way allocated twice with " + ways + " ways", seen.add(allocate(p)));
			}
			assertEquals(ways, seen.size());
		}
	}

	@Test
	public void testHitWayIsNotNextVictim() {
		for (int i = 0; i < 4; i++) {
			allocate(plru);
		}
		for (int w = 0; w < 4; w++) {
			plru.hit(w);
			plru.commit();
			assertNotEquals(w, plru.allocate());
		}
	}

	@Test
	public void testInvalidatedWayIsNextVictim() {
		for (int i = 0; i < 4; i++) {
			allocate(plru);
		}
		plru.invalidate(1);
		assertEquals(1, plru.allocate());
		plru.invalidate(2);
		assertEquals(2, plru.allocate());
	}

	@Test
	public void testCommitPublishesWorkingState() {
		plru.hit(3);
		assertTrue(plru.committedTree().isEmpty());
		assertEquals("plru[000]", plru.toString());
		// the next allocation already sees the uncommitted hit
		assertEquals(1, plru.allocate());
		plru.commit();
		BitSet expected = new BitSet();
		expected.set(0);
		expected.set(2);
		assertEquals(expected, plru.committedTree());
		assertEquals("plru[101]", plru.toString());
	}

	@Test
	public void testResetRestoresInitialOrder() {
		allocate(plru);
		allocate(plru);
		plru.reset();
		assertEquals(3, allocate(plru));
		assertEquals(1, allocate(plru));
	}

	@Test
	public void testTreeFunctionsArePure() {
		BitSet tree = new BitSet();
		BitSet touched = PseudoLruReplacement.touch(tree, 2, 3, false);
		assertTrue(tree.isEmpty());
		// root and right child both point left, away from way 3
		assertTrue(touched.get(0));
		assertTrue(touched.get(2));
		assertEquals(0, PseudoLruReplacement.victim(touched, 2) & 2);
	}

	@Test
	public void testTwoWays() {
		PseudoLruReplacement p = new PseudoLruReplacement(2);
		assertEquals(1, allocate(p));
		assertEquals(0, allocate(p));
		assertEquals(1, allocate(p));
		p.hit(1);
		assertEquals(0, p.allocate());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsNonPowerOfTwo() {
		new PseudoLruReplacement(6);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsSingleWay() {
		new PseudoLruReplacement(1);
	}
}
