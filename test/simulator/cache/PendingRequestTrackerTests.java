package simulator.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;

public final class PendingRequestTrackerTests {

	PendingRequestTracker tracker;

	@Before
	public void setUp() throws Exception {
		tracker = new PendingRequestTracker("tracker", 2, InvalidFirstReplacement.FACTORY);
	}

	private static void insert(PendingRequestTracker t, long id, long address) {
		PendingRequestTracker.TrackerStep s = t.step();
		s.insert(id, address);
		s.commit();
	}

	private static ReadResult retire(PendingRequestTracker t, long id) {
		PendingRequestTracker.TrackerStep s = t.step();
		ReadResult r = s.retire(id);
		s.commit();
		return r;
	}

	@Test
	public void testInsertThenRetire() {
		insert(tracker, 3, 0x99);
		assertTrue(tracker.isPending(3));
		assertEquals(1, tracker.occupancy());

		ReadResult r = retire(tracker, 3);
		assertTrue(r.valid);
		assertEquals(0x99, r.data);
		assertFalse(tracker.isPending(3));
		assertTrue(tracker.empty());

		assertFalse(retire(tracker, 3).valid);
	}

	@Test
	public void testPendingSeesStartOfStep() {
		PendingRequestTracker.TrackerStep s = tracker.step();
		s.insert(5, 0x50);
		assertFalse(s.pending(5));
		s.commit();

		s = tracker.step();
		assertTrue(s.retire(5).valid);
		assertTrue(s.pending(5));
		s.commit();
		assertFalse(tracker.isPending(5));
	}

	@Test
	public void testRetireMakesRoomInSameStep() {
		insert(tracker, 1, 0x10);
		insert(tracker, 2, 0x20);
		assertTrue(tracker.full());

		PendingRequestTracker.TrackerStep s = tracker.step();
		assertEquals(0x10, s.retire(1).data);
		s.insert(3, 0x30);
		s.commit();

		assertTrue(tracker.full());
		assertFalse(tracker.isPending(1));
		assertTrue(tracker.isPending(2));
		assertTrue(tracker.isPending(3));
	}

	@Test
	public void testInvalidFirstNeverDisplacesPendingEntries() {
		PendingRequestTracker t = new PendingRequestTracker("t4", 4, InvalidFirstReplacement.FACTORY);
		for (long id = 10; id < 14; id++) {
			insert(t, id, id * 0x100);
		}
		retire(t, 10);
		retire(t, 12);
		insert(t, 20, 0x2000);
		insert(t, 21, 0x2100);
		for (long id : new long[] { 11, 13, 20, 21 }) {
			assertTrue("id " + id + " lost", t.isPending(id));
		}
	}

	@Test(expected = AssertionError.class)
	public void testPseudoLruCanDisplacePendingEntries() {
		boolean assertsEnabled = false;
		assert assertsEnabled = true;
		Assume.assumeTrue(assertsEnabled);

		// same traffic as above; the tree points at a live entry on the last insert
		PendingRequestTracker t = new PendingRequestTracker("t4", 4, PseudoLruReplacement.FACTORY);
		for (long id = 10; id < 14; id++) {
			insert(t, id, id * 0x100);
		}
		retire(t, 10);
		retire(t, 12);
		insert(t, 20, 0x2000);
		insert(t, 21, 0x2100);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsSingleWay() {
		new PendingRequestTracker("t1", 1, InvalidFirstReplacement.FACTORY);
	}
}
