package simulator.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

public final class FullyAssociativeCacheTests {

	static final int WAYS = 4;

	static CacheConfiguration config = new CacheConfiguration() {
		{
			name = "fa";
			ways = WAYS;
			readPorts = 2;
			fillPorts = 2;
			evictionPorts = 2;
		}
	};

	FullyAssociativeCache cache;

	@Before
	public void setUp() throws Exception {
		cache = new FullyAssociativeCache(config);
	}

	private FillResult fill(long address, long data) {
		Cache.CacheStep s = cache.step();
		FillResult r = s.fill(FillRequest.store(address, data));
		s.commit();
		return r;
	}

	private FillResult invalidate(long address) {
		Cache.CacheStep s = cache.step();
		FillResult r = s.fill(FillRequest.invalidate(address));
		s.commit();
		return r;
	}

	private ReadResult read(long address) {
		Cache.CacheStep s = cache.step();
		ReadResult r = s.read(ReadRequest.lookup(address));
		s.commit();
		return r;
	}

	@Test
	public void testFillThenRead() {
		assertTrue(cache.empty());
		FillResult f = fill(0x10, 7);
		assertTrue(f.accepted);
		assertFalse(f.hit);
		assertEquals(1, cache.occupancy());

		ReadResult r = read(0x10);
		assertTrue(r.valid);
		assertEquals(7, r.data);
		assertFalse(read(0x11).valid);
	}

	@Test
	public void testFifthFillEvictsOldest() {
		fill(0x10, 7);
		fill(0x20, 8);
		fill(0x30, 9);
		fill(0x40, 10);
		assertEquals(4, cache.occupancy());
		assertTrue(cache.full());

		FillResult f = fill(0x50, 11);
		assertTrue(f.eviction.valid);
		assertEquals(0x10, f.eviction.address);
		assertEquals(7, f.eviction.data);
		assertEquals(4, cache.occupancy());
		assertFalse(read(0x10).valid);
		assertEquals(11, read(0x50).data);
	}

	@Test
	public void testHitProtectsEntryFromEviction() {
		fill(0x10, 7);
		fill(0x20, 8);
		fill(0x30, 9);
		fill(0x40, 10);
		assertTrue(read(0x10).valid);

		FillResult f = fill(0x50, 11);
		assertTrue(f.eviction.valid);
		assertNotEquals(0x10, f.eviction.address);
		assertEquals(0x20, f.eviction.address);
		assertTrue(read(0x10).valid);
	}

	@Test
	public void testReadsSeeStartOfStep() {
		Cache.CacheStep s = cache.step();
		assertFalse(s.read(ReadRequest.lookup(0x10)).valid);
		s.fill(FillRequest.store(0x10, 7));
		assertFalse(s.probe(0x10));
		s.commit();
		assertTrue(read(0x10).valid);
	}

	@Test
	public void testStoreHitOverwrites() {
		fill(0x10, 7);
		FillResult f = fill(0x10, 70);
		assertTrue(f.hit);
		assertFalse(f.eviction.valid);
		assertEquals(1, cache.occupancy());
		assertEquals(70, read(0x10).data);
	}

	@Test
	public void testReadWithInvalidateIsAtomic() {
		fill(0x10, 7);
		Cache.CacheStep s = cache.step();
		ReadResult r = s.read(ReadRequest.lookupAndInvalidate(0x10));
		assertTrue(r.valid);
		assertEquals(7, r.data);
		s.commit();

		assertTrue(cache.empty());
		assertFalse(read(0x10).valid);
	}

	@Test
	public void testReadWithInvalidateFreesWayForSameStepFill() {
		fill(0x10, 7);
		fill(0x20, 8);
		fill(0x30, 9);
		fill(0x40, 10);

		Cache.CacheStep s = cache.step();
		ReadResult r = s.read(ReadRequest.lookupAndInvalidate(0x40));
		FillResult f = s.fill(FillRequest.store(0x50, 11));
		s.commit();

		assertEquals(r.way, f.way);
		assertFalse(f.eviction.valid);
		assertEquals(4, cache.occupancy());
		assertFalse(read(0x40).valid);
		for (long a = 0x10; a <= 0x30; a += 0x10) {
			assertTrue(read(a).valid);
		}
		assertEquals(11, read(0x50).data);
	}

	@Test
	public void testFillWinsOverReadWithInvalidate() {
		fill(0x10, 7);
		Cache.CacheStep s = cache.step();
		assertEquals(7, s.read(ReadRequest.lookupAndInvalidate(0x10)).data);
		s.fill(FillRequest.store(0x10, 9));
		s.commit();
		assertEquals(9, read(0x10).data);
	}

	@Test
	public void testInvalidateIsIdempotent() {
		fill(0x10, 7);
		FillResult first = invalidate(0x10);
		assertTrue(first.hit);
		// the eviction port reports what was removed
		assertTrue(first.eviction.valid);
		assertEquals(7, first.eviction.data);
		assertTrue(cache.empty());

		FillResult second = invalidate(0x10);
		assertTrue(second.accepted);
		assertFalse(second.hit);
		assertFalse(second.eviction.valid);
		assertTrue(cache.empty());
		assertFalse(read(0x10).valid);
	}

	@Test
	public void testTwoFillPortsAllocateDistinctWays() {
		Cache.CacheStep s = cache.step();
		List<FillResult> r = s.fill(Arrays.asList(FillRequest.store(0x10, 1), FillRequest.store(0x20, 2)));
		s.commit();
		assertTrue(r.get(0).accepted && r.get(1).accepted);
		assertEquals(3, r.get(0).way);
		assertEquals(1, r.get(1).way);
		assertEquals(2, cache.occupancy());
	}

	@Test
	public void testSameAddressOnTwoPortsLowestWins() {
		Cache.CacheStep s = cache.step();
		List<FillResult> r = s.fill(Arrays.asList(FillRequest.store(0x10, 1), FillRequest.store(0x10, 2)));
		s.commit();
		assertTrue(r.get(0).accepted);
		assertFalse(r.get(1).accepted);
		assertEquals(1, cache.occupancy());
		assertEquals(1, read(0x10).data);
	}

	@Test
	public void testTwoReadPorts() {
		fill(0x10, 7);
		fill(0x20, 8);
		Cache.CacheStep s = cache.step();
		List<ReadResult> r = s.read(Arrays.asList(ReadRequest.lookup(0x20), ReadRequest.lookup(0x30)));
		s.commit();
		assertEquals(8, r.get(0).data);
		assertFalse(r.get(1).valid);
	}

	@Test
	public void testProbeLeavesReplacementAlone() {
		fill(0x10, 7);
		fill(0x20, 8);
		fill(0x30, 9);
		fill(0x40, 10);
		for (int i = 0; i < 3; i++) {
			Cache.CacheStep s = cache.step();
			assertTrue(s.probe(0x10));
			s.commit();
		}
		assertEquals(0x10, fill(0x50, 11).eviction.address);
	}

	@Test
	public void testResetClearsEntriesAndPolicy() {
		fill(0x10, 7);
		fill(0x20, 8);
		Cache.CacheStep s = cache.step();
		s.fill(FillRequest.store(0x30, 9));
		s.requestReset();
		s.commit();
		assertTrue(cache.empty());
		assertEquals(3, fill(0x40, 1).way);
	}

	@Test
	public void testResetBetweenSteps() {
		fill(0x10, 7);
		cache.reset();
		assertTrue(cache.empty());
		assertFalse(read(0x10).valid);
	}

	@Test(expected = IllegalStateException.class)
	public void testResetDuringStep() {
		cache.step();
		cache.reset();
	}

	@Test
	public void testRandomTrafficKeepsInvariants() {
		Random rng = new Random(7);
		for (int i = 0; i < 2000; i++) {
			long a = rng.nextInt(12);
			Cache.CacheStep s = cache.step();
			boolean rwi = rng.nextInt(4) == 0;
			s.read(rwi ? ReadRequest.lookupAndInvalidate(a) : ReadRequest.lookup(a));
			long b = rng.nextInt(12);
			long c = rng.nextInt(12);
			s.fill(Arrays.asList(rng.nextInt(5) == 0 ? FillRequest.invalidate(b) : FillRequest.store(b, b * 3),
					FillRequest.store(c, c * 3)));
			s.commit();

			assertTrue(cache.tagsUnique());
			assertTrue(cache.occupancy() <= WAYS);
			assertEquals(cache.occupancy() == WAYS, cache.full());
			ReadResult r = cache.lookup(c);
			if (r.valid) {
				assertEquals(c * 3, r.data);
			}
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsSingleWay() {
		new FullyAssociativeCache(new CacheConfiguration() {
			{
				ways = 1;
			}
		});
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsNonPowerOfTwoWaysForPlru() {
		new FullyAssociativeCache(new CacheConfiguration() {
			{
				ways = 6;
			}
		});
	}

	@Test
	public void testNonPowerOfTwoWaysWithLru() {
		FullyAssociativeCache c = new FullyAssociativeCache(new CacheConfiguration() {
			{
				ways = 6;
				replacement = LruReplacement.FACTORY;
			}
		});
		assertEquals(6, c.capacity());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsMismatchedEvictionPorts() {
		new FullyAssociativeCache(new CacheConfiguration() {
			{
				fillPorts = 2;
				evictionPorts = 1;
			}
		});
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsTooManyRequests() {
		Cache.CacheStep s = cache.step();
		s.read(Arrays.asList(ReadRequest.idle(), ReadRequest.idle(), ReadRequest.idle()));
	}

	@Test(expected = IllegalStateException.class)
	public void testStepMustCommitBeforeNext() {
		cache.step();
		cache.step();
	}

	@Test(expected = IllegalStateException.class)
	public void testReadAfterFill() {
		Cache.CacheStep s = cache.step();
		s.fill(FillRequest.idle());
		s.read(ReadRequest.idle());
	}

	@Test(expected = IllegalStateException.class)
	public void testCommitTwice() {
		Cache.CacheStep s = cache.step();
		s.commit();
		s.commit();
	}
}
