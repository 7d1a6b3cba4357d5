package simulator.cache;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.base.Preconditions;

class CacheConfiguration {
	public String name = "cache";
	public int ways = 4;
	/** number of sets; always 1 for a fully-associative cache */
	public int lines = 1;
	public int readPorts = 1;
	public int fillPorts = 1;
	/** either 0 or the same as fillPorts */
	public int evictionPorts = 0;
	public ReplacementPolicy.Factory replacement = PseudoLruReplacement.FACTORY;

	CacheConfiguration copy() {
		final CacheConfiguration src = this;
		return new CacheConfiguration() {
			{
				name = src.name;
				ways = src.ways;
				lines = src.lines;
				readPorts = src.readPorts;
				fillPorts = src.fillPorts;
				evictionPorts = src.evictionPorts;
				replacement = src.replacement;
			}
		};
	}
}

final class CacheEntry {
	boolean valid;
	long tag;
	long data;

	void clear() {
		valid = false;
		tag = 0;
		data = 0;
	}

	@Override
	public String toString() {
		if (!valid) {
			return "[invalid]";
		}
		return "[tag=0x" + Long.toHexString(tag) + " data=0x" + Long.toHexString(data) + "]";
	}
}

/**
 * A tag-matched store of {@code lines x ways} entries, driven one step at a
 * time. Each step is opened with {@link #step()}, may perform one round of
 * reads followed by one round of fills, and is closed by
 * {@link CacheStep#commit()}. Reads always see the table as it was at the start
 * of the step; all writes land at the commit.
 */
public abstract class Cache {

	protected final String name;
	protected final int ways;
	protected final int lines;
	protected final int readPorts;
	protected final int fillPorts;
	protected final boolean reportsEvictions;

	/** entries[line][way] */
	protected final CacheEntry[][] entries;
	protected final ReplacementPolicy[] policies;

	private CacheStep openStep = null;

	protected Cache(CacheConfiguration config) {
		Preconditions.checkArgument(config.ways >= 1, "%s: need at least 1 way, got %s", config.name, config.ways);
		Preconditions.checkArgument(BitTwiddle.isPowerOf2(config.lines), "%s: lines must be a power of 2, got %s",
				config.name, config.lines);
		Preconditions.checkArgument(config.readPorts >= 1, "%s: need at least 1 read port", config.name);
		Preconditions.checkArgument(config.fillPorts >= 1, "%s: need at least 1 fill port", config.name);
		Preconditions.checkArgument(config.evictionPorts == 0 || config.evictionPorts == config.fillPorts,
				"%s: %s eviction ports for %s fill ports", config.name, config.evictionPorts, config.fillPorts);

		this.name = config.name;
		this.ways = config.ways;
		this.lines = config.lines;
		this.readPorts = config.readPorts;
		this.fillPorts = config.fillPorts;
		this.reportsEvictions = config.evictionPorts > 0;

		entries = new CacheEntry[lines][ways];
		policies = new ReplacementPolicy[lines];
		for (int l = 0; l < lines; l++) {
			for (int w = 0; w < ways; w++) {
				entries[l][w] = new CacheEntry();
			}
			policies[l] = config.replacement.create(ways);
			Preconditions.checkArgument(policies[l].ways() == ways, "%s: policy built for %s ways", name,
					policies[l].ways());
		}
	} // end ctor

	/** Set holding the given address. */
	protected abstract int lineIndex(long address);

	/** Tag stored for the given address. */
	protected abstract long tag(long address);

	/** Inverse of {@link #lineIndex} and {@link #tag}. */
	protected abstract long address(int line, long tag);

	public String name() {
		return name;
	}

	public int ways() {
		return ways;
	}

	public int lines() {
		return lines;
	}

	public int capacity() {
		return ways * lines;
	}

	/** Begin the next step. The previous step must have been committed. */
	public CacheStep step() {
		Preconditions.checkState(openStep == null, "%s: previous step was not committed", name);
		openStep = new CacheStep();
		return openStep;
	}

	/** Look up an address in the committed table without touching any state. */
	public ReadResult lookup(long address) {
		int line = lineIndex(address);
		int way = findWay(line, tag(address));
		if (way < 0) {
			return ReadResult.MISS;
		}
		return new ReadResult(true, entries[line][way].data, way);
	}

	public int occupancy() {
		int n = 0;
		for (CacheEntry[] set : entries) {
			for (CacheEntry e : set) {
				if (e.valid) {
					n++;
				}
			}
		}
		return n;
	}

	public boolean full() {
		return occupancy() == capacity();
	}

	public boolean empty() {
		return occupancy() == 0;
	}

	/** Clear every entry and every replacement policy, between steps. */
	public void reset() {
		Preconditions.checkState(openStep == null, "%s: cannot reset during a step", name);
		clearAll();
	}

	private void clearAll() {
		for (int l = 0; l < lines; l++) {
			for (CacheEntry e : entries[l]) {
				e.clear();
			}
			policies[l].reset();
		}
	}

	private int findWay(int line, long tag) {
		CacheEntry[] set = entries[line];
		for (int w = 0; w < ways; w++) {
			if (set[w].valid && set[w].tag == tag) {
				return w;
			}
		}
		return -1;
	}

	/** No two valid entries of a line share a tag. */
	boolean tagsUnique() {
		for (CacheEntry[] set : entries) {
			Set<Long> seen = new HashSet<Long>();
			for (CacheEntry e : set) {
				if (e.valid && !seen.add(e.tag)) {
					return false;
				}
			}
		}
		return true;
	}

	private static final class StagedWrite {
		final int line;
		final int way;
		final boolean valid;
		final long tag;
		final long data;

		StagedWrite(int line, int way, boolean valid, long tag, long data) {
			this.line = line;
			this.way = way;
			this.valid = valid;
			this.tag = tag;
			this.data = data;
		}
	}

	/**
	 * One step of the cache. Replacement events are applied in a fixed order: all
	 * invalidates, then all hits, then allocations in fill-port order.
	 */
	public final class CacheStep {
		private boolean readDone = false;
		private boolean fillDone = false;
		private boolean eventsApplied = false;
		private boolean committed = false;
		private boolean resetRequested = false;

		/** {line, way} pairs */
		private final List<int[]> invalidateEvents = new ArrayList<int[]>();
		private final List<int[]> hitEvents = new ArrayList<int[]>();

		/** entries cleared by read-with-invalidate, keyed by slot() */
		private final Set<Integer> readInvalidated = new HashSet<Integer>();
		/** entries cleared by a fill-port invalidate, keyed by slot() */
		private final Set<Integer> fillInvalidated = new HashSet<Integer>();
		/** entries receiving data from a fill port, keyed by slot() */
		private final Set<Integer> stored = new HashSet<Integer>();
		private final Map<Integer, Set<Long>> tagsInFlight = new HashMap<Integer, Set<Long>>();
		private final List<StagedWrite> writes = new ArrayList<StagedWrite>();
		private final Set<Integer> touchedLines = new TreeSet<Integer>();

		private CacheStep() {
		}

		private int slot(int line, int way) {
			return line * ways + way;
		}

		private void checkOpen() {
			Preconditions.checkState(!committed, "%s: step already committed", name);
		}

		/**
		 * Present one lookup per read port. Ports beyond the list are idle. Hits
		 * return the data as of the start of the step, including for entries a
		 * read-with-invalidate removes.
		 */
		public List<ReadResult> read(List<ReadRequest> requests) {
			checkOpen();
			Preconditions.checkState(!readDone, "%s: read ports already used this step", name);
			Preconditions.checkState(!fillDone, "%s: reads must come before fills", name);
			Preconditions.checkArgument(requests.size() <= readPorts, "%s: %s reads for %s read ports", name,
					requests.size(), readPorts);
			readDone = true;

			List<ReadResult> results = new ArrayList<ReadResult>(requests.size());
			for (ReadRequest r : requests) {
				if (!r.enable) {
					results.add(ReadResult.MISS);
					continue;
				}
				int line = lineIndex(r.address);
				int way = findWay(line, tag(r.address));
				if (way < 0) {
					results.add(ReadResult.MISS);
					continue;
				}
				results.add(new ReadResult(true, entries[line][way].data, way));
				if (r.invalidateOnHit) {
					if (readInvalidated.add(slot(line, way))) {
						invalidateEvents.add(new int[] { line, way });
					}
				} else {
					hitEvents.add(new int[] { line, way });
				}
				touchedLines.add(line);
			}
			return results;
		}

		public ReadResult read(ReadRequest request) {
			return read(Collections.singletonList(request)).get(0);
		}

		/** Committed-table lookup; uses no port and reports no event. */
		public boolean probe(long address) {
			checkOpen();
			return findWay(lineIndex(address), tag(address)) >= 0;
		}

		/**
		 * Present one store or invalidate per fill port. Ports beyond the list are
		 * idle.
		 *
		 * Stores to a present address and invalidates claim their way first.
		 * Allocations are then served in port order. A port is rejected, and must
		 * retry on a later step, when an earlier port already carries the same tag
		 * or when its allocation victim is already being written this step.
		 */
		public List<FillResult> fill(List<FillRequest> requests) {
			checkOpen();
			Preconditions.checkState(!fillDone, "%s: fill ports already used this step", name);
			Preconditions.checkArgument(requests.size() <= fillPorts, "%s: %s fills for %s fill ports", name,
					requests.size(), fillPorts);
			fillDone = true;

			FillResult[] results = new FillResult[requests.size()];
			List<Integer> allocations = new ArrayList<Integer>();

			for (int i = 0; i < requests.size(); i++) {
				FillRequest f = requests.get(i);
				if (!f.enable) {
					results[i] = FillResult.IDLE;
					continue;
				}
				int line = lineIndex(f.address);
				long tag = tag(f.address);
				if (!claimTag(line, tag)) {
					results[i] = FillResult.REJECTED;
					continue;
				}
				touchedLines.add(line);
				int way = findWay(line, tag);
				if (way < 0) {
					if (f.store) {
						allocations.add(i);
					} else {
						results[i] = FillResult.IDLE;
					}
					continue;
				}
				// one valid entry per tag, and the tag is claimed, so the way is ours
				assert !stored.contains(slot(line, way));
				if (f.store) {
					stored.add(slot(line, way));
					writes.add(new StagedWrite(line, way, true, tag, f.data));
					hitEvents.add(new int[] { line, way });
					results[i] = new FillResult(true, true, way, Eviction.NONE);
				} else {
					fillInvalidated.add(slot(line, way));
					writes.add(new StagedWrite(line, way, false, tag, entries[line][way].data));
					invalidateEvents.add(new int[] { line, way });
					Eviction ev = reportsEvictions ? new Eviction(true, f.address, entries[line][way].data)
							: Eviction.NONE;
					results[i] = new FillResult(true, true, way, ev);
				}
			}

			applyEvents();

			for (int i : allocations) {
				FillRequest f = requests.get(i);
				int line = lineIndex(f.address);
				ReplacementPolicy policy = policies[line];
				int victim = policy.allocate();
				assert victim >= 0 && victim < ways : name + ": policy returned way " + victim;
				if (!stored.add(slot(line, victim))) {
					results[i] = FillResult.REJECTED;
					continue;
				}
				CacheEntry e = entries[line][victim];
				boolean freed = readInvalidated.contains(slot(line, victim))
						|| fillInvalidated.contains(slot(line, victim));
				Eviction ev = Eviction.NONE;
				if (reportsEvictions && e.valid && !freed) {
					ev = new Eviction(true, address(line, e.tag), e.data);
				}
				policy.hit(victim);
				writes.add(new StagedWrite(line, victim, true, tag(f.address), f.data));
				results[i] = new FillResult(true, false, victim, ev);
			}
			return Arrays.asList(results);
		}

		public FillResult fill(FillRequest request) {
			return fill(Collections.singletonList(request)).get(0);
		}

		/** Clear the whole cache at the end of this step, after any writes. */
		public void requestReset() {
			checkOpen();
			resetRequested = true;
		}

		private boolean claimTag(int line, long tag) {
			Set<Long> tags = tagsInFlight.get(line);
			if (tags == null) {
				tags = new HashSet<Long>();
				tagsInFlight.put(line, tags);
			}
			return tags.add(tag);
		}

		private void applyEvents() {
			if (eventsApplied) {
				return;
			}
			eventsApplied = true;
			for (int[] ev : invalidateEvents) {
				policies[ev[0]].invalidate(ev[1]);
			}
			for (int[] ev : hitEvents) {
				policies[ev[0]].hit(ev[1]);
			}
		}

		public void commit() {
			checkOpen();
			committed = true;
			applyEvents();

			for (int s : readInvalidated) {
				entries[s / ways][s % ways].valid = false;
			}
			// fills land after read-with-invalidate, so a fill into a freed way wins
			for (StagedWrite w : writes) {
				CacheEntry e = entries[w.line][w.way];
				e.valid = w.valid;
				e.tag = w.tag;
				e.data = w.data;
			}
			for (int line : touchedLines) {
				policies[line].commit();
			}
			if (resetRequested) {
				clearAll();
			}
			openStep = null;

			if (CacheSim.XASSERTS) {
				assert tagsUnique() : name + ": duplicate tags after commit\n" + Cache.this;
			}
		}
	} // end class CacheStep

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder();
		s.append("cache=" + name + System.getProperty("line.separator"));
		for (int l = 0; l < lines; l++) {
			s.append(l + " " + policies[l] + ":");
			for (CacheEntry e : entries[l]) {
				s.append(" " + e);
			}
			s.append(System.getProperty("line.separator"));
		}
		return s.toString();
	}

} // end class Cache
