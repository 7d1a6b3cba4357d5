package simulator.cache;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedList;
import java.util.List;
import java.util.StringTokenizer;

import joptsimple.OptionParser;
import joptsimple.OptionSpec;

public class Knobs {

	public static final OptionSpec<Boolean> Help;
	public static final OptionSpec<Boolean> Xasserts;
	public static final OptionSpec<String> StatsFile;

	public static final OptionSpec<String> Channel;

	// data cache
	public static final OptionSpec<String> CacheKind;
	public static final OptionSpec<Integer> CacheWays;
	public static final OptionSpec<Integer> CacheLines;
	public static final OptionSpec<String> Replacement;

	public static final OptionSpec<Integer> TrackerWays;
	public static final OptionSpec<Integer> ResponseBufferDepth;
	public static final OptionSpec<Integer> RequestBufferDepth;

	// workload
	public static final OptionSpec<Integer> DownstreamLatency;
	public static final OptionSpec<Integer> NonCacheableEvery;
	public static final OptionSpec<Integer> Requests;
	public static final OptionSpec<Integer> Ids;
	public static final OptionSpec<Long> AddressSpace;
	public static final OptionSpec<Integer> HotAddresses;
	public static final OptionSpec<Double> HotFraction;
	public static final OptionSpec<Long> Seed;
	public static final OptionSpec<Long> MaxSteps;
	public static final OptionSpec<String> TraceFile;

	public static final OptionParser parser;

	private Knobs() {
	}

	static {
		parser = new OptionParser();
		StringParameters = new LinkedList<OptionSpec<String>>();
		IntegerParameters = new LinkedList<OptionSpec<Integer>>();
		LongParameters = new LinkedList<OptionSpec<Long>>();
		DoubleParameters = new LinkedList<OptionSpec<Double>>();

		Help = parser.accepts("help", "print this help message").withOptionalArg().ofType(Boolean.class)
				.defaultsTo(false);
		Xasserts = parser.accepts("xasserts", "enable eXpensive assert checks").withOptionalArg().ofType(Boolean.class)
				.defaultsTo(true);
		StatsFile = parser.accepts("stats-file", "output file for statistics").withRequiredArg()
				.defaultsTo("cachesim-stats.py");

		Channel = registerString(parser.accepts("channel", "channel to simulate (one of: cached, buffered)")
				.withRequiredArg().defaultsTo("cached"));

		CacheKind = registerString(parser.accepts("cache-kind", "data cache organization (one of: fully, set, direct)")
				.withRequiredArg().defaultsTo("fully"));
		CacheWays = registerInt(parser.accepts("cache-ways", "ways per set of the data cache").withRequiredArg()
				.ofType(Integer.class).defaultsTo(4));
		CacheLines = registerInt(parser.accepts("cache-lines", "sets in the data cache (set and direct only)")
				.withRequiredArg().ofType(Integer.class).defaultsTo(16));
		Replacement = registerString(parser
				.accepts("replacement", "data cache replacement policy (one of: plru, lru, invalid-first, random)")
				.withRequiredArg().defaultsTo("plru"));

		TrackerWays = registerInt(parser.accepts("tracker-ways", "entries in the pending-request tracker")
				.withRequiredArg().ofType(Integer.class).defaultsTo(8));
		ResponseBufferDepth = registerInt(parser.accepts("response-buffer-depth", "depth of the response buffer")
				.withRequiredArg().ofType(Integer.class).defaultsTo(2));
		RequestBufferDepth = registerInt(
				parser.accepts("request-buffer-depth", "depth of the request buffer (buffered channel only)")
						.withRequiredArg().ofType(Integer.class).defaultsTo(2));

		DownstreamLatency = registerInt(parser.accepts("downstream-latency", "steps before memory answers a request")
				.withRequiredArg().ofType(Integer.class).defaultsTo(10));
		NonCacheableEvery = registerInt(
				parser.accepts("non-cacheable-every", "mark every n-th memory response non-cacheable (0 = never)")
						.withRequiredArg().ofType(Integer.class).defaultsTo(0));
		Requests = registerInt(parser.accepts("requests", "number of synthetic requests to issue").withRequiredArg()
				.ofType(Integer.class).defaultsTo(10000));
		Ids = registerInt(parser.accepts("ids", "distinct transaction ids used by synthetic requests")
				.withRequiredArg().ofType(Integer.class).defaultsTo(16));
		AddressSpace = registerLong(parser.accepts("address-space", "synthetic addresses are drawn from [0, n)")
				.withRequiredArg().ofType(Long.class).defaultsTo(1L << 20));
		HotAddresses = registerInt(parser.accepts("hot-addresses", "size of the frequently-read address set")
				.withRequiredArg().ofType(Integer.class).defaultsTo(8));
		HotFraction = registerDouble(parser.accepts("hot-fraction", "fraction of requests going to hot addresses")
				.withRequiredArg().ofType(Double.class).defaultsTo(0.75));
		Seed = registerLong(parser.accepts("seed", "random seed").withRequiredArg().ofType(Long.class)
				.defaultsTo(1L));
		MaxSteps = parser.accepts("max-steps", "abort if the run has not drained after this many steps")
				.withRequiredArg().ofType(Long.class).defaultsTo(100000000L);
		TraceFile = parser.accepts("trace-file", "read 'id address' requests from this file instead")
				.withRequiredArg();
	}

	/*
	 * Below is the stuff that automatically allows certain flags ("registered"
	 * ones) to be dumped into the stats file, so each run's configuration travels
	 * with its results.
	 */

	private static final List<OptionSpec<String>> StringParameters;
	private static final List<OptionSpec<Integer>> IntegerParameters;
	private static final List<OptionSpec<Long>> LongParameters;
	private static final List<OptionSpec<Double>> DoubleParameters;

	private static OptionSpec<String> registerString(OptionSpec<String> o) {
		StringParameters.add(o);
		return o;
	}

	private static OptionSpec<Integer> registerInt(OptionSpec<Integer> o) {
		IntegerParameters.add(o);
		return o;
	}

	private static OptionSpec<Long> registerLong(OptionSpec<Long> o) {
		LongParameters.add(o);
		return o;
	}

	private static OptionSpec<Double> registerDouble(OptionSpec<Double> o) {
		DoubleParameters.add(o);
		return o;
	}

	public static void dumpRegisteredParams(Writer w) throws IOException {
		for (OptionSpec<String> os : StringParameters) {
			w.write("'" + format(os.toString()) + "': '" + CacheSim.Options.valueOf(os) + "', ");
		}
		for (OptionSpec<Integer> os : IntegerParameters) {
			w.write("'" + format(os.toString()) + "': " + CacheSim.Options.valueOf(os) + ", ");
		}
		for (OptionSpec<Long> os : LongParameters) {
			w.write("'" + format(os.toString()) + "': " + CacheSim.Options.valueOf(os) + ", ");
		}
		for (OptionSpec<Double> os : DoubleParameters) {
			w.write("'" + format(os.toString()) + "': " + CacheSim.Options.valueOf(os) + ", ");
		}
	}

	static String format(String flag) {
		// strip brackets
		String noBrackets = flag.replaceAll("\\[", "").replaceAll("\\]", "");

		// tokenize on dashes
		StringBuilder result = new StringBuilder();
		StringTokenizer tok = new StringTokenizer(noBrackets, "-");
		while (tok.hasMoreTokens()) {
			String t = tok.nextToken();
			// capitalize each token
			result.append(t.substring(0, 1).toUpperCase()).append(t.substring(1));
		}
		return result.toString();
	}
}
