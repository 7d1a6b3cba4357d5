package simulator.cache;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.text.DecimalFormat;

import joptsimple.OptionSet;
import simulator.cache.Simulation.ChannelKind;

public class CacheSim {

	/** enable checking of computationally expensive asserts */
	public static boolean XASSERTS = true;

	static final String prefix = "[cachesim] ";

	static OptionSet Options;

	// http://docs.oracle.com/javase/7/docs/technotes/guides/language/assert.html
	static boolean assertsEnabled = false;

	static {
		assert assertsEnabled = true; // Intentional side effect!!!
	}

	public static void main(String[] args) throws IOException {
		Options = Knobs.parser.parse(args);
		if (Options.has(Knobs.Help)) {
			Knobs.parser.printHelpOn(System.out);
			return;
		}
		XASSERTS = Options.valueOf(Knobs.Xasserts);
		if (!assertsEnabled) {
			System.out.println(prefix + "asserts are disabled; run with -ea to check invariants");
		}

		Simulation.SimulationParams p = paramsFromOptions();
		Simulation sim = new Simulation(p);

		final long startTime = System.currentTimeMillis();
		System.out.println(prefix + "starting " + Options.valueOf(Knobs.Channel) + " channel simulation");
		long steps = sim.run();
		double mins = (System.currentTimeMillis() - startTime) / (double) (1000 * 60);

		DecimalFormat fmt = new DecimalFormat("0.000");
		System.out.println(prefix + "steps: " + steps + " responses: " + sim.delivered() + " hit rate: "
				+ fmt.format(sim.channel().stats().hitRate()));
		System.out.println(prefix + "simulation took " + fmt.format(mins) + " minutes");

		generateStats(sim);

		if (sim.mismatches() != 0) {
			System.err.println(prefix + sim.mismatches() + " responses did not match their requests");
			System.exit(1);
		}
		System.err.println(prefix + "finished");
	} // end main()

	static Simulation.SimulationParams paramsFromOptions() throws IOException {
		final ChannelKind channelKind = ChannelKind.valueOf(Options.valueOf(Knobs.Channel).toUpperCase());
		final CacheKind cacheKind = CacheKind.fromKnob(Options.valueOf(Knobs.CacheKind));
		final ReplacementPolicy.Factory policy = ReplacementKind.fromKnob(Options.valueOf(Knobs.Replacement))
				.factory(Options.valueOf(Knobs.Seed));

		final RequestSource source;
		if (Options.has(Knobs.TraceFile)) {
			TraceRequestSource trace = TraceRequestSource.fromFile(Options.valueOf(Knobs.TraceFile));
			System.out.println(prefix + "read " + trace.size() + " requests from " + Options.valueOf(Knobs.TraceFile));
			source = trace;
		} else {
			source = new RandomRequestSource(Options.valueOf(Knobs.Seed), Options.valueOf(Knobs.Requests),
					Options.valueOf(Knobs.Ids), Options.valueOf(Knobs.AddressSpace),
					Options.valueOf(Knobs.HotAddresses), Options.valueOf(Knobs.HotFraction));
		}

		return new Simulation.SimulationParams() {
			@Override
			ChannelKind channelKind() {
				return channelKind;
			}

			@Override
			CacheKind cacheKind() {
				return cacheKind;
			}

			@Override
			CacheConfiguration cacheConfig() {
				// NB: a new object each time; the values never change
				return new CacheConfiguration() {
					{
						name = "channel.cache";
						ways = Options.valueOf(Knobs.CacheWays);
						lines = cacheKind == CacheKind.FULLY ? 1 : Options.valueOf(Knobs.CacheLines);
						evictionPorts = 1;
						replacement = policy;
					}
				};
			}

			@Override
			int trackerWays() {
				return Options.valueOf(Knobs.TrackerWays);
			}

			@Override
			int responseBufferDepth() {
				return Options.valueOf(Knobs.ResponseBufferDepth);
			}

			@Override
			int requestBufferDepth() {
				return Options.valueOf(Knobs.RequestBufferDepth);
			}

			@Override
			int downstreamLatency() {
				return Options.valueOf(Knobs.DownstreamLatency);
			}

			@Override
			int nonCacheableEvery() {
				return Options.valueOf(Knobs.NonCacheableEvery);
			}

			@Override
			long seed() {
				return Options.valueOf(Knobs.Seed);
			}

			@Override
			long maxSteps() {
				return Options.valueOf(Knobs.MaxSteps);
			}

			@Override
			RequestSource requests() {
				return source;
			}
		};
	}

	static void generateStats(Simulation sim) throws IOException {
		// each stat is dumped as a Python dictionary object

		StringWriter prefix = new StringWriter();
		prefix.write("{'CacheSimStat':True, ");
		Knobs.dumpRegisteredParams(prefix);

		String suffix = "}" + System.getProperty("line.separator");

		File f = new File(Options.valueOf(Knobs.StatsFile));
		try (BufferedWriter statsFd = new BufferedWriter(new FileWriter(f))) {
			sim.dumpStats(statsFd, prefix.toString(), suffix);
		}
	}
}
