package simulator.cache;

/** One way per line; the configured replacement policy is ignored. */
public class DirectMappedCache extends SetAssociativeCache {

	public DirectMappedCache(CacheConfiguration config) {
		super(oneWay(config), false);
	}

	private static CacheConfiguration oneWay(CacheConfiguration config) {
		CacheConfiguration c = config.copy();
		c.ways = 1;
		c.replacement = LruReplacement.FACTORY;
		return c;
	}
}
