package simulator.cache;

import com.google.common.base.Preconditions;

/** A single line: any address may live in any way, and the tag is the whole address. */
public class FullyAssociativeCache extends Cache {

	public FullyAssociativeCache(CacheConfiguration config) {
		super(singleLine(config));
	}

	private static CacheConfiguration singleLine(CacheConfiguration config) {
		Preconditions.checkArgument(config.ways >= 2, "%s: fully-associative cache needs at least 2 ways, got %s",
				config.name, config.ways);
		CacheConfiguration c = config.copy();
		c.lines = 1;
		return c;
	}

	@Override
	protected int lineIndex(long address) {
		return 0;
	}

	@Override
	protected long tag(long address) {
		return address;
	}

	@Override
	protected long address(int line, long tag) {
		assert line == 0;
		return tag;
	}
}
