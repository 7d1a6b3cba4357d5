package simulator.cache;

import com.google.common.base.Preconditions;

/**
 * {@code lines} sets of {@code ways} entries each. The low log2(lines) bits of
 * an address select the set and the remaining high bits form the tag.
 */
public class SetAssociativeCache extends Cache {

	/** log_2(num sets) */
	protected final int indexBits;
	/** mask used to clear out the tag bits */
	protected final long indexMask;

	public SetAssociativeCache(CacheConfiguration config) {
		this(config, true);
	}

	SetAssociativeCache(CacheConfiguration config, boolean needsAssociativity) {
		super(checked(config, needsAssociativity));
		indexBits = BitTwiddle.floorLog2(lines);
		indexMask = lines - 1;
	}

	private static CacheConfiguration checked(CacheConfiguration config, boolean needsAssociativity) {
		if (needsAssociativity) {
			Preconditions.checkArgument(config.ways >= 2, "%s: set-associative cache needs at least 2 ways, got %s",
					config.name, config.ways);
		}
		return config;
	}

	@Override
	protected int lineIndex(long address) {
		return (int) (address & indexMask);
	}

	@Override
	protected long tag(long address) {
		return address >>> indexBits;
	}

	@Override
	protected long address(int line, long tag) {
		return (tag << indexBits) | line;
	}
}
