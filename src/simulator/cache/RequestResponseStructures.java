package simulator.cache;

/** A read request travelling from upstream toward memory. */
final class Request {
	final long id;
	final long address;

	Request(long id, long address) {
		this.id = id;
		this.address = address;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Request)) {
			return false;
		}
		Request r = (Request) o;
		return id == r.id && address == r.address;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(id) * 31 + Long.hashCode(address);
	}

	@Override
	public String toString() {
		return "req(id=" + id + ", 0x" + Long.toHexString(address) + ")";
	}
}

/** The answer to a {@link Request}, matched by id. */
final class Response {
	final long id;
	final long data;
	/** Forward the data but do not fill the cache with it. */
	final boolean nonCacheable;

	Response(long id, long data) {
		this(id, data, false);
	}

	Response(long id, long data, boolean nonCacheable) {
		this.id = id;
		this.data = data;
		this.nonCacheable = nonCacheable;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Response)) {
			return false;
		}
		Response r = (Response) o;
		return id == r.id && data == r.data && nonCacheable == r.nonCacheable;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(id) * 31 + Long.hashCode(data) + (nonCacheable ? 1 : 0);
	}

	@Override
	public String toString() {
		return "rsp(id=" + id + ", 0x" + Long.toHexString(data) + (nonCacheable ? ", nc" : "") + ")";
	}
}

/** A direct write into a channel's cache, bypassing the request path. */
final class CacheWrite {
	final long address;
	final long data;
	/** Remove the address instead of storing {@link #data}. */
	final boolean invalidate;

	CacheWrite(long address, long data, boolean invalidate) {
		this.address = address;
		this.data = data;
		this.invalidate = invalidate;
	}

	static CacheWrite store(long address, long data) {
		return new CacheWrite(address, data, false);
	}

	static CacheWrite invalidate(long address) {
		return new CacheWrite(address, 0, true);
	}

	@Override
	public String toString() {
		return invalidate ? "cw(inv 0x" + Long.toHexString(address) + ")"
				: "cw(0x" + Long.toHexString(address) + "=0x" + Long.toHexString(data) + ")";
	}
}
