package simulator.cache;

import java.util.ArrayDeque;

import com.google.common.base.Preconditions;

/**
 * Bounded FIFO with ready/valid handshakes on both ends. {@link #ready()} and
 * {@link #valid()} reflect the state at the start of the step; a push and a pop
 * made during the step take effect at {@link #commit()}, so an item pushed this
 * step can be popped on the next one at the earliest.
 */
public final class ReadyValidFifo<T> {

	private final String name;
	private final int depth;
	private final ArrayDeque<T> items;

	private T pushed = null;
	private boolean popped = false;

	public ReadyValidFifo(String name, int depth) {
		Preconditions.checkArgument(depth >= 1, "%s: depth must be at least 1, got %s", name, depth);
		this.name = name;
		this.depth = depth;
		this.items = new ArrayDeque<T>(depth);
	}

	public int depth() {
		return depth;
	}

	/** Room for one more item. */
	public boolean ready() {
		return items.size() < depth;
	}

	/** Head item available. */
	public boolean valid() {
		return !items.isEmpty();
	}

	public T peek() {
		return items.peekFirst();
	}

	/** Stage an enqueue; returns false when the FIFO was full at the start of the step. */
	public boolean push(T item) {
		Preconditions.checkNotNull(item);
		Preconditions.checkState(pushed == null, "%s: already pushed this step", name);
		if (!ready()) {
			return false;
		}
		pushed = item;
		return true;
	}

	/** Stage a dequeue of the head; returns null when empty at the start of the step. */
	public T pop() {
		Preconditions.checkState(!popped, "%s: already popped this step", name);
		if (!valid()) {
			return null;
		}
		popped = true;
		return items.peekFirst();
	}

	public void commit() {
		if (popped) {
			items.pollFirst();
			popped = false;
		}
		if (pushed != null) {
			items.addLast(pushed);
			pushed = null;
		}
		assert items.size() <= depth;
	}

	public int occupancy() {
		return items.size();
	}

	public boolean full() {
		return items.size() == depth;
	}

	public boolean empty() {
		return items.isEmpty();
	}

	@Override
	public String toString() {
		return name + items;
	}
}
