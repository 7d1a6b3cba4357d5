package simulator.cache;

import java.util.HashMap;
import java.util.LinkedList;
import java.util.Map;

/**
 * Tracks every request a channel accepted and checks each response against it.
 * Responses for one id must arrive in the order their requests were accepted.
 */
final class ResponseChecker {

	private final Map<Long, LinkedList<Long>> expected = new HashMap<Long, LinkedList<Long>>();
	private long outstanding = 0;
	private long delivered = 0;
	private long mismatches = 0;

	void expect(long id, long data) {
		LinkedList<Long> q = expected.get(id);
		if (q == null) {
			q = new LinkedList<Long>();
			expected.put(id, q);
		}
		q.addLast(data);
		outstanding++;
	}

	/** Returns false when the response was unexpected or carried the wrong data. */
	boolean deliver(Response r) {
		LinkedList<Long> q = expected.get(r.id);
		if (q == null || q.isEmpty()) {
			mismatches++;
			return false;
		}
		long want = q.removeFirst();
		outstanding--;
		delivered++;
		if (want != r.data) {
			mismatches++;
			return false;
		}
		return true;
	}

	long outstanding() {
		return outstanding;
	}

	long delivered() {
		return delivered;
	}

	long mismatches() {
		return mismatches;
	}
}
