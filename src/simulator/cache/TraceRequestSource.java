package simulator.cache;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * Requests read from a text trace, one {@code id address} pair per line. Both
 * fields accept decimal or 0x-prefixed hex; blank lines and text after '#' are
 * ignored.
 */
final class TraceRequestSource extends RequestSource {

	private final List<Request> requests;
	private int next = 0;

	TraceRequestSource(List<Request> requests) {
		this.requests = requests;
	}

	static TraceRequestSource fromFile(String filename) throws IOException {
		try (Reader r = new FileReader(filename, StandardCharsets.UTF_8)) {
			return new TraceRequestSource(parse(r, filename));
		}
	}

	static List<Request> parse(Reader in, String source) throws IOException {
		List<Request> result = new ArrayList<Request>();
		BufferedReader br = new BufferedReader(in);
		String line;
		int lineNo = 0;
		while ((line = br.readLine()) != null) {
			lineNo++;
			int hash = line.indexOf('#');
			if (hash >= 0) {
				line = line.substring(0, hash);
			}
			StringTokenizer tok = new StringTokenizer(line);
			if (!tok.hasMoreTokens()) {
				continue;
			}
			if (tok.countTokens() != 2) {
				throw new IOException(source + ":" + lineNo + ": expected 'id address', got '" + line.trim() + "'");
			}
			try {
				long id = Long.decode(tok.nextToken());
				long address = Long.decode(tok.nextToken());
				result.add(new Request(id, address));
			} catch (NumberFormatException nfe) {
				throw new IOException(source + ":" + lineNo + ": " + nfe.getMessage(), nfe);
			}
		}
		return result;
	}

	int size() {
		return requests.size();
	}

	@Override
	Request peek() {
		return next < requests.size() ? requests.get(next) : null;
	}

	@Override
	void advance() {
		assert next < requests.size();
		next++;
	}
}
