package simulator.cache;

/** Supplies upstream requests one at a time; a request is re-offered until accepted. */
abstract class RequestSource {

	/** The request currently on offer, or null once the source is used up. */
	abstract Request peek();

	/** The request on offer was accepted; move to the next one. */
	abstract void advance();

	boolean exhausted() {
		return peek() == null;
	}
}
