package ime.gmail.mailbox;

/**
 * One FETCH response entry: the response preamble carrying FLAGS and the
 * Gmail attributes, plus the raw RFC-822 source of the message.
 */
public class FetchResult {
	private final String headerBlock;
	private final byte[] rawBody;

	public FetchResult(String headerBlock, byte[] rawBody) {
		this.headerBlock = headerBlock;
		this.rawBody = rawBody;
	}

	public String getHeaderBlock() {
		return headerBlock;
	}

	public byte[] getRawBody() {
		return rawBody;
	}
}
