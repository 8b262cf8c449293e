package ime.gmail;

import javax.mail.MessagingException;

/**
 * Raised when a fetched message cannot be turned into a {@link Message}:
 * missing or unreadable Date header, or a MIME structure that cannot be read.
 */
public class MessageParseException extends MessagingException {
	private static final long serialVersionUID = -3154871020496512217L;

	public MessageParseException(String message) {
		super(message);
	}

	public MessageParseException(String message, Exception cause) {
		super(message, cause);
	}
}
