package ime.gmail.compose;

import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.internet.MimeMessage;

/**
 * A composed message that keeps the Message-ID assigned at composition time
 * when headers are updated before sending.
 */
public class ComposedMessage extends MimeMessage {

	public ComposedMessage(Session session) {
		super(session);
	}

	/**
	 * Assigns a JavaMail generated Message-ID unless one is already set.
	 */
	@Override
	protected void updateMessageID() throws MessagingException {
		if (getHeader("Message-ID", null) == null)
			super.updateMessageID();
	}
}
