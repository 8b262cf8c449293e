package ime.gmail.compose;

import ime.gmail.util.MimeTypes;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Date;
import java.util.Properties;

import javax.activation.DataHandler;
import javax.mail.MessagingException;
import javax.mail.Part;
import javax.mail.Session;
import javax.mail.internet.MimeBodyPart;
import javax.mail.internet.MimeMessage;
import javax.mail.internet.MimeMultipart;
import javax.mail.util.ByteArrayDataSource;

import org.apache.log4j.Logger;

/**
 * Builds outbound MIME messages. Nothing is sent here; the result goes to a
 * transport.
 */
public class MessageComposer {
	private static Logger logger = Logger.getLogger(MessageComposer.class);

	public static final String CHARSET = "UTF-8";

	private final Session session;

	public MessageComposer() {
		this(Session.getInstance(new Properties(), null));
	}

	public MessageComposer(Session session) {
		this.session = session;
	}

	/**
	 * Plain text without attachments gives a single text/plain message.
	 * Otherwise the message is multipart/mixed holding the text (an HTML
	 * body goes inside a multipart/alternative) followed by one part per
	 * attachment. A missing subject is written as an empty Subject header; a
	 * missing recipient is an error.
	 */
	public ComposedMessage create(ComposeOptions options) throws MessagingException, IOException {
		if (options.getTo() == null)
			throw new MessagingException("Message has no recipient");
		ComposedMessage message = new ComposedMessage(session);
		String text = options.getText() == null ? "" : options.getText();

		if (!options.isHtml() && !options.hasAttachments()) {
			message.setText(text, CHARSET, "plain");
		} else {
			MimeMultipart mixed = new MimeMultipart();
			if (options.isHtml()) {
				// TODO add a text/plain alternative rendered from the HTML body
				MimeMultipart alternative = new MimeMultipart("alternative");
				MimeBodyPart htmlPart = new MimeBodyPart();
				htmlPart.setText(text, CHARSET, "html");
				alternative.addBodyPart(htmlPart);

				MimeBodyPart alternativePart = new MimeBodyPart();
				alternativePart.setContent(alternative);
				mixed.addBodyPart(alternativePart);
			} else {
				MimeBodyPart textPart = new MimeBodyPart();
				textPart.setText(text, CHARSET, "plain");
				mixed.addBodyPart(textPart);
			}
			for (Object attachment : options.getAttachments()) {
				mixed.addBodyPart(toMimeAttachment(attachment));
			}
			message.setContent(mixed);
		}

		message.setHeader("To", options.getTo());
		if (options.getCc() != null)
			message.setHeader("Cc", options.getCc());
		if (options.getBcc() != null)
			message.setHeader("Bcc", options.getBcc());

		if (options.getSender() != null) {
			message.setHeader("From", options.getSender());
			if (options.getReplyTo() == null)
				message.setHeader("Reply-To", options.getSender());
		}

		if (message.getHeader("Date", null) == null)
			message.setSentDate(new Date());
		message.updateMessageID();

		if (options.getReplyTo() != null)
			message.setHeader("Reply-To", options.getReplyTo());

		message.setSubject(options.getSubject() == null ? "" : options.getSubject(), CHARSET);

		logger.debug("Composed message " + message.getHeader("Message-ID", null) + " to " + options.getTo());
		return message;
	}

	/**
	 * The RFC 822 source of {@code message}.
	 */
	public static byte[] toBytes(MimeMessage message) throws MessagingException, IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		message.writeTo(out);
		return out.toByteArray();
	}

	static MimeBodyPart toMimeAttachment(Object attachment) throws MessagingException, IOException {
		if (attachment instanceof MimeBodyPart)
			return (MimeBodyPart) attachment;

		File file = (File) attachment;
		String type = MimeTypes.getMimeType(file.getName());

		MimeBodyPart part = new MimeBodyPart();
		part.setDataHandler(new DataHandler(new ByteArrayDataSource(readFile(file), type)));
		part.setDisposition(Part.ATTACHMENT);
		part.setFileName(file.getName());
		part.setHeader("Content-Transfer-Encoding", "base64");
		return part;
	}

	private static byte[] readFile(File file) throws IOException {
		InputStream in = new FileInputStream(file);
		try {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			byte[] buffer = new byte[4096];
			int len;
			while ((len = in.read(buffer)) > 0) {
				out.write(buffer, 0, len);
			}
			return out.toByteArray();
		} finally {
			in.close();
		}
	}
}
