package ime.gmail;

import ime.gmail.mailbox.FetchResult;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.mail.Header;
import javax.mail.MessagingException;
import javax.mail.Multipart;
import javax.mail.Part;
import javax.mail.Session;
import javax.mail.internet.ContentType;
import javax.mail.internet.MailDateFormat;
import javax.mail.internet.MimeMessage;
import javax.mail.internet.MimeUtility;

import org.apache.log4j.Logger;

/**
 * Turns one FETCH response entry into a {@link ParsedMessage}.
 * <p>
 * The header block is the response preamble, e.g.
 * <pre>
 * 42 (X-GM-THRID 1278455344230334865 X-GM-MSGID 1278455344230334865
 *     X-GM-LABELS ("\\Important" "Work") UID 42 FLAGS (\Seen) BODY[] {2310}
 * </pre>
 * and is scanned with patterns since the Gmail attributes have no structured
 * representation in the MIME source.
 */
public class MessageParser {
	private static Logger logger = Logger.getLogger(MessageParser.class);

	private static final Pattern FLAGS = Pattern.compile("FLAGS \\(([^\\)]*)\\)");
	private static final Pattern LABELS = Pattern.compile("X-GM-LABELS \\(([^\\)]+)\\)");
	private static final Pattern THREAD_ID = Pattern.compile("X-GM-THRID (\\d+)");
	private static final Pattern MESSAGE_ID = Pattern.compile("X-GM-MSGID (\\d+)");

	private final Session session;

	public MessageParser() {
		this(defaultSession());
	}

	public MessageParser(Session session) {
		this.session = session;
	}

	public ParsedMessage parse(FetchResult result) throws MessagingException {
		return parse(result.getHeaderBlock(), result.getRawBody());
	}

	public ParsedMessage parse(String headerBlock, byte[] rawBody) throws MessagingException {
		ParsedMessage parsed = new ParsedMessage();
		MimeMessage message = new MimeMessage(session, new ByteArrayInputStream(rawBody));

		parsed.mimeMessage = message;
		parsed.headers = parseHeaders(message);

		parsed.to = message.getHeader("To", null);
		parsed.from = message.getHeader("From", null);
		parsed.cc = message.getHeader("Cc", null);
		parsed.deliveredTo = message.getHeader("Delivered-To", null);

		parsed.subject = parseSubject(message.getHeader("Subject", null));

		try {
			if (message.isMimeType("multipart/*")) {
				walk(message, parsed);
			} else if (message.isMimeType("text/*")) {
				parsed.body = rawPayload(message);
			}
			parsed.attachments = parseAttachments(message);
		} catch (IOException e) {
			throw new MessageParseException("Failed to read MIME content", e);
		}

		parsed.sentAt = parseDate(message.getHeader("Date", null));

		parsed.flags = parseFlags(headerBlock);
		parsed.labels = parseLabels(headerBlock);
		parsed.threadId = parseThreadId(headerBlock);
		parsed.messageId = parseMessageId(headerBlock);

		logger.debug("Parsed message " + parsed.messageId + ": " + parsed.attachments.size() + " attachment(s), flags " + parsed.flags);
		return parsed;
	}

	/**
	 * Header names keep the case they were received with; a repeated header
	 * keeps its last value.
	 */
	public static Map<String, String> parseHeaders(MimeMessage message) throws MessagingException {
		Map<String, String> headers = new LinkedHashMap<String, String>();
		Enumeration<Header> all = message.getAllHeaders();
		while (all.hasMoreElements()) {
			Header h = all.nextElement();
			headers.put(h.getName(), h.getValue());
		}
		return headers;
	}

	public static String parseSubject(String encoded) {
		if (encoded == null)
			return null;
		try {
			return MimeUtility.decodeText(MimeUtility.unfold(encoded));
		} catch (UnsupportedEncodingException e) {
			logger.warn("Cannot decode subject " + encoded + ": " + e.getMessage());
			return encoded;
		}
	}

	public static Date parseDate(String date) throws MessageParseException {
		if (date == null)
			throw new MessageParseException("Message has no Date header");
		try {
			return new MailDateFormat().parse(date);
		} catch (java.text.ParseException e) {
			throw new MessageParseException("Invalid Date header: " + date, e);
		}
	}

	public static Set<String> parseFlags(String headerBlock) {
		Set<String> flags = new LinkedHashSet<String>();
		if (headerBlock == null)
			return flags;
		Matcher m = FLAGS.matcher(headerBlock);
		if (m.find()) {
			for (String flag : m.group(1).trim().split("\\s+")) {
				if (flag.length() > 0)
					flags.add(flag);
			}
		}
		return flags;
	}

	/**
	 * Reads the {@code X-GM-LABELS} list. Quoted labels may contain spaces;
	 * quotes are stripped.
	 */
	public static Set<String> parseLabels(String headerBlock) {
		Set<String> labels = new LinkedHashSet<String>();
		if (headerBlock == null)
			return labels;
		Matcher m = LABELS.matcher(headerBlock);
		if (!m.find())
			return labels;

		String list = m.group(1);
		StringBuilder token = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < list.length(); i++) {
			char c = list.charAt(i);
			if (c == '"') {
				quoted = !quoted;
			} else if (c == ' ' && !quoted) {
				if (token.length() > 0)
					labels.add(token.toString());
				token.setLength(0);
			} else {
				token.append(c);
			}
		}
		if (token.length() > 0)
			labels.add(token.toString());
		return labels;
	}

	public static String parseThreadId(String headerBlock) {
		return find(THREAD_ID, headerBlock);
	}

	public static String parseMessageId(String headerBlock) {
		return find(MESSAGE_ID, headerBlock);
	}

	private static String find(Pattern pattern, String headerBlock) {
		if (headerBlock == null)
			return null;
		Matcher m = pattern.matcher(headerBlock);
		return m.find() ? m.group(1) : null;
	}

	/**
	 * Depth-first walk; a later text/plain or text/html part replaces an
	 * earlier one.
	 */
	private void walk(Part part, ParsedMessage parsed) throws MessagingException, IOException {
		if (part.isMimeType("text/plain")) {
			parsed.body = textContent(part);
		} else if (part.isMimeType("text/html")) {
			parsed.html = textContent(part);
		} else if (part.isMimeType("multipart/*")) {
			Multipart multipart = (Multipart) part.getContent();
			for (int i = 0; i < multipart.getCount(); i++) {
				walk(multipart.getBodyPart(i), parsed);
			}
		} else if (part.isMimeType("message/rfc822")) {
			Object nested = part.getContent();
			if (nested instanceof Part)
				walk((Part) nested, parsed);
		}
	}

	private List<Attachment> parseAttachments(MimeMessage message) throws MessagingException, IOException {
		List<Attachment> attachments = new ArrayList<Attachment>();
		if (!message.isMimeType("multipart/*"))
			return Collections.emptyList();

		Multipart multipart = (Multipart) message.getContent();
		for (int i = 0; i < multipart.getCount(); i++) {
			Part part = multipart.getBodyPart(i);
			if (!Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition()))
				continue;
			Attachment attachment = new Attachment(part);
			if (attachment.isEmpty()) {
				logger.debug("Dropping empty attachment " + attachment.getName());
				continue;
			}
			attachments.add(attachment);
		}
		return Collections.unmodifiableList(attachments);
	}

	private static String textContent(Part part) throws MessagingException, IOException {
		return new String(readAll(part.getInputStream()), charset(part));
	}

	/**
	 * The body of a single-part text message, still transfer encoded.
	 */
	private static String rawPayload(MimeMessage message) throws MessagingException, IOException {
		return new String(readAll(message.getRawInputStream()), charset(message));
	}

	/**
	 * The Java charset of a text part. Unknown charsets such as
	 * {@code unknown-8bit} fall back to ISO-8859-1, which maps every byte.
	 */
	static Charset charset(Part part) throws MessagingException {
		String charset = new ContentType(part.getContentType()).getParameter("charset");
		if (charset == null)
			return StandardCharsets.US_ASCII;
		String javaCharset = MimeUtility.javaCharset(charset);
		try {
			if (Charset.isSupported(javaCharset))
				return Charset.forName(javaCharset);
		} catch (IllegalCharsetNameException e) {
			logger.debug("Illegal charset name " + charset);
		}
		logger.warn("Unsupported charset " + charset + ", reading text as ISO-8859-1");
		return StandardCharsets.ISO_8859_1;
	}

	private static byte[] readAll(InputStream in) throws IOException {
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

	private static Session defaultSession() {
		Properties props = new Properties();
		props.put("mail.mime.decodetext.strict", "false");
		return Session.getInstance(props, null);
	}
}
