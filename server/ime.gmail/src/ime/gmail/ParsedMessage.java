package ime.gmail;

import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.mail.internet.MimeMessage;

/**
 * Everything one parse pass extracts from a FETCH response.
 */
public class ParsedMessage {
	MimeMessage mimeMessage;
	Map<String, String> headers;

	String subject;
	String body;
	String html;

	String to;
	String from;
	String cc;
	String deliveredTo;

	Date sentAt;

	Set<String> flags;
	Set<String> labels;

	String threadId;
	String messageId;

	List<Attachment> attachments;

	public MimeMessage getMimeMessage() {
		return mimeMessage;
	}

	public Map<String, String> getHeaders() {
		return headers;
	}

	public String getSubject() {
		return subject;
	}

	public String getBody() {
		return body;
	}

	public String getHtml() {
		return html;
	}

	public String getTo() {
		return to;
	}

	public String getFrom() {
		return from;
	}

	public String getCc() {
		return cc;
	}

	public String getDeliveredTo() {
		return deliveredTo;
	}

	public Date getSentAt() {
		return sentAt;
	}

	public Set<String> getFlags() {
		return flags;
	}

	public Set<String> getLabels() {
		return labels;
	}

	public String getThreadId() {
		return threadId;
	}

	public String getMessageId() {
		return messageId;
	}

	public List<Attachment> getAttachments() {
		return attachments;
	}
}
