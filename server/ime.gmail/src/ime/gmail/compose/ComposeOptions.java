package ime.gmail.compose;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.mail.internet.MimeBodyPart;

/**
 * Parameters of an outbound message. Attachments are either prepared MIME
 * parts or files read when the message is composed.
 */
public class ComposeOptions {
	private String subject;
	private String to;
	private String cc;
	private String bcc;
	private String text;
	private boolean html = false;
	private String sender;
	private String replyTo;
	private List<Object> attachments = new ArrayList<Object>();

	public ComposeOptions() {
	}

	public ComposeOptions(String subject, String to, String text) {
		this.subject = subject;
		this.to = to;
		this.text = text;
	}

	public String getSubject() {
		return subject;
	}

	public ComposeOptions setSubject(String subject) {
		this.subject = subject;
		return this;
	}

	public String getTo() {
		return to;
	}

	public ComposeOptions setTo(String to) {
		this.to = to;
		return this;
	}

	public String getCc() {
		return cc;
	}

	public ComposeOptions setCc(String cc) {
		this.cc = cc;
		return this;
	}

	public String getBcc() {
		return bcc;
	}

	public ComposeOptions setBcc(String bcc) {
		this.bcc = bcc;
		return this;
	}

	public String getText() {
		return text;
	}

	public ComposeOptions setText(String text) {
		this.text = text;
		return this;
	}

	public boolean isHtml() {
		return html;
	}

	public ComposeOptions setHtml(boolean html) {
		this.html = html;
		return this;
	}

	public String getSender() {
		return sender;
	}

	public ComposeOptions setSender(String sender) {
		this.sender = sender;
		return this;
	}

	public String getReplyTo() {
		return replyTo;
	}

	public ComposeOptions setReplyTo(String replyTo) {
		this.replyTo = replyTo;
		return this;
	}

	public ComposeOptions addAttachment(MimeBodyPart part) {
		attachments.add(part);
		return this;
	}

	public ComposeOptions addAttachment(File file) {
		attachments.add(file);
		return this;
	}

	public ComposeOptions addAttachment(String path) {
		return addAttachment(new File(path));
	}

	public List<Object> getAttachments() {
		return Collections.unmodifiableList(attachments);
	}

	public boolean hasAttachments() {
		return !attachments.isEmpty();
	}
}
