package ime.gmail;

import ime.gmail.mailbox.FetchResult;
import ime.gmail.mailbox.IMailBox;
import ime.gmail.mailbox.IMailSession;
import ime.gmail.mailbox.MailBox;
import ime.gmail.mailbox.StoreAction;

import java.text.SimpleDateFormat;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.mail.MessagingException;
import javax.mail.internet.MimeMessage;

import org.apache.log4j.Logger;

/**
 * One message of a Gmail mailbox, addressed by UID.
 * <p>
 * A new instance only knows its UID and mailbox. The first read of any data
 * field fetches the full message with its flags and Gmail attributes and
 * fills every field from that single response; later reads use the loaded
 * state, even when a field is legitimately empty. Flag and label operations
 * send one STORE (or COPY) each and then update the local state.
 * <p>
 * Instances are not thread-safe.
 */
public class Message {
	private static Logger logger = Logger.getLogger(Message.class);

	public static final String FETCH_SPEC = "(BODY.PEEK[] FLAGS X-GM-THRID X-GM-MSGID X-GM-LABELS)";

	public enum Flag {
		ANSWERED("\\Answered"), DELETED("\\Deleted"), DRAFT("\\Draft"), FLAGGED("\\Flagged"), RECENT("\\Recent"), SEEN("\\Seen");

		private final String atom;

		Flag(String atom) {
			this.atom = atom;
		}

		public String getAtom() {
			return atom;
		}
	}

	private static final MessageParser DEFAULT_PARSER = new MessageParser();

	private final String uid;
	private final IMailBox mailBox;
	private final MessageParser parser;

	private boolean loaded = false;

	private MimeMessage mailMessage;
	private Map<String, String> headers;

	private String subject;
	private String body;
	private String html;

	private String to;
	private String fr;
	private String cc;
	private String deliveredTo;

	private Date sentAt;

	private Set<String> flags;
	private Set<String> labels;

	private String threadId;
	private String messageId;

	private List<Attachment> attachments;

	public Message(IMailBox mailBox, String uid) {
		this(mailBox, uid, DEFAULT_PARSER);
	}

	public Message(IMailBox mailBox, String uid, MessageParser parser) {
		this.mailBox = mailBox;
		this.uid = uid;
		this.parser = parser;
	}

	public String getUid() {
		return uid;
	}

	public IMailBox getMailBox() {
		return mailBox;
	}

	public boolean isLoaded() {
		return loaded;
	}

	/**
	 * Fetches the message again and replaces all local state.
	 */
	public MimeMessage fetch() throws MessagingException {
		logger.debug("Fetching message " + uid + " from " + mailBox.getName());
		FetchResult result = session().fetchByUid(uid, FETCH_SPEC);
		parse(result);
		return mailMessage;
	}

	public void parse(FetchResult result) throws MessagingException {
		ParsedMessage parsed = parser.parse(result);

		this.mailMessage = parsed.getMimeMessage();
		this.headers = parsed.getHeaders();
		this.subject = parsed.getSubject();
		this.body = parsed.getBody();
		this.html = parsed.getHtml();
		this.to = parsed.getTo();
		this.fr = parsed.getFrom();
		this.cc = parsed.getCc();
		this.deliveredTo = parsed.getDeliveredTo();
		this.sentAt = parsed.getSentAt();
		this.flags = new LinkedHashSet<String>(parsed.getFlags());
		this.labels = new LinkedHashSet<String>(parsed.getLabels());
		this.threadId = parsed.getThreadId();
		this.messageId = parsed.getMessageId();
		this.attachments = parsed.getAttachments();
		this.loaded = true;
	}

	private void ensureLoaded() throws MessagingException {
		if (!loaded)
			fetch();
	}

	public MimeMessage getMailMessage() throws MessagingException {
		ensureLoaded();
		return mailMessage;
	}

	public Map<String, String> getHeaders() throws MessagingException {
		ensureLoaded();
		return Collections.unmodifiableMap(headers);
	}

	public String getSubject() throws MessagingException {
		ensureLoaded();
		return subject;
	}

	public String getBody() throws MessagingException {
		ensureLoaded();
		return body;
	}

	public String getHtml() throws MessagingException {
		ensureLoaded();
		return html;
	}

	public String getTo() throws MessagingException {
		ensureLoaded();
		return to;
	}

	public String getFrom() throws MessagingException {
		ensureLoaded();
		return fr;
	}

	/**
	 * The bare address of the From header, without display name.
	 */
	public String getFromAddress() throws MessagingException {
		String from = getFrom();
		if (from != null && from.indexOf('<') != -1 && from.indexOf('>') != -1)
			return from.substring(from.lastIndexOf('<') + 1).replace(">", "");
		return from;
	}

	public String getCc() throws MessagingException {
		ensureLoaded();
		return cc;
	}

	public String getDeliveredTo() throws MessagingException {
		ensureLoaded();
		return deliveredTo;
	}

	public Date getSentAt() throws MessagingException {
		ensureLoaded();
		return sentAt;
	}

	public Date getDate() throws MessagingException {
		return getSentAt();
	}

	/**
	 * The sent date as {@code M/d/yy}.
	 */
	public String getStringSentAt() throws MessagingException {
		return new SimpleDateFormat("M/d/yy").format(getSentAt());
	}

	public String getStringDate() throws MessagingException {
		return getStringSentAt();
	}

	public Set<String> getFlags() throws MessagingException {
		ensureLoaded();
		return Collections.unmodifiableSet(flags);
	}

	public Set<String> getLabels() throws MessagingException {
		ensureLoaded();
		return Collections.unmodifiableSet(labels);
	}

	public String getThreadId() throws MessagingException {
		ensureLoaded();
		return threadId;
	}

	public String getMessageId() throws MessagingException {
		ensureLoaded();
		return messageId;
	}

	public List<Attachment> getAttachments() throws MessagingException {
		ensureLoaded();
		return attachments;
	}

	public boolean hasFlag(Flag flag) throws MessagingException {
		return hasFlag(flag.getAtom());
	}

	public boolean hasFlag(String flag) throws MessagingException {
		ensureLoaded();
		return flags.contains(flag);
	}

	public boolean isRead() throws MessagingException {
		return hasFlag(Flag.SEEN);
	}

	public void read() throws MessagingException {
		addFlag(Flag.SEEN);
	}

	public void markAsRead() throws MessagingException {
		read();
	}

	public void unread() throws MessagingException {
		removeFlag(Flag.SEEN);
	}

	public void markAsUnread() throws MessagingException {
		unread();
	}

	public boolean isStarred() throws MessagingException {
		return hasFlag(Flag.FLAGGED);
	}

	public void star() throws MessagingException {
		addFlag(Flag.FLAGGED);
	}

	public void unstar() throws MessagingException {
		removeFlag(Flag.FLAGGED);
	}

	public boolean isDraft() throws MessagingException {
		return hasFlag(Flag.DRAFT);
	}

	public boolean isDeleted() throws MessagingException {
		return hasFlag(Flag.DELETED);
	}

	public boolean hasLabel(String label) throws MessagingException {
		ensureLoaded();
		return labels.contains(label);
	}

	public void addLabel(String label) throws MessagingException {
		session().storeLabel(uid, StoreAction.ADD, label);
		ensureLoaded();
		labels.add(label);
	}

	public void removeLabel(String label) throws MessagingException {
		session().storeLabel(uid, StoreAction.REMOVE, label);
		ensureLoaded();
		labels.remove(label);
	}

	/**
	 * Flags the message deleted and, unless it already sits in the trash,
	 * moves it there.
	 */
	public void delete() throws MessagingException {
		addFlag(Flag.DELETED);

		String trash = session().listLabels().contains(MailBox.TRASH) ? MailBox.TRASH : MailBox.BIN;
		if (!MailBox.isTrash(mailBox.getName()))
			moveTo(trash);
	}

	/**
	 * Copies the message to {@code name} and deletes the original unless the
	 * target is the trash. The two steps are not atomic: a failure after the
	 * copy leaves the message in both mailboxes.
	 */
	public void moveTo(String name) throws MessagingException {
		logger.debug("Moving message " + uid + " from " + mailBox.getName() + " to " + name);
		session().copy(uid, name, mailBox.getName());
		if (!MailBox.isTrash(name))
			delete();
	}

	public void archive() throws MessagingException {
		moveTo(MailBox.ALL_MAIL);
	}

	private void addFlag(Flag flag) throws MessagingException {
		session().storeFlags(uid, StoreAction.ADD, flag.getAtom());
		ensureLoaded();
		flags.add(flag.getAtom());
	}

	private void removeFlag(Flag flag) throws MessagingException {
		session().storeFlags(uid, StoreAction.REMOVE, flag.getAtom());
		ensureLoaded();
		flags.remove(flag.getAtom());
	}

	private IMailSession session() throws MessagingException {
		IMailSession session = mailBox.getSession();
		session.select(mailBox.getName());
		return session;
	}

	@Override
	public String toString() {
		return "<Message " + uid + ">";
	}
}
