package ime.gmail.mailbox;

import ime.gmail.MailAccount;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

import javax.mail.AuthenticationFailedException;
import javax.mail.FetchProfile;
import javax.mail.Flags;
import javax.mail.Folder;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.Store;

import org.apache.log4j.Logger;

import com.sun.mail.gimap.GmailFolder;
import com.sun.mail.gimap.GmailMessage;
import com.sun.mail.imap.IMAPFolder;
import com.sun.mail.imap.IMAPMessage;

/**
 * {@link IMailSession} over JavaMail's Gmail provider. One folder is open at
 * a time; selecting another mailbox closes the current one.
 */
public class ImapMailSession implements IMailSession {
	private static Logger logger = Logger.getLogger(ImapMailSession.class);

	private MailAccount mailAccount;
	private Session mailSession;
	private Store store;
	private IMAPFolder folder;

	public ImapMailSession(MailAccount mailAccount) {
		this.mailAccount = mailAccount;
		this.mailSession = Session.getInstance(mailAccount.getSessionProperties(), null);
	}

	ImapMailSession(MailAccount mailAccount, Store store) {
		this.mailAccount = mailAccount;
		this.store = store;
	}

	public void connect() throws MessagingException {
		if (store == null)
			store = mailSession.getStore(mailAccount.getStoreProtocol());
		try {
			store.connect(mailAccount.getRecvAddress(), mailAccount.getRecvPort(), mailAccount.getAccount(), mailAccount.getPassword());
		} catch (AuthenticationFailedException e) {
			logger.error("Authentication failed for " + mailAccount.getAccount());
			throw e;
		}
		logger.info("Connected to " + mailAccount.getRecvAddress() + " as " + mailAccount.getAccount());
	}

	public void close() {
		try {
			closeFolder();
			if (store != null && store.isConnected())
				store.close();
		} catch (MessagingException e) {
			logger.warn("Failed to close session for " + mailAccount.getAccount(), e);
		}
	}

	public IMailBox getMailBox(String name) {
		return new MailBox(name, this);
	}

	@Override
	public void select(String mailbox) throws MessagingException {
		if (folder != null && folder.isOpen() && mailbox.equals(folder.getFullName()))
			return;
		closeFolder();
		folder = (IMAPFolder) store.getFolder(mailbox);
		folder.open(Folder.READ_WRITE);
		logger.debug("Selected " + mailbox);
	}

	@Override
	public FetchResult fetchByUid(String uid, String fetchSpec) throws MessagingException {
		logger.debug("UID FETCH " + uid + " " + fetchSpec);
		IMAPMessage message = getMessage(uid);

		FetchProfile profile = new FetchProfile();
		profile.add(FetchProfile.Item.FLAGS);
		profile.add(GmailFolder.FetchProfileItem.MSGID);
		profile.add(GmailFolder.FetchProfileItem.THRID);
		profile.add(GmailFolder.FetchProfileItem.LABELS);
		folder.fetch(new Message[] { message }, profile);

		message.setPeek(true);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try {
			message.writeTo(out);
		} catch (IOException e) {
			logger.error(e.getMessage(), e);
			throw new MessagingException("Failed to read message " + uid, e);
		}
		byte[] rawBody = out.toByteArray();
		return new FetchResult(headerBlock(uid, message, rawBody.length), rawBody);
	}

	@Override
	public void storeFlags(String uid, StoreAction action, String flag) throws MessagingException {
		logger.debug("UID STORE " + uid + " " + action.keyword("FLAGS") + " " + flag);
		getMessage(uid).setFlags(toFlags(flag), action.isSet());
	}

	@Override
	public void storeLabel(String uid, StoreAction action, String label) throws MessagingException {
		logger.debug("UID STORE " + uid + " " + action.keyword("X-GM-LABELS") + " " + label);
		IMAPMessage message = getMessage(uid);
		if (!(message instanceof GmailMessage))
			throw new MessagingException("Labels are not supported by " + mailAccount.getRecvAddress());
		((GmailMessage) message).setLabels(new String[] { label }, action.isSet());
	}

	@Override
	public void copy(String uid, String targetMailbox, String sourceMailbox) throws MessagingException {
		logger.debug("UID COPY " + uid + " " + sourceMailbox + " -> " + targetMailbox);
		select(sourceMailbox);
		IMAPMessage message = getMessage(uid);
		Folder target = store.getFolder(targetMailbox);
		folder.copyMessages(new Message[] { message }, target);
	}

	@Override
	public Set<String> listLabels() throws MessagingException {
		Set<String> labels = new LinkedHashSet<String>();
		for (Folder f : store.getDefaultFolder().list("*")) {
			labels.add(f.getFullName());
		}
		return labels;
	}

	private IMAPMessage getMessage(String uid) throws MessagingException {
		if (folder == null)
			throw new MessagingException("No mailbox selected");
		Message message = folder.getMessageByUID(Long.parseLong(uid));
		if (message == null)
			throw new MessagingException("No message with UID " + uid + " in " + folder.getFullName());
		return (IMAPMessage) message;
	}

	private void closeFolder() throws MessagingException {
		if (folder != null && folder.isOpen())
			folder.close(false);
		folder = null;
	}

	/**
	 * Renders the attributes of {@code message} the way a
	 * {@code UID FETCH ... (BODY.PEEK[] FLAGS X-GM-THRID X-GM-MSGID X-GM-LABELS)}
	 * response preamble carries them.
	 */
	static String headerBlock(String uid, IMAPMessage message, int length) throws MessagingException {
		StringBuilder sb = new StringBuilder();
		sb.append(message.getMessageNumber()).append(" (");
		if (message instanceof GmailMessage) {
			GmailMessage gmail = (GmailMessage) message;
			sb.append("X-GM-THRID ").append(gmail.getThrId())
			  .append(" X-GM-MSGID ").append(gmail.getMsgId())
			  .append(" X-GM-LABELS (");
			String[] labels = gmail.getLabels();
			if (labels != null) {
				for (int i = 0; i < labels.length; i++) {
					if (i > 0)
						sb.append(' ');
					sb.append('"').append(labels[i]).append('"');
				}
			}
			sb.append(") ");
		}
		sb.append("UID ").append(uid)
		  .append(" FLAGS (").append(flagList(message.getFlags())).append(")")
		  .append(" BODY[] {").append(length).append("}");
		return sb.toString();
	}

	static String flagList(Flags flags) {
		StringBuilder sb = new StringBuilder();
		for (Flags.Flag flag : flags.getSystemFlags()) {
			String atom = toAtom(flag);
			if (atom == null)
				continue;
			if (sb.length() > 0)
				sb.append(' ');
			sb.append(atom);
		}
		for (String flag : flags.getUserFlags()) {
			if (sb.length() > 0)
				sb.append(' ');
			sb.append(flag);
		}
		return sb.toString();
	}

	static Flags toFlags(String atom) {
		String name = atom.toLowerCase();
		if (name.equals("\\seen"))
			return new Flags(Flags.Flag.SEEN);
		if (name.equals("\\flagged"))
			return new Flags(Flags.Flag.FLAGGED);
		if (name.equals("\\deleted"))
			return new Flags(Flags.Flag.DELETED);
		if (name.equals("\\draft"))
			return new Flags(Flags.Flag.DRAFT);
		if (name.equals("\\answered"))
			return new Flags(Flags.Flag.ANSWERED);
		if (name.equals("\\recent"))
			return new Flags(Flags.Flag.RECENT);
		return new Flags(atom);
	}

	private static String toAtom(Flags.Flag flag) {
		if (flag == Flags.Flag.SEEN)
			return "\\Seen";
		if (flag == Flags.Flag.FLAGGED)
			return "\\Flagged";
		if (flag == Flags.Flag.DELETED)
			return "\\Deleted";
		if (flag == Flags.Flag.DRAFT)
			return "\\Draft";
		if (flag == Flags.Flag.ANSWERED)
			return "\\Answered";
		if (flag == Flags.Flag.RECENT)
			return "\\Recent";
		return null;
	}
}
