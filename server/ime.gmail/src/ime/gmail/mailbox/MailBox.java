package ime.gmail.mailbox;

import ime.gmail.Message;

public class MailBox implements IMailBox {
	public static final String INBOX = "INBOX";
	//Gmail system folders
	public static final String TRASH = "[Gmail]/Trash";
	public static final String BIN = "[Gmail]/Bin";
	public static final String ALL_MAIL = "[Gmail]/All Mail";

	private String name;
	private IMailSession session;

	public MailBox(String name, IMailSession session) {
		this.name = name;
		this.session = session;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public IMailSession getSession() {
		return session;
	}

	/**
	 * Returns an unloaded message; nothing is fetched until one of its fields
	 * is read.
	 */
	@Override
	public Message getMessage(String uid) {
		return new Message(this, uid);
	}

	public boolean isTrash() {
		return isTrash(name);
	}

	public static boolean isTrash(String name) {
		return TRASH.equals(name) || BIN.equals(name);
	}

	@Override
	public String toString() {
		return "<MailBox " + name + ">";
	}
}
