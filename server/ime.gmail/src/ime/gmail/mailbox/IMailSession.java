package ime.gmail.mailbox;

import java.util.Set;

import javax.mail.MessagingException;

/**
 * Authenticated protocol operations against one mail account. Commands act on
 * the currently selected mailbox; callers serialize access when they share a
 * session.
 */
public interface IMailSession {

	void select(String mailbox) throws MessagingException;

	FetchResult fetchByUid(String uid, String fetchSpec) throws MessagingException;

	void storeFlags(String uid, StoreAction action, String flag) throws MessagingException;

	void storeLabel(String uid, StoreAction action, String label) throws MessagingException;

	void copy(String uid, String targetMailbox, String sourceMailbox) throws MessagingException;

	Set<String> listLabels() throws MessagingException;
}
