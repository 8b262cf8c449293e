package ime.gmail.mailbox;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import ime.gmail.MailAccount;
import ime.gmail.MessageParser;
import ime.gmail.ParsedMessage;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;

import javax.mail.AuthenticationFailedException;
import javax.mail.FetchProfile;
import javax.mail.Flags;
import javax.mail.Folder;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.Store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.mail.gimap.GmailFolder;
import com.sun.mail.gimap.GmailMessage;

class ImapMailSessionTest {

	private static final String RAW = "Date: Mon, 10 Jun 2024 12:00:00 +0000\r\n"
			+ "From: alice@example.com\r\n"
			+ "To: bob@example.com\r\n"
			+ "Subject: Agenda\r\n"
			+ "Content-Type: text/plain\r\n"
			+ "\r\n"
			+ "See you at ten\r\n";

	private MailAccount account;
	private Store store;
	private GmailFolder inbox;
	private GmailMessage message;
	private ImapMailSession session;

	@BeforeEach
	void setUp() throws Exception {
		account = new MailAccount("someone@gmail.com", "secret");
		store = mock(Store.class);
		inbox = mock(GmailFolder.class);
		message = mock(GmailMessage.class);

		when(store.getFolder(MailBox.INBOX)).thenReturn(inbox);
		when(inbox.getFullName()).thenReturn(MailBox.INBOX);
		when(inbox.getMessageByUID(42L)).thenReturn(message);
		doAnswer(invocation -> {
			when(inbox.isOpen()).thenReturn(true);
			return null;
		}).when(inbox).open(Folder.READ_WRITE);

		session = new ImapMailSession(account, store);
	}

	@Test
	void connectUsesAccountSettings() throws Exception {
		session.connect();

		verify(store).connect("imap.gmail.com", 993, "someone@gmail.com", "secret");
	}

	@Test
	void failedLoginIsRethrown() throws Exception {
		doThrow(new AuthenticationFailedException("bad credentials"))
				.when(store).connect("imap.gmail.com", 993, "someone@gmail.com", "secret");

		assertThrows(AuthenticationFailedException.class, () -> session.connect());
	}

	@Test
	void selectOpensFolderOnce() throws Exception {
		session.select(MailBox.INBOX);
		session.select(MailBox.INBOX);

		verify(inbox, times(1)).open(Folder.READ_WRITE);
	}

	@Test
	void selectingAnotherMailboxClosesCurrent() throws Exception {
		GmailFolder trash = mock(GmailFolder.class);
		when(store.getFolder(MailBox.TRASH)).thenReturn(trash);

		session.select(MailBox.INBOX);
		session.select(MailBox.TRASH);

		verify(inbox).close(false);
		verify(trash).open(Folder.READ_WRITE);
	}

	@Test
	void fetchRendersGmailAttributes() throws Exception {
		when(message.getMessageNumber()).thenReturn(3);
		when(message.getThrId()).thenReturn(1278455344230334865L);
		when(message.getMsgId()).thenReturn(1278455344230334866L);
		when(message.getLabels()).thenReturn(new String[] { "Work", "My Label" });
		Flags flags = new Flags(Flags.Flag.SEEN);
		flags.add(Flags.Flag.FLAGGED);
		when(message.getFlags()).thenReturn(flags);
		doAnswer(invocation -> {
			OutputStream out = invocation.getArgument(0);
			out.write(RAW.getBytes(StandardCharsets.US_ASCII));
			return null;
		}).when(message).writeTo(any(OutputStream.class));

		session.select(MailBox.INBOX);
		FetchResult result = session.fetchByUid("42", "(BODY.PEEK[] FLAGS X-GM-THRID X-GM-MSGID X-GM-LABELS)");

		verify(inbox).fetch(aryEq(new Message[] { message }), any(FetchProfile.class));
		verify(message).setPeek(true);
		assertTrue(result.getHeaderBlock().startsWith("3 (X-GM-THRID 1278455344230334865 X-GM-MSGID 1278455344230334866"));
		assertTrue(result.getHeaderBlock().endsWith("BODY[] {" + RAW.length() + "}"));

		ParsedMessage parsed = new MessageParser().parse(result);
		assertEquals("Agenda", parsed.getSubject());
		assertEquals("See you at ten\r\n", parsed.getBody());
		assertEquals("1278455344230334865", parsed.getThreadId());
		assertEquals("1278455344230334866", parsed.getMessageId());
		assertEquals(new HashSet<String>(Arrays.asList("Work", "My Label")), parsed.getLabels());
		assertEquals(new HashSet<String>(Arrays.asList("\\Seen", "\\Flagged")), parsed.getFlags());
	}

	@Test
	void storeFlagsMapsSystemFlags() throws Exception {
		session.select(MailBox.INBOX);

		session.storeFlags("42", StoreAction.ADD, "\\Seen");
		session.storeFlags("42", StoreAction.REMOVE, "\\Flagged");

		verify(message).setFlags(new Flags(Flags.Flag.SEEN), true);
		verify(message).setFlags(new Flags(Flags.Flag.FLAGGED), false);
	}

	@Test
	void storeLabelSetsGmailLabels() throws Exception {
		session.select(MailBox.INBOX);

		session.storeLabel("42", StoreAction.ADD, "Work");
		session.storeLabel("42", StoreAction.REMOVE, "Travel");

		verify(message).setLabels(aryEq(new String[] { "Work" }), eq(true));
		verify(message).setLabels(aryEq(new String[] { "Travel" }), eq(false));
	}

	@Test
	void copyGoesToTargetFolder() throws Exception {
		Folder allMail = mock(Folder.class);
		when(store.getFolder(MailBox.ALL_MAIL)).thenReturn(allMail);

		session.copy("42", MailBox.ALL_MAIL, MailBox.INBOX);

		verify(inbox).open(Folder.READ_WRITE);
		verify(inbox).copyMessages(aryEq(new Message[] { message }), eq(allMail));
	}

	@Test
	void listLabelsReturnsFolderNames() throws Exception {
		Folder root = mock(Folder.class);
		Folder trash = mock(Folder.class);
		when(trash.getFullName()).thenReturn(MailBox.TRASH);
		when(store.getDefaultFolder()).thenReturn(root);
		when(root.list("*")).thenReturn(new Folder[] { inbox, trash });

		assertEquals(new HashSet<String>(Arrays.asList(MailBox.INBOX, MailBox.TRASH)), session.listLabels());
	}

	@Test
	void unknownUidIsAnError() throws Exception {
		session.select(MailBox.INBOX);

		assertThrows(MessagingException.class, () -> session.storeFlags("7", StoreAction.ADD, "\\Seen"));
	}

	@Test
	void nothingSelectedIsAnError() {
		assertThrows(MessagingException.class, () -> session.fetchByUid("42", "(FLAGS)"));
	}

	@Test
	void userFlagsPassThrough() {
		assertEquals(new Flags("$Later"), ImapMailSession.toFlags("$Later"));
		assertEquals("\\Seen $Later", ImapMailSession.flagList(flagsOf()));
	}

	private static Flags flagsOf() {
		Flags flags = new Flags(Flags.Flag.SEEN);
		flags.add("$Later");
		return flags;
	}
}
