package ime.gmail.mailbox;

import ime.gmail.Message;

public interface IMailBox {

	String getName();

	IMailSession getSession();

	Message getMessage(String uid);
}
