package ime.gmail;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Connection settings of a Gmail account.
 */
public class MailAccount {
	public static final String DEFAULT_HOST = "imap.gmail.com";
	public static final String PROPERTY_PREFIX = "gmail.";

	private Map<String, Object> entity;
	private Properties mailProperties = new Properties();

	public MailAccount(Map<String, Object> entity) {
		this.entity = entity;
	}

	public MailAccount(String account, String password) {
		this(new HashMap<String, Object>());
		entity.put("account", account);
		entity.put("password", password);
	}

	/**
	 * Reads {@code gmail.*} keys into the account and keeps any
	 * {@code mail.*} keys as extra JavaMail properties.
	 */
	public static MailAccount load(InputStream in) throws IOException {
		Properties props = new Properties();
		props.load(in);

		MailAccount mailAccount = new MailAccount(new HashMap<String, Object>());
		for (String key : props.stringPropertyNames()) {
			String value = props.getProperty(key).trim();
			if (key.startsWith(PROPERTY_PREFIX)) {
				String field = key.substring(PROPERTY_PREFIX.length());
				if (field.equals("recv_port"))
					mailAccount.entity.put(field, Long.valueOf(value));
				else if (field.equals("is_recv_ssl"))
					mailAccount.entity.put(field, Boolean.valueOf(value));
				else
					mailAccount.entity.put(field, value);
			} else if (key.startsWith("mail.")) {
				mailAccount.mailProperties.setProperty(key, value);
			}
		}
		return mailAccount;
	}

	public Map<String, Object> getEntity() {
		return this.entity;
	}

	public String getRecvAddress() {
		String value = (String) entity.get("recv_address");
		if (value != null)
			return value;
		else
			return DEFAULT_HOST;
	}

	public int getRecvPort() {
		Long value = (Long) entity.get("recv_port");
		if (value != null)
			return value.intValue();
		else if (isRecvSSL())
			return 993;
		else
			return 143;
	}

	public boolean isRecvSSL() {
		Boolean value = (Boolean) entity.get("is_recv_ssl");
		if (value != null)
			return value;
		else
			return true;
	}

	public String getAccount() {
		String value = (String) entity.get("account");
		if (value != null)
			return value;
		else
			return "";
	}

	public String getPassword() {
		String value = (String) entity.get("password");
		if (value != null)
			return value;
		else
			return "";
	}

	/**
	 * Store protocol for the Gmail provider.
	 */
	public String getStoreProtocol() {
		return isRecvSSL() ? "gimaps" : "gimap";
	}

	public Properties getSessionProperties() {
		Properties props = new Properties();
		props.put("mail." + getStoreProtocol() + ".partialfetch", "false");
		props.putAll(mailProperties);
		return props;
	}
}
