package ime.gmail.mailbox;

/**
 * Direction of a STORE command.
 */
public enum StoreAction {
	/** +FLAGS / +X-GM-LABELS */
	ADD("+"),
	/** -FLAGS / -X-GM-LABELS */
	REMOVE("-");

	private final String prefix;

	StoreAction(String prefix) {
		this.prefix = prefix;
	}

	public String getPrefix() {
		return prefix;
	}

	/**
	 * Returns the STORE item name for this action, e.g. {@code +FLAGS}.
	 */
	public String keyword(String item) {
		return prefix + item;
	}

	public boolean isSet() {
		return this == ADD;
	}
}
