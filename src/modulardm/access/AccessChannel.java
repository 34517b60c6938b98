package modulardm.access;

/**
 * The four independent paths through which a property can be read or written.
 */
public enum AccessChannel {

	/**
	 * Writes arriving through declarative data, {@link modulardm.Control#set}.
	 */
	SET("Set"),

	/**
	 * Reads for {@link modulardm.Control#get} and change notifications.
	 */
	GET("Get"),

	/**
	 * Direct writes through the generated setter.
	 */
	SETTER("setter"),

	/**
	 * Direct reads through the generated getter.
	 */
	GETTER("getter");

	public final String key;

	private AccessChannel(String key) {
		this.key = key;
	}
}
