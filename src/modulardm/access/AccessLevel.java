package modulardm.access;

/**
 * Permission level of a single access channel.
 */
public enum AccessLevel {

	PUBLIC("public"),

	/**
	 * Reserved for access by the control itself. Until that is supported it
	 * denies like {@link #NONE}.
	 */
	PRIVATE("private"),

	NONE("none");

	public final String key;

	private AccessLevel(String key) {
		this.key = key;
	}

	public boolean permitsExternal() {
		return this == PUBLIC;
	}

	/**
	 * Parses a level as written in declarative access lists. Unrecognized values
	 * deny access.
	 */
	public static AccessLevel parse(String val) {
		if (val == null) {
			return PUBLIC;
		}
		for (AccessLevel level : values()) {
			if (level.key.equals(val)) {
				return level;
			}
		}
		System.out.println("Illegal " + AccessLevel.class.getSimpleName() + " value '" + val + "', treating as '"
				+ NONE.key + "'");
		return NONE;
	}
}
