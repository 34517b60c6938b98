package modulardm.event;

/**
 * Which controls receive an emitted event.
 */
public enum EventScope {

	/**
	 * Only the emitting control.
	 */
	LOCAL("local"),

	/**
	 * The emitting control and every ancestor up to the root.
	 */
	BUBBLE("bubble"),

	/**
	 * Only the root of the tree.
	 */
	TOP("top"),

	/**
	 * The emitting control and the root.
	 */
	LOCAL_TOP("local_top");

	public final String key;

	private EventScope(String key) {
		this.key = key;
	}

	public boolean includesLocal() {
		return this == LOCAL || this == LOCAL_TOP || this == BUBBLE;
	}

	public boolean includesTop() {
		return this == TOP || this == LOCAL_TOP;
	}

	public static EventScope parse(String val) {
		if (val != null) {
			for (EventScope scope : values()) {
				if (scope.key.equals(val)) {
					return scope;
				}
			}
			System.out.println("Illegal " + EventScope.class.getSimpleName() + " value '" + val + "'");
		}
		return LOCAL;
	}
}
