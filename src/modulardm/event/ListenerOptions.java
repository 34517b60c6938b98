package modulardm.event;

import modulardm.Control;

/**
 * Options for {@link Control#on(String, ControlListener, ListenerOptions)} and
 * {@link Control#once(String, ControlListener, ListenerOptions)}.
 */
public class ListenerOptions {

	public static final ListenerOptions NONE = new ListenerOptions(false, null);

	/**
	 * Call the listener right away with the current value of the property (or
	 * child) named by the event, if there is one.
	 */
	public final boolean immediate;

	/**
	 * Unsubscribe the listener automatically once this control emits 'remove'.
	 */
	public final Control caller;

	public ListenerOptions(boolean immediate, Control caller) {
		this.immediate = immediate;
		this.caller = caller;
	}

	public static ListenerOptions immediate() {
		return new ListenerOptions(true, null);
	}

	public static ListenerOptions caller(Control caller) {
		return new ListenerOptions(false, caller);
	}

	public ListenerOptions withImmediate(boolean immediate) {
		return new ListenerOptions(immediate, caller);
	}

	public ListenerOptions withCaller(Control caller) {
		return new ListenerOptions(immediate, caller);
	}
}
