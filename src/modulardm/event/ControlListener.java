package modulardm.event;

import org.json.JSONObject;

@FunctionalInterface
public interface ControlListener {

	/**
	 * @param data     the emitted value. For property events the new value, for
	 *                 'data' events the change delta, for structural events the
	 *                 control concerned.
	 * @param metadata metadata attached to the property (or properties) the event
	 *                 concerns, or <code>null</code> if there is none.
	 */
	void onEvent(Object data, JSONObject metadata);
}
