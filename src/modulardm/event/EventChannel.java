package modulardm.event;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;

/**
 * Local publish/subscribe registry of one control. Scoping across the tree is
 * handled by the control, this class only knows about its own listeners.
 */
public class EventChannel {

	private static class Registration {
		final ControlListener listener;
		final ControlListener target;
		final boolean once;

		Registration(ControlListener listener, ControlListener target, boolean once) {
			this.listener = listener;
			this.target = target;
			this.once = once;
		}
	}

	private final Map<String, List<Registration>> listeners = new HashMap<>();

	public void add(String eventName, ControlListener listener, boolean once) {
		add(eventName, listener, listener, once);
	}

	/**
	 * Registers <code>target</code> to be invoked, identified by
	 * <code>listener</code> for {@link #remove(String, ControlListener)}.
	 */
	public void add(String eventName, ControlListener listener, ControlListener target, boolean once) {
		if (listener == null || target == null) {
			throw new NullPointerException("Missing listener for '" + eventName + "'");
		}
		List<Registration> regs = listeners.get(eventName);
		if (regs == null) {
			regs = new ArrayList<>();
			listeners.put(eventName, regs);
		}
		regs.add(new Registration(listener, target, once));
	}

	/**
	 * Removes the most recently added registration of <code>listener</code>.
	 */
	public boolean remove(String eventName, ControlListener listener) {
		final List<Registration> regs = listeners.get(eventName);
		if (regs == null) {
			return false;
		}
		for (int i = regs.size() - 1; i >= 0; --i) {
			if (regs.get(i).listener == listener) {
				regs.remove(i);
				if (regs.isEmpty()) {
					listeners.remove(eventName, regs);
				}
				return true;
			}
		}
		return false;
	}

	public void removeAll() {
		listeners.clear();
	}

	public int count(String eventName) {
		final List<Registration> regs = listeners.get(eventName);
		return regs != null ? regs.size() : 0;
	}

	/**
	 * Invokes the listeners registered for <code>eventName</code> in
	 * registration order. Listeners added or removed while firing take effect on
	 * the next emission.
	 *
	 * @return whether there were any listeners
	 */
	public boolean fire(String eventName, Object data, JSONObject metadata) {
		final List<Registration> regs = listeners.get(eventName);
		if (regs == null || regs.isEmpty()) {
			return false;
		}
		final List<Registration> snapshot = new ArrayList<>(regs);
		for (Registration reg : snapshot) {
			if (reg.once) {
				if (!regs.remove(reg)) {
					// Already consumed by a re-entrant emission
					continue;
				}
				if (regs.isEmpty()) {
					listeners.remove(eventName, regs);
				}
			}
			reg.target.onEvent(data, metadata);
		}
		return true;
	}
}
