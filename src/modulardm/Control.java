package modulardm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONObject;

import modulardm.access.AccessChannel;
import modulardm.access.AccessPolicy;
import modulardm.data.ControlData;
import modulardm.data.GetOptions;
import modulardm.event.ControlListener;
import modulardm.event.EventChannel;
import modulardm.event.EventScope;
import modulardm.event.ListenerOptions;
import modulardm.metaprogramming.AccessorGenerator;
import modulardm.property.PropertyAccessor;
import modulardm.property.PropertyRegistry;
import modulardm.resolver.ControlFactory;
import modulardm.util.JsonUtil;

/**
 * A node in a control tree.
 * <p>
 * Node types extend this class and declare their observable properties as
 * plain instance fields of type number, String, boolean, array or List. When a
 * control is created from declarative data, the values of those fields are
 * moved into the control's property registry. From then on they must be read
 * and written through {@link #getProperty(String)} and
 * {@link #setProperty(String, Object)}, the Java fields only provide initial
 * values. Fields whose name starts with '_' are left alone.
 *
 * <pre>
 * public class Room extends Control {
 * 	public int doors = 1;
 * 	public int windows = 1;
 * }
 * </pre>
 */
public class Control {

	public static final String EVENT_NEW_CHILD = "newChildControl";
	public static final String EVENT_REMOVE = "remove";
	public static final String EVENT_DATA = "data";
	public static final String EVENT_LOG = "log";

	private String typeName;
	private String name = "";
	private boolean hidden;
	private Boolean removalRequested;

	private final Map<String, Control> children = new LinkedHashMap<>();
	private final PropertyRegistry properties = new PropertyRegistry();
	private final EventChannel events = new EventChannel();
	private final List<CallerLink> callerLinks = new ArrayList<>();

	private Control parent;
	private TopLevelContainer root;

	private static class CallerLink {
		final String eventName;
		final ControlListener listener;
		final Control caller;
		final ControlListener hook;

		CallerLink(String eventName, ControlListener listener, Control caller, ControlListener hook) {
			this.eventName = eventName;
			this.listener = listener;
			this.caller = caller;
			this.hook = hook;
		}
	}

	public Control() {
		this.typeName = getClass().getSimpleName();
	}

	void becomeRoot(TopLevelContainer self) {
		this.root = self;
		this.name = "";
		properties.seal();
	}

	private void attach(String childName, String childTypeName, Control newParent) {
		if (root != null || parent != null) {
			throw new IllegalStateException(this + " is already part of a control tree");
		}
		this.name = childName;
		this.typeName = childTypeName;
		this.parent = newParent;
		this.root = newParent.root;
		AccessorGenerator.generate(this, root.getSchema(getClass()), properties);
	}

	/**
	 * Called after the control has been created and received its initial data,
	 * before its parent announces it. Override to add initialization logic.
	 */
	protected void init() {
	}

	// -------------------------------------
	// Declarative data
	// -------------------------------------

	public void set(JSONObject data) {
		set(data != null ? ControlData.fromJSON(data) : null);
	}

	/**
	 * Applies declarative data: updates properties, forwards nested data to
	 * existing children, creates new children for nested data with a type name
	 * and removes this control if asked to.
	 * <p>
	 * A <code>remove</code> flag that is exactly true removes this control from
	 * its parent, and the rest of <code>data</code> is then ignored. Keys that do
	 * not match a property, a child or a typed branch are ignored, as are values
	 * that cannot be coerced to the matching property's kind.
	 */
	public void set(ControlData data) {
		if (data == null) {
			return;
		}
		if (data.remove != null) {
			removalRequested = data.remove;
			if (data.isRemoveRequested() && parent != null) {
				parent.removeChild(name);
				return;
			}
		}
		if (data.hidden != null) {
			setHidden(data.hidden);
		}

		final boolean wasAttached = root != null;
		for (Map.Entry<String, Object> ent : data.getEntries().entrySet()) {
			if (wasAttached && root == null) {
				// Removed by a listener while applying data
				break;
			}
			final String key = ent.getKey();
			if (ControlData.isInternalKey(key) || ControlData.isReservedKey(key)) {
				continue;
			}
			final Object val = ent.getValue();

			if (properties.has(key)) {
				if (!(val instanceof ControlData) && properties.isAllowed(key, AccessChannel.SET)) {
					final PropertyAccessor acc = properties.accessor(key);
					final Object coerced;
					try {
						coerced = acc.getDescriptor().coerce(val);
					} catch (IllegalArgumentException e) {
						if (TopLevelContainer.VERBOSE) {
							System.out.println("Ignoring '" + key + "' for " + this + ": " + e.getMessage());
						}
						continue;
					}
					// Listener exceptions from here on belong to the caller
					acc.write(coerced, false);
				}
			} else if (children.containsKey(key)) {
				// If a child shares the name of a property, the property wins
				if (val instanceof ControlData) {
					children.get(key).set((ControlData) val);
				}
			} else if (val instanceof ControlData && ((ControlData) val).hasTypeName()) {
				createControl((ControlData) val, key);
			} else if (TopLevelContainer.VERBOSE) {
				System.out.println("Ignoring unknown key '" + key + "' for " + this);
			}
		}
	}

	Control createControl(ControlData data, String childName) {
		if (root == null) {
			return null;
		}
		final ControlFactory factory = root.resolveType(data.typeName);
		if (factory == null) {
			if (TopLevelContainer.VERBOSE) {
				System.out.println("Unknown control type '" + data.typeName + "' for '" + childName + "' in " + this
						+ ", skipping it");
			}
			return null;
		}
		final Control child = factory.create();
		if (child == null) {
			return null;
		}
		child.attach(childName, data.typeName, this);
		children.put(childName, child);

		child.set(data);
		if (child.parent != this) {
			// The initial data removed it again
			return null;
		}
		child.init();

		emit(childName, child);
		emit(EVENT_NEW_CHILD, child);
		if (TopLevelContainer.VERBOSE) {
			System.out.println("Created " + child);
		}
		return child;
	}

	/**
	 * Removes a child and everything below it. The child emits 'remove' before it
	 * is detached. Afterwards it has no listeners and no links into the tree.
	 * Unknown names are ignored.
	 */
	public void removeChild(String childName) {
		final Control child = children.get(childName);
		if (child == null) {
			return;
		}
		child.emit(EVENT_REMOVE, child);
		if (children.remove(childName, child)) {
			child.teardown();
			if (TopLevelContainer.VERBOSE) {
				System.out.println("Removed '" + childName + "' from " + this);
			}
		}
	}

	private void teardown() {
		for (String childName : new ArrayList<>(children.keySet())) {
			removeChild(childName);
		}
		removeAllListeners();
		parent = null;
		root = null;
	}

	public JSONObject get() {
		return get(GetOptions.DEFAULT);
	}

	public JSONObject get(boolean sparse) {
		return get(new GetOptions(sparse, GetOptions.DEFAULT.includeTypeNames));
	}

	/**
	 * Collects the readable properties of this control and its visible
	 * descendants.
	 */
	public JSONObject get(GetOptions options) {
		final JSONObject ret = new JSONObject();
		if (options.includeTypeNames) {
			ret.put(ControlData.TYPE_NAME_KEY, typeName);
		}
		for (String prop : properties.names()) {
			if (!properties.isAllowed(prop, AccessChannel.GET)) {
				continue;
			}
			final Object val = properties.value(prop);
			if (options.sparse && "".equals(val)) {
				continue;
			}
			ret.put(prop, JsonUtil.toJsonValue(val));
		}
		for (Map.Entry<String, Control> ent : children.entrySet()) {
			if (!ent.getValue().hidden) {
				ret.put(ent.getKey(), ent.getValue().get(options));
			}
		}
		return ret;
	}

	// -------------------------------------
	// Properties
	// -------------------------------------

	/**
	 * Reads a property through its generated getter. Returns <code>null</code>
	 * for unknown properties and when the getter channel is denied.
	 */
	public Object getProperty(String propertyName) {
		final PropertyAccessor acc = properties.accessor(propertyName);
		return acc != null ? acc.get() : null;
	}

	public <T> T getProperty(String propertyName, Class<T> type) {
		final Object val = getProperty(propertyName);
		return type.isInstance(val) ? type.cast(val) : null;
	}

	/**
	 * Writes a property through its generated setter.
	 *
	 * @return whether the value changed
	 * @throws IllegalArgumentException if there is no such property or the value
	 *                                  cannot be coerced to its kind
	 */
	public boolean setProperty(String propertyName, Object value) {
		final PropertyAccessor acc = properties.accessor(propertyName);
		if (acc == null) {
			throw new IllegalArgumentException("No property '" + propertyName + "' in " + this);
		}
		return acc.set(value);
	}

	public boolean hasProperty(String propertyName) {
		return properties.has(propertyName);
	}

	public Set<String> getPropertyNames() {
		return properties.names();
	}

	public PropertyAccessor accessor(String propertyName) {
		return properties.accessor(propertyName);
	}

	/**
	 * Sets the access control list of a property. Ignored for names that are not
	 * properties.
	 */
	public boolean setAccess(String propertyName, AccessPolicy policy) {
		return properties.setAccess(propertyName, policy);
	}

	public boolean setAccess(String propertyName, JSONObject acl) {
		return setAccess(propertyName, AccessPolicy.fromJSON(acl));
	}

	public AccessPolicy getAccess(String propertyName) {
		return properties.getAccess(propertyName);
	}

	/**
	 * Attaches metadata to a property. It is passed to listeners of the
	 * property's events and of 'data' events caused by the property.
	 */
	public boolean setMeta(String propertyName, JSONObject meta) {
		return properties.setMeta(propertyName, meta);
	}

	public JSONObject getMeta(String propertyName) {
		return properties.getMeta(propertyName);
	}

	// -------------------------------------
	// Notification
	// -------------------------------------

	public void notifyProperty(String... propertyNames) {
		notifyProperty(Arrays.asList(propertyNames));
	}

	/**
	 * Reports the current values of the given properties to the parent chain and
	 * emits 'data' on this control. Properties that are not readable on the Get
	 * channel are left out.
	 */
	public void notifyProperty(Collection<String> propertyNames) {
		final JSONObject delta = new JSONObject();
		JSONObject meta = null;
		for (String prop : propertyNames) {
			if (!properties.has(prop) || !properties.isAllowed(prop, AccessChannel.GET)) {
				continue;
			}
			final Object val = properties.accessor(prop).get();
			if (val == null) {
				continue;
			}
			delta.put(prop, JsonUtil.toJsonValue(val));
			final JSONObject propMeta = properties.getMeta(prop);
			if (propMeta != null) {
				if (meta == null) {
					meta = new JSONObject();
				}
				meta.put(prop, propMeta);
			}
		}
		if (!delta.isEmpty()) {
			notifyData(delta, meta);
		}
	}

	private void notifyData(JSONObject delta, JSONObject meta) {
		if (parent != null && !hidden) {
			parent.notifyData(new JSONObject().put(name, delta), meta != null ? new JSONObject().put(name, meta) : null);
		}
		emit(EVENT_DATA, delta, meta, EventScope.LOCAL);
	}

	public void log(String message) {
		final String line = getClass().getSimpleName() + " | " + name + ": " + message;
		if (root == null) {
			System.out.println(line);
			return;
		}
		emit(EVENT_LOG, line, EventScope.TOP);
	}

	// -------------------------------------
	// Events
	// -------------------------------------

	public ControlListener on(String eventName, ControlListener listener) {
		return on(eventName, listener, ListenerOptions.NONE);
	}

	/**
	 * Adds a listener. No check is made whether it is already registered, adding
	 * it twice makes it run twice.
	 */
	public ControlListener on(String eventName, ControlListener listener, ListenerOptions options) {
		events.add(eventName, listener, false);
		if (options != null) {
			if (options.immediate) {
				final Object current = resolveLive(eventName);
				if (current != null) {
					listener.onEvent(current, properties.getMeta(eventName));
				}
			}
			if (options.caller != null) {
				unsubscribeOnRemove(options.caller, eventName, listener);
			}
		}
		return listener;
	}

	public ControlListener once(String eventName, ControlListener listener) {
		return once(eventName, listener, ListenerOptions.NONE);
	}

	public ControlListener once(String eventName, ControlListener listener, ListenerOptions options) {
		if (options != null && options.caller != null) {
			events.add(eventName, listener, (data, meta) -> {
				dropCallerLink(eventName, listener);
				listener.onEvent(data, meta);
			}, true);
			unsubscribeOnRemove(options.caller, eventName, listener);
		} else {
			events.add(eventName, listener, true);
		}
		return listener;
	}

	private void unsubscribeOnRemove(Control caller, String eventName, ControlListener listener) {
		final ControlListener hook = caller.on(EVENT_REMOVE, (data, meta) -> off(eventName, listener));
		callerLinks.add(new CallerLink(eventName, listener, caller, hook));
	}

	/**
	 * Detaches the 'remove' hook that was placed on the caller for the most
	 * recent caller-bound registration of <code>listener</code>.
	 */
	private void dropCallerLink(String eventName, ControlListener listener) {
		for (int i = callerLinks.size() - 1; i >= 0; --i) {
			final CallerLink link = callerLinks.get(i);
			if (link.listener == listener && link.eventName.equals(eventName)) {
				callerLinks.remove(i);
				link.caller.events.remove(EVENT_REMOVE, link.hook);
				return;
			}
		}
	}

	private void dropAllCallerLinks() {
		for (CallerLink link : callerLinks) {
			link.caller.events.remove(EVENT_REMOVE, link.hook);
		}
		callerLinks.clear();
	}

	private Object resolveLive(String eventName) {
		if (properties.has(eventName)) {
			return properties.accessor(eventName).get();
		}
		return children.get(eventName);
	}

	public boolean off(String eventName, ControlListener listener) {
		if (!events.remove(eventName, listener)) {
			return false;
		}
		dropCallerLink(eventName, listener);
		return true;
	}

	public void removeAllListeners() {
		events.removeAll();
		dropAllCallerLinks();
	}

	public int listenerCount(String eventName) {
		return events.count(eventName);
	}

	public boolean emit(String eventName, Object data) {
		return emit(eventName, data, null, EventScope.LOCAL);
	}

	public boolean emit(String eventName, Object data, EventScope scope) {
		return emit(eventName, data, null, scope);
	}

	/**
	 * Emits an event within the given scope, {@link EventScope#LOCAL} when
	 * <code>scope</code> is <code>null</code>.
	 *
	 * @return whether any listener was invoked
	 */
	public boolean emit(String eventName, Object data, JSONObject metadata, EventScope scope) {
		if (scope == null) {
			scope = EventScope.LOCAL;
		}
		boolean handled = false;
		if (scope.includesLocal()) {
			handled |= events.fire(eventName, data, metadata);
		}
		if (scope == EventScope.BUBBLE && parent != null) {
			handled |= parent.emit(eventName, data, metadata, scope);
		}
		if (scope.includesTop() && root != null) {
			handled |= root.fireLocal(eventName, data, metadata);
		}
		return handled;
	}

	boolean fireLocal(String eventName, Object data, JSONObject metadata) {
		return events.fire(eventName, data, metadata);
	}

	// -------------------------------------
	// Tree structure
	// -------------------------------------

	public String getTypeName() {
		return typeName;
	}

	public String getName() {
		return name;
	}

	/**
	 * Dot separated names from the root down to this control. Empty for the root.
	 */
	public String getPath() {
		if (parent == null || parent.parent == null) {
			return name;
		}
		return parent.getPath() + "." + name;
	}

	public boolean isHidden() {
		return hidden;
	}

	public void setHidden(boolean hidden) {
		this.hidden = hidden;
	}

	/**
	 * The last 'remove' flag received through declarative data, or
	 * <code>null</code> if none was received.
	 */
	public Boolean getRemovalRequested() {
		return removalRequested;
	}

	public Control getParent() {
		return parent;
	}

	public TopLevelContainer getTopLevelParent() {
		return root;
	}

	public boolean isAttached() {
		return root != null;
	}

	public Control getChild(String childName) {
		return children.get(childName);
	}

	public <T extends Control> T getChild(String childName, Class<T> type) {
		final Control child = children.get(childName);
		return type.isInstance(child) ? type.cast(child) : null;
	}

	public Map<String, Control> getChildren() {
		return Collections.unmodifiableMap(children);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "<" + (parent == null ? typeName : getPath()) + ">";
	}
}
