package modulardm.property;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.json.JSONObject;

import modulardm.access.AccessChannel;
import modulardm.access.AccessPolicy;
import modulardm.metaprogramming.PropertyDescriptor;

/**
 * Current property values of one control, together with their access control
 * lists and metadata. The set of property names is fixed once
 * {@link #seal()} has been called.
 */
public class PropertyRegistry {

	private final Map<String, PropertyAccessor> accessors = new LinkedHashMap<>();
	private final Map<String, Object> values = new HashMap<>();
	private final Map<String, AccessPolicy> acl = new HashMap<>();
	private final Map<String, JSONObject> meta = new HashMap<>();
	private boolean sealed;

	public void define(PropertyDescriptor descriptor, Object initialValue, PropertyAccessor accessor) {
		if (sealed) {
			throw new IllegalStateException(
					"Cannot define property '" + descriptor.name + "', the property set is already fixed");
		}
		accessors.put(descriptor.name, accessor);
		values.put(descriptor.name, initialValue);
	}

	public void seal() {
		sealed = true;
	}

	public boolean isSealed() {
		return sealed;
	}

	public boolean has(String name) {
		return accessors.containsKey(name);
	}

	public PropertyAccessor accessor(String name) {
		return accessors.get(name);
	}

	/**
	 * Property names in declaration order.
	 */
	public Set<String> names() {
		return Collections.unmodifiableSet(accessors.keySet());
	}

	/**
	 * The stored value, bypassing all access checks.
	 */
	public Object value(String name) {
		return values.get(name);
	}

	void store(String name, Object value) {
		values.put(name, value);
	}

	public boolean isAllowed(String name, AccessChannel channel) {
		final AccessPolicy policy = acl.get(name);
		return policy == null || policy.isAllowed(channel);
	}

	public AccessPolicy getAccess(String name) {
		final AccessPolicy policy = acl.get(name);
		return policy != null ? policy : AccessPolicy.PUBLIC;
	}

	/**
	 * Stores the policy if <code>name</code> is a property. Returns whether it
	 * was stored.
	 */
	public boolean setAccess(String name, AccessPolicy policy) {
		if (!has(name)) {
			return false;
		}
		if (policy == null) {
			acl.remove(name);
		} else {
			acl.put(name, policy);
		}
		return true;
	}

	public JSONObject getMeta(String name) {
		return meta.get(name);
	}

	public boolean setMeta(String name, JSONObject data) {
		if (!has(name)) {
			return false;
		}
		if (data == null) {
			meta.remove(name);
		} else {
			meta.put(name, data);
		}
		return true;
	}
}
