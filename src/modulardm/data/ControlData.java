package modulardm.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.json.JSONArray;
import org.json.JSONObject;

import modulardm.util.JsonUtil;

/**
 * Declarative description of (part of) a control tree, as passed to
 * {@link modulardm.Control#set(ControlData)}.
 * <p>
 * This is a recursive variant: every entry value is either a leaf (Number,
 * String, Boolean, List of primitives or <code>null</code>) or a nested
 * {@link ControlData} branch. A branch may carry a type name, which makes it
 * create a new child control when no child of that name exists yet, a removal
 * flag, and a hidden flag. Entries keep their insertion order.
 */
public class ControlData implements JsonUtil.ToJsonable {

	public static final String TYPE_NAME_KEY = "typeName";
	public static final String REMOVE_KEY = "remove";
	public static final String HIDDEN_KEY = "hidden";
	public static final String INTERNAL_PREFIX = "_";

	public final String typeName;
	public final Boolean remove;
	public final Boolean hidden;
	private final Map<String, Object> entries;

	public ControlData(String typeName, Boolean remove, Boolean hidden, Map<String, Object> entries) {
		this.typeName = typeName;
		this.remove = remove;
		this.hidden = hidden;
		this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
	}

	public static boolean isReservedKey(String key) {
		return TYPE_NAME_KEY.equals(key) || REMOVE_KEY.equals(key) || HIDDEN_KEY.equals(key);
	}

	public static boolean isInternalKey(String key) {
		return key.startsWith(INTERNAL_PREFIX);
	}

	public boolean hasTypeName() {
		return typeName != null;
	}

	/**
	 * True only if the removal flag is exactly <code>true</code>.
	 */
	public boolean isRemoveRequested() {
		return Boolean.TRUE.equals(remove);
	}

	public Map<String, Object> getEntries() {
		return entries;
	}

	public Object get(String key) {
		return entries.get(key);
	}

	public ControlData getBranch(String key) {
		final Object val = entries.get(key);
		return val instanceof ControlData ? (ControlData) val : null;
	}

	public static ControlData parse(String json) {
		return fromJSON(new JSONObject(json));
	}

	public static ControlData fromJSON(JSONObject obj) {
		final Builder builder = new Builder();
		for (String key : obj.keySet()) {
			final Object val = obj.opt(key);
			switch (key) {
			case TYPE_NAME_KEY: {
				if (val instanceof String) {
					builder.typeName((String) val);
				}
				break;
			}
			case REMOVE_KEY: {
				builder.remove(Boolean.TRUE.equals(val));
				break;
			}
			case HIDDEN_KEY: {
				if (val instanceof Boolean) {
					builder.hidden((Boolean) val);
				}
				break;
			}
			default: {
				builder.put(key, val);
				break;
			}
			}
		}
		return builder.build();
	}

	public JSONObject toJSON() {
		JSONObject _ret = new JSONObject();
		if (typeName != null) _ret.put(TYPE_NAME_KEY, typeName);
		if (remove != null) _ret.put(REMOVE_KEY, remove);
		if (hidden != null) _ret.put(HIDDEN_KEY, hidden);
		for (Map.Entry<String, Object> ent : entries.entrySet()) {
			_ret.put(ent.getKey(), JsonUtil.toJsonValue(ent.getValue()));
		}
		return _ret;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ControlData)) {
			return false;
		}
		final ControlData other = (ControlData) obj;
		return Objects.equals(typeName, other.typeName) //
				&& Objects.equals(remove, other.remove) //
				&& Objects.equals(hidden, other.hidden) //
				&& entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return Objects.hash(typeName, remove, hidden, entries);
	}

	@Override
	public String toString() {
		return toJSON().toString();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static Builder ofType(String typeName) {
		return new Builder().typeName(typeName);
	}

	public static class Builder {
		private String typeName;
		private Boolean remove;
		private Boolean hidden;
		private final Map<String, Object> entries = new LinkedHashMap<>();

		public Builder typeName(String typeName) {
			this.typeName = typeName;
			return this;
		}

		public Builder remove(boolean remove) {
			this.remove = remove;
			return this;
		}

		public Builder hidden(boolean hidden) {
			this.hidden = hidden;
			return this;
		}

		/**
		 * Adds an entry. JSON values are converted: objects become branches, arrays
		 * become lists and {@link JSONObject#NULL} becomes <code>null</code>.
		 */
		public Builder put(String key, Object value) {
			if (value instanceof Builder) {
				value = ((Builder) value).build();
			} else if (value instanceof JSONObject) {
				value = fromJSON((JSONObject) value);
			} else if (value instanceof JSONArray) {
				value = JsonUtil.toList((JSONArray) value);
			} else if (value instanceof List<?>) {
				value = Collections.unmodifiableList((List<?>) value);
			} else {
				value = JsonUtil.fromJsonValue(value);
			}
			entries.put(key, value);
			return this;
		}

		public ControlData build() {
			return new ControlData(typeName, remove, hidden, entries);
		}
	}
}
