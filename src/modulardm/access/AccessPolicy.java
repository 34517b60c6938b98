package modulardm.access;

import java.util.EnumMap;
import java.util.Map;

import org.json.JSONObject;

import modulardm.util.JsonUtil;

/**
 * Per-property access control list. Channels without an explicit level are
 * public. Instances are immutable, {@link #with(AccessChannel, AccessLevel)}
 * returns a copy.
 */
public class AccessPolicy implements JsonUtil.ToJsonable {

	public static final AccessPolicy PUBLIC = new AccessPolicy(new EnumMap<>(AccessChannel.class));

	private final EnumMap<AccessChannel, AccessLevel> levels;

	private AccessPolicy(EnumMap<AccessChannel, AccessLevel> levels) {
		this.levels = levels;
	}

	public static AccessPolicy of(AccessChannel channel, AccessLevel level) {
		return PUBLIC.with(channel, level);
	}

	public AccessPolicy with(AccessChannel channel, AccessLevel level) {
		final EnumMap<AccessChannel, AccessLevel> copy = new EnumMap<>(levels);
		if (level == null) {
			copy.remove(channel);
		} else {
			copy.put(channel, level);
		}
		return new AccessPolicy(copy);
	}

	public AccessLevel getLevel(AccessChannel channel) {
		final AccessLevel level = levels.get(channel);
		return level != null ? level : AccessLevel.PUBLIC;
	}

	public boolean isAllowed(AccessChannel channel) {
		return getLevel(channel).permitsExternal();
	}

	public static AccessPolicy fromJSON(JSONObject obj) {
		final EnumMap<AccessChannel, AccessLevel> levels = new EnumMap<>(AccessChannel.class);
		for (AccessChannel channel : AccessChannel.values()) {
			if (obj.has(channel.key) && !obj.isNull(channel.key)) {
				levels.put(channel, AccessLevel.parse(String.valueOf(obj.get(channel.key))));
			}
		}
		return new AccessPolicy(levels);
	}

	public JSONObject toJSON() {
		JSONObject _ret = new JSONObject();
		for (Map.Entry<AccessChannel, AccessLevel> ent : levels.entrySet()) {
			_ret.put(ent.getKey().key, ent.getValue().key);
		}
		return _ret;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof AccessPolicy && ((AccessPolicy) obj).levels.equals(levels);
	}

	@Override
	public int hashCode() {
		return levels.hashCode();
	}

	@Override
	public String toString() {
		return "AccessPolicy" + toJSON();
	}
}
