package modulardm.util;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

public class JsonUtil {

	public static interface ToJsonable {
		public JSONObject toJSON();
	}

	/**
	 * Converts a value read from a {@link JSONObject} or {@link JSONArray} to its
	 * plain Java form. {@link JSONObject#NULL} becomes <code>null</code> and
	 * arrays become unmodifiable lists. Objects are returned as-is.
	 */
	public static Object fromJsonValue(Object val) {
		if (val == null || val == JSONObject.NULL) {
			return null;
		}
		if (val instanceof JSONArray) {
			return toList((JSONArray) val);
		}
		return val;
	}

	/**
	 * The inverse of {@link #fromJsonValue(Object)}, for values stored in a
	 * property registry.
	 */
	public static Object toJsonValue(Object val) {
		if (val == null) {
			return JSONObject.NULL;
		}
		if (val instanceof Collection<?>) {
			final JSONArray arr = new JSONArray();
			for (Object item : (Collection<?>) val) {
				arr.put(toJsonValue(item));
			}
			return arr;
		}
		if (val.getClass().isArray()) {
			return toJsonValue(arrayToList(val));
		}
		if (val instanceof ToJsonable) {
			return ((ToJsonable) val).toJSON();
		}
		return val;
	}

	public static List<Object> toList(JSONArray arr) {
		final List<Object> ret = new ArrayList<>();
		final int len = arr.length();
		for (int i = 0; i < len; ++i) {
			ret.add(fromJsonValue(arr.opt(i)));
		}
		return Collections.unmodifiableList(ret);
	}

	public static List<Object> arrayToList(Object javaArray) {
		final int len = Array.getLength(javaArray);
		final List<Object> ret = new ArrayList<>(len);
		for (int i = 0; i < len; ++i) {
			ret.add(Array.get(javaArray, i));
		}
		return Collections.unmodifiableList(ret);
	}
}
