package modulardm.data;

import org.json.JSONObject;

import modulardm.util.JsonUtil;

/**
 * Options for {@link modulardm.Control#get(GetOptions)}.
 */
public class GetOptions implements JsonUtil.ToJsonable {

	public static final GetOptions DEFAULT = new GetOptions(true, false);

	/**
	 * Omit properties whose value is the empty string.
	 */
	public final boolean sparse;

	/**
	 * Add each control's type name, so that the result can be fed to a fresh
	 * tree.
	 */
	public final boolean includeTypeNames;

	public GetOptions(boolean sparse, boolean includeTypeNames) {
		this.sparse = sparse;
		this.includeTypeNames = includeTypeNames;
	}

	/**
	 * Everything needed to rebuild the tree elsewhere.
	 */
	public static GetOptions full() {
		return new GetOptions(false, true);
	}

	public static GetOptions fromJSON(JSONObject obj) {
		return new GetOptions( //
				obj.optBoolean("sparse", DEFAULT.sparse), //
				obj.optBoolean("includeTypeNames", DEFAULT.includeTypeNames));
	}

	public JSONObject toJSON() {
		JSONObject _ret = new JSONObject();
		_ret.put("sparse", sparse);
		_ret.put("includeTypeNames", includeTypeNames);
		return _ret;
	}
}
