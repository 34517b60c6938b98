package modulardm.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

public class TestJsonUtil {

	@Test
	public void testFromJsonValue() {
		assertNull(JsonUtil.fromJsonValue(JSONObject.NULL));
		assertEquals(Arrays.asList(1, Arrays.asList("a")),
				JsonUtil.fromJsonValue(new JSONArray().put(1).put(new JSONArray().put("a"))));
		final JSONObject obj = new JSONObject();
		assertSame(obj, JsonUtil.fromJsonValue(obj));
	}

	@Test
	public void testToJsonValue() {
		assertSame(JSONObject.NULL, JsonUtil.toJsonValue(null));
		assertTrue(new JSONArray("[1, null, \"x\"]").similar(JsonUtil.toJsonValue(Arrays.asList(1, null, "x"))));
		assertTrue(new JSONArray("[true, false]").similar(JsonUtil.toJsonValue(new boolean[] { true, false })));
		assertEquals("s", JsonUtil.toJsonValue("s"));
	}
}
