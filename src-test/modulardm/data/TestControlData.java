package modulardm.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.json.JSONObject;
import org.junit.Test;

public class TestControlData {

	@Test
	public void testParseSeparatesReservedKeys() {
		final ControlData data = ControlData
				.parse("{\"typeName\": \"house\", \"hidden\": true, \"remove\": false, \"streetNumber\": \"12\"}");

		assertEquals("house", data.typeName);
		assertEquals(Boolean.TRUE, data.hidden);
		assertEquals(Boolean.FALSE, data.remove);
		assertFalse(data.isRemoveRequested());
		assertEquals(1, data.getEntries().size());
		assertEquals("12", data.get("streetNumber"));
	}

	@Test
	public void testOnlyExactTrueRequestsRemoval() {
		assertTrue(ControlData.parse("{\"remove\": true}").isRemoveRequested());
		assertFalse(ControlData.parse("{\"remove\": \"true\"}").isRemoveRequested());
		assertFalse(ControlData.parse("{\"remove\": 1}").isRemoveRequested());
		assertNull(ControlData.parse("{}").remove);
	}

	@Test
	public void testMalformedReservedValuesAreDropped() {
		final ControlData data = ControlData.parse("{\"typeName\": 3, \"hidden\": \"yes\"}");

		assertNull(data.typeName);
		assertFalse(data.hasTypeName());
		assertNull(data.hidden);
		assertTrue(data.getEntries().isEmpty());
	}

	@Test
	public void testNestedValues() {
		final ControlData data = ControlData
				.parse("{\"room1\": {\"typeName\": \"room\", \"windows\": 2}, \"tags\": [\"a\", null], \"gone\": null}");

		final ControlData room = data.getBranch("room1");
		assertEquals("room", room.typeName);
		assertEquals(2, room.get("windows"));
		assertEquals(Arrays.asList("a", null), data.get("tags"));
		assertTrue(data.getEntries().containsKey("gone"));
		assertNull(data.get("gone"));
		assertNull(data.getBranch("tags"));
	}

	@Test
	public void testBuilderKeepsInsertionOrder() {
		final ControlData data = ControlData.builder() //
				.put("c", 1) //
				.put("a", 2) //
				.put("b", ControlData.ofType("room")) //
				.build();

		assertEquals(Arrays.asList("c", "a", "b"), new ArrayList<>(data.getEntries().keySet()));
		assertEquals("room", data.getBranch("b").typeName);
	}

	@Test
	public void testToJSON() {
		final ControlData data = ControlData.ofType("house") //
				.hidden(true) //
				.put("tags", Arrays.asList("x")) //
				.put("nothing", null) //
				.build();

		final JSONObject json = data.toJSON();
		assertTrue(new JSONObject("{\"typeName\":\"house\",\"hidden\":true,\"tags\":[\"x\"],\"nothing\":null}")
				.similar(json));
		assertEquals(data, ControlData.fromJSON(json));
	}

	@Test
	public void testReservedKeys() {
		assertTrue(ControlData.isReservedKey("typeName"));
		assertTrue(ControlData.isReservedKey("remove"));
		assertTrue(ControlData.isReservedKey("hidden"));
		assertFalse(ControlData.isReservedKey("name"));
		assertTrue(ControlData.isInternalKey("_private"));
		assertFalse(ControlData.isInternalKey("public_"));
	}
}
