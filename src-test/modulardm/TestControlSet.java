package modulardm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

import modulardm.data.ControlData;

public class TestControlSet {

	private static JSONObject roomUpdate(String key, Object value) {
		return new JSONObject().put("house1", new JSONObject().put("room1", new JSONObject().put(key, value)));
	}

	@Test
	public void testCreatesTreeFromNestedData() {
		final TopLevelContainer root = TestData.newHouseTree();

		final JSONObject house = root.get().getJSONObject("house1");
		assertEquals("12", house.getString("streetNumber"));
		final JSONObject room = house.getJSONObject("room1");
		assertEquals(2, room.length());
		assertEquals(1, room.getInt("doors"));
		assertEquals(2, room.getInt("windows"));

		final Control houseControl = root.getChild("house1");
		assertTrue(houseControl instanceof TestData.House);
		assertEquals("house", houseControl.getTypeName());
		assertEquals("house1", houseControl.getName());
		assertSame(root, houseControl.getParent());
		assertSame(root, houseControl.getTopLevelParent());

		final TestData.Room roomControl = houseControl.getChild("room1", TestData.Room.class);
		assertNotNull(roomControl);
		assertEquals("house1.room1", roomControl.getPath());
		assertSame(root, roomControl.getTopLevelParent());
	}

	@Test
	public void testApplyingSameDataTwiceIsIdempotent() {
		final TopLevelContainer root = TestData.newHouseTree();
		final JSONObject first = root.get();
		final Control room = root.getChild("house1").getChild("room1");
		final List<Object> events = new ArrayList<>();
		room.on("windows", (data, meta) -> events.add(data));
		root.on(Control.EVENT_NEW_CHILD, (data, meta) -> events.add(data));

		root.set(TestData.houseWithRoom());

		assertTrue(first.similar(root.get()));
		assertSame(room, root.getChild("house1").getChild("room1"));
		assertEquals(1, root.getChildren().size());
		assertEquals(0, events.size());
	}

	@Test
	public void testDataForExistingChildIsForwarded() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");

		root.set(roomUpdate("doors", 3));

		assertEquals(3, room.getProperty("doors"));
		assertEquals(2, room.getProperty("windows"));
	}

	@Test
	public void testSetDrivenWriteEmitsPropertyEventButNoDataEvent() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		final List<Object> propertyEvents = new ArrayList<>();
		final List<Object> dataEvents = new ArrayList<>();
		room.on("windows", (data, meta) -> propertyEvents.add(data));
		room.on(Control.EVENT_DATA, (data, meta) -> dataEvents.add(data));
		root.on(Control.EVENT_DATA, (data, meta) -> dataEvents.add(data));

		root.set(roomUpdate("windows", 5));

		assertEquals(Arrays.asList(5), propertyEvents);
		assertEquals(0, dataEvents.size());
	}

	@Test
	public void testValuesAreCoercedToDeclaredKind() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");

		root.set(roomUpdate("windows", "3"));
		assertEquals(Integer.valueOf(3), room.getProperty("windows"));

		root.set(roomUpdate("windows", 4.9));
		assertEquals(Integer.valueOf(4), room.getProperty("windows"));
	}

	@Test
	public void testUncoercibleValuesAreSkipped() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");

		root.set(new JSONObject().put("house1", new JSONObject() //
				.put("occupied", "maybe") //
				.put("streetNumber", "7") //
				.put("room1", new JSONObject().put("windows", "lots"))));

		assertEquals(2, room.getProperty("windows"));
		assertEquals(false, root.getChild("house1").getProperty("occupied"));
		assertEquals("7", root.getChild("house1").getProperty("streetNumber"));
	}

	@Test
	public void testNullBecomesStringNullForStringProperties() {
		final TopLevelContainer root = TestData.newHouseTree();
		root.set(new JSONObject("{\"house1\": {\"streetNumber\": null}}"));

		assertEquals("null", root.getChild("house1").getProperty("streetNumber"));
	}

	@Test
	public void testNullIsSkippedForNumberProperties() {
		final TopLevelContainer root = TestData.newHouseTree();
		root.set(new JSONObject("{\"house1\": {\"room1\": {\"windows\": null}}}"));

		assertEquals(2, root.getChild("house1").getChild("room1").getProperty("windows"));
	}

	@Test
	public void testArraysAreStoredAsLists() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");
		assertEquals(Arrays.asList("brick"), house.getProperty("tags"));

		root.set(new JSONObject().put("house1", new JSONObject().put("tags", new JSONArray().put("wood").put("glass"))));

		assertEquals(Arrays.asList("wood", "glass"), house.getProperty("tags"));
		final JSONArray tags = root.get().getJSONObject("house1").getJSONArray("tags");
		assertEquals(2, tags.length());
		assertEquals("glass", tags.getString(1));
	}

	@Test
	public void testUnknownKeysAreIgnored() {
		final TopLevelContainer root = TestData.newHouseTree();
		final JSONObject before = root.get();

		root.set(new JSONObject() //
				.put("nonsense", 42) //
				.put("house1", new JSONObject() //
						.put("color", "red") //
						.put("garage", new JSONObject().put("doors", 2))));

		assertTrue(before.similar(root.get()));
		assertNull(root.getChild("house1").getChild("garage"));
	}

	@Test
	public void testReservedAndInternalKeysAreNotProperties() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");

		root.set(new JSONObject().put("house1", new JSONObject() //
				.put("typeName", "room") //
				.put("_note", "changed")));

		assertEquals("house", house.getTypeName());
		assertTrue(house instanceof TestData.House);
		assertEquals("not a property", ((TestData.House) house)._note);
		assertTrue(!house.hasProperty("_note"));
	}

	@Test
	public void testPropertyWinsOverTypedBranchOfSameName() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");

		root.set(new JSONObject().put("house1", new JSONObject() //
				.put("streetNumber", new JSONObject().put("typeName", "room"))));

		assertNull(house.getChild("streetNumber"));
		assertEquals("12", house.getProperty("streetNumber"));
	}

	@Test
	public void testSetWithControlDataBuilder() {
		final TopLevelContainer root = TestData.newContainer();
		root.set(ControlData.builder() //
				.put("k", ControlData.ofType("kitchen").put("doors", 2)) //
				.build());

		final Control kitchen = root.getChild("k");
		assertTrue(kitchen instanceof TestData.Kitchen);
		assertEquals(2, kitchen.getProperty("doors"));
		assertEquals(3, kitchen.getProperty("windows"));
		assertEquals(true, kitchen.getProperty("hasOven"));
	}

	private static TopLevelContainer newMeterTree() {
		final TopLevelContainer root = TestData.newContainer();
		root.set(new JSONObject().put("m", new JSONObject().put("typeName", "meter")));
		return root;
	}

	@Test
	public void testListenerFailureDuringSetReachesCaller() {
		final TopLevelContainer root = newMeterTree();
		final Control meter = root.getChild("m");
		meter.on("count", (data, meta) -> {
			throw new IllegalArgumentException("Listener failure");
		});

		try {
			root.set(new JSONObject().put("m", new JSONObject().put("count", 5)));
			throw new AssertionError("Expected the listener failure to propagate");
		} catch (IllegalArgumentException e) {
			assertEquals("Listener failure", e.getMessage());
		}
		assertEquals(5, meter.getProperty("count"));
	}

	@Test
	public void testOutOfRangeNumbersAreSkipped() {
		final TopLevelContainer root = newMeterTree();
		final Control meter = root.getChild("m");

		root.set(new JSONObject().put("m", new JSONObject() //
				.put("count", 3000000000L) //
				.put("step", 300)));

		assertEquals(0, meter.getProperty("count"));
		assertEquals((byte) 1, meter.getProperty("step"));

		root.set(new JSONObject().put("m", new JSONObject().put("count", -2147483648L)));
		assertEquals(Integer.MIN_VALUE, meter.getProperty("count"));
	}

	@Test
	public void testNonFiniteNumbersAreSkipped() {
		final TopLevelContainer root = newMeterTree();
		final Control meter = root.getChild("m");

		root.set(new JSONObject("{\"m\": {\"level\": 1e400}}"));
		root.set(new JSONObject().put("m", new JSONObject().put("level", "NaN")));

		assertEquals(0.0, meter.getProperty("level"));
		assertEquals(0.0, root.get().getJSONObject("m").getDouble("level"), 0.0);
	}

	@Test
	public void testNullDataIsIgnored() {
		final TopLevelContainer root = TestData.newHouseTree();
		root.set((JSONObject) null);
		root.set((ControlData) null);

		assertNotNull(root.getChild("house1"));
	}
}
