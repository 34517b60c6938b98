package modulardm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.json.JSONObject;
import org.junit.Test;

import modulardm.access.AccessChannel;
import modulardm.access.AccessLevel;
import modulardm.access.AccessPolicy;

public class TestNotification {

	private static class Recorder {
		final List<JSONObject> data = new ArrayList<>();
		final List<JSONObject> meta = new ArrayList<>();

		Recorder(Control control) {
			control.on(Control.EVENT_DATA, (d, m) -> {
				data.add((JSONObject) d);
				meta.add(m);
			});
		}
	}

	@Test
	public void testChangeBubblesWithNestedPath() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");
		final Control room = house.getChild("room1");
		final Recorder roomRec = new Recorder(room);
		final Recorder houseRec = new Recorder(house);
		final Recorder rootRec = new Recorder(root);

		assertTrue(room.setProperty("windows", 4));

		assertEquals(1, roomRec.data.size());
		assertTrue(new JSONObject().put("windows", 4).similar(roomRec.data.get(0)));
		assertEquals(1, houseRec.data.size());
		assertTrue(new JSONObject("{\"room1\":{\"windows\":4}}").similar(houseRec.data.get(0)));
		assertEquals(1, rootRec.data.size());
		assertTrue(new JSONObject("{\"house1\":{\"room1\":{\"windows\":4}}}").similar(rootRec.data.get(0)));
		assertNull(rootRec.meta.get(0));
	}

	@Test
	public void testDeltaReachesRootBeforePropertyEvent() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		final List<String> order = new ArrayList<>();
		root.on(Control.EVENT_DATA, (d, m) -> order.add("root data"));
		room.on("windows", (d, m) -> order.add("windows"));

		room.setProperty("windows", 7);

		assertEquals(2, order.size());
		assertEquals("root data", order.get(0));
		assertEquals("windows", order.get(1));
	}

	@Test
	public void testUnchangedValueIsNotReported() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		final Recorder rootRec = new Recorder(root);

		assertFalse(room.setProperty("windows", 2));
		assertFalse(room.setProperty("windows", "2"));

		assertEquals(0, rootRec.data.size());
	}

	@Test
	public void testHiddenControlDoesNotForward() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");
		final Control room = house.getChild("room1");
		house.setHidden(true);
		final Recorder roomRec = new Recorder(room);
		final Recorder houseRec = new Recorder(house);
		final Recorder rootRec = new Recorder(root);

		room.setProperty("doors", 2);

		assertEquals(1, roomRec.data.size());
		assertEquals(1, houseRec.data.size());
		assertEquals(0, rootRec.data.size());
	}

	@Test
	public void testUnreadablePropertyIsLeftOutOfDelta() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		room.setAccess("windows", AccessPolicy.of(AccessChannel.GET, AccessLevel.NONE));
		final Recorder roomRec = new Recorder(room);
		final Recorder rootRec = new Recorder(root);
		final List<Object> windowsEvents = new ArrayList<>();
		room.on("windows", (d, m) -> windowsEvents.add(d));

		room.setProperty("windows", 9);

		assertEquals(0, roomRec.data.size());
		assertEquals(0, rootRec.data.size());
		assertEquals(1, windowsEvents.size());
		assertEquals(9, room.getProperty("windows"));
	}

	@Test
	public void testExplicitNotifyOfSeveralProperties() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		final Recorder rootRec = new Recorder(root);

		room.notifyProperty("doors", "windows", "notAProperty");

		assertEquals(1, rootRec.data.size());
		final JSONObject delta = rootRec.data.get(0).getJSONObject("house1").getJSONObject("room1");
		assertEquals(2, delta.length());
		assertEquals(1, delta.getInt("doors"));
		assertEquals(2, delta.getInt("windows"));
	}

	@Test
	public void testEmptyDeltaEmitsNothing() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		final Recorder roomRec = new Recorder(room);

		room.notifyProperty("notAProperty");
		room.notifyProperty();

		assertEquals(0, roomRec.data.size());
	}

	@Test
	public void testMetadataTravelsWithChange() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		final JSONObject unit = new JSONObject().put("unit", "count");
		assertTrue(room.setMeta("windows", unit));
		assertFalse(room.setMeta("notAProperty", unit));
		final List<JSONObject> propertyMeta = new ArrayList<>();
		room.on("windows", (d, m) -> propertyMeta.add(m));
		final Recorder roomRec = new Recorder(room);
		final Recorder rootRec = new Recorder(root);

		room.setProperty("windows", 3);

		assertEquals(1, propertyMeta.size());
		assertTrue(unit.similar(propertyMeta.get(0)));
		assertTrue(new JSONObject().put("windows", unit).similar(roomRec.meta.get(0)));
		assertTrue(new JSONObject("{\"house1\":{\"room1\":{\"windows\":{\"unit\":\"count\"}}}}")
				.similar(rootRec.meta.get(0)));
	}
}
