package modulardm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.json.JSONObject;
import org.junit.Test;

import modulardm.data.ControlData;
import modulardm.event.ListenerOptions;

public class TestRemoval {

	private static JSONObject removeHouse() {
		return new JSONObject().put("house1", new JSONObject().put("remove", true));
	}

	@Test
	public void testRemoveFlagRemovesControl() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");

		root.set(removeHouse());

		assertNull(root.getChild("house1"));
		assertFalse(root.get().has("house1"));
		assertFalse(house.isAttached());
		assertNull(house.getParent());
		assertNull(house.getTopLevelParent());
	}

	@Test
	public void testRemoveEventIsEmittedWhileStillAttached() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");
		final List<Object> payloads = new ArrayList<>();
		house.on(Control.EVENT_REMOVE, (data, meta) -> {
			payloads.add(data);
			assertSame(root, house.getParent());
			assertSame(house, root.getChild("house1"));
		});

		root.set(removeHouse());

		assertEquals(1, payloads.size());
		assertSame(house, payloads.get(0));
		assertEquals(0, house.listenerCount(Control.EVENT_REMOVE));
	}

	@Test
	public void testRemovalIsRecursive() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		final List<Object> removed = new ArrayList<>();
		room.on(Control.EVENT_REMOVE, (data, meta) -> removed.add(data));

		root.set(removeHouse());

		assertEquals(1, removed.size());
		assertFalse(room.isAttached());
		assertNull(room.getParent());
	}

	@Test
	public void testCallerListenersAreUnsubscribedOnRemoval() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		final List<Object> received = new ArrayList<>();
		root.on("ping", (data, meta) -> received.add(data), ListenerOptions.caller(room));
		root.emit("ping", 1);
		assertEquals(1, root.listenerCount("ping"));

		root.set(removeHouse());
		root.emit("ping", 2);

		assertEquals(0, root.listenerCount("ping"));
		assertEquals(1, received.size());
	}

	@Test
	public void testRemoveWinsOverOtherKeys() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");
		final List<Object> changes = new ArrayList<>();
		house.on("streetNumber", (data, meta) -> changes.add(data));

		root.set(ControlData.builder() //
				.put("house1", ControlData.builder() //
						.put("streetNumber", "99") //
						.remove(true)) //
				.build());

		assertNull(root.getChild("house1"));
		assertEquals(0, changes.size());
		assertEquals("12", ((TestData.House) house).streetNumber);
	}

	@Test
	public void testRemoveFlagMustBeExactlyTrue() {
		final TopLevelContainer root = TestData.newHouseTree();

		root.set(new JSONObject().put("house1", new JSONObject().put("remove", "true")));
		root.set(new JSONObject().put("house1", new JSONObject().put("remove", 1)));
		root.set(new JSONObject().put("house1", new JSONObject().put("remove", false)));

		assertNotNull(root.getChild("house1"));
		assertEquals(Boolean.FALSE, root.getChild("house1").getRemovalRequested());
	}

	@Test
	public void testRemoveOnRootIsRecordedButIgnored() {
		final TopLevelContainer root = TestData.newContainer();

		root.set(new JSONObject() //
				.put("remove", true) //
				.put("house1", new JSONObject().put("typeName", "house")));

		assertEquals(Boolean.TRUE, root.getRemovalRequested());
		assertTrue(root.isAttached());
		assertNotNull(root.getChild("house1"));
	}

	@Test
	public void testRemovedInInitialDataIsNeverAnnounced() {
		final TopLevelContainer root = TestData.newContainer();
		final List<Object> created = new ArrayList<>();
		root.on(Control.EVENT_NEW_CHILD, (data, meta) -> created.add(data));

		root.set(new JSONObject().put("house2", new JSONObject().put("typeName", "house").put("remove", true)));

		assertNull(root.getChild("house2"));
		assertEquals(0, created.size());
	}

	@Test
	public void testRemovalByListenerStopsApplyingData() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");
		house.on("streetNumber", (data, meta) -> root.removeChild("house1"));

		root.set(ControlData.builder() //
				.put("house1", ControlData.builder() //
						.put("streetNumber", "1") //
						.put("description", "never applied")) //
				.build());

		assertNull(root.getChild("house1"));
		assertEquals("", house.getProperty("description"));
	}

	@Test
	public void testRemovingUnknownChildIsNoop() {
		final TopLevelContainer root = TestData.newHouseTree();
		root.removeChild("nope");

		assertEquals(1, root.getChildren().size());
	}

	@Test
	public void testNameCanBeReusedAfterRemoval() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control oldHouse = root.getChild("house1");

		root.set(removeHouse());
		root.set(TestData.houseWithRoom());

		assertNotNull(root.getChild("house1"));
		assertTrue(oldHouse != root.getChild("house1"));
		assertTrue(root.getChild("house1").isAttached());
	}
}
