package modulardm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.json.JSONObject;
import org.junit.Test;

import modulardm.event.ControlListener;
import modulardm.event.EventScope;
import modulardm.event.ListenerOptions;

public class TestControlEvents {

	private final TopLevelContainer root = TestData.newHouseTree();
	private final Control house = root.getChild("house1");
	private final Control room = house.getChild("room1");
	private final List<String> received = new ArrayList<>();

	private void listenEverywhere(String eventName) {
		root.on(eventName, (data, meta) -> received.add("root"));
		house.on(eventName, (data, meta) -> received.add("house"));
		room.on(eventName, (data, meta) -> received.add("room"));
	}

	@Test
	public void testLocalScope() {
		listenEverywhere("ev");

		assertTrue(room.emit("ev", null));

		assertEquals(Arrays.asList("room"), received);
	}

	@Test
	public void testBubbleScope() {
		listenEverywhere("ev");

		room.emit("ev", null, EventScope.BUBBLE);

		assertEquals(Arrays.asList("room", "house", "root"), received);
	}

	@Test
	public void testTopScope() {
		listenEverywhere("ev");

		room.emit("ev", null, EventScope.TOP);

		assertEquals(Arrays.asList("root"), received);
	}

	@Test
	public void testLocalTopScope() {
		listenEverywhere("ev");

		room.emit("ev", null, EventScope.LOCAL_TOP);

		assertEquals(Arrays.asList("room", "root"), received);
	}

	@Test
	public void testEmitWithoutListeners() {
		assertFalse(room.emit("nobodyListens", 1));
		assertFalse(room.emit("nobodyListens", 1, EventScope.BUBBLE));
	}

	@Test
	public void testLogIsDeliveredToRoot() {
		final List<Object> lines = new ArrayList<>();
		root.on(Control.EVENT_LOG, (data, meta) -> lines.add(data));
		room.on(Control.EVENT_LOG, (data, meta) -> lines.add("should not be local"));

		room.log("opened");

		assertEquals(Arrays.asList("Room | room1: opened"), lines);
	}

	@Test
	public void testOnceFiresOnlyOnce() {
		room.once("ev", (data, meta) -> received.add(String.valueOf(data)));

		room.emit("ev", 1);
		room.emit("ev", 2);

		assertEquals(Arrays.asList("1"), received);
		assertEquals(0, room.listenerCount("ev"));
	}

	@Test
	public void testOffRemovesListener() {
		final ControlListener listener = room.on("ev", (data, meta) -> received.add("room"));
		assertEquals(1, room.listenerCount("ev"));

		assertTrue(room.off("ev", listener));
		assertFalse(room.off("ev", listener));
		room.emit("ev", null);

		assertEquals(0, received.size());
	}

	@Test
	public void testSameListenerTwiceRunsTwice() {
		final ControlListener listener = (data, meta) -> received.add("room");
		room.on("ev", listener);
		room.on("ev", listener);

		room.emit("ev", null);
		assertEquals(2, received.size());

		room.off("ev", listener);
		room.emit("ev", null);
		assertEquals(3, received.size());
	}

	@Test
	public void testImmediateReceivesCurrentPropertyValue() {
		final List<Object> values = new ArrayList<>();
		room.on("windows", (data, meta) -> values.add(data), ListenerOptions.immediate());
		room.setProperty("windows", 6);

		assertEquals(Arrays.asList(2, 6), values);
	}

	@Test
	public void testImmediateReceivesExistingChild() {
		final List<Object> values = new ArrayList<>();
		house.on("room1", (data, meta) -> values.add(data), ListenerOptions.immediate());

		assertEquals(1, values.size());
		assertSame(room, values.get(0));
	}

	@Test
	public void testImmediateWithoutCurrentValueWaits() {
		final List<Object> values = new ArrayList<>();
		house.on("nothingHere", (data, meta) -> values.add(data), ListenerOptions.immediate());

		assertEquals(0, values.size());
		assertEquals(1, house.listenerCount("nothingHere"));
	}

	@Test
	public void testOnceWithCallerIsDroppedWhenCallerIsRemoved() {
		root.once("ev", (data, meta) -> received.add("root"), ListenerOptions.caller(room));

		root.removeChild("house1");
		root.emit("ev", null);

		assertEquals(0, received.size());
	}

	@Test
	public void testCallerHookIsDroppedWithListener() {
		for (int i = 0; i < 50; ++i) {
			final ControlListener listener = root.on("ev", (data, meta) -> received.add("root"),
					ListenerOptions.caller(room));
			root.off("ev", listener);
		}

		assertEquals(0, room.listenerCount(Control.EVENT_REMOVE));
		assertEquals(0, root.listenerCount("ev"));
	}

	@Test
	public void testCallerHookIsDroppedWhenOnceFires() {
		root.once("ev", (data, meta) -> received.add("root"), ListenerOptions.caller(room));
		assertEquals(1, room.listenerCount(Control.EVENT_REMOVE));

		root.emit("ev", null);
		root.emit("ev", null);

		assertEquals(Arrays.asList("root"), received);
		assertEquals(0, room.listenerCount(Control.EVENT_REMOVE));
	}

	@Test
	public void testOnceWithCallerCanBeRemovedWithOff() {
		final ControlListener listener = root.once("ev", (data, meta) -> received.add("root"),
				ListenerOptions.caller(room));

		assertTrue(root.off("ev", listener));
		root.emit("ev", null);

		assertEquals(0, received.size());
		assertEquals(0, room.listenerCount(Control.EVENT_REMOVE));
	}

	@Test
	public void testCallerHookIsDroppedWhenSubscriberIsRemoved() {
		root.set(new JSONObject().put("k", new JSONObject().put("typeName", "kitchen")));
		final Control kitchen = root.getChild("k");
		room.on("ev", (data, meta) -> received.add("room"), ListenerOptions.caller(kitchen));
		assertEquals(1, kitchen.listenerCount(Control.EVENT_REMOVE));

		root.removeChild("house1");

		assertEquals(0, kitchen.listenerCount(Control.EVENT_REMOVE));
		root.removeChild("k");
		assertEquals(0, received.size());
	}

	@Test
	public void testNullScopeIsLocal() {
		listenEverywhere("ev");

		assertTrue(room.emit("ev", null, null, null));
		room.emit("ev", null, (EventScope) null);

		assertEquals(Arrays.asList("room", "room"), received);
	}

	@Test
	public void testRemoveAllListeners() {
		listenEverywhere("ev");
		room.removeAllListeners();

		room.emit("ev", null, EventScope.BUBBLE);

		assertEquals(Arrays.asList("house", "root"), received);
	}

	@Test(expected = IllegalStateException.class)
	public void testListenerExceptionPropagates() {
		room.on("ev", (data, meta) -> {
			throw new IllegalStateException("Listener failure");
		});
		room.emit("ev", null);
	}

	@Test
	public void testScopeParsing() {
		assertEquals(EventScope.BUBBLE, EventScope.parse("bubble"));
		assertEquals(EventScope.LOCAL_TOP, EventScope.parse("local_top"));
		assertEquals(EventScope.LOCAL, EventScope.parse(null));
		assertEquals(EventScope.LOCAL, EventScope.parse("sideways"));
	}
}
