package modulardm.event;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.json.JSONObject;
import org.junit.Test;

public class TestEventChannel {

	private final EventChannel channel = new EventChannel();
	private final List<String> calls = new ArrayList<>();

	private ControlListener recording(String id) {
		return (data, meta) -> calls.add(id);
	}

	@Test
	public void testFiresInRegistrationOrder() {
		channel.add("ev", recording("a"), false);
		channel.add("ev", recording("b"), false);
		channel.add("other", recording("c"), false);

		assertTrue(channel.fire("ev", null, null));

		assertEquals(Arrays.asList("a", "b"), calls);
	}

	@Test
	public void testPassesDataAndMetadata() {
		final JSONObject meta = new JSONObject().put("k", "v");
		final List<Object> seen = new ArrayList<>();
		channel.add("ev", (data, m) -> {
			seen.add(data);
			seen.add(m);
		}, false);

		channel.fire("ev", 42, meta);

		assertEquals(Arrays.asList(42, meta), seen);
	}

	@Test
	public void testRemoveTakesMostRecentRegistration() {
		final ControlListener a = recording("a");
		channel.add("ev", a, true);
		channel.add("ev", a, false);

		assertTrue(channel.remove("ev", a));
		assertEquals(1, channel.count("ev"));

		// The remaining registration is the 'once' one
		channel.fire("ev", null, null);
		channel.fire("ev", null, null);
		assertEquals(Arrays.asList("a"), calls);
		assertEquals(0, channel.count("ev"));
	}

	@Test
	public void testRemoveUnknown() {
		assertFalse(channel.remove("ev", recording("a")));
		channel.add("ev", recording("a"), false);
		assertFalse(channel.remove("ev", recording("a")));
	}

	@Test
	public void testReentrantFireDoesNotRepeatOnce() {
		final List<String> order = new ArrayList<>();
		channel.add("ev", (data, meta) -> {
			order.add("once:" + data);
			channel.fire("ev", "inner", null);
		}, true);
		channel.add("ev", (data, meta) -> order.add("always:" + data), false);

		channel.fire("ev", "outer", null);

		assertEquals(Arrays.asList("once:outer", "always:inner", "always:outer"), order);
	}

	@Test
	public void testListenerAddedWhileFiringWaitsForNextEmission() {
		channel.add("ev", (data, meta) -> {
			calls.add("first");
			if (calls.size() == 1) {
				channel.add("ev", recording("late"), false);
			}
		}, false);

		channel.fire("ev", null, null);
		assertEquals(Arrays.asList("first"), calls);

		channel.fire("ev", null, null);
		assertEquals(Arrays.asList("first", "first", "late"), calls);
	}

	@Test
	public void testSeparateTargetIsRemovedByListenerIdentity() {
		final ControlListener key = recording("key");
		channel.add("ev", key, recording("target"), false);

		channel.fire("ev", null, null);
		assertEquals(Arrays.asList("target"), calls);

		assertTrue(channel.remove("ev", key));
		assertFalse(channel.fire("ev", null, null));
	}

	@Test
	public void testRemoveAll() {
		channel.add("a", recording("a"), false);
		channel.add("b", recording("b"), true);

		channel.removeAll();

		assertFalse(channel.fire("a", null, null));
		assertFalse(channel.fire("b", null, null));
		assertEquals(0, calls.size());
	}

	@Test(expected = NullPointerException.class)
	public void testNullListenerIsRejected() {
		channel.add("ev", null, false);
	}
}
