package modulardm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.json.JSONObject;
import org.junit.Test;

import modulardm.access.AccessChannel;
import modulardm.access.AccessLevel;
import modulardm.access.AccessPolicy;

public class TestAccessControl {

	private static JSONObject windows(int count) {
		return new JSONObject().put("house1",
				new JSONObject().put("room1", new JSONObject().put("windows", count)));
	}

	@Test
	public void testDefaultPolicyIsPublic() {
		final Control room = TestData.newHouseTree().getChild("house1").getChild("room1");

		assertSame(AccessPolicy.PUBLIC, room.getAccess("windows"));
		for (AccessChannel channel : AccessChannel.values()) {
			assertTrue(room.getAccess("windows").isAllowed(channel));
		}
	}

	@Test
	public void testDeniedSetChannelOnlyBlocksDeclarativeWrites() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		assertTrue(room.setAccess("windows", new JSONObject().put("Set", "none")));

		root.set(windows(7));
		assertEquals(2, room.getProperty("windows"));

		assertTrue(room.setProperty("windows", 7));
		assertEquals(7, room.getProperty("windows"));
	}

	@Test
	public void testDeniedSetterBlocksAllWrites() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		room.setAccess("windows", AccessPolicy.of(AccessChannel.SETTER, AccessLevel.NONE));

		assertFalse(room.setProperty("windows", 7));
		root.set(windows(8));

		assertEquals(2, room.getProperty("windows"));
	}

	@Test
	public void testDeniedGetterHidesDirectReads() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		room.setAccess("windows", AccessPolicy.of(AccessChannel.GETTER, AccessLevel.NONE));

		assertNull(room.getProperty("windows"));
		assertNull(room.accessor("windows").get());
		// Declarative reads use the Get channel, which is still public
		assertEquals(2, root.get().getJSONObject("house1").getJSONObject("room1").getInt("windows"));
	}

	@Test
	public void testPrivateDeniesLikeNone() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		room.setAccess("doors", new JSONObject().put("Get", "private").put("setter", "private"));

		assertFalse(root.get().getJSONObject("house1").getJSONObject("room1").has("doors"));
		assertFalse(room.setProperty("doors", 4));
		assertEquals(AccessLevel.PRIVATE, room.getAccess("doors").getLevel(AccessChannel.GET));
	}

	@Test
	public void testUnknownPropertyIsIgnored() {
		final Control room = TestData.newHouseTree().getChild("house1").getChild("room1");

		assertFalse(room.setAccess("chimney", AccessPolicy.of(AccessChannel.GET, AccessLevel.NONE)));
		assertSame(AccessPolicy.PUBLIC, room.getAccess("chimney"));
	}

	@Test
	public void testResettingPolicyRestoresAccess() {
		final Control room = TestData.newHouseTree().getChild("house1").getChild("room1");
		room.setAccess("windows", AccessPolicy.of(AccessChannel.GETTER, AccessLevel.NONE));
		assertNull(room.getProperty("windows"));

		room.setAccess("windows", (AccessPolicy) null);

		assertEquals(2, room.getProperty("windows"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSettingUnknownPropertyThrows() {
		TestData.newHouseTree().getChild("house1").setProperty("chimney", 1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSettingUncoercibleValueThrows() {
		TestData.newHouseTree().getChild("house1").getChild("room1").setProperty("windows", "many");
	}
}
