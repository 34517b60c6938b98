package modulardm.access;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import org.json.JSONObject;
import org.junit.Test;

public class TestAccessPolicy {

	@Test
	public void testFromJSON() {
		final AccessPolicy policy = AccessPolicy
				.fromJSON(new JSONObject("{\"Set\": \"none\", \"getter\": \"private\", \"Get\": \"public\"}"));

		assertFalse(policy.isAllowed(AccessChannel.SET));
		assertFalse(policy.isAllowed(AccessChannel.GETTER));
		assertTrue(policy.isAllowed(AccessChannel.GET));
		assertTrue(policy.isAllowed(AccessChannel.SETTER));
		assertEquals(AccessLevel.PRIVATE, policy.getLevel(AccessChannel.GETTER));
	}

	@Test
	public void testChannelNamesAreCaseSensitive() {
		final AccessPolicy policy = AccessPolicy.fromJSON(new JSONObject("{\"set\": \"none\", \"Setter\": \"none\"}"));

		assertEquals(AccessPolicy.PUBLIC, policy);
	}

	@Test
	public void testUnknownLevelDenies() {
		final AccessPolicy policy = AccessPolicy.fromJSON(new JSONObject("{\"Get\": \"maybe\"}"));

		assertEquals(AccessLevel.NONE, policy.getLevel(AccessChannel.GET));
		assertFalse(policy.isAllowed(AccessChannel.GET));
	}

	@Test
	public void testWithReturnsCopy() {
		final AccessPolicy denied = AccessPolicy.of(AccessChannel.SETTER, AccessLevel.NONE);
		final AccessPolicy restored = denied.with(AccessChannel.SETTER, null);

		assertNotSame(denied, restored);
		assertFalse(denied.isAllowed(AccessChannel.SETTER));
		assertEquals(AccessPolicy.PUBLIC, restored);
		assertTrue(AccessPolicy.PUBLIC.isAllowed(AccessChannel.SETTER));
	}

	@Test
	public void testToJSON() {
		final AccessPolicy policy = AccessPolicy.of(AccessChannel.GET, AccessLevel.NONE).with(AccessChannel.SET,
				AccessLevel.PUBLIC);

		final JSONObject json = policy.toJSON();
		assertTrue(new JSONObject("{\"Get\": \"none\", \"Set\": \"public\"}").similar(json));
		assertEquals(policy, AccessPolicy.fromJSON(json));
	}

	@Test
	public void testParseLevel() {
		assertEquals(AccessLevel.PUBLIC, AccessLevel.parse(null));
		assertEquals(AccessLevel.NONE, AccessLevel.parse("none"));
		assertEquals(AccessLevel.NONE, AccessLevel.parse("NONE"));
		assertTrue(AccessLevel.PUBLIC.permitsExternal());
		assertFalse(AccessLevel.PRIVATE.permitsExternal());
	}
}
