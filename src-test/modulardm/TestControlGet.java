package modulardm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONObject;
import org.junit.Test;

import modulardm.access.AccessChannel;
import modulardm.access.AccessLevel;
import modulardm.access.AccessPolicy;
import modulardm.data.GetOptions;

public class TestControlGet {

	@Test
	public void testSparseOmitsEmptyStrings() {
		final TopLevelContainer root = TestData.newHouseTree();

		final JSONObject sparse = root.get().getJSONObject("house1");
		assertFalse(sparse.has("description"));
		assertEquals(false, sparse.get("occupied"));

		final JSONObject full = root.get(false).getJSONObject("house1");
		assertEquals("", full.getString("description"));
	}

	@Test
	public void testRootHasNoPropertiesOfItsOwn() {
		final TopLevelContainer root = TestData.newContainer();

		assertEquals(0, root.get().length());
		assertTrue(root.getPropertyNames().isEmpty());
	}

	@Test
	public void testHiddenChildIsOmitted() {
		final TopLevelContainer root = TestData.newHouseTree();
		root.set(new JSONObject().put("house1", new JSONObject().put("hidden", true)));

		assertTrue(root.getChild("house1").isHidden());
		assertFalse(root.get().has("house1"));

		// Reading the hidden control itself still works
		assertTrue(root.getChild("house1").get().has("room1"));

		root.getChild("house1").setHidden(false);
		assertTrue(root.get().has("house1"));
	}

	@Test
	public void testUnreadablePropertyIsOmitted() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control room = root.getChild("house1").getChild("room1");
		room.setAccess("windows", AccessPolicy.of(AccessChannel.GET, AccessLevel.NONE));

		final JSONObject roomData = root.get().getJSONObject("house1").getJSONObject("room1");
		assertFalse(roomData.has("windows"));
		assertEquals(1, roomData.getInt("doors"));
	}

	@Test
	public void testIncludeTypeNames() {
		final TopLevelContainer root = TestData.newHouseTree();

		final JSONObject res = root.get(GetOptions.full());
		assertEquals("TopLevelContainer", res.getString("typeName"));
		assertEquals("house", res.getJSONObject("house1").getString("typeName"));
		assertEquals("room", res.getJSONObject("house1").getJSONObject("room1").getString("typeName"));
		assertEquals("", res.getJSONObject("house1").getString("description"));
	}

	@Test
	public void testFullSnapshotRebuildsEquivalentTree() {
		final TopLevelContainer root = TestData.newHouseTree();
		root.getChild("house1").setProperty("description", "Yellow, two floors");
		root.getChild("house1").getChild("room1").setProperty("windows", 5);
		root.set(new JSONObject().put("k", new JSONObject().put("typeName", "kitchen")));

		final TopLevelContainer copy = TestData.newContainer();
		copy.set(root.get(GetOptions.full()));

		assertTrue(root.get(GetOptions.full()).similar(copy.get(GetOptions.full())));
		assertTrue(copy.getChild("k") instanceof TestData.Kitchen);
	}

	@Test
	public void testNonSparseSnapshotRestoresEquivalentTree() {
		final TopLevelContainer root = TestData.newHouseTree();
		root.getChild("house1").setProperty("occupied", true);
		root.getChild("house1").getChild("room1").setProperty("doors", 2);

		final TopLevelContainer copy = TestData.newHouseTree();
		copy.set(root.get(false));

		assertTrue(root.get(false).similar(copy.get(false)));
	}

	@Test
	public void testNonFiniteNumbersNeverBreakGet() {
		final TopLevelContainer root = TestData.newContainer();
		root.set(new JSONObject().put("m", new JSONObject().put("typeName", "meter")));
		final Control meter = root.getChild("m");
		final List<Object> events = new ArrayList<>();
		meter.on("level", (data, meta) -> events.add(data));
		root.on(Control.EVENT_DATA, (data, meta) -> events.add(data));

		// The field initializer is NaN
		assertEquals(0.0, root.get().getJSONObject("m").getDouble("level"), 0.0);

		for (Object bad : new Object[] { Double.NaN, Double.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY,
				new BigDecimal("1e400") }) {
			try {
				meter.setProperty("level", bad);
				throw new AssertionError("Expected " + bad + " to be rejected");
			} catch (IllegalArgumentException e) {
				// Expected
			}
		}

		assertEquals(0.0, meter.getProperty("level"));
		assertEquals(0, events.size());
		assertEquals(0.0, root.get().getJSONObject("m").getDouble("level"), 0.0);
	}

	@Test
	public void testGetOptionsFromJSON() {
		final GetOptions defaults = GetOptions.fromJSON(new JSONObject());
		assertTrue(defaults.sparse);
		assertFalse(defaults.includeTypeNames);

		final GetOptions parsed = GetOptions.fromJSON(GetOptions.full().toJSON());
		assertFalse(parsed.sparse);
		assertTrue(parsed.includeTypeNames);
	}
}
