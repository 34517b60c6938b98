package modulardm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.json.JSONObject;
import org.junit.Test;

import modulardm.resolver.RegistryTypeResolver;

public class TestControlCreation {

	@Test
	public void testInitRunsWithInitialDataBeforeAnnouncement() {
		final TopLevelContainer root = TestData.newContainer();
		final List<String> seenByListener = new ArrayList<>();
		root.on(Control.EVENT_NEW_CHILD, (data, meta) -> {
			final TestData.InitRecorder rec = (TestData.InitRecorder) data;
			seenByListener.add(rec._labelSeenInInit);
		});

		root.set(new JSONObject().put("rec", new JSONObject().put("typeName", "initRecorder").put("label", "hello")));

		assertEquals(Arrays.asList("hello"), seenByListener);
		assertEquals(1, root.getChild("rec", TestData.InitRecorder.class)._initCalls);
	}

	@Test
	public void testNameEventPrecedesGenericEvent() {
		final TopLevelContainer root = TestData.newContainer();
		final List<String> order = new ArrayList<>();
		final List<Object> payloads = new ArrayList<>();
		root.on("house1", (data, meta) -> {
			order.add("house1");
			payloads.add(data);
		});
		root.on(Control.EVENT_NEW_CHILD, (data, meta) -> {
			order.add(Control.EVENT_NEW_CHILD);
			payloads.add(data);
		});

		root.set(TestData.houseWithRoom());

		assertEquals(Arrays.asList("house1", Control.EVENT_NEW_CHILD), order);
		assertSame(root.getChild("house1"), payloads.get(0));
		assertSame(root.getChild("house1"), payloads.get(1));
	}

	@Test
	public void testNestedChildrenAreAnnouncedByTheirParent() {
		final TopLevelContainer root = TestData.newContainer();
		final List<String> rootCreations = new ArrayList<>();
		root.on(Control.EVENT_NEW_CHILD, (data, meta) -> rootCreations.add(((Control) data).getName()));

		root.set(TestData.houseWithRoom());

		assertEquals(Arrays.asList("house1"), rootCreations);
	}

	@Test
	public void testUnknownTypeIsSkipped() {
		final TopLevelContainer root = TestData.newContainer();

		root.set(new JSONObject() //
				.put("a", new JSONObject().put("typeName", "spaceship")) //
				.put("b", new JSONObject().put("typeName", "room")) //
				.put("c", new JSONObject().put("typeName", "../room")) //
				.put("d", new JSONObject().put("typeName", "notAControl")));

		assertNull(root.getChild("a"));
		assertNotNull(root.getChild("b"));
		assertNull(root.getChild("c"));
		assertNull(root.getChild("d"));
		assertEquals(1, root.getChildren().size());
	}

	@Test
	public void testNonStringTypeNameIsNotABranchType() {
		final TopLevelContainer root = TestData.newContainer();

		root.set(new JSONObject().put("a", new JSONObject().put("typeName", 5)));

		assertNull(root.getChild("a"));
	}

	@Test
	public void testConstructorFailurePropagates() {
		final TopLevelContainer root = TestData.newContainer();
		try {
			root.set(new JSONObject().put("boom", new JSONObject().put("typeName", "exploding")));
			throw new AssertionError("Expected construction to fail");
		} catch (IllegalStateException e) {
			assertEquals("Simulated failure", e.getMessage());
		}
		assertNull(root.getChild("boom"));
	}

	@Test
	public void testRedeclaredFieldUsesSubclassInitialValue() {
		final TopLevelContainer root = TestData.newContainer();
		root.set(new JSONObject().put("k", new JSONObject().put("typeName", "Kitchen")));

		final Control kitchen = root.getChild("k");
		assertEquals("Kitchen", kitchen.getTypeName());
		assertEquals(3, kitchen.getProperty("windows"));
		assertEquals(1, kitchen.getProperty("doors"));
		assertEquals(true, kitchen.getProperty("hasOven"));
	}

	@Test
	public void testReservedFieldNamesAreNotObservable() {
		final TopLevelContainer root = TestData.newContainer();
		root.set(new JSONObject().put("g", new JSONObject().put("typeName", "garden").put("hidden", false)));

		final Control garden = root.getChild("g");
		assertFalse(garden.hasProperty("typeName"));
		assertFalse(garden.hasProperty("remove"));
		assertFalse(garden.hasProperty("hidden"));
		assertFalse(garden.hasProperty("layout"));
		assertTrue(garden.hasProperty("flowers"));
		assertEquals(0.0, garden.getProperty("area"));
		assertEquals(new ArrayList<>(), garden.getProperty("flowers"));
	}

	@Test
	public void testControlCannotBeAttachedTwice() {
		final TopLevelContainer root = TestData.newHouseTree();
		final Control house = root.getChild("house1");
		final TopLevelContainer other = new TopLevelContainer(new RegistryTypeResolver().register("house", () -> house));

		try {
			other.set(new JSONObject().put("stolen", new JSONObject().put("typeName", "house")));
			throw new AssertionError("Expected attach to fail");
		} catch (IllegalStateException e) {
			// Expected
		}
		assertSame(root, house.getParent());
	}

	@Test
	public void testEachTreeHasItsOwnTypeCache() {
		final TopLevelContainer first = TestData.newHouseTree();
		final TopLevelContainer second = TestData.newContainer();

		assertTrue(first.getTypeCache().isCached("house"));
		assertTrue(first.getTypeCache().isCached("room"));
		assertFalse(second.getTypeCache().isCached("house"));
		assertEquals(0, second.getTypeCache().size());
	}

	@Test
	public void testRegistryResolver() {
		final TopLevelContainer root = new TopLevelContainer(new RegistryTypeResolver() //
				.register("building", TestData.House::new) //
				.register("chamber", TestData.Room.class));

		root.set(new JSONObject().put("b", new JSONObject() //
				.put("typeName", "building") //
				.put("c", new JSONObject().put("typeName", "chamber").put("doors", 4))));

		assertTrue(root.getChild("b") instanceof TestData.House);
		assertEquals("building", root.getChild("b").getTypeName());
		assertEquals(4, root.getChild("b").getChild("c").getProperty("doors"));
	}

	@Test
	public void testDefaultLocationComesFromSystemProperty() {
		final String old = System.getProperty(TopLevelContainer.TYPE_LOCATION_PROPERTY);
		System.setProperty(TopLevelContainer.TYPE_LOCATION_PROPERTY, TestData.class.getName());
		try {
			final TopLevelContainer root = new TopLevelContainer();
			root.set(TestData.houseWithRoom());
			assertNotNull(root.getChild("house1"));
		} finally {
			if (old == null) {
				System.clearProperty(TopLevelContainer.TYPE_LOCATION_PROPERTY);
			} else {
				System.setProperty(TopLevelContainer.TYPE_LOCATION_PROPERTY, old);
			}
		}
	}
}
