package modulardm.metaprogramming;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

import modulardm.Control;
import modulardm.TestData;
import modulardm.TopLevelContainer;
import modulardm.property.PropertyRegistry;

public class TestControlSchema {

	private static Map<String, PropertyDescriptor> byName(ControlSchema schema) {
		final Map<String, PropertyDescriptor> ret = new HashMap<>();
		for (PropertyDescriptor desc : schema.getProperties()) {
			ret.put(desc.name, desc);
		}
		return ret;
	}

	@Test
	public void testCollectsObservableFields() {
		final Map<String, PropertyDescriptor> props = byName(ControlSchema.scan(TestData.House.class));

		final Set<String> expected = new LinkedHashSet<>();
		expected.add("streetNumber");
		expected.add("description");
		expected.add("occupied");
		expected.add("tags");
		assertEquals(expected, props.keySet());

		assertEquals(PropertyKind.STRING, props.get("streetNumber").kind);
		assertEquals(PropertyKind.BOOLEAN, props.get("occupied").kind);
		assertEquals(PropertyKind.ARRAY, props.get("tags").kind);
	}

	@Test
	public void testRedeclaredFieldAppearsOnce() {
		final ControlSchema schema = ControlSchema.scan(TestData.Kitchen.class);
		final Map<String, PropertyDescriptor> props = byName(schema);

		assertEquals(3, schema.getProperties().size());
		assertSame(TestData.Kitchen.class, props.get("windows").field.getDeclaringClass());
		assertSame(TestData.Room.class, props.get("doors").field.getDeclaringClass());
		assertEquals(PropertyKind.BOOLEAN, props.get("hasOven").kind);
	}

	@Test
	public void testReservedNamesAreSkipped() {
		final Map<String, PropertyDescriptor> props = byName(ControlSchema.scan(TestData.Garden.class));

		final Set<String> expected = new LinkedHashSet<>();
		expected.add("flowers");
		expected.add("area");
		assertEquals(expected, props.keySet());
	}

	@Test
	public void testEngineClassesHaveNoProperties() {
		assertTrue(ControlSchema.scan(Control.class).isEmpty());
		assertTrue(ControlSchema.scan(TopLevelContainer.class).isEmpty());
	}

	@Test
	public void testContainerCachesSchemaPerClass() {
		final TopLevelContainer root = TestData.newContainer();

		assertSame(root.getSchema(TestData.Room.class), root.getSchema(TestData.Room.class));
		assertSame(TestData.Room.class, root.getSchema(TestData.Room.class).controlClass);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testGeneratorRejectsMismatchingSchema() {
		final TestData.Room room = new TestData.Room();
		AccessorGenerator.generate(room, ControlSchema.scan(TestData.House.class),
				new PropertyRegistry());
	}
}
