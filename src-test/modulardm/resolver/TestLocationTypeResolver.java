package modulardm.resolver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import modulardm.Control;
import modulardm.TestData;
import modulardm.resolver.fixtures.Lamp;

public class TestLocationTypeResolver {

	private final LocationTypeResolver nested = new LocationTypeResolver(TestData.class.getName());

	@Test
	public void testNestedClassesOfClassLocation() {
		final ControlFactory factory = nested.resolve("room");

		assertNotNull(factory);
		final Control first = factory.create();
		final Control second = factory.create();
		assertTrue(first instanceof TestData.Room);
		assertTrue(first != second);
	}

	@Test
	public void testExactNameIsTriedFirst() {
		final String prefix = TestData.class.getName() + "$";

		assertEquals(Arrays.asList(prefix + "room", prefix + "Room"), nested.candidateClassNames("room"));
		assertEquals(Arrays.asList(prefix + "Room"), nested.candidateClassNames("Room"));
		assertNotNull(nested.resolve("Room"));
	}

	@Test
	public void testPackageLocation() {
		final LocationTypeResolver pkg = new LocationTypeResolver(Lamp.class.getPackage().getName());

		assertEquals(Arrays.asList("modulardm.resolver.fixtures.lamp", "modulardm.resolver.fixtures.Lamp"),
				pkg.candidateClassNames("lamp"));
		final ControlFactory factory = pkg.resolve("lamp");
		assertNotNull(factory);
		assertTrue(factory.create() instanceof Lamp);
	}

	@Test
	public void testDefaultPackage() {
		final LocationTypeResolver def = new LocationTypeResolver(null);

		assertEquals("", def.getLocation());
		assertEquals(Arrays.asList("lamp", "Lamp"), def.candidateClassNames("lamp"));
		assertNull(def.resolve("lamp"));
	}

	@Test
	public void testUnusableClassesAreRejected() {
		assertNull(nested.resolve("spaceship"));
		assertNull(nested.resolve("notAControl"));
		assertNull(nested.resolve("abstractThing"));
		assertNull(nested.resolve("noDefaultConstructor"));
	}

	@Test
	public void testRegistryResolver() {
		final RegistryTypeResolver registry = new RegistryTypeResolver() //
				.register("lamp", Lamp.class) //
				.register("room", TestData.Room::new);

		assertTrue(registry.isRegistered("lamp"));
		assertTrue(registry.resolve("lamp").create() instanceof Lamp);
		assertTrue(registry.resolve("room").create() instanceof TestData.Room);
		assertNull(registry.resolve("Lamp"));

		registry.unregister("lamp");
		assertNull(registry.resolve("lamp"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRegistryRejectsClassWithoutNoArgConstructor() {
		new RegistryTypeResolver().register("x", TestData.NoDefaultConstructor.class);
	}
}
