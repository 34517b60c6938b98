package modulardm.resolver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import modulardm.TestData;

public class TestTypeCache {

	private final List<String> requested = new ArrayList<>();

	private final ControlTypeResolver underlying = typeName -> {
		requested.add(typeName);
		if ("room".equals(typeName)) {
			return TestData.Room::new;
		}
		return null;
	};

	@Test
	public void testSuccessfulLookupIsCached() {
		final TypeCache cache = new TypeCache(underlying);

		final ControlFactory first = cache.resolve("room");
		final ControlFactory second = cache.resolve("room");

		assertNotNull(first);
		assertSame(first, second);
		assertEquals(Arrays.asList("room"), requested);
		assertTrue(cache.isCached("room"));
		assertEquals(1, cache.size());
		assertTrue(first.create() instanceof TestData.Room);
	}

	@Test
	public void testFailedLookupIsRetried() {
		final TypeCache cache = new TypeCache(underlying);

		assertNull(cache.resolve("attic"));
		assertNull(cache.resolve("attic"));

		assertEquals(Arrays.asList("attic", "attic"), requested);
		assertFalse(cache.isCached("attic"));
	}

	@Test
	public void testInvalidNamesNeverReachResolver() {
		final TypeCache cache = new TypeCache(underlying);

		for (String name : new String[] { "", "a.b", "../room", "room ", "a-b", "räum", null }) {
			assertNull(cache.resolve(name));
		}

		assertEquals(0, requested.size());
	}

	@Test
	public void testValidNames() {
		assertTrue(TypeCache.isValidTypeName("room"));
		assertTrue(TypeCache.isValidTypeName("Room_2"));
		assertTrue(TypeCache.isValidTypeName("_"));
		assertFalse(TypeCache.isValidTypeName("modulardm.Room"));
		assertFalse(TypeCache.isValidTypeName(null));
	}

	@Test
	public void testResolverFailuresBecomeUnknownTypes() {
		final TypeCache cache = new TypeCache(typeName -> {
			if ("broken".equals(typeName)) {
				throw new NoClassDefFoundError("Simulated linkage problem") {
					private static final long serialVersionUID = 1L;

					// Keep the test output clean
					@Override
					public void printStackTrace() {
					}
				};
			}
			throw new IllegalStateException("Simulated resolver failure") {
				private static final long serialVersionUID = 1L;

				@Override
				public void printStackTrace() {
				}
			};
		});

		assertNull(cache.resolve("broken"));
		assertNull(cache.resolve("other"));
		assertEquals(0, cache.size());
	}

	@Test
	public void testClear() {
		final TypeCache cache = new TypeCache(underlying);
		cache.resolve("room");

		cache.clear();
		cache.resolve("room");

		assertEquals(Arrays.asList("room", "room"), requested);
		assertSame(underlying, cache.getProxyTarget());
	}

	@Test(expected = NullPointerException.class)
	public void testRequiresResolver() {
		new TypeCache(null);
	}
}
