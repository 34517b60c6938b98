package modulardm.resolver;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

import modulardm.TopLevelContainer;

/**
 * Caching proxy in front of the {@link ControlTypeResolver} of one tree. Owned
 * by a {@link TopLevelContainer}, so every tree has its own cache.
 * <p>
 * Names are only passed on to the underlying resolver if they consist of
 * letters, digits and underscores. Failed lookups are not cached, so a type
 * that becomes available later is picked up on the next attempt.
 */
public class TypeCache implements ControlTypeResolver {

	private static final Pattern VALID_TYPE_NAME = Pattern.compile("^[a-zA-Z0-9_]+$");

	private final ControlTypeResolver proxyTarget;
	private final Map<String, ControlFactory> cache = new HashMap<>();

	public TypeCache(ControlTypeResolver proxyTarget) {
		if (proxyTarget == null) {
			throw new NullPointerException("Missing type resolver");
		}
		this.proxyTarget = proxyTarget;
	}

	public static boolean isValidTypeName(String typeName) {
		return typeName != null && VALID_TYPE_NAME.matcher(typeName).matches();
	}

	@Override
	public ControlFactory resolve(String typeName) {
		final ControlFactory cached = cache.get(typeName);
		if (cached != null) {
			return cached;
		}
		if (!isValidTypeName(typeName)) {
			if (TopLevelContainer.VERBOSE) {
				System.out.println("Invalid type name '" + typeName + "'");
			}
			return null;
		}
		final ControlFactory fresh;
		try {
			fresh = proxyTarget.resolve(typeName);
		} catch (RuntimeException | LinkageError e) {
			System.err.println("Failed loading control type '" + typeName + "'");
			e.printStackTrace();
			return null;
		}
		if (fresh != null) {
			cache.put(typeName, fresh);
		}
		return fresh;
	}

	public boolean isCached(String typeName) {
		return cache.containsKey(typeName);
	}

	public int size() {
		return cache.size();
	}

	public void clear() {
		cache.clear();
	}

	public ControlTypeResolver getProxyTarget() {
		return proxyTarget;
	}
}
