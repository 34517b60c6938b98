package modulardm.resolver;

import java.lang.reflect.Constructor;
import java.util.LinkedHashMap;
import java.util.Map;

import modulardm.Control;
import modulardm.metaprogramming.Reflect;

/**
 * Resolver backed by explicit registrations.
 *
 * <pre>
 * new RegistryTypeResolver() //
 * 		.register("house", House::new) //
 * 		.register("room", Room.class);
 * </pre>
 */
public class RegistryTypeResolver implements ControlTypeResolver {

	private final Map<String, ControlFactory> factories = new LinkedHashMap<>();

	public RegistryTypeResolver register(String typeName, ControlFactory factory) {
		if (factory == null) {
			throw new NullPointerException("Missing factory for '" + typeName + "'");
		}
		factories.put(typeName, factory);
		return this;
	}

	public RegistryTypeResolver register(String typeName, Class<? extends Control> clazz) {
		final Constructor<? extends Control> ctor = Reflect.findNoArgConstructor(clazz);
		if (ctor == null) {
			throw new IllegalArgumentException(clazz.getName() + " has no public no-argument constructor");
		}
		return register(typeName, () -> Reflect.instantiate(ctor));
	}

	public RegistryTypeResolver unregister(String typeName) {
		factories.remove(typeName);
		return this;
	}

	public boolean isRegistered(String typeName) {
		return factories.containsKey(typeName);
	}

	@Override
	public ControlFactory resolve(String typeName) {
		return factories.get(typeName);
	}
}
