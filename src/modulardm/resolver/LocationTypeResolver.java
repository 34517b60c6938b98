package modulardm.resolver;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;

import modulardm.Control;
import modulardm.TopLevelContainer;
import modulardm.metaprogramming.Reflect;

/**
 * Loads control classes by name relative to a base location.
 * <p>
 * The location is either a package name, in which case type 'room' is looked
 * up as <code>location.room</code> and then <code>location.Room</code>, or the
 * name of a class, in which case its nested classes are used
 * (<code>location$Room</code>). An empty location means the default package.
 * <p>
 * A class is accepted if it extends {@link Control}, is concrete and has a
 * public no-argument constructor.
 */
public class LocationTypeResolver implements ControlTypeResolver {

	private final String location;
	private final ClassLoader classLoader;

	private Boolean locationIsClass;

	public LocationTypeResolver(String location) {
		this(location, defaultClassLoader());
	}

	private static ClassLoader defaultClassLoader() {
		final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
		return ctx != null ? ctx : LocationTypeResolver.class.getClassLoader();
	}

	public LocationTypeResolver(String location, ClassLoader classLoader) {
		this.location = location != null ? location : "";
		this.classLoader = classLoader;
	}

	public String getLocation() {
		return location;
	}

	private boolean isClassLocation() {
		if (locationIsClass == null) {
			locationIsClass = !location.isEmpty() && loadClass(location) != null;
		}
		return locationIsClass;
	}

	List<String> candidateClassNames(String typeName) {
		final List<String> names = new ArrayList<>();
		final String prefix;
		if (location.isEmpty()) {
			prefix = "";
		} else if (isClassLocation()) {
			prefix = location + "$";
		} else {
			prefix = location + ".";
		}
		names.add(prefix + typeName);
		if (!typeName.isEmpty() && Character.isLowerCase(typeName.charAt(0))) {
			names.add(prefix + Character.toUpperCase(typeName.charAt(0)) + typeName.substring(1));
		}
		return names;
	}

	private Class<?> loadClass(String className) {
		try {
			return Class.forName(className, true, classLoader);
		} catch (ClassNotFoundException e) {
			return null;
		} catch (NoClassDefFoundError e) {
			// Case-insensitive file systems find 'Room.class' when asked for 'room'
			if (TopLevelContainer.VERBOSE) {
				System.out.println("Cannot load '" + className + "': " + e.getMessage());
			}
			return null;
		}
	}

	@Override
	public ControlFactory resolve(String typeName) {
		for (String cname : candidateClassNames(typeName)) {
			final Class<?> clazz = loadClass(cname);
			if (clazz == null) {
				continue;
			}
			if (!Control.class.isAssignableFrom(clazz)) {
				if (TopLevelContainer.VERBOSE) {
					System.out.println("'" + cname + "' is not a " + Control.class.getSimpleName() + ", ignoring it");
				}
				continue;
			}
			final Constructor<? extends Control> ctor = Reflect.findNoArgConstructor(clazz.asSubclass(Control.class));
			if (ctor == null) {
				System.out.println("'" + cname + "' has no public no-argument constructor, ignoring it");
				continue;
			}
			return () -> Reflect.instantiate(ctor);
		}
		return null;
	}

	@Override
	public String toString() {
		return "LocationTypeResolver<" + location + ">";
	}
}
