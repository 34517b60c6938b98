package modulardm.metaprogramming;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import modulardm.Control;
import modulardm.TopLevelContainer;
import modulardm.data.ControlData;

/**
 * The observable fields of a control class, enumerated once per class.
 * <p>
 * Fields are collected from the concrete class and its superclasses, stopping
 * at {@link Control} (or {@link TopLevelContainer}) so that the engine's own
 * bookkeeping is never picked up. A field qualifies when it is an instance
 * field, its name does not start with '_' or collide with a reserved data key,
 * and its declared type is classified by {@link PropertyKind#classify(Class)}.
 */
public class ControlSchema {

	public final Class<? extends Control> controlClass;
	private final List<PropertyDescriptor> properties;

	private ControlSchema(Class<? extends Control> controlClass, List<PropertyDescriptor> properties) {
		this.controlClass = controlClass;
		this.properties = Collections.unmodifiableList(properties);
	}

	public List<PropertyDescriptor> getProperties() {
		return properties;
	}

	public boolean isEmpty() {
		return properties.isEmpty();
	}

	public static ControlSchema scan(Class<? extends Control> clazz) {
		final List<Class<?>> hierarchy = new ArrayList<>();
		for (Class<?> c = clazz; c != null && c != Control.class && c != TopLevelContainer.class
				&& c != Object.class; c = c.getSuperclass()) {
			hierarchy.add(0, c);
		}

		// Superclass fields first, subclass redeclarations replace them in place
		final Map<String, PropertyDescriptor> found = new LinkedHashMap<>();
		for (Class<?> c : hierarchy) {
			for (Field f : c.getDeclaredFields()) {
				if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) {
					continue;
				}
				final String name = f.getName();
				if (name.startsWith("_")) {
					continue;
				}
				final PropertyKind kind = PropertyKind.classify(f.getType());
				if (kind == null) {
					continue;
				}
				if (ControlData.isReservedKey(name)) {
					System.out.println("Field '" + name + "' in " + c.getName()
							+ " uses a reserved name and will not be observable");
					continue;
				}
				found.put(name, new PropertyDescriptor(name, kind, f));
			}
		}
		return new ControlSchema(clazz, new ArrayList<>(found.values()));
	}

	@Override
	public String toString() {
		return "ControlSchema<" + controlClass.getSimpleName() + ":" + properties + ">";
	}
}
