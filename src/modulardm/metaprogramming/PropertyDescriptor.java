package modulardm.metaprogramming;

import java.lang.reflect.Field;

/**
 * One observable field of a control class.
 */
public class PropertyDescriptor {

	public final String name;
	public final PropertyKind kind;
	public final Field field;

	public PropertyDescriptor(String name, PropertyKind kind, Field field) {
		this.name = name;
		this.kind = kind;
		this.field = field;
	}

	public Class<?> getDeclaredType() {
		return field.getType();
	}

	public Object coerce(Object value) {
		return kind.coerce(value, field.getType());
	}

	@Override
	public String toString() {
		return name + ":" + kind;
	}
}
