package modulardm.metaprogramming;

import modulardm.Control;
import modulardm.property.PropertyAccessor;
import modulardm.property.PropertyRegistry;

/**
 * Turns the observable fields of a freshly constructed control into registry
 * backed properties. Must run after the control's field initializers, i.e. after
 * the constructor has returned.
 */
public class AccessorGenerator {

	public static void generate(Control control, ControlSchema schema, PropertyRegistry registry) {
		if (!schema.controlClass.isInstance(control)) {
			throw new IllegalArgumentException(schema + " does not describe " + control.getClass().getName());
		}
		for (PropertyDescriptor desc : schema.getProperties()) {
			final Object fieldValue = Reflect.readField(control, desc.field);
			final Object initial = desc.kind.normalizeInitial(fieldValue, desc.getDeclaredType());
			registry.define(desc, initial, new PropertyAccessor(control, desc, registry));
		}
		registry.seal();
	}
}
