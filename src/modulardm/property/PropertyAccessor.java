package modulardm.property;

import java.util.Objects;

import modulardm.Control;
import modulardm.access.AccessChannel;
import modulardm.event.EventScope;
import modulardm.metaprogramming.PropertyDescriptor;

/**
 * Generated getter/setter pair for one observable property of one control.
 */
public class PropertyAccessor {

	private final Control owner;
	private final PropertyDescriptor descriptor;
	private final PropertyRegistry registry;

	public PropertyAccessor(Control owner, PropertyDescriptor descriptor, PropertyRegistry registry) {
		this.owner = owner;
		this.descriptor = descriptor;
		this.registry = registry;
	}

	public String getName() {
		return descriptor.name;
	}

	public PropertyDescriptor getDescriptor() {
		return descriptor;
	}

	/**
	 * Returns the current value, or <code>null</code> when the getter channel is
	 * denied.
	 */
	public Object get() {
		if (!registry.isAllowed(descriptor.name, AccessChannel.GETTER)) {
			return null;
		}
		return registry.value(descriptor.name);
	}

	public boolean set(Object value) {
		return write(value, true);
	}

	/**
	 * Stores a new value if it differs from the current one and the setter
	 * channel permits it. When <code>notify</code> is true the change is routed
	 * towards the root before the property event is emitted.
	 *
	 * @return whether the value changed
	 * @throws IllegalArgumentException if the value cannot be coerced to the
	 *                                  property's kind
	 */
	public boolean write(Object value, boolean notify) {
		final Object coerced = descriptor.coerce(value);
		if (Objects.equals(registry.value(descriptor.name), coerced)) {
			return false;
		}
		if (!registry.isAllowed(descriptor.name, AccessChannel.SETTER)) {
			return false;
		}
		registry.store(descriptor.name, coerced);
		if (notify) {
			owner.notifyProperty(descriptor.name);
		}
		owner.emit(descriptor.name, coerced, registry.getMeta(descriptor.name), EventScope.LOCAL);
		return true;
	}

	@Override
	public String toString() {
		return "PropertyAccessor<" + owner.getName() + "." + descriptor + ">";
	}
}
