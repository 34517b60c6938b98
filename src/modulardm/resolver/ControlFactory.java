package modulardm.resolver;

import modulardm.Control;

@FunctionalInterface
public interface ControlFactory {

	/**
	 * Creates a fresh, detached control. Exceptions thrown here propagate to the
	 * caller of the {@link Control#set} that triggered construction.
	 */
	Control create();
}
