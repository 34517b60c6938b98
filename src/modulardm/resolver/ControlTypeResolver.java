package modulardm.resolver;

/**
 * Maps type names found in declarative data to factories for control
 * instances.
 * <p>
 * Where the control classes come from is up to the implementation. The two
 * stock resolvers are {@link LocationTypeResolver}, which loads classes by name
 * relative to a base package or class, and {@link RegistryTypeResolver}, which
 * is filled in explicitly.
 */
@FunctionalInterface
public interface ControlTypeResolver {

	/**
	 * @return a factory for <code>typeName</code>, or <code>null</code> if the
	 *         type is unknown
	 */
	ControlFactory resolve(String typeName);

	public static ControlTypeResolver fromLocation(String typeLocation) {
		return new LocationTypeResolver(typeLocation);
	}
}
