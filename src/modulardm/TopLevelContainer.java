package modulardm;

import java.util.HashMap;
import java.util.Map;

import modulardm.metaprogramming.ControlSchema;
import modulardm.resolver.ControlFactory;
import modulardm.resolver.ControlTypeResolver;
import modulardm.resolver.TypeCache;

/**
 * Root of a control tree. Host code applies and reads declarative data through
 * the container; the container in turn owns the type cache and the property
 * schemas used by every control in its tree.
 * <p>
 * The container is its own top-level parent, so 'top' scoped events emitted
 * anywhere in the tree arrive here. It has no observable properties of its
 * own.
 */
public class TopLevelContainer extends Control {

	public static final boolean VERBOSE = "true".equals(System.getProperty("mdm.verbose"));

	public static final String TYPE_LOCATION_PROPERTY = "mdm.typeLocation";

	private final TypeCache typeCache;
	private final Map<Class<? extends Control>, ControlSchema> schemaCache = new HashMap<>();

	/**
	 * Creates a container that loads control types relative to the location in
	 * the system property 'mdm.typeLocation'.
	 */
	public TopLevelContainer() {
		this(System.getProperty(TYPE_LOCATION_PROPERTY, ""));
	}

	/**
	 * @param typeLocation package name, or name of a class whose nested classes
	 *                     are the control types. See
	 *                     {@link modulardm.resolver.LocationTypeResolver}.
	 */
	public TopLevelContainer(String typeLocation) {
		this(ControlTypeResolver.fromLocation(typeLocation));
	}

	public TopLevelContainer(ControlTypeResolver resolver) {
		this.typeCache = new TypeCache(resolver);
		becomeRoot(this);
	}

	public TypeCache getTypeCache() {
		return typeCache;
	}

	ControlFactory resolveType(String typeName) {
		return typeCache.resolve(typeName);
	}

	public ControlSchema getSchema(Class<? extends Control> clazz) {
		ControlSchema schema = schemaCache.get(clazz);
		if (schema == null) {
			schema = ControlSchema.scan(clazz);
			schemaCache.put(clazz, schema);
		}
		return schema;
	}
}
