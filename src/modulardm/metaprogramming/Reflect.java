package modulardm.metaprogramming;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

public class Reflect {

	public static Object readField(Object target, Field field) {
		try {
			field.setAccessible(true);
			return field.get(target);
		} catch (IllegalAccessException | IllegalArgumentException | SecurityException e) {
			throw new InvokeProblem("Cannot read field '" + field.getName() + "'", e);
		}
	}

	/**
	 * Returns the public no-argument constructor of <code>clazz</code>, or
	 * <code>null</code> if the class cannot be instantiated that way.
	 */
	public static <T> Constructor<T> findNoArgConstructor(Class<T> clazz) {
		if (Modifier.isAbstract(clazz.getModifiers()) || clazz.isInterface()) {
			return null;
		}
		if (clazz.getEnclosingClass() != null && !Modifier.isStatic(clazz.getModifiers())) {
			// Inner (non-static) classes need an enclosing instance
			return null;
		}
		try {
			final Constructor<T> ctor = clazz.getConstructor();
			return Modifier.isPublic(clazz.getModifiers()) ? ctor : null;
		} catch (NoSuchMethodException | SecurityException e) {
			return null;
		}
	}

	/**
	 * Invokes a no-argument constructor. Exceptions thrown by the constructor
	 * itself are rethrown unwrapped when unchecked.
	 */
	public static <T> T instantiate(Constructor<T> ctor) {
		try {
			return ctor.newInstance();
		} catch (InvocationTargetException e) {
			final Throwable target = e.getTargetException();
			if (target instanceof RuntimeException) {
				throw (RuntimeException) target;
			}
			if (target instanceof Error) {
				throw (Error) target;
			}
			throw new InvokeProblem(target);
		} catch (InstantiationException | IllegalAccessException | IllegalArgumentException e) {
			throw new InvokeProblem(e);
		}
	}
}
