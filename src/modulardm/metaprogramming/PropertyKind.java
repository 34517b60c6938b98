package modulardm.metaprogramming;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

import modulardm.util.JsonUtil;

/**
 * The value kinds a control field can have to become an observable property.
 */
public enum PropertyKind {

	NUMBER, STRING, BOOLEAN, ARRAY;

	/**
	 * Classifies a declared field type, or returns <code>null</code> if fields of
	 * that type are not observable.
	 */
	public static PropertyKind classify(Class<?> type) {
		if (type == Integer.TYPE || type == Integer.class //
				|| type == Long.TYPE || type == Long.class //
				|| type == Double.TYPE || type == Double.class //
				|| type == Float.TYPE || type == Float.class //
				|| type == Short.TYPE || type == Short.class //
				|| type == Byte.TYPE || type == Byte.class) {
			return NUMBER;
		}
		if (type == String.class) {
			return STRING;
		}
		if (type == Boolean.TYPE || type == Boolean.class) {
			return BOOLEAN;
		}
		if (type.isArray() || List.class.isAssignableFrom(type)) {
			return ARRAY;
		}
		return null;
	}

	/**
	 * Normalizes the value a field held right after construction. Missing values,
	 * and numbers that cannot be stored such as NaN, become the kind's empty value
	 * so that every property starts out defined.
	 */
	public Object normalizeInitial(Object fieldValue, Class<?> declaredType) {
		if (fieldValue == null) {
			switch (this) {
			case NUMBER:
				return convertNumber(0, declaredType);
			case STRING:
				return "";
			case BOOLEAN:
				return false;
			case ARRAY:
			default:
				return Collections.emptyList();
			}
		}
		try {
			return coerce(fieldValue, declaredType);
		} catch (IllegalArgumentException e) {
			System.out.println("Initial value " + describe(fieldValue) + " is not a valid " + name().toLowerCase()
					+ ", using the empty value instead");
			return normalizeInitial(null, declaredType);
		}
	}

	/**
	 * Coerces an incoming value to this kind.
	 *
	 * @throws IllegalArgumentException if the value has no sensible
	 *                                  representation in this kind
	 */
	public Object coerce(Object value, Class<?> declaredType) {
		if (value == JSONObject.NULL) {
			value = null;
		}
		switch (this) {
		case STRING:
			return String.valueOf(value);

		case NUMBER: {
			if (value instanceof Number) {
				return convertNumber((Number) value, declaredType);
			}
			if (value instanceof String) {
				try {
					return convertNumber(new BigDecimal(((String) value).trim()), declaredType);
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Not a number: '" + value + "'", e);
				}
			}
			throw new IllegalArgumentException("Expected a number, got " + describe(value));
		}

		case BOOLEAN: {
			if (value instanceof Boolean) {
				return value;
			}
			if ("true".equals(value)) {
				return true;
			}
			if ("false".equals(value)) {
				return false;
			}
			throw new IllegalArgumentException("Expected a boolean, got " + describe(value));
		}

		case ARRAY:
		default: {
			if (value instanceof JSONArray) {
				return JsonUtil.toList((JSONArray) value);
			}
			if (value instanceof List<?>) {
				final List<Object> copy = new ArrayList<>();
				for (Object item : (List<?>) value) {
					copy.add(JsonUtil.fromJsonValue(item));
				}
				return Collections.unmodifiableList(copy);
			}
			if (value != null && value.getClass().isArray()) {
				return JsonUtil.arrayToList(value);
			}
			throw new IllegalArgumentException("Expected an array, got " + describe(value));
		}
		}
	}

	/**
	 * Converts to the declared box type. Fractions are dropped for integral
	 * types, values outside the target range and non-finite values are
	 * rejected.
	 */
	private static Object convertNumber(Number num, Class<?> declaredType) {
		final BigDecimal exact = toBigDecimal(num);
		if (declaredType == Float.TYPE || declaredType == Float.class) {
			final float f = exact.floatValue();
			if (Float.isInfinite(f)) {
				throw new IllegalArgumentException("Out of range for float: " + num);
			}
			return f;
		}
		if (declaredType != Integer.TYPE && declaredType != Integer.class //
				&& declaredType != Long.TYPE && declaredType != Long.class //
				&& declaredType != Short.TYPE && declaredType != Short.class //
				&& declaredType != Byte.TYPE && declaredType != Byte.class) {
			final double d = exact.doubleValue();
			if (Double.isInfinite(d)) {
				throw new IllegalArgumentException("Out of range for double: " + num);
			}
			return d;
		}
		final BigDecimal whole = exact.setScale(0, RoundingMode.DOWN);
		try {
			if (declaredType == Integer.TYPE || declaredType == Integer.class) {
				return whole.intValueExact();
			}
			if (declaredType == Long.TYPE || declaredType == Long.class) {
				return whole.longValueExact();
			}
			if (declaredType == Short.TYPE || declaredType == Short.class) {
				return whole.shortValueExact();
			}
			return whole.byteValueExact();
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException(
					"Out of range for " + declaredType.getSimpleName() + ": " + num, e);
		}
	}

	private static BigDecimal toBigDecimal(Number num) {
		if (num instanceof BigDecimal) {
			return (BigDecimal) num;
		}
		if (num instanceof BigInteger) {
			return new BigDecimal((BigInteger) num);
		}
		if (num instanceof Integer || num instanceof Long || num instanceof Short || num instanceof Byte) {
			return BigDecimal.valueOf(num.longValue());
		}
		final double d = num.doubleValue();
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			throw new IllegalArgumentException("Not a finite number: " + num);
		}
		return BigDecimal.valueOf(d);
	}

	private static String describe(Object value) {
		return value == null ? "null" : (value.getClass().getSimpleName() + " '" + value + "'");
	}
}
