package modulardm.metaprogramming;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

public class TestPropertyKind {

	@Test
	public void testClassify() {
		assertEquals(PropertyKind.NUMBER, PropertyKind.classify(Integer.TYPE));
		assertEquals(PropertyKind.NUMBER, PropertyKind.classify(Double.class));
		assertEquals(PropertyKind.STRING, PropertyKind.classify(String.class));
		assertEquals(PropertyKind.BOOLEAN, PropertyKind.classify(Boolean.TYPE));
		assertEquals(PropertyKind.ARRAY, PropertyKind.classify(int[].class));
		assertEquals(PropertyKind.ARRAY, PropertyKind.classify(ArrayList.class));
		assertEquals(PropertyKind.ARRAY, PropertyKind.classify(List.class));
		assertNull(PropertyKind.classify(Object.class));
		assertNull(PropertyKind.classify(Map.class));
		assertNull(PropertyKind.classify(Character.TYPE));
	}

	@Test
	public void testNumbersFollowDeclaredType() {
		assertEquals(2, PropertyKind.NUMBER.coerce(2.7, Integer.TYPE));
		assertEquals(5, PropertyKind.NUMBER.coerce(" 5 ", Integer.TYPE));
		assertEquals(2.5, PropertyKind.NUMBER.coerce("2.5", Double.TYPE));
		assertEquals(3.0, PropertyKind.NUMBER.coerce(3, Double.class));
		assertEquals(7L, PropertyKind.NUMBER.coerce(7, Long.TYPE));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNumberRejectsText() {
		PropertyKind.NUMBER.coerce("many", Integer.TYPE);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNumberRejectsBoolean() {
		PropertyKind.NUMBER.coerce(true, Integer.TYPE);
	}

	@Test
	public void testStrings() {
		assertEquals("null", PropertyKind.STRING.coerce(null, String.class));
		assertEquals("null", PropertyKind.STRING.coerce(JSONObject.NULL, String.class));
		assertEquals("5", PropertyKind.STRING.coerce(5, String.class));
		assertEquals("true", PropertyKind.STRING.coerce(true, String.class));
	}

	@Test
	public void testBooleans() {
		assertEquals(true, PropertyKind.BOOLEAN.coerce("true", Boolean.TYPE));
		assertEquals(false, PropertyKind.BOOLEAN.coerce(false, Boolean.TYPE));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBooleanRejectsNumbers() {
		PropertyKind.BOOLEAN.coerce(1, Boolean.TYPE);
	}

	@Test
	public void testArrays() {
		assertEquals(Arrays.asList(1, null), PropertyKind.ARRAY.coerce(new JSONArray().put(1).put(JSONObject.NULL), List.class));
		assertEquals(Arrays.asList(1, 2), PropertyKind.ARRAY.coerce(new int[] { 1, 2 }, int[].class));
		assertEquals(Arrays.asList("a"), PropertyKind.ARRAY.coerce(Collections.singletonList("a"), List.class));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testArrayRejectsScalars() {
		PropertyKind.ARRAY.coerce("a,b", List.class);
	}

	@Test
	public void testIntegralRangeIsChecked() {
		assertEquals(Integer.MAX_VALUE, PropertyKind.NUMBER.coerce(2147483647L, Integer.TYPE));
		assertEquals(-7, PropertyKind.NUMBER.coerce(-7.9, Integer.TYPE));
		assertEquals(Long.MAX_VALUE, PropertyKind.NUMBER.coerce(new BigDecimal("9223372036854775807.5"), Long.TYPE));
		assertEquals((byte) -128, PropertyKind.NUMBER.coerce("-128", Byte.TYPE));

		final Object[][] outOfRange = { //
				{ 3000000000L, Integer.TYPE }, //
				{ 2147483648.0, Integer.class }, //
				{ new BigInteger("9223372036854775808"), Long.TYPE }, //
				{ 40000, Short.TYPE }, //
				{ "128", Byte.TYPE }, //
				{ 1e300, Float.TYPE }, //
		};
		for (Object[] row : outOfRange) {
			try {
				PropertyKind.NUMBER.coerce(row[0], (Class<?>) row[1]);
				throw new AssertionError("Expected " + row[0] + " to be out of range for " + row[1]);
			} catch (IllegalArgumentException e) {
				// Expected
			}
		}
	}

	@Test
	public void testNonFiniteNumbersAreRejected() {
		final Object[] nonFinite = { Double.NaN, Double.NEGATIVE_INFINITY, Float.POSITIVE_INFINITY, "1e400",
				new BigDecimal("-1e400") };
		for (Object val : nonFinite) {
			try {
				PropertyKind.NUMBER.coerce(val, Double.TYPE);
				throw new AssertionError("Expected " + val + " to be rejected");
			} catch (IllegalArgumentException e) {
				// Expected
			}
		}
	}

	@Test
	public void testNonFiniteInitialValueBecomesZero() {
		assertEquals(0.0, PropertyKind.NUMBER.normalizeInitial(Double.NaN, Double.TYPE));
		assertEquals(0.0f, PropertyKind.NUMBER.normalizeInitial(Float.POSITIVE_INFINITY, Float.TYPE));
	}

	@Test
	public void testMissingInitialValues() {
		assertEquals(0, PropertyKind.NUMBER.normalizeInitial(null, Integer.class));
		assertEquals(0.0, PropertyKind.NUMBER.normalizeInitial(null, Double.class));
		assertEquals("", PropertyKind.STRING.normalizeInitial(null, String.class));
		assertEquals(false, PropertyKind.BOOLEAN.normalizeInitial(null, Boolean.class));
		assertEquals(Collections.emptyList(), PropertyKind.ARRAY.normalizeInitial(null, List.class));
	}
}
