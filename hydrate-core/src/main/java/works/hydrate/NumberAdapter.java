package works.hydrate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Converts decoded numbers to the numeric type of a field, refusing lossy conversions
 * of integral values. Decoders choose {@code Integer}, {@code Long}, {@code Double}
 * and so on by magnitude, not by what the model wants.
 */
final class NumberAdapter {
	private NumberAdapter() { }

	static final Map<Class<?>, Class<?>> BOXES = Map.of(
		byte.class, Byte.class,
		short.class, Short.class,
		int.class, Integer.class,
		long.class, Long.class,
		float.class, Float.class,
		double.class, Double.class,
		boolean.class, Boolean.class,
		char.class, Character.class
	);

	static Class<?> boxed(Class<?> type) {
		return BOXES.getOrDefault(type, type);
	}

	static boolean isAdaptable(Class<?> type) {
		Class<?> b = boxed(type);
		return b == Byte.class || b == Short.class || b == Integer.class || b == Long.class
			|| b == Float.class || b == Double.class
			|| b == BigInteger.class || b == BigDecimal.class;
	}

	/**
	 * @param target a type for which {@link #isAdaptable} returns true
	 * @throws ArithmeticException if {@code value} can't be represented as a {@code target}
	 */
	static Number adapt(Number value, Class<?> target) {
		Class<?> b = boxed(target);
		if (b.isInstance(value)) {
			return value;
		} else if (b == Double.class) {
			return value.doubleValue();
		} else if (b == Float.class) {
			return value.floatValue();
		}
		BigDecimal exact = exactly(value);
		if (b == BigDecimal.class) {
			return exact;
		} else if (b == BigInteger.class) {
			return exact.toBigIntegerExact();
		} else if (b == Long.class) {
			return exact.longValueExact();
		} else if (b == Integer.class) {
			return exact.intValueExact();
		} else if (b == Short.class) {
			return exact.shortValueExact();
		} else if (b == Byte.class) {
			return exact.byteValueExact();
		} else {
			throw new IllegalArgumentException("Not a numeric type: " + target);
		}
	}

	private static BigDecimal exactly(Number value) {
		if (value instanceof BigDecimal bd) {
			return bd;
		} else if (value instanceof BigInteger bi) {
			return new BigDecimal(bi);
		} else if (value instanceof Double || value instanceof Float) {
			double d = value.doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				throw new ArithmeticException("Not a finite number: " + value);
			}
			return new BigDecimal(value.toString());
		} else {
			return BigDecimal.valueOf(value.longValue());
		}
	}
}
