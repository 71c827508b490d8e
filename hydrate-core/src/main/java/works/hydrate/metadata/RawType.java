package works.hydrate.metadata;

import java.util.Collection;

/**
 * A coarse classification of a raw value, as found in a decoded record.
 * Used to select a {@link ValueConverter} and to decide whether a value
 * can be assigned to a field without reconstruction.
 */
public enum RawType {
	NULL,
	STRING,
	NUMBER,
	BOOLEAN,

	/**
	 * Any non-null value that is not one of the other kinds.
	 * Only {@link java.util.Map Map}s can be reconstructed into model instances.
	 */
	OBJECT,

	/**
	 * A {@link Collection} or a Java array.
	 */
	ARRAY;

	public static RawType of(Object value) {
		if (value == null) {
			return NULL;
		} else if (value instanceof CharSequence || value instanceof Character) {
			return STRING;
		} else if (value instanceof Number) {
			return NUMBER;
		} else if (value instanceof Boolean) {
			return BOOLEAN;
		} else if (value instanceof Collection<?> || value.getClass().isArray()) {
			return ARRAY;
		} else {
			return OBJECT;
		}
	}

	/**
	 * @return true if values of this kind need a declared data type to be reconstructed
	 */
	public boolean isStructured() {
		return this == OBJECT || this == ARRAY;
	}
}
