package works.hydrate.metadata;

import java.time.Instant;
import java.util.Date;

import static java.util.Objects.requireNonNull;

/**
 * What a field's raw value is to be reconstructed into.
 * <p>
 * This is a closed set: nothing at all, the built-in date type,
 * or an instance of some model class.
 */
public sealed interface TargetType permits TargetType.Absent, TargetType.DateType, TargetType.ModelType {
	TargetType ABSENT = new Absent();
	TargetType DATE = new DateType();

	/**
	 * {@link Instant} and {@link Date} select {@link #DATE};
	 * any other class is taken to be a model class.
	 *
	 * @throws IllegalArgumentException if {@code type} can't be instantiated from a record
	 */
	static TargetType of(Class<?> type) {
		if (type == Instant.class || type == Date.class) {
			return DATE;
		} else if (type.isPrimitive() || type.isArray() || type.isInterface() || type.isEnum()) {
			throw new IllegalArgumentException("Not a model class: " + type.getTypeName());
		} else {
			return new ModelType(type);
		}
	}

	/**
	 * Primitive value; no reconstruction needed.
	 */
	record Absent() implements TargetType {
		@Override
		public String toString() {
			return "absent";
		}
	}

	/**
	 * The built-in date type, materialized as an {@link Instant}.
	 */
	record DateType() implements TargetType {
		@Override
		public String toString() {
			return "date";
		}
	}

	record ModelType(Class<?> modelClass) implements TargetType {
		public ModelType {
			requireNonNull(modelClass);
		}

		@Override
		public String toString() {
			return modelClass.getSimpleName();
		}
	}
}
