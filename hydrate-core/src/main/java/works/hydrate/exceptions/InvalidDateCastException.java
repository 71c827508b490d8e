package works.hydrate.exceptions;

import works.hydrate.metadata.RawType;

/**
 * A date field received a value that the built-in date rule can't cast.
 */
public final class InvalidDateCastException extends ModelMappingException {
	private final RawType rawType;

	public InvalidDateCastException(Class<?> modelType, String fieldName, RawType rawType, String location) {
		super(modelType, fieldName, location, "Cannot cast " + rawType + " to a date");
		this.rawType = rawType;
	}

	public InvalidDateCastException(Class<?> modelType, String fieldName, RawType rawType, String location, String detail, Throwable cause) {
		super(modelType, fieldName, location, "Cannot cast " + rawType + " to a date: " + detail, cause);
		this.rawType = rawType;
	}

	public RawType rawType() {
		return rawType;
	}
}
