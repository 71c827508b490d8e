package works.hydrate.exceptions;

import works.hydrate.metadata.RawType;

public final class ExpectedArrayException extends ModelMappingException {
	private final RawType actualType;

	/**
	 * @param fieldName null if the whole input was expected to be an array
	 */
	public ExpectedArrayException(Class<?> modelType, String fieldName, RawType actualType, String location) {
		super(modelType, fieldName, location,
			(fieldName == null ? "Object must be array" : "Expected array") + " but got " + actualType);
		this.actualType = actualType;
	}

	public RawType actualType() {
		return actualType;
	}
}
