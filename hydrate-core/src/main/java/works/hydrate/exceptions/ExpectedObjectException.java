package works.hydrate.exceptions;

import works.hydrate.metadata.RawType;

/**
 * A model instance was to be built from a value that isn't a record.
 */
public final class ExpectedObjectException extends ModelMappingException {
	private final RawType actualType;

	public ExpectedObjectException(Class<?> modelType, RawType actualType, String location) {
		super(modelType, null, location, "Expected a record but got " + actualType);
		this.actualType = actualType;
	}

	public RawType actualType() {
		return actualType;
	}
}
