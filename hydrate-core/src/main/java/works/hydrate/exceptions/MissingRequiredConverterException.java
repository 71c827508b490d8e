package works.hydrate.exceptions;

import works.hydrate.metadata.RawType;
import works.hydrate.metadata.TargetType;

/**
 * A field's converter table has no entry for the type of value it received.
 */
public final class MissingRequiredConverterException extends ModelMappingException {
	private final TargetType targetType;
	private final RawType rawType;

	public MissingRequiredConverterException(Class<?> modelType, String fieldName, TargetType targetType, RawType rawType, String location) {
		super(modelType, fieldName, location, "No converter for " + rawType + " to target type " + targetType);
		this.targetType = targetType;
		this.rawType = rawType;
	}

	public TargetType targetType() {
		return targetType;
	}

	public RawType rawType() {
		return rawType;
	}
}
