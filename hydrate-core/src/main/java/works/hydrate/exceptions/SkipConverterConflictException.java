package works.hydrate.exceptions;

/**
 * A field was declared both skipped and converted.
 * Thrown when the second of the two declarations is made.
 */
public final class SkipConverterConflictException extends ModelMappingException {
	public SkipConverterConflictException(Class<?> modelType, String fieldName) {
		super(modelType, fieldName, null, "Field cannot declare both skip and converters");
	}
}
