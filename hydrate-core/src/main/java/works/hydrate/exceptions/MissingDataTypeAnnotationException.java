package works.hydrate.exceptions;

/**
 * A field received an object or array, but nothing declares what to reconstruct it into.
 */
public final class MissingDataTypeAnnotationException extends ModelMappingException {
	public MissingDataTypeAnnotationException(Class<?> modelType, String fieldName, String location) {
		super(modelType, fieldName, location, "Missing data type declaration for structured value");
	}
}
