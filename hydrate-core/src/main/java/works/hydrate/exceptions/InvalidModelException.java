package works.hydrate.exceptions;

/**
 * A model class carries annotations that can't be turned into declarations.
 */
public final class InvalidModelException extends ModelMappingException {
	public InvalidModelException(Class<?> modelType, String fieldName, String message) {
		super(modelType, fieldName, null, message);
	}

	public InvalidModelException(Class<?> modelType, String fieldName, String message, Throwable cause) {
		super(modelType, fieldName, null, message, cause);
	}
}
