package works.hydrate.exceptions;

public final class FieldAssignmentException extends ModelMappingException {
	public FieldAssignmentException(Class<?> modelType, String fieldName, String location, String message, Throwable cause) {
		super(modelType, fieldName, location, message, cause);
	}
}
