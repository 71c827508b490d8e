package works.hydrate.exceptions;

/**
 * Raw data or declared metadata can't be mapped onto a model class.
 * <p>
 * These indicate programming or declaration errors to be fixed where
 * the model is declared, not transient conditions: the same input,
 * model and declarations will always fail the same way.
 */
public sealed abstract class ModelMappingException extends RuntimeException permits
	ArrayNotExpectedException,
	ExpectedArrayException,
	ExpectedObjectException,
	FieldAssignmentException,
	InvalidDateCastException,
	InvalidModelException,
	MissingDataTypeAnnotationException,
	MissingRequiredConverterException,
	ModelInstantiationException,
	SkipConverterConflictException,
	UnknownFieldException
{
	private final Class<?> modelType;
	private final String fieldName;
	private final String location;

	protected ModelMappingException(Class<?> modelType, String fieldName, String location, String message) {
		super(fullMessage(modelType, fieldName, location, message));
		this.modelType = modelType;
		this.fieldName = fieldName;
		this.location = location;
	}

	protected ModelMappingException(Class<?> modelType, String fieldName, String location, String message, Throwable cause) {
		super(fullMessage(modelType, fieldName, location, message), cause);
		this.modelType = modelType;
		this.fieldName = fieldName;
		this.location = location;
	}

	public Class<?> modelType() {
		return modelType;
	}

	/**
	 * @return the offending field, or null if the problem is with the model class as a whole
	 */
	public String fieldName() {
		return fieldName;
	}

	/**
	 * @return where in the input the offending value was found, like {@code $.products[0].product};
	 * or null if the problem was found before any input was read
	 */
	public String location() {
		return location;
	}

	private static String fullMessage(Class<?> modelType, String fieldName, String location, String message) {
		StringBuilder sb = new StringBuilder(modelType.getSimpleName());
		if (fieldName != null) {
			sb.append('.').append(fieldName);
		}
		sb.append(": ").append(message);
		if (location != null) {
			sb.append(" (at ").append(location).append(')');
		}
		return sb.toString();
	}
}
