package works.hydrate.exceptions;

/**
 * A record has a key with no corresponding field in the model class.
 * Only thrown when unknown fields are configured to fail.
 *
 * @see works.hydrate.DeserializerSettings#unknownFieldMode()
 */
public final class UnknownFieldException extends ModelMappingException {
	public UnknownFieldException(Class<?> modelType, String fieldName, String location) {
		super(modelType, fieldName, location, "No such field");
	}
}
