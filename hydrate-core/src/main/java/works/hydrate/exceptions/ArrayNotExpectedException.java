package works.hydrate.exceptions;

public final class ArrayNotExpectedException extends ModelMappingException {
	/**
	 * @param fieldName null if the whole input was expected to be a single object
	 */
	public ArrayNotExpectedException(Class<?> modelType, String fieldName, String location) {
		super(modelType, fieldName, location, "Array not expected");
	}
}
