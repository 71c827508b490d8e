package works.hydrate.exceptions;

public final class ModelInstantiationException extends ModelMappingException {
	public ModelInstantiationException(Class<?> modelType, String message) {
		super(modelType, null, null, message);
	}

	public ModelInstantiationException(Class<?> modelType, String message, Throwable cause) {
		super(modelType, null, null, message, cause);
	}
}
