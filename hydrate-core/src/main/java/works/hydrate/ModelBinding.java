package works.hydrate;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.hydrate.exceptions.ModelInstantiationException;

import static java.lang.reflect.Modifier.isAbstract;
import static java.lang.reflect.Modifier.isStatic;

/**
 * The reflective handles needed to build instances of one model class:
 * its no-argument constructor and its instance fields by name.
 * Fields declared in subclasses hide same-named fields of superclasses.
 */
final class ModelBinding {
	private final Class<?> modelType;
	private final Constructor<?> constructor;
	private final Map<String, Field> fields;

	private ModelBinding(Class<?> modelType, Constructor<?> constructor, Map<String, Field> fields) {
		this.modelType = modelType;
		this.constructor = constructor;
		this.fields = fields;
	}

	/**
	 * @throws ModelInstantiationException if {@code modelType} can't be instantiated
	 * or its members can't be made accessible
	 */
	static ModelBinding of(Class<?> modelType) {
		if (modelType.isInterface() || isAbstract(modelType.getModifiers())) {
			throw new ModelInstantiationException(modelType, "Model class cannot be abstract");
		}
		if (modelType.isMemberClass() && !isStatic(modelType.getModifiers())) {
			throw new ModelInstantiationException(modelType, "Model class nested in another class must be static");
		}
		try {
			Constructor<?> constructor = modelType.getDeclaredConstructor();
			constructor.setAccessible(true);

			Map<String, Field> fields = new LinkedHashMap<>();
			for (Class<?> c = modelType; c != null && c != Object.class; c = c.getSuperclass()) {
				for (Field field: c.getDeclaredFields()) {
					if (isStatic(field.getModifiers()) || field.isSynthetic() || fields.containsKey(field.getName())) {
						continue;
					}
					field.setAccessible(true);
					fields.put(field.getName(), field);
				}
			}
			LOGGER.trace("Bound {} with fields {}", modelType.getSimpleName(), fields.keySet());
			return new ModelBinding(modelType, constructor, Collections.unmodifiableMap(fields));
		} catch (NoSuchMethodException e) {
			throw new ModelInstantiationException(modelType, "Model class must have a no-argument constructor", e);
		} catch (InaccessibleObjectException | SecurityException e) {
			throw new ModelInstantiationException(modelType, "Model class is not accessible for reflection", e);
		}
	}

	Class<?> modelType() {
		return modelType;
	}

	/**
	 * @return the field with the given name, or null if there is none
	 */
	Field field(String name) {
		return fields.get(name);
	}

	Object newInstance() {
		try {
			return constructor.newInstance();
		} catch (InvocationTargetException e) {
			throw new ModelInstantiationException(modelType, "Constructor threw " + e.getCause(), e.getCause());
		} catch (InstantiationException | IllegalAccessException e) {
			throw new ModelInstantiationException(modelType, "Unable to call constructor", e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ModelBinding.class);
}
