package works.hydrate;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.hydrate.exceptions.ArrayNotExpectedException;
import works.hydrate.exceptions.ExpectedArrayException;
import works.hydrate.exceptions.ExpectedObjectException;
import works.hydrate.exceptions.FieldAssignmentException;
import works.hydrate.exceptions.MissingDataTypeAnnotationException;
import works.hydrate.exceptions.ModelMappingException;
import works.hydrate.exceptions.UnknownFieldException;
import works.hydrate.metadata.FieldMetadata;
import works.hydrate.metadata.MetadataRegistry;
import works.hydrate.metadata.RawType;
import works.hydrate.metadata.TargetType;

import static java.util.Objects.requireNonNull;
import static works.hydrate.DeserializerSettings.UnknownFieldMode.FAIL;

/**
 * Builds model instances from raw records, guided by the {@link FieldMetadata}
 * in a {@link MetadataRegistry}.
 * <p>
 * A raw record is a {@link Map} from field names to raw values,
 * as produced by decoding JSON into plain Java objects.
 * Each key is handled independently, in no particular order:
 *
 * <ul>
 *     <li>
 *         a {@link FieldMetadata#skip skipped} field receives the raw value verbatim;
 *     </li>
 *     <li>
 *         an undeclared field receives primitive values as they are,
 *         and rejects objects and arrays;
 *     </li>
 *     <li>
 *         an {@link FieldMetadata#isArray array} field receives a {@link List}
 *         (or a Java array, if that's the field's type) of values each resolved as below,
 *         and rejects anything that isn't a sequence, including null;
 *     </li>
 *     <li>
 *         any other declared field receives the value produced by its converters,
 *         by the built-in date rule, or by recursively building an instance of its model class.
 *     </li>
 * </ul>
 *
 * Fields with no key in the record keep whatever value the model's constructor gave them.
 * <p>
 * Any mismatch between the data and the declarations throws a {@link ModelMappingException};
 * there are no partial results.
 * <p>
 * Constructing a {@code Deserializer} {@link MetadataRegistry#freeze freezes} its registry,
 * after which a single instance can be used by any number of threads at once.
 */
public final class Deserializer {
	private final MetadataRegistry registry;
	private final DeserializerSettings settings;
	private final ConverterResolver resolver;
	private final Map<Class<?>, ModelBinding> bindings = new ConcurrentHashMap<>();

	public Deserializer(MetadataRegistry registry) {
		this(registry, DeserializerSettings.DEFAULT);
	}

	public Deserializer(MetadataRegistry registry, DeserializerSettings settings) {
		this.registry = requireNonNull(registry);
		this.settings = requireNonNull(settings);
		this.resolver = new ConverterResolver(settings.dateZone());
		registry.freeze();
	}

	public MetadataRegistry registry() {
		return registry;
	}

	public DeserializerSettings settings() {
		return settings;
	}

	/**
	 * @param raw a record; or null, in which case the result is null
	 * @throws ArrayNotExpectedException if {@code raw} is a sequence
	 * @throws ExpectedObjectException if {@code raw} is not a record
	 * @throws ModelMappingException if any part of {@code raw} doesn't match the declarations
	 */
	public <T> T deserialize(Class<T> modelType, Object raw) {
		return modelType.cast(instantiate(modelType, raw, Location.ROOT));
	}

	/**
	 * @param raw a sequence of records
	 * @return a new list with one instance per element of {@code raw}, in the same order
	 * @throws ExpectedArrayException if {@code raw} is not a sequence
	 * @throws ModelMappingException if any element doesn't match the declarations
	 */
	public <T> List<T> deserializeArray(Class<T> modelType, Object raw) {
		RawType rawType = RawType.of(raw);
		if (rawType != RawType.ARRAY) {
			throw new ExpectedArrayException(modelType, null, rawType, Location.ROOT.toString());
		}
		List<?> elements = elementsOf(raw);
		List<T> result = new ArrayList<>(elements.size());
		for (int i = 0; i < elements.size(); i++) {
			result.add(modelType.cast(instantiate(modelType, elements.get(i), Location.ROOT.index(i))));
		}
		return result;
	}

	private Object instantiate(Class<?> modelType, Object raw, Location at) {
		if (raw == null) {
			return null;
		}
		if (!(raw instanceof Map<?, ?> record)) {
			RawType rawType = RawType.of(raw);
			if (rawType == RawType.ARRAY) {
				throw new ArrayNotExpectedException(modelType, null, at.toString());
			}
			throw new ExpectedObjectException(modelType, rawType, at.toString());
		}
		ModelBinding binding = bindings.computeIfAbsent(modelType, ModelBinding::of);
		Object instance = binding.newInstance();
		for (Map.Entry<?, ?> entry: record.entrySet()) {
			String key = String.valueOf(entry.getKey());
			populate(binding, instance, key, entry.getValue(), at.field(key));
		}
		return instance;
	}

	private void populate(ModelBinding binding, Object instance, String key, Object value, Location at) {
		Class<?> modelType = binding.modelType();
		Optional<FieldMetadata> declared = registry.lookup(modelType, key);
		if (declared.isEmpty()) {
			if (RawType.of(value).isStructured()) {
				throw new MissingDataTypeAnnotationException(modelType, key, at.toString());
			}
			assign(binding, instance, key, value, false, at);
			return;
		}

		FieldMetadata metadata = declared.get();
		if (metadata.skip()) {
			assign(binding, instance, key, value, true, at);
		} else if (metadata.isArray()) {
			assign(binding, instance, key, resolveArray(modelType, key, metadata, value, at), false, at);
		} else {
			assign(binding, instance, key, resolveValue(modelType, key, metadata, value, at), false, at);
		}
	}

	private List<Object> resolveArray(Class<?> owner, String key, FieldMetadata metadata, Object value, Location at) {
		RawType rawType = RawType.of(value);
		if (rawType != RawType.ARRAY) {
			throw new ExpectedArrayException(owner, key, rawType, at.toString());
		}
		List<?> elements = elementsOf(value);
		List<Object> result = new ArrayList<>(elements.size());
		for (int i = 0; i < elements.size(); i++) {
			result.add(resolveValue(owner, key, metadata, elements.get(i), at.index(i)));
		}
		return result;
	}

	private Object resolveValue(Class<?> owner, String key, FieldMetadata metadata, Object value, Location at) {
		RawType rawType = RawType.of(value);
		if (rawType == RawType.ARRAY) {
			throw new ArrayNotExpectedException(owner, key, at.toString());
		}
		TargetType target = metadata.target();
		if (metadata.converters().isPresent() || target instanceof TargetType.DateType) {
			return resolver.resolve(owner, key, target, metadata.converters(), value, at);
		} else if (target instanceof TargetType.ModelType model) {
			return instantiate(model.modelClass(), value, at);
		} else if (rawType.isStructured()) {
			throw new MissingDataTypeAnnotationException(owner, key, at.toString());
		} else {
			return value;
		}
	}

	private void assign(ModelBinding binding, Object instance, String key, Object value, boolean verbatim, Location at) {
		Class<?> modelType = binding.modelType();
		Field field = binding.field(key);
		if (field == null) {
			if (settings.unknownFieldMode() == FAIL) {
				throw new UnknownFieldException(modelType, key, at.toString());
			}
			LOGGER.trace("Ignoring {} at {}: {} has no such field", RawType.of(value), at, modelType.getSimpleName());
			return;
		}
		Object fieldValue = verbatim ? value : adapt(modelType, key, field.getType(), value, at);
		try {
			field.set(instance, fieldValue);
		} catch (IllegalArgumentException | IllegalAccessException e) {
			throw new FieldAssignmentException(modelType, key, at.toString(),
				"Cannot assign " + describe(fieldValue) + " to field of type " + field.getGenericType().getTypeName(), e);
		}
	}

	/**
	 * Bridges the gap between the values we produce and the Java types of the fields that hold them.
	 * Anything we don't know how to adapt is returned unchanged for {@link Field#set} to accept or reject.
	 */
	private Object adapt(Class<?> modelType, String key, Class<?> fieldType, Object value, Location at) {
		if (value instanceof Number number && settings.adaptNumbers() && NumberAdapter.isAdaptable(fieldType)) {
			try {
				return NumberAdapter.adapt(number, fieldType);
			} catch (ArithmeticException e) {
				throw new FieldAssignmentException(modelType, key, at.toString(),
					"Cannot represent " + number + " as " + fieldType.getSimpleName() + " without loss", e);
			}
		} else if (value instanceof Instant instant && fieldType == Date.class) {
			return Date.from(instant);
		} else if (value instanceof List<?> list && fieldType.isArray()) {
			Class<?> componentType = fieldType.getComponentType();
			Object array = Array.newInstance(componentType, list.size());
			for (int i = 0; i < list.size(); i++) {
				Object element = adapt(modelType, key, componentType, list.get(i), at.index(i));
				try {
					Array.set(array, i, element);
				} catch (IllegalArgumentException e) {
					throw new FieldAssignmentException(modelType, key, at.index(i).toString(),
						"Cannot store " + describe(element) + " in array of " + componentType.getSimpleName(), e);
				}
			}
			return array;
		} else {
			return value;
		}
	}

	private static List<?> elementsOf(Object sequence) {
		if (sequence instanceof List<?> list) {
			return list;
		} else if (sequence instanceof Collection<?> collection) {
			return new ArrayList<>(collection);
		} else {
			int length = Array.getLength(sequence);
			List<Object> result = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				result.add(Array.get(sequence, i));
			}
			return result;
		}
	}

	private static String describe(Object value) {
		return (value == null) ? "null" : value.getClass().getSimpleName();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Deserializer.class);
}
