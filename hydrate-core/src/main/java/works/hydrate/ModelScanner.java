package works.hydrate;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.hydrate.annotations.Converter;
import works.hydrate.annotations.DataType;
import works.hydrate.annotations.Skip;
import works.hydrate.exceptions.InvalidModelException;
import works.hydrate.exceptions.SkipConverterConflictException;
import works.hydrate.metadata.ConverterTable;
import works.hydrate.metadata.FieldMetadata;
import works.hydrate.metadata.MetadataRegistry;
import works.hydrate.metadata.TargetType;
import works.hydrate.metadata.ValueConverter;

import static java.lang.reflect.Modifier.isStatic;

/**
 * Finds fields annotated with {@link DataType}, {@link Skip} and {@link Converter}
 * in the given model classes and declares them in a {@link MetadataRegistry}.
 * <p>
 * Follows superclasses and the model classes named by {@link DataType} annotations,
 * so scanning the root of a model graph declares the whole graph.
 */
public final class ModelScanner {
	private ModelScanner() { }

	/**
	 * @return every class that was scanned
	 * @throws InvalidModelException if an annotation can't be turned into a declaration
	 * @throws SkipConverterConflictException if a field is annotated with both {@link Skip} and {@link Converter};
	 * that field is left undeclared
	 */
	public static Set<Class<?>> scan(MetadataRegistry registry, Class<?>... modelTypes) {
		Deque<Class<?>> pending = new ArrayDeque<>(List.of(modelTypes));
		Set<Class<?>> scanned = new LinkedHashSet<>();
		int declarationCounter = 0;
		while (!pending.isEmpty()) {
			Class<?> modelType = pending.removeFirst();
			if (!scanned.add(modelType)) {
				continue;
			}
			Class<?> superclass = modelType.getSuperclass();
			if (superclass != null && superclass != Object.class) {
				pending.addLast(superclass);
			}
			for (Field field: modelType.getDeclaredFields()) {
				if (!isStatic(field.getModifiers()) && scanField(registry, modelType, field, pending)) {
					declarationCounter++;
				}
			}
		}
		if (declarationCounter == 0) {
			LOGGER.warn("Found no field declarations in {}; may be misconfigured", simpleNames(scanned));
		} else {
			LOGGER.info("Declared {} field{} in {}", declarationCounter, (declarationCounter >= 2) ? "s" : "", simpleNames(scanned));
		}
		return scanned;
	}

	/**
	 * @return true if {@code field} had any annotations to declare
	 */
	private static boolean scanField(MetadataRegistry registry, Class<?> modelType, Field field, Deque<Class<?>> pending) {
		DataType dataType = field.getAnnotation(DataType.class);
		boolean skip = field.isAnnotationPresent(Skip.class);
		Converter[] converters = field.getAnnotationsByType(Converter.class);
		if (dataType == null && !skip && converters.length == 0) {
			return false;
		}

		// Registered once, so a conflict leaves this field undeclared
		FieldMetadata metadata = registry.declared(modelType, field.getName()).orElse(FieldMetadata.NONE);
		if (dataType != null) {
			TargetType target;
			try {
				target = TargetType.of(dataType.value());
			} catch (IllegalArgumentException e) {
				throw new InvalidModelException(modelType, field.getName(), "Invalid @DataType: " + e.getMessage(), e);
			}
			metadata = metadata.withDataType(target, dataType.array());
			if (target instanceof TargetType.ModelType model) {
				pending.addLast(model.modelClass());
			}
		}
		if (skip) {
			metadata = metadata.withSkip();
		}
		if (converters.length != 0) {
			metadata = metadata.withConverters(converterTable(modelType, field, converters));
		}
		registry.register(modelType, field.getName(), metadata);
		return true;
	}

	private static ConverterTable converterTable(Class<?> modelType, Field field, Converter[] annotations) {
		ConverterTable.Builder builder = ConverterTable.builder();
		for (Converter annotation: annotations) {
			try {
				builder.on(annotation.from(), instantiate(modelType, field, annotation.using()));
			} catch (IllegalArgumentException e) {
				throw new InvalidModelException(modelType, field.getName(), e.getMessage(), e);
			}
		}
		return builder.build();
	}

	private static ValueConverter instantiate(Class<?> modelType, Field field, Class<? extends ValueConverter> converterClass) {
		try {
			Constructor<? extends ValueConverter> constructor = converterClass.getDeclaredConstructor();
			constructor.setAccessible(true);
			return constructor.newInstance();
		} catch (ReflectiveOperationException | RuntimeException e) {
			throw new InvalidModelException(modelType, field.getName(),
				"Unable to instantiate converter " + converterClass.getSimpleName() + "; it needs an accessible no-argument constructor", e);
		}
	}

	private static String simpleNames(Set<Class<?>> types) {
		return types.stream().map(Class::getSimpleName).toList().toString();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ModelScanner.class);
}
