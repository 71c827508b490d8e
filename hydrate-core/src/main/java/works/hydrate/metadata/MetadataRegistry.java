package works.hydrate.metadata;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.hydrate.exceptions.SkipConverterConflictException;

import static java.util.Objects.requireNonNull;

/**
 * Holds the {@link FieldMetadata} for every declared field of every model class,
 * keyed by (class, field name).
 * <p>
 * All writes must precede all reads. Once {@link #freeze frozen}, the registry
 * can be considered immutable, and can be shared freely between threads.
 * Constructing a {@link works.hydrate.Deserializer Deserializer} freezes its registry.
 */
public final class MetadataRegistry {
	private final Map<Class<?>, Map<String, FieldMetadata>> entries = new ConcurrentHashMap<>();
	private final AtomicBoolean isFrozen = new AtomicBoolean(false);

	/**
	 * Records {@code metadata} for the given field, replacing any earlier declaration.
	 *
	 * @return the metadata previously declared for this field, or null if there was none
	 * @throws SkipConverterConflictException if {@code metadata} both skips and converts
	 * @throws IllegalStateException if this registry is frozen
	 */
	public FieldMetadata register(Class<?> modelType, String fieldName, FieldMetadata metadata) {
		requireNonNull(modelType);
		requireNonNull(fieldName);
		requireNonNull(metadata);
		if (isFrozen.get()) {
			throw new IllegalStateException("MetadataRegistry is frozen; cannot declare " + modelType.getSimpleName() + "." + fieldName);
		}
		if (metadata.hasSkipConverterConflict()) {
			throw new SkipConverterConflictException(modelType, fieldName);
		}
		FieldMetadata previous = entries
			.computeIfAbsent(modelType, t -> new ConcurrentHashMap<>())
			.put(fieldName, metadata);
		if (previous == null) {
			LOGGER.debug("Declared {}.{}: {}", modelType.getSimpleName(), fieldName, metadata);
		} else {
			LOGGER.debug("Redeclared {}.{}: {} replaces {}", modelType.getSimpleName(), fieldName, metadata, previous);
		}
		return previous;
	}

	/**
	 * Finds the metadata governing the given field, searching superclasses
	 * if {@code modelType} doesn't declare it.
	 */
	public Optional<FieldMetadata> lookup(Class<?> modelType, String fieldName) {
		for (Class<?> c = modelType; c != null; c = c.getSuperclass()) {
			Map<String, FieldMetadata> fields = entries.get(c);
			if (fields != null) {
				FieldMetadata result = fields.get(fieldName);
				if (result != null) {
					return Optional.of(result);
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Like {@link #lookup} but ignores superclasses.
	 */
	public Optional<FieldMetadata> declared(Class<?> modelType, String fieldName) {
		return Optional.ofNullable(entries.getOrDefault(modelType, Map.of()).get(fieldName));
	}

	public Set<String> declaredFields(Class<?> modelType) {
		return Set.copyOf(entries.getOrDefault(modelType, Map.of()).keySet());
	}

	public Set<Class<?>> modelTypes() {
		return Set.copyOf(entries.keySet());
	}

	/**
	 * Begins a series of declarations for the fields of {@code modelType}.
	 */
	public ModelDeclaration declare(Class<?> modelType) {
		return new ModelDeclaration(this, requireNonNull(modelType));
	}

	public void freeze() {
		if (isFrozen.compareAndSet(false, true)) {
			LOGGER.debug("Froze registry with {} model type{}", entries.size(), entries.size() == 1 ? "" : "s");
		}
	}

	public boolean isFrozen() {
		return isFrozen.get();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MetadataRegistry.class);
}
