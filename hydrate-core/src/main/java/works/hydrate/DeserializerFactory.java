package works.hydrate;

import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Binds a {@link Deserializer} to one model class, yielding a plain {@link Function}
 * that can be handed to a mapping step, like {@code Stream.map}
 * or {@code CompletableFuture.thenApply}.
 */
public final class DeserializerFactory {
	private final Deserializer deserializer;

	public DeserializerFactory(Deserializer deserializer) {
		this.deserializer = requireNonNull(deserializer);
	}

	public <T> Function<Object, T> makeDeserializer(Class<T> modelType) {
		requireNonNull(modelType);
		return raw -> deserializer.deserialize(modelType, raw);
	}

	public <T> Function<Object, List<T>> makeArrayDeserializer(Class<T> modelType) {
		requireNonNull(modelType);
		return raw -> deserializer.deserializeArray(modelType, raw);
	}
}
