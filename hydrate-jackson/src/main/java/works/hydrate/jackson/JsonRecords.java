package works.hydrate.jackson;

import java.io.InputStream;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectReader;
import tools.jackson.databind.json.JsonMapper;
import works.hydrate.DeserializerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Decodes JSON into the raw values accepted by {@link works.hydrate.Deserializer}:
 * {@link java.util.Map}s for objects, {@link java.util.List}s for arrays,
 * and boxed scalars or null for everything else.
 * <p>
 * All methods throw Jackson's unchecked {@link JacksonException} on malformed input.
 */
public final class JsonRecords {
	private final ObjectMapper mapper;
	private final ObjectReader reader;

	public JsonRecords() {
		this(JsonMapper.builder().build());
	}

	/**
	 * @param mapper governs how JSON numbers become Java numbers.
	 * Mappers with custom bindings for {@link Object} will produce raw values
	 * the deserializer doesn't understand.
	 */
	public JsonRecords(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
		this.reader = mapper.readerFor(Object.class);
	}

	public Object readRaw(String json) {
		return reader.readValue(json);
	}

	/**
	 * Does not close {@code json}.
	 */
	public Object readRaw(InputStream json) {
		return reader.readValue(json);
	}

	public Object toRaw(JsonNode node) {
		return mapper.treeToValue(node, Object.class);
	}

	/**
	 * @return a function that decodes a JSON body and deserializes it as a {@code modelType}
	 */
	public <T> Function<String, T> bodyMapper(DeserializerFactory factory, Class<T> modelType) {
		Function<Object, T> deserializer = factory.makeDeserializer(modelType);
		return body -> {
			LOGGER.trace("Mapping {} body of {} chars", modelType.getSimpleName(), body.length());
			return deserializer.apply(readRaw(body));
		};
	}

	/**
	 * @return a function that decodes a JSON array body and deserializes each element as a {@code modelType}
	 */
	public <T> Function<String, List<T>> arrayBodyMapper(DeserializerFactory factory, Class<T> modelType) {
		Function<Object, List<T>> deserializer = factory.makeArrayDeserializer(modelType);
		return body -> {
			LOGGER.trace("Mapping {} array body of {} chars", modelType.getSimpleName(), body.length());
			return deserializer.apply(readRaw(body));
		};
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonRecords.class);
}
