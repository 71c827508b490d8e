package works.hydrate.metadata;

/**
 * Converts one raw value to a value assignable to a declared field.
 * <p>
 * Implementations used with {@link works.hydrate.annotations.Converter @Converter}
 * need a no-argument constructor.
 */
@FunctionalInterface
public interface ValueConverter {
	Object convert(Object raw);
}
