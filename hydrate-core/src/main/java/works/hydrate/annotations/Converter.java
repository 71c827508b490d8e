package works.hydrate.annotations;

import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import works.hydrate.metadata.RawType;
import works.hydrate.metadata.ValueConverter;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Converts raw values of type {@link #from} using a new instance of {@link #using}.
 * <p>
 * All the {@code @Converter}s on a field form its converter table,
 * which must cover every raw type the field can receive.
 */
@Retention(RUNTIME)
@Target(FIELD)
@Repeatable(Converters.class)
public @interface Converter {
	RawType from();
	Class<? extends ValueConverter> using();
}
