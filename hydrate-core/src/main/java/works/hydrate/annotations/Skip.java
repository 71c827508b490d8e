package works.hydrate.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The annotated field receives its raw value verbatim.
 * Cannot be combined with {@link Converter}.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Skip {
}
