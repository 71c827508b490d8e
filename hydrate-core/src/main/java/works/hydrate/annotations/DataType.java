package works.hydrate.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares what the annotated field's raw value is reconstructed into.
 * <p>
 * {@link java.time.Instant Instant} or {@link java.util.Date Date} selects the built-in date rule;
 * any other class is a model class to be built recursively.
 *
 * @see works.hydrate.metadata.ModelDeclaration.FieldDeclaration#dataType(Class, boolean)
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface DataType {
	Class<?> value();

	/**
	 * If true, the raw value must be an array, each element of which conforms to {@link #value}.
	 */
	boolean array() default false;
}
