package works.hydrate;

import java.time.ZoneId;
import java.time.ZoneOffset;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class DeserializerSettings {
	public static final DeserializerSettings DEFAULT = DeserializerSettings.builder().build();

	/**
	 * What to do with a record key that names no field of the model class.
	 * Keys holding objects or arrays with no declared data type fail regardless.
	 */
	@Default UnknownFieldMode unknownFieldMode = UnknownFieldMode.IGNORE;

	/**
	 * When true, a number is converted to the numeric type of the field it's assigned to,
	 * provided no information is lost: {@code 2L} can go into an {@code int} field,
	 * but {@code 2.5} cannot.
	 * When false, numbers must already have the field's type (or be widenable to it).
	 */
	@Default boolean adaptNumbers = true;

	/**
	 * The zone for date strings with no offset, like {@code 2020-01-01}
	 * or {@code 2020-01-01T12:00:00}.
	 */
	@Default ZoneId dateZone = ZoneOffset.UTC;

	public enum UnknownFieldMode {
		/**
		 * The value is dropped.
		 */
		IGNORE,

		/**
		 * Throw {@link works.hydrate.exceptions.UnknownFieldException}.
		 */
		FAIL,
	}
}
