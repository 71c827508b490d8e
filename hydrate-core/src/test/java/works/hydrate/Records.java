package works.hydrate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds raw records the way a JSON decoder would, nulls included.
 */
public final class Records {
	private Records() { }

	public static Map<String, Object> record(Object... keysAndValues) {
		if (keysAndValues.length % 2 != 0) {
			throw new IllegalArgumentException("Expected key/value pairs");
		}
		Map<String, Object> result = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			result.put((String) keysAndValues[i], keysAndValues[i + 1]);
		}
		return result;
	}

	public static List<Object> array(Object... elements) {
		return new ArrayList<>(Arrays.asList(elements));
	}
}
