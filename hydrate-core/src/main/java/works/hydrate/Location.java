package works.hydrate;

/**
 * Where a value sits within the input, for error messages.
 * Cheap to extend; only rendered when something goes wrong.
 */
final class Location {
	static final Location ROOT = new Location(null, "$");

	private final Location parent;
	private final String segment;

	private Location(Location parent, String segment) {
		this.parent = parent;
		this.segment = segment;
	}

	Location field(String name) {
		return new Location(this, "." + name);
	}

	Location index(int index) {
		return new Location(this, "[" + index + "]");
	}

	@Override
	public String toString() {
		if (parent == null) {
			return segment;
		}
		StringBuilder sb = new StringBuilder();
		appendTo(sb);
		return sb.toString();
	}

	private void appendTo(StringBuilder sb) {
		if (parent != null) {
			parent.appendTo(sb);
		}
		sb.append(segment);
	}
}
