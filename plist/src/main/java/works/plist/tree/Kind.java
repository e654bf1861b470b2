package works.plist.tree;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toMap;

/**
 * The variants a {@link PlistNode} can take,
 * along with the textual names used for them by the dump format.
 */
public enum Kind {
	DICTIONARY("dict"),
	KEY("key"),
	ARRAY("array"),
	DATA("data"),
	DATE("date"),
	STRING("string"),
	INTEGER("integer"),
	REAL("real"),
	BOOLEAN("boolean"),

	/**
	 * Not the kind of any node. Returned by {@link #fromName} for names it doesn't recognize.
	 */
	UNKNOWN("unknown");

	private final String displayName;

	Kind(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}

	/**
	 * Case-insensitive lookup.
	 *
	 * @return the kind with the given {@link #displayName() name},
	 * or {@link #UNKNOWN} if {@code name} is null or not recognized
	 */
	public static Kind fromName(String name) {
		if (name == null) {
			return UNKNOWN;
		}
		return BY_NAME.getOrDefault(name.toLowerCase(Locale.ROOT), UNKNOWN);
	}

	public boolean isContainer() {
		return this == DICTIONARY || this == ARRAY;
	}

	private static final Map<String, Kind> BY_NAME = Stream.of(values())
		.filter(k -> k != UNKNOWN)
		.collect(toMap(Kind::displayName, Function.identity()));
}
