package works.plist.exceptions;

/**
 * An operation was applied to a node of the wrong kind,
 * like using a {@code key} where a value belongs.
 */
public final class PlistKindException extends PlistException {
	public PlistKindException(String message) {
		super(message);
	}
}
