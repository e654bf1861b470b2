package works.plist.exceptions;

/**
 * A dictionary was asked to merge in something that is not
 * a dictionary, a key, or an array of keys.
 */
public final class PlistMergeException extends PlistException {
	public PlistMergeException(String message) {
		super(message);
	}
}
