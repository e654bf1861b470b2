package works.plist.exceptions;

/**
 * An internal invariant of a property tree has been violated.
 * <p>
 * This does not indicate a problem with the caller's input.
 * A correct implementation never throws this;
 * if it does, the affected subtree should be considered lost.
 */
public final class PlistCorruptionException extends PlistException {
	public PlistCorruptionException(String message) {
		super(message);
	}
}
