package works.plist.exceptions;

/**
 * The requested dictionary entry does not exist,
 * or a decoder was asked for a result it does not have.
 */
public final class PlistNotFoundException extends PlistException {
	public PlistNotFoundException(String message) {
		super(message);
	}
}
