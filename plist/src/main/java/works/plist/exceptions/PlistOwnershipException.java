package works.plist.exceptions;

/**
 * A node cannot be attached because it already has a parent,
 * or because attaching it would make it its own ancestor.
 * Neither tree is changed.
 */
public final class PlistOwnershipException extends PlistException {
	public PlistOwnershipException(String message) {
		super(message);
	}
}
