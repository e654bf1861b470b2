package works.plist.exceptions;

/**
 * Base class of every error reported by the property tree and its codecs.
 * <p>
 * Missing required arguments are reported with {@link NullPointerException},
 * and use of a node that has already been freed with {@link IllegalStateException};
 * everything specific to property trees is one of these subclasses.
 */
public sealed abstract class PlistException extends RuntimeException permits
	PlistCorruptionException,
	PlistKindException,
	PlistMergeException,
	PlistNotFoundException,
	PlistOwnershipException,
	PlistRangeException,
	PlistSyntaxException
{
	protected PlistException(String message) {
		super(message);
	}

	protected PlistException(String message, Throwable cause) {
		super(message, cause);
	}
}
