package works.plist.exceptions;

/**
 * The input text is not a valid property list.
 */
public final class PlistSyntaxException extends PlistException {
	private final long offset;

	public PlistSyntaxException(String message, long offset) {
		super(message + " at offset " + offset);
		this.offset = offset;
	}

	public PlistSyntaxException(String message, long offset, Throwable cause) {
		super(message + " at offset " + offset, cause);
		this.offset = offset;
	}

	/**
	 * @return the number of input bytes consumed before the problem was detected
	 */
	public long offset() {
		return offset;
	}
}
