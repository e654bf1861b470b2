package works.plist.exceptions;

public final class PlistRangeException extends PlistException {
	private final int index;
	private final int size;

	public PlistRangeException(int index, int size) {
		super("Index " + index + " out of range for array of size " + size);
		this.index = index;
		this.size = size;
	}

	public int index() {
		return index;
	}

	public int size() {
		return size;
	}
}
