package works.plist.codec.text;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.util.Arrays;

import static java.nio.charset.CodingErrorAction.REPORT;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Holds the bytes of a token that may span several input chunks.
 * Grows geometrically, and keeps its capacity across {@link #reset()}
 * so that later tokens don't pay for growth again.
 */
final class ScratchBuffer {
	private byte[] bytes;
	private int length = 0;

	ScratchBuffer(int initialCapacity) {
		if (initialCapacity < 1) {
			throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
		}
		this.bytes = new byte[initialCapacity];
	}

	void append(int b) {
		if (length == bytes.length) {
			grow();
		}
		bytes[length++] = (byte) b;
	}

	/**
	 * Sets bits in the most recently appended byte.
	 */
	void orLast(int bits) {
		assert length > 0;
		bytes[length - 1] |= (byte) bits;
	}

	int length() {
		return length;
	}

	int capacity() {
		return bytes.length;
	}

	void reset() {
		length = 0;
	}

	byte[] toByteArray() {
		return Arrays.copyOf(bytes, length);
	}

	String toAsciiString() {
		return new String(bytes, 0, length, US_ASCII);
	}

	/**
	 * @throws CharacterCodingException if the contents are not well-formed UTF-8
	 */
	String decodeUtf8() throws CharacterCodingException {
		return UTF_8.newDecoder()
			.onMalformedInput(REPORT)
			.onUnmappableCharacter(REPORT)
			.decode(ByteBuffer.wrap(bytes, 0, length))
			.toString();
	}

	private void grow() {
		if (bytes.length >= MAX_CAPACITY) {
			throw new OutOfMemoryError("Token exceeds " + MAX_CAPACITY + " bytes");
		}
		int newCapacity = (int) Math.min(MAX_CAPACITY, 2L * bytes.length);
		bytes = Arrays.copyOf(bytes, newCapacity);
	}

	private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;
}
