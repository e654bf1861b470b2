package works.plist.codec.text;

import java.util.stream.LongStream;

/**
 * Character classes and escapes of the property list text format.
 */
final class TextSyntax {
	private TextSyntax() {}

	private static final long BLANK_CHARS = LongStream
		.of(' ', '\t', '\n', '\r', 0x0B, '\f')
		.map(n -> 1L << n)
		.sum();

	static boolean isBlank(int b) {
		return b >= 0 && b < 64 && (BLANK_CHARS & (1L << b)) != 0;
	}

	static boolean isDigit(int b) {
		return b >= '0' && b <= '9';
	}

	static boolean isNumberLeadingChar(int b) {
		return isDigit(b) || b == '-';
	}

	/**
	 * Characters that turn an integer into a real.
	 */
	static boolean isRealMarker(int b) {
		return b == '.' || b == 'e' || b == 'E';
	}

	static boolean isRealChar(int b) {
		return isDigit(b) || isRealMarker(b) || b == '+' || b == '-';
	}

	/**
	 * @param b the character following a backslash
	 * @return the character it stands for, or -1 if it is not a valid escape
	 */
	static int decodeEscapeChar(int b) {
		return switch (b) {
			case '"' -> '"';
			case '\\' -> '\\';
			case '/' -> '/';
			case 'b' -> '\b';
			case 'f' -> '\f';
			case 'n' -> '\n';
			case 'r' -> '\r';
			case 't' -> '\t';
			default -> -1;
		};
	}

	/**
	 * @return the character to follow a backslash for {@code c}, or 0 if {@code c} needs no escaping
	 */
	static char escapeFor(char c) {
		return switch (c) {
			case '"' -> '"';
			case '\\' -> '\\';
			case '\b' -> 'b';
			case '\f' -> 'f';
			case '\n' -> 'n';
			case '\r' -> 'r';
			case '\t' -> 't';
			default -> 0;
		};
	}

	/**
	 * @return the value of the hex digit {@code b}, or -1 if it isn't one
	 */
	static int hexValue(int b) {
		if (b >= '0' && b <= '9') {
			return b - '0';
		} else if (b >= 'a' && b <= 'f') {
			return b - 'a' + 10;
		} else if (b >= 'A' && b <= 'F') {
			return b - 'A' + 10;
		} else {
			return -1;
		}
	}

	static char hexDigit(int nibble) {
		return HEX_DIGITS.charAt(nibble & 0xF);
	}

	private static final String HEX_DIGITS = "0123456789abcdef";
}
