package works.plist.codec.text;

import java.nio.charset.CharacterCodingException;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.plist.exceptions.PlistNotFoundException;
import works.plist.exceptions.PlistSyntaxException;
import works.plist.tree.ArrayNode;
import works.plist.tree.ContainerNode;
import works.plist.tree.DictionaryNode;
import works.plist.tree.Kind;
import works.plist.tree.NodeFactory;
import works.plist.tree.PlistNode;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.checkFromIndexSize;
import static java.util.Objects.requireNonNull;
import static works.plist.codec.text.TextSyntax.decodeEscapeChar;
import static works.plist.codec.text.TextSyntax.hexValue;
import static works.plist.codec.text.TextSyntax.isBlank;
import static works.plist.codec.text.TextSyntax.isDigit;
import static works.plist.codec.text.TextSyntax.isNumberLeadingChar;
import static works.plist.codec.text.TextSyntax.isRealChar;
import static works.plist.codec.text.TextSyntax.isRealMarker;

/**
 * Resumable decoder for the property list text format.
 * <p>
 * Input arrives in chunks of arbitrary size via {@link #parse}; each byte is examined exactly once,
 * and any token that crosses a chunk boundary is accumulated in a scratch buffer
 * that survives between calls. Containers are attached to the tree as soon as they open,
 * so the partial tree is always a well-formed tree owned by this decoder.
 * <p>
 * Typical use:
 * <pre>
 * try (PlistTextDecoder decoder = new PlistTextDecoder()) {
 *     for (byte[] chunk: chunks) {
 *         decoder.parse(chunk);
 *     }
 *     decoder.finish();
 *     return decoder.result();
 * }
 * </pre>
 * Any malformed input throws {@link PlistSyntaxException} and latches the decoder
 * into an error state; {@link #result()} then discards the partial tree and resets the decoder.
 * <p>
 * Not thread-safe.
 */
public final class PlistTextDecoder implements AutoCloseable {
	public enum Status {
		/**
		 * The document is not yet complete.
		 */
		NEED_MORE,

		/**
		 * A complete document has been decoded and is available from {@link #result()}.
		 */
		DONE
	}

	enum State { SCAN, STRING, TRUE, FALSE, DATA, DATE, NUMBER, DOUBLE, DONE, ERROR }

	/**
	 * What {@link State#SCAN} will accept next, besides whitespace.
	 */
	private enum Expect {
		VALUE,
		ELEMENT_OR_END,
		SEPARATOR_OR_END,
		KEY_OR_END,
		KEY_SEPARATOR,
		ENTRY_SEPARATOR,
	}

	public record Settings(
		int initialScratchCapacity,
		int maxDepth
	) {
		public static final Settings DEFAULT = new Settings(64, Integer.MAX_VALUE);

		public Settings {
			if (initialScratchCapacity < 1) {
				throw new IllegalArgumentException("initialScratchCapacity must be positive: " + initialScratchCapacity);
			}
			if (maxDepth < 0) {
				throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
			}
		}

		public Settings withInitialScratchCapacity(int initialScratchCapacity) {
			return new Settings(initialScratchCapacity, maxDepth);
		}

		public Settings withMaxDepth(int maxDepth) {
			return new Settings(initialScratchCapacity, maxDepth);
		}
	}

	private final NodeFactory factory;
	private final Settings settings;
	private final ScratchBuffer scratch;

	private State state;
	private Expect expect;

	/**
	 * Number of containers opened and not yet closed.
	 */
	private int depth;

	/**
	 * The innermost open container, or null if none is open.
	 */
	private ContainerNode<?> current;

	/**
	 * Name of the dictionary entry whose value is being decoded.
	 */
	private String pendingKey;

	/**
	 * The outermost value. Owned by this decoder until handed out by {@link #result()}.
	 */
	private PlistNode root;

	private boolean stringIsKey;
	private boolean escape;
	private int literalIndex;

	/**
	 * Hex digits seen so far in the current data token.
	 * When odd, the last byte in {@link #scratch} is waiting for its low nibble.
	 */
	private long nibbles;

	/**
	 * Bytes consumed by previous calls to {@link #parse}.
	 */
	private long consumed;

	/**
	 * Offset in the input of index zero of the current chunk array.
	 */
	private long chunkBase;

	public PlistTextDecoder() {
		this(NodeFactory.DEFAULT, Settings.DEFAULT);
	}

	public PlistTextDecoder(NodeFactory factory) {
		this(factory, Settings.DEFAULT);
	}

	public PlistTextDecoder(NodeFactory factory, Settings settings) {
		this.factory = requireNonNull(factory, "factory");
		this.settings = requireNonNull(settings, "settings");
		this.scratch = new ScratchBuffer(settings.initialScratchCapacity());
		reset();
	}

	/**
	 * Decodes a complete document held in memory.
	 *
	 * @throws PlistSyntaxException if {@code text} is not exactly one well-formed value
	 */
	public static PlistNode decode(CharSequence text) {
		return decode(text.toString().getBytes(UTF_8));
	}

	/**
	 * @see #decode(CharSequence)
	 */
	public static PlistNode decode(byte[] utf8) {
		try (PlistTextDecoder decoder = new PlistTextDecoder()) {
			decoder.parse(utf8);
			decoder.finish();
			return decoder.result();
		}
	}

	public Settings settings() {
		return settings;
	}

	State state() {
		return state;
	}

	public Status parse(byte[] chunk) {
		return parse(chunk, 0, chunk.length);
	}

	/**
	 * Feeds the next chunk of UTF-8 input.
	 * A NUL byte ends the chunk: the bytes after it are ignored.
	 *
	 * @return {@link Status#DONE} once the outermost value is complete
	 * @throws PlistSyntaxException if the input is malformed, or the decoder is already in an error state
	 */
	public Status parse(byte[] chunk, int offset, int length) {
		requireNonNull(chunk, "chunk");
		checkFromIndexSize(offset, length, chunk.length);
		requireNoError();
		chunkBase = consumed - offset;
		int end = offset + length;
		try {
			int pos = offset;
			while (pos < end) {
				pos = switch (state) {
					case SCAN -> scan(chunk, pos, end);
					case STRING -> string(chunk, pos, end);
					case TRUE -> literal("true", chunk, pos, end);
					case FALSE -> literal("false", chunk, pos, end);
					case DATA -> data(chunk, pos, end);
					case DATE -> date(chunk, pos, end);
					case NUMBER, DOUBLE -> number(chunk, pos, end);
					case DONE -> trailing(chunk, pos, end);
					case ERROR -> throw new IllegalStateException("Unexpected error state");
				};
			}
		} catch (RuntimeException | OutOfMemoryError e) {
			latchError(e);
			throw e;
		}
		consumed += length;
		return (state == State.DONE) ? Status.DONE : Status.NEED_MORE;
	}

	/**
	 * Feeds the next chunk of input, encoded as UTF-8.
	 */
	public Status parse(CharSequence chunk) {
		requireNonNull(chunk, "chunk");
		return parse(chunk.toString().getBytes(UTF_8));
	}

	/**
	 * Signals the end of the input, completing a number that was still accepting digits.
	 *
	 * @return {@link Status#DONE}
	 * @throws PlistSyntaxException if the document is incomplete
	 */
	public Status finish() {
		requireNoError();
		try {
			if (state == State.NUMBER || state == State.DOUBLE) {
				completeNumber(consumed);
			}
			if (state != State.DONE) {
				throw new PlistSyntaxException("Unexpected end of input", consumed);
			}
		} catch (RuntimeException | OutOfMemoryError e) {
			latchError(e);
			throw e;
		}
		return Status.DONE;
	}

	/**
	 * Hands the decoded tree to the caller and resets this decoder for a fresh document.
	 * If the document is not complete, the partial tree is freed instead.
	 *
	 * @return the root of the decoded tree, now owned by the caller
	 * @throws PlistNotFoundException if no complete document has been decoded
	 */
	public PlistNode result() {
		PlistNode decoded = root;
		State finalState = state;
		reset();
		if (finalState != State.DONE) {
			if (decoded != null) {
				LOGGER.debug("Discarding partial {} in state {}", decoded.kind(), finalState);
				decoded.free();
			}
			throw new PlistNotFoundException("No complete document (state " + finalState + ")");
		}
		return decoded;
	}

	/**
	 * Frees any tree not yet handed out by {@link #result()} and resets this decoder.
	 */
	@Override
	public void close() {
		PlistNode abandoned = root;
		reset();
		if (abandoned != null) {
			abandoned.free();
		}
	}

	private void reset() {
		state = State.SCAN;
		expect = Expect.VALUE;
		depth = 0;
		current = null;
		pendingKey = null;
		root = null;
		stringIsKey = false;
		escape = false;
		literalIndex = 0;
		nibbles = 0;
		consumed = 0;
		chunkBase = 0;
		scratch.reset();
	}

	private void requireNoError() {
		if (state == State.ERROR) {
			throw new PlistSyntaxException("Decoder has already failed; call result() to reset it", consumed);
		}
	}

	private void latchError(Throwable cause) {
		if (state != State.ERROR) {
			LOGGER.debug("Decoding failed in state {}", state, cause);
			state = State.ERROR;
		}
	}

	private void setState(State newState) {
		LOGGER.trace("{} -> {}", state, newState);
		state = newState;
	}

	private PlistSyntaxException syntaxError(String message, int pos) {
		return new PlistSyntaxException(message, chunkBase + pos);
	}

	//
	// State handlers.
	// Each consumes bytes from buf starting at pos, and returns the position
	// of the first byte it didn't consume.
	//

	private int scan(byte[] buf, int pos, int end) {
		while (pos < end) {
			int b = buf[pos] & 0xFF;
			if (b == 0) {
				return end;
			} else if (isBlank(b)) {
				pos++;
				continue;
			}
			switch (expect) {
				case VALUE -> {
					return startValue(b, pos);
				}
				case ELEMENT_OR_END -> {
					if (b == ')') {
						closeContainer();
						return pos + 1;
					}
					return startValue(b, pos);
				}
				case SEPARATOR_OR_END -> {
					if (b == ',') {
						expect = Expect.ELEMENT_OR_END;
					} else if (b == ')') {
						closeContainer();
						return pos + 1;
					} else {
						throw syntaxError("Expected ',' or ')' but found " + describe(b), pos);
					}
				}
				case KEY_OR_END -> {
					if (b == '"') {
						startString(true);
						return pos + 1;
					} else if (b == '}') {
						closeContainer();
						return pos + 1;
					} else {
						throw syntaxError("Expected key or '}' but found " + describe(b), pos);
					}
				}
				case KEY_SEPARATOR -> {
					if (b == ':' || b == '=') {
						expect = Expect.VALUE;
					} else {
						throw syntaxError("Expected ':' after key but found " + describe(b), pos);
					}
				}
				case ENTRY_SEPARATOR -> {
					if (b == ';') {
						expect = Expect.KEY_OR_END;
					} else {
						throw syntaxError("Expected ';' after dict entry but found " + describe(b), pos);
					}
				}
			}
			pos++;
		}
		return pos;
	}

	/**
	 * @return the position after whatever part of the value's first byte was consumed
	 */
	private int startValue(int b, int pos) {
		switch (b) {
			case '{' -> {
				openContainer(pos, Kind.DICTIONARY);
				return pos + 1;
			}
			case '(' -> {
				openContainer(pos, Kind.ARRAY);
				return pos + 1;
			}
			case '"' -> {
				startString(false);
				return pos + 1;
			}
			case '<' -> {
				nibbles = 0;
				scratch.reset();
				setState(State.DATA);
				return pos + 1;
			}
			case 't', 'T' -> {
				literalIndex = 0;
				setState(State.TRUE);
				return pos;
			}
			case 'f', 'F' -> {
				literalIndex = 0;
				setState(State.FALSE);
				return pos;
			}
			default -> {
				if (isNumberLeadingChar(b)) {
					scratch.reset();
					setState(State.NUMBER);
					return pos;
				}
				throw syntaxError("Unexpected " + describe(b), pos);
			}
		}
	}

	private void startString(boolean isKey) {
		stringIsKey = isKey;
		escape = false;
		scratch.reset();
		setState(State.STRING);
	}

	private int string(byte[] buf, int pos, int end) {
		while (pos < end) {
			int b = buf[pos] & 0xFF;
			if (b == 0) {
				throw syntaxError("NUL inside string", pos);
			}
			if (escape) {
				int c = decodeEscapeChar(b);
				if (c < 0) {
					throw syntaxError("Invalid escape \\" + (char) b, pos);
				}
				scratch.append(c);
				escape = false;
			} else if (b == '\\') {
				escape = true;
			} else if (b == '"') {
				completeString(pos);
				return pos + 1;
			} else {
				scratch.append(b);
			}
			pos++;
		}
		return pos;
	}

	private void completeString(int pos) {
		String text;
		try {
			text = scratch.decodeUtf8();
		} catch (CharacterCodingException e) {
			throw new PlistSyntaxException("String is not valid UTF-8", chunkBase + pos, e);
		}
		if (stringIsKey) {
			pendingKey = text;
			expect = Expect.KEY_SEPARATOR;
			setState(State.SCAN);
		} else {
			completeValue(factory.newString(text));
		}
	}

	private int literal(String word, byte[] buf, int pos, int end) {
		while (pos < end) {
			int b = buf[pos] & 0xFF;
			int lower = (b >= 'A' && b <= 'Z') ? b + ('a' - 'A') : b;
			if (lower != word.charAt(literalIndex)) {
				throw syntaxError("Invalid literal; expected " + word, pos);
			}
			pos++;
			if (++literalIndex == word.length()) {
				completeValue(factory.newBoolean(state == State.TRUE));
				return pos;
			}
		}
		return pos;
	}

	private int data(byte[] buf, int pos, int end) {
		while (pos < end) {
			int b = buf[pos] & 0xFF;
			if (b == '*' && nibbles == 0) {
				scratch.reset();
				setState(State.DATE);
				return pos + 1;
			} else if (b == '>') {
				completeValue(factory.newData(scratch.toByteArray()));
				return pos + 1;
			} else if (!isBlank(b)) {
				int nibble = hexValue(b);
				if (nibble < 0) {
					throw syntaxError("Invalid hex digit " + describe(b), pos);
				}
				if ((nibbles & 1) == 0) {
					scratch.append(nibble << 4);
				} else {
					scratch.orLast(nibble);
				}
				nibbles++;
			}
			pos++;
		}
		return pos;
	}

	private int date(byte[] buf, int pos, int end) {
		while (pos < end) {
			int b = buf[pos] & 0xFF;
			if (b == '>') {
				completeValue(factory.newDate(parseDate(scratch.toAsciiString(), pos)));
				return pos + 1;
			} else if (b == 0 || b >= 0x80) {
				throw syntaxError("Invalid character in date: " + describe(b), pos);
			}
			scratch.append(b);
			pos++;
		}
		return pos;
	}

	private OffsetDateTime parseDate(String text, int pos) {
		if (text.isEmpty() || text.charAt(0) != 'D') {
			throw syntaxError("Expected date to begin with 'D'", pos);
		}
		Matcher m = DATE_PATTERN.matcher(text.substring(1));
		if (!m.matches()) {
			throw syntaxError("Invalid date: " + text, pos);
		}
		try {
			ZoneOffset zone = (m.group(7) == null) ? ZoneOffset.UTC : ZoneOffset.of(m.group(7));
			return OffsetDateTime.of(
				Integer.parseInt(m.group(1)),
				Integer.parseInt(m.group(2)),
				Integer.parseInt(m.group(3)),
				Integer.parseInt(m.group(4)),
				Integer.parseInt(m.group(5)),
				Integer.parseInt(m.group(6)),
				0,
				zone);
		} catch (DateTimeException e) {
			throw new PlistSyntaxException("Invalid date: " + text, chunkBase + pos, e);
		}
	}

	private int number(byte[] buf, int pos, int end) {
		while (pos < end) {
			int b = buf[pos] & 0xFF;
			if (b == 0) {
				completeNumber(chunkBase + pos);
				return end;
			}
			if (state == State.NUMBER) {
				if (isRealMarker(b)) {
					setState(State.DOUBLE);
				} else if (!isDigit(b) && !(b == '-' && scratch.length() == 0)) {
					completeNumber(chunkBase + pos);
					return pos;
				}
			} else if (!isRealChar(b)) {
				completeNumber(chunkBase + pos);
				return pos;
			}
			scratch.append(b);
			pos++;
		}
		return pos;
	}

	private void completeNumber(long offset) {
		String text = scratch.toAsciiString();
		PlistNode node;
		try {
			if (state == State.NUMBER) {
				node = factory.newInteger(Long.parseLong(text));
			} else {
				double value = Double.parseDouble(text);
				if (!Double.isFinite(value)) {
					throw new PlistSyntaxException("Real out of range: " + text, offset);
				}
				node = factory.newReal(value);
			}
		} catch (NumberFormatException e) {
			throw new PlistSyntaxException("Invalid number: " + text, offset, e);
		}
		completeValue(node);
	}

	private int trailing(byte[] buf, int pos, int end) {
		while (pos < end) {
			int b = buf[pos] & 0xFF;
			if (b == 0) {
				return end;
			} else if (!isBlank(b)) {
				throw syntaxError("Unexpected " + describe(b) + " after end of document", pos);
			}
			pos++;
		}
		return pos;
	}

	//
	// Tree building
	//

	private void openContainer(int pos, Kind kind) {
		if (depth >= settings.maxDepth()) {
			throw syntaxError("Nesting exceeds maximum depth " + settings.maxDepth(), pos);
		}
		ContainerNode<?> container = (kind == Kind.DICTIONARY) ? factory.newDictionary() : factory.newArray();
		attach(container);
		current = container;
		depth++;
		expect = (kind == Kind.DICTIONARY) ? Expect.KEY_OR_END : Expect.ELEMENT_OR_END;
		setState(State.SCAN);
	}

	private void closeContainer() {
		depth--;
		PlistNode parent = current.parent();
		if (parent == null) {
			current = null;
			documentComplete();
		} else if (PlistNode.isKind(parent, Kind.KEY)) {
			current = (DictionaryNode) parent.parent();
			expect = Expect.ENTRY_SEPARATOR;
		} else {
			current = (ArrayNode) parent;
			expect = Expect.SEPARATOR_OR_END;
		}
	}

	private void completeValue(PlistNode node) {
		attach(node);
		if (current == null) {
			documentComplete();
		} else {
			setState(State.SCAN);
		}
	}

	/**
	 * Gives {@code node} an owner: the enclosing container, or this decoder if it's the root.
	 * If that fails, {@code node} is freed.
	 */
	private void attach(PlistNode node) {
		try {
			if (current == null) {
				root = node;
			} else if (current instanceof DictionaryNode dict) {
				dict.set(pendingKey, node);
				pendingKey = null;
				expect = Expect.ENTRY_SEPARATOR;
			} else {
				((ArrayNode) current).append(node);
				expect = Expect.SEPARATOR_OR_END;
			}
		} catch (RuntimeException | OutOfMemoryError e) {
			node.free();
			throw e;
		}
	}

	private void documentComplete() {
		assert depth == 0;
		LOGGER.debug("Decoded {} document", root.kind());
		setState(State.DONE);
	}

	private static String describe(int b) {
		if (b >= 0x20 && b < 0x7F) {
			return "'" + (char) b + "'";
		} else {
			return String.format("byte 0x%02x", b);
		}
	}

	private static final Pattern DATE_PATTERN = Pattern.compile(
		"(\\d{4})-(\\d{2})-(\\d{2})[ T](\\d{2}):(\\d{2}):(\\d{2})(?:\\s*(Z|[+-]\\d{2}(?::?\\d{2})?))?\\s*");

	private static final Logger LOGGER = LoggerFactory.getLogger(PlistTextDecoder.class);
}
