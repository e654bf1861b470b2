package works.plist.codec.text;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.plist.tree.BooleanNode;
import works.plist.tree.ContainerNode;
import works.plist.tree.DataNode;
import works.plist.tree.DateNode;
import works.plist.tree.IntegerNode;
import works.plist.tree.KeyNode;
import works.plist.tree.Kind;
import works.plist.tree.PlistNode;
import works.plist.tree.RealNode;
import works.plist.tree.StringNode;
import works.plist.tree.TreeWalker;

import static java.util.Objects.requireNonNull;
import static works.plist.codec.text.TextSyntax.escapeFor;
import static works.plist.codec.text.TextSyntax.hexDigit;

/**
 * Emits property list text that {@link PlistTextDecoder} reads back
 * as a structurally equal tree.
 * <p>
 * A free-standing {@link KeyNode} is written as a dictionary with that one entry.
 * <p>
 * Values the text form cannot carry are rejected with {@link IllegalArgumentException}:
 * strings with NUL or unpaired surrogates, non-finite reals,
 * and dates whose year falls outside 0 to 9999 or whose offset has a seconds part.
 */
public final class PlistTextEncoder {
	/**
	 * @param indent inserted once per nesting level, with each child on its own line;
	 *               if empty, everything goes on one line with no optional whitespace
	 */
	public record Settings(String indent) {
		public static final Settings COMPACT = new Settings("");
		public static final Settings PRETTY = new Settings("\t");

		public Settings {
			requireNonNull(indent, "indent");
			if (!indent.isBlank()) {
				throw new IllegalArgumentException("Indent must be whitespace");
			}
		}

		public Settings withIndent(String indent) {
			return new Settings(indent);
		}

		boolean isPretty() {
			return !indent.isEmpty();
		}
	}

	private final Settings settings;

	public PlistTextEncoder() {
		this(Settings.COMPACT);
	}

	public PlistTextEncoder(Settings settings) {
		this.settings = requireNonNull(settings, "settings");
	}

	public static String encode(PlistNode node) {
		return new PlistTextEncoder().encodeToString(node);
	}

	public String encodeToString(PlistNode node) {
		StringWriter out = new StringWriter();
		encode(out, node);
		return out.toString();
	}

	/**
	 * @throws IllegalArgumentException if the tree contains a string with a NUL character,
	 * or a real that is infinite or NaN; neither can be represented in the text format
	 * @throws IllegalStateException if the tree contains a key with no value
	 * @throws UncheckedIOException if {@code out} fails
	 */
	public void encode(Writer out, PlistNode node) {
		requireNonNull(out, "out");
		requireNonNull(node, "node");
		LOGGER.debug("Encoding {} node", node.kind());
		PrintWriter printer = (out instanceof PrintWriter pw) ? pw : new PrintWriter(out);
		Session session = new Session(printer, node);
		if (node.kind() == Kind.KEY) {
			printer.print('{');
			session.depth = 1;
			TreeWalker.walk(node, session);
			session.newline(0);
			printer.print('}');
		} else {
			TreeWalker.walk(node, session);
		}
		printer.flush();
		if (printer.checkError()) {
			throw new UncheckedIOException(new IOException("Unable to write plist text"));
		}
	}

	private final class Session implements TreeWalker.Visitor {
		final PrintWriter out;
		final PlistNode root;

		/**
		 * Number of containers entered and not yet exited.
		 */
		int depth = 0;

		/**
		 * Whether the array being written already has an element,
		 * so the next one needs a separator.
		 */
		boolean needComma = false;

		Session(PrintWriter out, PlistNode root) {
			this.out = out;
			this.root = root;
		}

		@Override
		public void enter(PlistNode node) {
			if (isArrayElement(node)) {
				if (needComma) {
					out.print(',');
				}
				newline(depth);
			}
			switch (node.kind()) {
				case DICTIONARY -> openContainer('{');
				case ARRAY -> openContainer('(');
				case KEY -> {
					KeyNode key = (KeyNode) node;
					if (key.value() == null) {
						throw new IllegalStateException("Key \"" + key.name() + "\" has no value");
					}
					newline(depth);
					out.print(stringLiteral(key.name()));
					out.print(settings.isPretty() ? ": " : ":");
				}
				case DATA -> out.print(dataLiteral((DataNode) node));
				case DATE -> out.print(dateLiteral(((DateNode) node).value()));
				case STRING -> out.print(stringLiteral(((StringNode) node).value()));
				case INTEGER -> out.print(((IntegerNode) node).value());
				case REAL -> out.print(realLiteral(((RealNode) node).value()));
				case BOOLEAN -> out.print(((BooleanNode) node).value() ? "true" : "false");
				case UNKNOWN -> throw new IllegalStateException("Unexpected node kind " + node.kind());
			}
		}

		@Override
		public void exit(PlistNode node) {
			switch (node.kind()) {
				case DICTIONARY -> closeContainer(node, '}');
				case ARRAY -> closeContainer(node, ')');
				case KEY -> out.print(';');
				default -> { }
			}
			if (isArrayElement(node)) {
				needComma = true;
			}
		}

		/**
		 * The root counts as a top-level value even if it happens to sit inside an array.
		 */
		private boolean isArrayElement(PlistNode node) {
			return node != root && PlistNode.isKind(node.parent(), Kind.ARRAY);
		}

		private void openContainer(char opener) {
			out.print(opener);
			depth++;
			needComma = false;
		}

		private void closeContainer(PlistNode node, char closer) {
			depth--;
			if (((ContainerNode<?>) node).size() != 0) {
				newline(depth);
			}
			out.print(closer);
		}

		void newline(int level) {
			if (settings.isPretty()) {
				out.print('\n');
				out.print(settings.indent().repeat(level));
			}
		}
	}

	static String stringLiteral(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == 0) {
				throw new IllegalArgumentException("String contains NUL character at index " + i);
			}
			if (Character.isSurrogate(c)) {
				if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
					sb.append(c).append(s.charAt(++i));
					continue;
				}
				throw new IllegalArgumentException("String contains unpaired surrogate at index " + i);
			}
			char escape = escapeFor(c);
			if (escape == 0) {
				sb.append(c);
			} else {
				sb.append('\\').append(escape);
			}
		}
		sb.append('"');
		return sb.toString();
	}

	static String dataLiteral(DataNode node) {
		StringBuilder sb = new StringBuilder(2 * node.length() + 2);
		sb.append('<');
		for (int i = 0; i < node.length(); i++) {
			byte b = node.byteAt(i);
			sb.append(hexDigit(b >> 4)).append(hexDigit(b));
		}
		sb.append('>');
		return sb.toString();
	}

	static String realLiteral(double value) {
		if (!Double.isFinite(value)) {
			throw new IllegalArgumentException("Real cannot be represented as text: " + value);
		}
		// Always contains '.' or 'E', so it decodes as a real rather than an integer
		return Double.toString(value);
	}

	/**
	 * The text form has a four-digit year and an offset in whole minutes.
	 */
	static String dateLiteral(OffsetDateTime value) {
		int year = value.getYear();
		if (year < 0 || year > 9999) {
			throw new IllegalArgumentException("Date year cannot be represented as text: " + value);
		}
		if (value.getOffset().getTotalSeconds() % 60 != 0) {
			throw new IllegalArgumentException("Date offset cannot be represented as text: " + value);
		}
		return "<*D" + DATE_FORMAT.format(value) + ">";
	}

	private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss xx");

	private static final Logger LOGGER = LoggerFactory.getLogger(PlistTextEncoder.class);
}
