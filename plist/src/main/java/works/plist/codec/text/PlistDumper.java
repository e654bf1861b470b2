package works.plist.codec.text;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.time.format.DateTimeFormatter;
import works.plist.tree.BooleanNode;
import works.plist.tree.DataNode;
import works.plist.tree.DateNode;
import works.plist.tree.IntegerNode;
import works.plist.tree.KeyNode;
import works.plist.tree.PlistNode;
import works.plist.tree.RealNode;
import works.plist.tree.StringNode;
import works.plist.tree.TreeWalker;

import static java.util.Objects.requireNonNull;
import static works.plist.codec.text.TextSyntax.hexDigit;

/**
 * Human-readable rendering of a tree for debugging.
 * Not meant to be parsed.
 * <p>
 * Each node gets a line indented by its depth, showing its kind and,
 * for keys and scalars, {@code =value}. Data is followed by a hex dump.
 */
public final class PlistDumper {
	private PlistDumper() {}

	static final String INDENT = "        ";
	static final int BYTES_PER_ROW = 16;

	public static String dumpToString(PlistNode node) {
		StringWriter out = new StringWriter();
		dump(out, node);
		return out.toString();
	}

	public static void dump(Writer out, PlistNode node) {
		requireNonNull(out, "out");
		requireNonNull(node, "node");
		PrintWriter printer = (out instanceof PrintWriter pw) ? pw : new PrintWriter(out);
		TreeWalker.walk(node, new TreeWalker.Visitor() {
			int depth = 0;

			@Override
			public void enter(PlistNode n) {
				String indent = INDENT.repeat(depth);
				printer.print(indent);
				printer.print(n.kind().displayName());
				switch (n.kind()) {
					case KEY -> printer.print("=" + ((KeyNode) n).name());
					case DATA -> printer.print("=" + ((DataNode) n).length());
					case DATE -> printer.print("=" + DATE_FORMAT.format(((DateNode) n).value()));
					case STRING -> printer.print("=" + ((StringNode) n).value());
					case INTEGER -> printer.print("=" + ((IntegerNode) n).value());
					case REAL -> printer.print("=" + ((RealNode) n).value());
					case BOOLEAN -> printer.print("=" + ((BooleanNode) n).value());
					default -> { }
				}
				printer.print('\n');
				if (n instanceof DataNode data) {
					hexDump(printer, indent + INDENT, data);
				}
				depth++;
			}

			@Override
			public void exit(PlistNode n) {
				depth--;
			}
		});
		printer.flush();
	}

	/**
	 * Rows of {@link #BYTES_PER_ROW} bytes: offset, hex, then printable ASCII with dots for the rest.
	 */
	static void hexDump(PrintWriter out, String indent, DataNode data) {
		int length = data.length();
		for (int rowStart = 0; rowStart < length; rowStart += BYTES_PER_ROW) {
			StringBuilder hex = new StringBuilder(3 * BYTES_PER_ROW);
			StringBuilder ascii = new StringBuilder(BYTES_PER_ROW);
			for (int i = rowStart; i < rowStart + BYTES_PER_ROW; i++) {
				if (i < length) {
					byte b = data.byteAt(i);
					hex.append(hexDigit(b >> 4)).append(hexDigit(b)).append(' ');
					ascii.append((b >= 0x20 && b < 0x7F) ? (char) b : '.');
				} else {
					hex.append("   ");
				}
			}
			out.printf("%s%04x  %s %s\n", indent, rowStart, hex, ascii);
		}
	}

	private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx");
}
