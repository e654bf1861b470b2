package works.plist.tree;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Creates property tree nodes.
 * <p>
 * Every node remembers the factory that created it, and nodes created internally
 * (key wrappers, copies) come from that same factory.
 * Subclasses can override {@link #onCreate} and {@link #onRelease}
 * to observe every node's lifetime, which is handy for accounting and for tests.
 * <p>
 * Every method returns a free-standing node with no parent.
 */
public class NodeFactory {
	public static final NodeFactory DEFAULT = new NodeFactory();

	public NodeFactory() { }

	public DictionaryNode newDictionary() {
		return created(new DictionaryNode(this));
	}

	public ArrayNode newArray() {
		return created(new ArrayNode(this));
	}

	/**
	 * @param bytes copied; later changes to the array do not affect the node
	 */
	public DataNode newData(byte[] bytes) {
		requireNonNull(bytes, "bytes");
		return created(new DataNode(this, bytes));
	}

	/**
	 * @param value truncated to whole seconds
	 */
	public DateNode newDate(OffsetDateTime value) {
		requireNonNull(value, "value");
		return created(new DateNode(this, value.truncatedTo(ChronoUnit.SECONDS)));
	}

	public StringNode newString(String value) {
		requireNonNull(value, "value");
		return created(new StringNode(this, value));
	}

	/**
	 * Formats with {@link Locale#ROOT}, so the result does not depend on the default locale.
	 *
	 * @see String#format(Locale, String, Object...)
	 */
	public StringNode newFormattedString(String format, Object... args) {
		requireNonNull(format, "format");
		return newString(String.format(Locale.ROOT, format, args));
	}

	public IntegerNode newInteger(long value) {
		return created(new IntegerNode(this, value));
	}

	public RealNode newReal(double value) {
		return created(new RealNode(this, value));
	}

	public BooleanNode newBoolean(boolean value) {
		return created(new BooleanNode(this, value));
	}

	/**
	 * A free-standing dictionary entry, suitable for {@link DictionaryNode#update}.
	 * The key takes ownership of {@code value}.
	 */
	public KeyNode newKey(String name, PlistNode value) {
		requireNonNull(name, "name");
		requireNonNull(value, "value");
		KeyNode key = new KeyNode(this, name);
		key.checkAttachable(value);
		created(key).adoptChild(value);
		return key;
	}

	KeyNode newEmptyKey(String name) {
		return created(new KeyNode(this, name));
	}

	/**
	 * Produces a structurally identical, fully independent tree from {@code source},
	 * whose nodes are all created by this factory.
	 * <p>
	 * The source is walked in preorder by {@link TreeWalker}, and each node is mirrored
	 * into the destination as it is entered; the destination cursor ascends
	 * through its own parent links as the walk leaves each source node.
	 * If anything fails partway, the partial destination tree is freed
	 * and the exception propagates. The source is never modified.
	 *
	 * @return a free-standing copy. Copying a key yields a free-standing key.
	 */
	public PlistNode copy(PlistNode source) {
		requireNonNull(source, "source");
		Mirror mirror = new Mirror();
		try {
			TreeWalker.walk(source, mirror);
		} catch (RuntimeException | OutOfMemoryError e) {
			if (mirror.root != null) {
				LOGGER.debug("Freeing partial copy of {}", source.kind());
				mirror.root.free();
			}
			throw e;
		}
		return mirror.root;
	}

	private final class Mirror implements TreeWalker.Visitor {
		PlistNode root;

		/**
		 * The destination node corresponding to the source node most recently entered
		 * and not yet exited.
		 */
		PlistNode cursor;

		@Override
		public void enter(PlistNode node) {
			PlistNode duplicate = node.shallowCopy(NodeFactory.this);
			if (root == null) {
				root = duplicate;
			} else {
				cursor.adoptChild(duplicate);
			}
			cursor = duplicate;
		}

		@Override
		public void exit(PlistNode node) {
			cursor = cursor.parent;
		}
	}

	/**
	 * Called for every node this factory creates, before the node is handed out.
	 * If this throws, the node is never used.
	 */
	protected void onCreate(PlistNode node) { }

	/**
	 * Called for every node created by this factory when it is freed,
	 * after it has been detached and its payload dropped.
	 */
	protected void onRelease(PlistNode node) { }

	private <T extends PlistNode> T created(T node) {
		onCreate(node);
		return node;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NodeFactory.class);
}
