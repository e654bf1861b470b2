package works.plist.tree;

/**
 * A signed 64-bit integer. Text input outside the range of {@code long}
 * is rejected rather than truncated.
 */
public final class IntegerNode extends PlistNode {
	private final long value;

	IntegerNode(NodeFactory factory, long value) {
		super(factory);
		this.value = value;
	}

	@Override
	public Kind kind() {
		return Kind.INTEGER;
	}

	public long value() {
		requireLive();
		return value;
	}

	@Override
	IntegerNode shallowCopy(NodeFactory factory) {
		return factory.newInteger(value);
	}

	@Override
	boolean payloadEquals(PlistNode other) {
		return value == ((IntegerNode) other).value;
	}

	@Override
	public String toString() {
		return "IntegerNode(" + value + ")";
	}
}
