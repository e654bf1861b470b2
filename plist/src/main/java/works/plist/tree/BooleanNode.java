package works.plist.tree;

public final class BooleanNode extends PlistNode {
	private final boolean value;

	BooleanNode(NodeFactory factory, boolean value) {
		super(factory);
		this.value = value;
	}

	@Override
	public Kind kind() {
		return Kind.BOOLEAN;
	}

	public boolean value() {
		requireLive();
		return value;
	}

	@Override
	BooleanNode shallowCopy(NodeFactory factory) {
		return factory.newBoolean(value);
	}

	@Override
	boolean payloadEquals(PlistNode other) {
		return value == ((BooleanNode) other).value;
	}

	@Override
	public String toString() {
		return "BooleanNode(" + value + ")";
	}
}
