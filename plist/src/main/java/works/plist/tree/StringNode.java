package works.plist.tree;

public final class StringNode extends PlistNode {
	private String value;

	StringNode(NodeFactory factory, String value) {
		super(factory);
		this.value = value;
	}

	@Override
	public Kind kind() {
		return Kind.STRING;
	}

	public String value() {
		requireLive();
		return value;
	}

	@Override
	StringNode shallowCopy(NodeFactory factory) {
		return factory.newString(value);
	}

	@Override
	boolean payloadEquals(PlistNode other) {
		return value.equals(((StringNode) other).value);
	}

	@Override
	void clearPayload() {
		value = null;
	}

	@Override
	public String toString() {
		return isFreed() ? "StringNode(freed)" : "StringNode(\"" + value + "\")";
	}
}
