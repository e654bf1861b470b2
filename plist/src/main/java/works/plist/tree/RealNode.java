package works.plist.tree;

public final class RealNode extends PlistNode {
	private final double value;

	RealNode(NodeFactory factory, double value) {
		super(factory);
		this.value = value;
	}

	@Override
	public Kind kind() {
		return Kind.REAL;
	}

	public double value() {
		requireLive();
		return value;
	}

	@Override
	RealNode shallowCopy(NodeFactory factory) {
		return factory.newReal(value);
	}

	@Override
	boolean payloadEquals(PlistNode other) {
		// NaN equals NaN here, and -0.0 differs from 0.0
		return Double.compare(value, ((RealNode) other).value) == 0;
	}

	@Override
	public String toString() {
		return "RealNode(" + value + ")";
	}
}
