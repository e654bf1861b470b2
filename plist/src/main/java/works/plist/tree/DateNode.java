package works.plist.tree;

import java.time.OffsetDateTime;

/**
 * A calendar timestamp with its timezone offset, to the second.
 */
public final class DateNode extends PlistNode {
	private final OffsetDateTime value;

	DateNode(NodeFactory factory, OffsetDateTime value) {
		super(factory);
		this.value = value;
	}

	@Override
	public Kind kind() {
		return Kind.DATE;
	}

	public OffsetDateTime value() {
		requireLive();
		return value;
	}

	@Override
	DateNode shallowCopy(NodeFactory factory) {
		return factory.newDate(value);
	}

	@Override
	boolean payloadEquals(PlistNode other) {
		// Same instant isn't enough; the offset is part of the value
		return value.equals(((DateNode) other).value);
	}

	@Override
	public String toString() {
		return "DateNode(" + value + ")";
	}
}
