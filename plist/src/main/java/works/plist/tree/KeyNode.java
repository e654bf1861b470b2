package works.plist.tree;

import java.util.Deque;
import works.plist.exceptions.PlistCorruptionException;

/**
 * A named entry of a {@link DictionaryNode}, owning exactly one value.
 * <p>
 * Keys are normally created and destroyed by the dictionary itself,
 * via {@link DictionaryNode#set} and friends.
 * A free-standing key, from {@link NodeFactory#newKey} or from {@link #copy()},
 * can be merged into a dictionary with {@link DictionaryNode#update}.
 */
public final class KeyNode extends PlistNode {
	private final String name;
	PlistNode value;

	KeyNode(NodeFactory factory, String name) {
		super(factory);
		this.name = name;
	}

	@Override
	public Kind kind() {
		return Kind.KEY;
	}

	public String name() {
		return name;
	}

	/**
	 * @return the value owned by this key. Null only if the value has been freed directly.
	 */
	public PlistNode value() {
		requireLive();
		return value;
	}

	@Override
	PlistNode firstChild() {
		return value;
	}

	@Override
	void adoptChild(PlistNode child) {
		if (value != null) {
			throw new PlistCorruptionException("Key \"" + name + "\" already has a value");
		}
		child.parent = this;
		child.prev = null;
		child.next = null;
		value = child;
	}

	void clearValue(PlistNode child) {
		if (value != child) {
			throw new PlistCorruptionException("Node is not the value of key \"" + name + "\"");
		}
		child.parent = null;
		value = null;
	}

	@Override
	void releaseChildrenInto(Deque<PlistNode> worklist) {
		if (value != null) {
			value.parent = null;
			worklist.push(value);
			value = null;
		}
	}

	@Override
	KeyNode shallowCopy(NodeFactory factory) {
		return factory.newEmptyKey(name);
	}

	@Override
	boolean payloadEquals(PlistNode other) {
		return name.equals(((KeyNode) other).name);
	}

	@Override
	public String toString() {
		return "KeyNode(" + name + ")";
	}
}
