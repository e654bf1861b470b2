package works.plist.tree;

import works.plist.exceptions.PlistKindException;
import works.plist.exceptions.PlistOwnershipException;
import works.plist.exceptions.PlistRangeException;

/**
 * An ordered sequence of values of any kind except {@link Kind#KEY key}.
 */
public final class ArrayNode extends ContainerNode<PlistNode> {
	ArrayNode(NodeFactory factory) {
		super(factory);
	}

	@Override
	public Kind kind() {
		return Kind.ARRAY;
	}

	/**
	 * Attaches {@code value} at the end of this array, taking ownership of it.
	 *
	 * @throws PlistOwnershipException if {@code value} already has a parent,
	 * or is this array or one of its ancestors
	 * @throws PlistKindException if {@code value} is a key
	 */
	public void append(PlistNode value) {
		checkAttachable(value);
		linkLast(value);
	}

	/**
	 * Attaches {@code value} so that it ends up at position {@code index}.
	 * Inserting at {@link #size()} is the same as {@link #append}.
	 *
	 * @throws PlistRangeException unless {@code 0 <= index <= size()}
	 */
	public void insert(int index, PlistNode value) {
		requireLive();
		if (index < 0 || index > count) {
			throw new PlistRangeException(index, count);
		}
		checkAttachable(value);
		if (index == count) {
			linkLast(value);
		} else {
			linkBefore(value, nodeAt(index));
		}
	}

	/**
	 * @return the element at {@code index}, still owned by this array
	 * @throws PlistRangeException unless {@code 0 <= index < size()}
	 */
	public PlistNode get(int index) {
		requireLive();
		checkElementIndex(index);
		return nodeAt(index);
	}

	/**
	 * Detaches the element at {@code index} and hands it to the caller.
	 *
	 * @return the detached element, now free-standing
	 * @throws PlistRangeException unless {@code 0 <= index < size()}
	 */
	public PlistNode pop(int index) {
		requireLive();
		checkElementIndex(index);
		PlistNode element = nodeAt(index);
		unlink(element);
		return element;
	}

	/**
	 * Removes and frees the element at {@code index}.
	 *
	 * @throws PlistRangeException unless {@code 0 <= index < size()}
	 */
	public void delete(int index) {
		requireLive();
		checkElementIndex(index);
		nodeAt(index).free();
	}

	private void checkElementIndex(int index) {
		if (index < 0 || index >= count) {
			throw new PlistRangeException(index, count);
		}
	}

	/**
	 * Walks from whichever end is closer.
	 */
	private PlistNode nodeAt(int index) {
		PlistNode node;
		if (index < count / 2) {
			node = head;
			for (int i = 0; i < index; i++) {
				node = node.next;
			}
		} else {
			node = tail;
			for (int i = count - 1; i > index; i--) {
				node = node.prev;
			}
		}
		return node;
	}

	@Override
	ArrayNode shallowCopy(NodeFactory factory) {
		return factory.newArray();
	}

	@Override
	public String toString() {
		return isFreed() ? "ArrayNode(freed)" : "ArrayNode[size=" + count + "]";
	}
}
