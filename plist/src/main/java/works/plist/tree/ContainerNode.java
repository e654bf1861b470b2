package works.plist.tree;

import java.util.Deque;
import works.plist.exceptions.PlistCorruptionException;

/**
 * A node that owns an ordered sequence of children.
 * <p>
 * Children are kept in an intrusive doubly-linked list threaded through
 * {@link PlistNode#prev} and {@link PlistNode#next}, so that appending and unlinking
 * are constant-time, and so that a child can find its neighbours
 * during a {@link TreeWalker walk} without help from the container.
 *
 * @param <E> the type of the children
 */
public sealed abstract class ContainerNode<E extends PlistNode> extends PlistNode implements Iterable<E>
	permits DictionaryNode, ArrayNode
{
	PlistNode head, tail;
	int count;

	ContainerNode(NodeFactory factory) {
		super(factory);
	}

	/**
	 * @return the number of children actually linked into this container
	 */
	public int size() {
		requireLive();
		return count;
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * @return the first child, or null if this container is empty
	 */
	@SuppressWarnings("unchecked")
	public E first() {
		requireLive();
		return (E) head;
	}

	/**
	 * Iterates over the children in insertion order.
	 * <p>
	 * Removing (or freeing) the element most recently returned
	 * does not disturb the iteration; removing any other element does.
	 */
	@Override
	public PlistIterator<E> iterator() {
		requireLive();
		return new PlistIterator<>(this);
	}

	@Override
	PlistNode firstChild() {
		return head;
	}

	@Override
	void adoptChild(PlistNode child) {
		linkLast(child);
	}

	final void linkLast(PlistNode child) {
		assert child.parent == null;
		child.parent = this;
		child.prev = tail;
		child.next = null;
		if (tail == null) {
			head = child;
		} else {
			tail.next = child;
		}
		tail = child;
		count++;
		childLinked(child);
	}

	final void linkBefore(PlistNode child, PlistNode successor) {
		assert child.parent == null;
		assert successor.parent == this;
		child.parent = this;
		child.prev = successor.prev;
		child.next = successor;
		if (successor.prev == null) {
			head = child;
		} else {
			successor.prev.next = child;
		}
		successor.prev = child;
		count++;
		childLinked(child);
	}

	final void unlink(PlistNode child) {
		if (child.parent != this || count <= 0) {
			throw new PlistCorruptionException("Node is not linked into this " + kind().displayName());
		}
		if (child.prev == null) {
			head = child.next;
		} else {
			child.prev.next = child.next;
		}
		if (child.next == null) {
			tail = child.prev;
		} else {
			child.next.prev = child.prev;
		}
		child.parent = null;
		child.prev = null;
		child.next = null;
		count--;
		childUnlinked(child);
	}

	/**
	 * Hook for subclasses that index their children.
	 */
	void childLinked(PlistNode child) { }

	/**
	 * Hook for subclasses that index their children.
	 */
	void childUnlinked(PlistNode child) { }

	@Override
	void releaseChildrenInto(Deque<PlistNode> worklist) {
		PlistNode child = head;
		while (child != null) {
			PlistNode following = child.next;
			child.parent = null;
			child.prev = null;
			child.next = null;
			worklist.push(child);
			count--;
			child = following;
		}
		assert count == 0;
		head = null;
		tail = null;
		count = 0;
	}

	@Override
	boolean payloadEquals(PlistNode other) {
		// Containers have no payload of their own
		return true;
	}
}
