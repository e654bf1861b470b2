package works.plist.tree;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates over the children of a {@link ContainerNode} in order.
 * <p>
 * The following element is looked up before the current one is returned,
 * so the caller may remove or free the current element
 * (directly, or via {@link #remove()}) without disturbing the iteration.
 * Removing any other element of the container while iterating is not supported.
 */
public final class PlistIterator<E extends PlistNode> implements Iterator<E> {
	private final ContainerNode<E> container;
	private PlistNode current;
	private PlistNode upcoming;

	PlistIterator(ContainerNode<E> container) {
		this.container = container;
		this.upcoming = container.head;
	}

	@Override
	public boolean hasNext() {
		return upcoming != null;
	}

	@Override
	@SuppressWarnings("unchecked")
	public E next() {
		if (upcoming == null) {
			throw new NoSuchElementException();
		}
		current = upcoming;
		upcoming = current.next;
		return (E) current;
	}

	/**
	 * Removes the element most recently returned by {@link #next()} from the container and frees it.
	 */
	@Override
	public void remove() {
		if (current == null || current.isFreed() || current.parent != container) {
			throw new IllegalStateException("No current element to remove");
		}
		current.free();
		current = null;
	}
}
