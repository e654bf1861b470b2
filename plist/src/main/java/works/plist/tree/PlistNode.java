package works.plist.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.plist.exceptions.PlistCorruptionException;
import works.plist.exceptions.PlistKindException;
import works.plist.exceptions.PlistOwnershipException;

import static java.util.Objects.requireNonNull;

/**
 * One node of a property tree.
 * <p>
 * Every node is owned by exactly one of: its parent, or the caller holding it.
 * A node without a parent is a free-standing root; attaching it to a container
 * hands ownership to that container, and attaching a node that already has a parent
 * is rejected rather than silently moving it.
 * <p>
 * Nodes are only ever destroyed by {@link #free()}, after which they must not be used.
 * There is no reference counting: freeing a node frees its entire subtree.
 * <p>
 * None of this is thread-safe. Callers that share a tree between threads
 * must serialize access to it themselves.
 */
public sealed abstract class PlistNode permits
	ContainerNode,
	KeyNode,
	DataNode,
	DateNode,
	StringNode,
	IntegerNode,
	RealNode,
	BooleanNode
{
	final NodeFactory factory;

	/**
	 * A dictionary, an array, a key, or null for a free-standing root.
	 * Not an owning reference: the parent owns this node, not the other way around.
	 */
	PlistNode parent;

	/**
	 * Siblings within the parent container. Always null when the parent is a key.
	 */
	PlistNode prev, next;

	private boolean freed = false;

	PlistNode(NodeFactory factory) {
		this.factory = factory;
	}

	public abstract Kind kind();

	/**
	 * @return the containing dictionary, array, or key; or null if this is a root
	 */
	public PlistNode parent() {
		requireLive();
		return parent;
	}

	public boolean isAttached() {
		requireLive();
		return parent != null;
	}

	public boolean isFreed() {
		return freed;
	}

	/**
	 * Null-safe kind check.
	 */
	public static boolean isKind(PlistNode node, Kind kind) {
		return node != null && node.kind() == kind;
	}

	/**
	 * @return a structurally identical, fully independent, free-standing tree
	 * created by the same {@link NodeFactory} as this node
	 * @see NodeFactory#copy
	 */
	public PlistNode copy() {
		return factory.copy(this);
	}

	/**
	 * Detaches this node from its parent, if any, and then releases it and all its descendants.
	 * <p>
	 * If the parent is a {@link KeyNode}, the key itself survives with no value.
	 * <p>
	 * Teardown uses a worklist rather than recursion,
	 * so arbitrarily deep trees can be freed without risk to the call stack.
	 */
	public void free() {
		requireLive();
		detachFromParent();

		Deque<PlistNode> worklist = new ArrayDeque<>();
		worklist.push(this);
		while (!worklist.isEmpty()) {
			PlistNode node = worklist.pop();
			node.releaseChildrenInto(worklist);
			node.release();
		}
	}

	/**
	 * Structural equality: same kinds, same payloads, same key names, same child order.
	 * Node identity and parentage are not compared.
	 * <p>
	 * Iterative, so it's safe for arbitrarily deep trees.
	 */
	public static boolean contentEquals(PlistNode a, PlistNode b) {
		Deque<PlistNode> left = new ArrayDeque<>();
		Deque<PlistNode> right = new ArrayDeque<>();
		PlistNode x = a, y = b;
		while (true) {
			if (x == null || y == null) {
				if (x != y) {
					return false;
				}
			} else {
				x.requireLive();
				y.requireLive();
				if (x.kind() != y.kind() || !x.payloadEquals(y)) {
					return false;
				}
				PlistNode xc = x.firstChild();
				PlistNode yc = y.firstChild();
				while (xc != null && yc != null) {
					left.push(xc);
					right.push(yc);
					xc = xc.next;
					yc = yc.next;
				}
				if (xc != null || yc != null) {
					return false; // Different number of children
				}
			}
			if (left.isEmpty()) {
				return true;
			}
			x = left.pop();
			y = right.pop();
		}
	}

	final void requireLive() {
		if (freed) {
			throw new IllegalStateException("Node has been freed: " + kind().displayName());
		}
	}

	/**
	 * The first node the {@link TreeWalker} descends into:
	 * a container's first element, or a key's value.
	 */
	PlistNode firstChild() {
		return null;
	}

	/**
	 * @return a new node of the same kind with the same payload but no children,
	 * created by the given factory
	 */
	abstract PlistNode shallowCopy(NodeFactory factory);

	/**
	 * Compares only the data held directly by this node, not its children.
	 * Only called with a node of the same kind.
	 */
	abstract boolean payloadEquals(PlistNode other);

	/**
	 * Called when this node becomes a child of another.
	 * Does no checking; callers must have already verified the ownership rules.
	 */
	void adoptChild(PlistNode child) {
		throw new PlistCorruptionException(kind().displayName() + " cannot have children");
	}

	/**
	 * Moves this node's children to the worklist, leaving them parentless,
	 * and leaves this node with no children.
	 */
	void releaseChildrenInto(Deque<PlistNode> worklist) {
		// Most nodes have no children
	}

	/**
	 * Drop the payload and mark this node unusable.
	 */
	void clearPayload() {
		// Primitives have nothing worth dropping
	}

	private void release() {
		clearPayload();
		parent = null;
		prev = null;
		next = null;
		freed = true;
		factory.onRelease(this);
	}

	private void detachFromParent() {
		PlistNode p = this.parent;
		if (p == null) {
			return;
		}
		switch (p.kind()) {
			case DICTIONARY, ARRAY -> ((ContainerNode<?>) p).unlink(this);
			case KEY -> ((KeyNode) p).clearValue(this);
			default -> {
				// Something got broken: no other kind can be a parent
				LOGGER.error("Invalid parent kind {} for {} node", p.kind(), kind());
				throw new PlistCorruptionException("Invalid parent kind " + p.kind() + " for " + kind() + " node");
			}
		}
	}

	/**
	 * Verifies that {@code child} may be attached underneath this node.
	 */
	final void checkAttachable(PlistNode child) {
		requireNonNull(child, "value");
		requireLive();
		child.requireLive();
		if (child.kind() == Kind.KEY) {
			throw new PlistKindException("A key cannot be used as a value");
		}
		if (child.parent != null) {
			throw new PlistOwnershipException(
				"Node is already attached to a " + child.parent.kind().displayName());
		}
		for (PlistNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
			if (ancestor == child) {
				throw new PlistOwnershipException("Node cannot be attached inside itself");
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PlistNode.class);
}
