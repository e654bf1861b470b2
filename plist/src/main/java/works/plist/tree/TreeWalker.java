package works.plist.tree;

import works.plist.exceptions.PlistCorruptionException;

import static java.util.Objects.requireNonNull;

/**
 * Depth-first, preorder traversal of a property tree.
 * <p>
 * The walk is driven entirely by the parent and sibling links stored in the nodes:
 * it descends to a node's first child, moves across to the next sibling,
 * and ascends through the parent link when a sibling list runs out.
 * There is no recursion and no auxiliary stack, so trees of any depth are fine.
 * <p>
 * A {@link KeyNode key}'s value counts as its only child.
 * <p>
 * The visitor must not modify the tree being walked.
 */
public final class TreeWalker {
	private TreeWalker() {}

	public interface Visitor {
		/**
		 * Called for every node before any of its descendants.
		 */
		void enter(PlistNode node);

		/**
		 * Called for every node after all of its descendants,
		 * including nodes that have none.
		 */
		default void exit(PlistNode node) { }
	}

	public static void walk(PlistNode root, Visitor visitor) {
		requireNonNull(root, "root");
		requireNonNull(visitor, "visitor");
		root.requireLive();

		PlistNode node = root;
		while (true) {
			visitor.enter(node);
			PlistNode child = node.firstChild();
			if (child != null) {
				node = child;
				continue;
			}

			// Attempt to ascend
			while (true) {
				visitor.exit(node);
				if (node == root) {
					return;
				}
				if (node.next != null) {
					node = node.next;
					break;
				}
				node = node.parent;
				if (node == null) {
					throw new PlistCorruptionException("Walk escaped from the subtree being walked");
				}
			}
		}
	}
}
