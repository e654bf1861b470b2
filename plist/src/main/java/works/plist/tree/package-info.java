/**
 * The property tree model: dictionaries, arrays, and typed scalars
 * linked into a tree with strict single-ownership rules.
 * <p>
 * Start with {@link works.plist.tree.NodeFactory} to create nodes,
 * and attach them to {@link works.plist.tree.DictionaryNode dictionaries}
 * and {@link works.plist.tree.ArrayNode arrays}.
 * Every node has at most one parent; a tree is released as a whole
 * by calling {@link works.plist.tree.PlistNode#free() free} on its root.
 * <p>
 * Nothing in this package recurses in proportion to tree depth.
 */
package works.plist.tree;
