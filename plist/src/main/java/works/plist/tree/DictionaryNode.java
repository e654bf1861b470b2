package works.plist.tree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.plist.exceptions.PlistKindException;
import works.plist.exceptions.PlistMergeException;
import works.plist.exceptions.PlistNotFoundException;
import works.plist.exceptions.PlistOwnershipException;

import static java.util.Objects.requireNonNull;

/**
 * An ordered collection of uniquely named entries.
 * Each entry is a {@link KeyNode} owning one value.
 * <p>
 * Entries stay in insertion order. Replacing an entry does not keep its position:
 * the old entry is freed and the new one goes at the end.
 */
public final class DictionaryNode extends ContainerNode<KeyNode> {
	private final Map<String, KeyNode> keysByName = new HashMap<>();

	DictionaryNode(NodeFactory factory) {
		super(factory);
	}

	@Override
	public Kind kind() {
		return Kind.DICTIONARY;
	}

	/**
	 * Makes {@code value} the entry for {@code name}, taking ownership of it.
	 * Any existing entry for {@code name} is freed first.
	 * Modeled after {@code d[name] = value}.
	 *
	 * @throws PlistOwnershipException if {@code value} already has a parent,
	 * or is this dictionary or one of its ancestors
	 * @throws PlistKindException if {@code value} is a key
	 */
	public void set(String name, PlistNode value) {
		requireNonNull(name, "name");
		checkAttachable(value);

		// Allocate the wrapper before disturbing anything, so failure leaves us unchanged
		KeyNode key = factory.newEmptyKey(name);
		key.adoptChild(value);
		putEntry(key);
	}

	/**
	 * Detaches the value for {@code name} and hands it to the caller.
	 * The entry itself is removed.
	 *
	 * @return the detached value, now free-standing;
	 * or null if the entry had no value, because its value had been freed directly
	 * @throws PlistNotFoundException if there is no such entry
	 */
	public PlistNode pop(String name) {
		requireNonNull(name, "name");
		requireLive();
		KeyNode key = keysByName.get(name);
		if (key == null) {
			throw new PlistNotFoundException("No entry named \"" + name + "\"");
		}
		PlistNode value = key.value;
		if (value != null) {
			key.clearValue(value);
		}
		key.free();
		return value;
	}

	/**
	 * Removes and frees the entry for {@code name}, if there is one.
	 *
	 * @return true if an entry was removed;
	 * false if there was none, in which case the dictionary is unchanged
	 */
	public boolean delete(String name) {
		requireNonNull(name, "name");
		requireLive();
		KeyNode key = keysByName.get(name);
		if (key == null) {
			return false;
		}
		key.free();
		return true;
	}

	public boolean hasKey(String name) {
		requireNonNull(name, "name");
		requireLive();
		return keysByName.containsKey(name);
	}

	/**
	 * @return the value for {@code name}, still owned by this dictionary; or null if there's no such entry
	 */
	public PlistNode get(String name) {
		KeyNode key = getKey(name);
		return (key == null) ? null : key.value;
	}

	/**
	 * @return the entry for {@code name}, still owned by this dictionary; or null if there's no such entry
	 */
	public KeyNode getKey(String name) {
		requireNonNull(name, "name");
		requireLive();
		return keysByName.get(name);
	}

	/**
	 * @return the entry names in order
	 */
	public List<String> names() {
		requireLive();
		List<String> result = new ArrayList<>(count);
		for (KeyNode key: this) {
			result.add(key.name());
		}
		return result;
	}

	/**
	 * Merges entries from {@code other} into this dictionary,
	 * modeled after Python's {@code dict.update}.
	 * <p>
	 * {@code other} can be a dictionary (all its entries are merged),
	 * a single key, or an array of keys.
	 * Each entry is deep-copied, so {@code other} is left untouched and still owned by its caller;
	 * each copy is then inserted as though by {@link #set}.
	 * If any copy fails, the copies made so far are freed and this dictionary is unchanged.
	 *
	 * @throws PlistMergeException if {@code other} is any other kind,
	 * or is an array with an element that is not a key
	 */
	public void update(PlistNode other) {
		requireNonNull(other, "other");
		requireLive();
		other.requireLive();

		List<KeyNode> sources = new ArrayList<>();
		switch (other.kind()) {
			case DICTIONARY -> ((DictionaryNode) other).forEach(sources::add);
			case KEY -> sources.add((KeyNode) other);
			case ARRAY -> {
				for (PlistNode element: (ArrayNode) other) {
					if (element.kind() != Kind.KEY) {
						throw new PlistMergeException("Cannot merge array containing " + element.kind().displayName());
					}
					sources.add((KeyNode) element);
				}
			}
			default -> throw new PlistMergeException("Cannot merge " + other.kind().displayName() + " into dict");
		}

		List<KeyNode> copies = new ArrayList<>(sources.size());
		try {
			for (KeyNode source: sources) {
				copies.add((KeyNode) factory.copy(source));
			}
		} catch (RuntimeException | OutOfMemoryError e) {
			LOGGER.debug("Discarding {} partial copies after failed update", copies.size(), e);
			copies.forEach(PlistNode::free);
			throw e;
		}

		// Nothing below can fail
		copies.forEach(this::putEntry);
	}

	/**
	 * Links a parentless key at the tail, first freeing any existing entry with the same name.
	 */
	void putEntry(KeyNode key) {
		KeyNode existing = keysByName.get(key.name());
		if (existing != null) {
			existing.free();
		}
		linkLast(key);
	}

	@Override
	void childLinked(PlistNode child) {
		KeyNode key = (KeyNode) child;
		KeyNode previous = keysByName.put(key.name(), key);
		assert previous == null: "Duplicate key \"" + key.name() + "\"";
	}

	@Override
	void childUnlinked(PlistNode child) {
		keysByName.remove(((KeyNode) child).name());
	}

	@Override
	void adoptChild(PlistNode child) {
		// Only used when copying, where names are already known to be unique
		if (child.kind() != Kind.KEY) {
			throw new PlistKindException("A dict can only contain keys");
		}
		linkLast(child);
	}

	@Override
	void clearPayload() {
		keysByName.clear();
	}

	@Override
	DictionaryNode shallowCopy(NodeFactory factory) {
		return factory.newDictionary();
	}

	@Override
	public String toString() {
		return isFreed() ? "DictionaryNode(freed)" : "DictionaryNode" + names();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DictionaryNode.class);
}
