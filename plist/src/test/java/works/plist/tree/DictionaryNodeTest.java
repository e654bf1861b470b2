package works.plist.tree;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.plist.exceptions.PlistKindException;
import works.plist.exceptions.PlistMergeException;
import works.plist.exceptions.PlistNotFoundException;
import works.plist.exceptions.PlistOwnershipException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DictionaryNodeTest {
	TrackingNodeFactory factory;
	DictionaryNode dict;

	@BeforeEach
	void setup() {
		factory = new TrackingNodeFactory();
		dict = factory.newDictionary();
	}

	@Test
	void set_get() {
		IntegerNode one = factory.newInteger(1);
		dict.set("one", one);
		assertSame(one, dict.get("one"));
		assertTrue(dict.hasKey("one"));
		assertEquals(1, dict.size());

		KeyNode key = dict.getKey("one");
		assertEquals("one", key.name());
		assertSame(key, one.parent());
		assertSame(dict, key.parent());
	}

	@Test
	void get_missing_null() {
		assertNull(dict.get("nope"));
		assertNull(dict.getKey("nope"));
		assertFalse(dict.hasKey("nope"));
	}

	@Test
	void names_insertionOrder() {
		dict.set("b", factory.newInteger(1));
		dict.set("a", factory.newInteger(2));
		dict.set("c", factory.newInteger(3));
		assertEquals(List.of("b", "a", "c"), dict.names());
	}

	@Test
	void set_existingName_replacesAtEnd() {
		IntegerNode original = factory.newInteger(1);
		dict.set("a", original);
		dict.set("b", factory.newInteger(2));
		IntegerNode replacement = factory.newInteger(3);
		dict.set("a", replacement);

		assertEquals(List.of("b", "a"), dict.names());
		assertSame(replacement, dict.get("a"));
		assertTrue(original.isFreed());
		assertEquals(2, dict.size());
	}

	@Test
	void set_attachedValue_rejected() {
		ArrayNode array = factory.newArray();
		IntegerNode value = factory.newInteger(1);
		array.append(value);

		assertThrows(PlistOwnershipException.class, () -> dict.set("a", value));
		assertTrue(dict.isEmpty());
		assertSame(array, value.parent());
	}

	@Test
	void set_sameNodeTwice_rejected() {
		IntegerNode value = factory.newInteger(1);
		dict.set("a", value);
		assertThrows(PlistOwnershipException.class, () -> dict.set("b", value));
		assertEquals(List.of("a"), dict.names());
	}

	@Test
	void set_key_rejected() {
		KeyNode key = factory.newKey("k", factory.newInteger(1));
		assertThrows(PlistKindException.class, () -> dict.set("k", key));
	}

	@Test
	void set_self_rejected() {
		assertThrows(PlistOwnershipException.class, () -> dict.set("me", dict));
	}

	@Test
	void set_ancestor_rejected() {
		DictionaryNode child = factory.newDictionary();
		dict.set("child", child);
		DictionaryNode grandchild = factory.newDictionary();
		child.set("grandchild", grandchild);

		// dict is the root, so it isn't attached; only the ancestry check can stop this
		assertThrows(PlistOwnershipException.class, () -> grandchild.set("loop", dict));
		assertTrue(grandchild.isEmpty());
	}

	@Test
	void set_failedAllocation_leavesDictionaryUnchanged() {
		dict.set("a", factory.newInteger(1));
		IntegerNode value = factory.newInteger(2);
		factory.failAfter(0);
		assertThrows(OutOfMemoryError.class, () -> dict.set("a", value));
		factory.stopFailing();

		assertEquals(1L, ((IntegerNode) dict.get("a")).value());
		assertFalse(value.isAttached());
		assertFalse(value.isFreed());
	}

	@Test
	void pop_detachesValue() {
		StringNode value = factory.newString("v");
		dict.set("k", value);
		int before = factory.liveCount();

		PlistNode popped = dict.pop("k");
		assertSame(value, popped);
		assertNull(popped.parent());
		assertFalse(popped.isFreed());
		assertFalse(dict.hasKey("k"));
		assertEquals(before - 1, factory.liveCount(), "The key wrapper should be freed");

		popped.free();
		dict.free();
		factory.assertNoLeaks();
	}

	@Test
	void pop_missing_notFound() {
		assertThrows(PlistNotFoundException.class, () -> dict.pop("missing"));
	}

	@Test
	void pop_keyWhoseValueWasFreed_null() {
		IntegerNode value = factory.newInteger(1);
		dict.set("k", value);
		value.free();
		assertTrue(dict.hasKey("k"));
		assertNull(dict.getKey("k").value());

		assertNull(dict.pop("k"));
		assertFalse(dict.hasKey("k"));
	}

	@Test
	void delete() {
		IntegerNode value = factory.newInteger(1);
		dict.set("a", value);
		dict.set("b", factory.newInteger(2));

		assertTrue(dict.delete("a"));
		assertTrue(value.isFreed());
		assertEquals(List.of("b"), dict.names());
	}

	@Test
	void delete_missing_unchanged() {
		dict.set("a", factory.newInteger(1));
		assertFalse(dict.delete("b"));
		assertEquals(List.of("a"), dict.names());
	}

	@Test
	void delete_emptyDictionary_false() {
		assertFalse(dict.delete("a"));
		assertTrue(dict.isEmpty());
	}

	@Test
	void pop_emptyDictionary_notFound() {
		assertThrows(PlistNotFoundException.class, () -> dict.pop("a"));
		assertTrue(dict.isEmpty());
	}

	@Test
	void freeValue_keepsKey() {
		ArrayNode array = factory.newArray();
		dict.set("a", array);
		array.free();
		assertTrue(dict.hasKey("a"));
		assertNull(dict.get("a"));
	}

	@Test
	void freeKey_removesEntry() {
		dict.set("a", factory.newInteger(1));
		dict.set("b", factory.newInteger(2));
		dict.getKey("a").free();
		assertEquals(List.of("b"), dict.names());
	}

	@Test
	void update_fromDictionary() {
		dict.set("a", factory.newInteger(1));
		dict.set("b", factory.newInteger(2));

		DictionaryNode other = factory.newDictionary();
		other.set("b", factory.newInteger(20));
		ArrayNode array = factory.newArray();
		array.append(factory.newString("x"));
		other.set("c", array);

		dict.update(other);

		assertEquals(List.of("a", "b", "c"), dict.names());
		assertEquals(20L, ((IntegerNode) dict.get("b")).value());
		assertNotSame(array, dict.get("c"));
		assertTrue(PlistNode.contentEquals(array, dict.get("c")));

		// Source untouched and still owned by the caller
		assertEquals(List.of("b", "c"), other.names());
		assertSame(array, other.get("c"));
		assertNull(other.parent());
	}

	@Test
	void update_fromKey() {
		KeyNode key = factory.newKey("k", factory.newString("v"));
		dict.update(key);
		assertEquals("v", ((StringNode) dict.get("k")).value());
		assertNotSame(key, dict.getKey("k"));
		assertFalse(key.isFreed());
	}

	@Test
	void update_fromArrayOfKeys() {
		ArrayNode array = factory.newArray();
		// Arrays reject keys, so the only array of keys we can make is an empty one
		dict.set("a", factory.newInteger(1));
		dict.update(array);
		assertEquals(List.of("a"), dict.names());
	}

	@Test
	void update_wrongKind_rejected() {
		assertThrows(PlistMergeException.class, () -> dict.update(factory.newInteger(1)));
		assertThrows(PlistMergeException.class, () -> dict.update(factory.newString("s")));
	}

	@Test
	void update_arrayOfValues_rejected() {
		ArrayNode array = factory.newArray();
		array.append(factory.newInteger(1));
		assertThrows(PlistMergeException.class, () -> dict.update(array));
		assertTrue(dict.isEmpty());
	}

	@Test
	void update_failedCopy_rollsBack() {
		dict.set("a", factory.newInteger(1));
		DictionaryNode other = factory.newDictionary();
		other.set("a", factory.newInteger(10));
		other.set("b", factory.newInteger(20));
		other.set("c", factory.newInteger(30));
		int before = factory.liveCount();

		// Enough for the first two entries (key plus value each), but not the third
		factory.failAfter(4);
		assertThrows(OutOfMemoryError.class, () -> dict.update(other));
		factory.stopFailing();

		assertEquals(before, factory.liveCount(), "Partial copies should be freed");
		assertEquals(List.of("a"), dict.names());
		assertEquals(1L, ((IntegerNode) dict.get("a")).value());
	}

	@Test
	void freedDictionary_unusable() {
		dict.free();
		assertTrue(dict.isFreed());
		assertThrows(IllegalStateException.class, () -> dict.get("a"));
		assertThrows(IllegalStateException.class, () -> dict.set("a", factory.newInteger(1)));
		assertThrows(IllegalStateException.class, dict::size);
		assertThrows(IllegalStateException.class, dict::free);
	}

	@Test
	void nullName_rejected() {
		assertThrows(NullPointerException.class, () -> dict.set(null, factory.newInteger(1)));
		assertThrows(NullPointerException.class, () -> dict.get(null));
		assertThrows(NullPointerException.class, () -> dict.delete(null));
		assertThrows(NullPointerException.class, () -> dict.pop(null));
	}
}
