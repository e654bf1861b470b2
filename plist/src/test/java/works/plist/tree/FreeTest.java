package works.plist.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FreeTest {
	TrackingNodeFactory factory;

	@BeforeEach
	void setupFactory() {
		factory = new TrackingNodeFactory();
	}

	@Test
	void freeRoot_releasesSubtree() {
		DictionaryNode root = factory.newDictionary();
		ArrayNode array = factory.newArray();
		array.append(factory.newInteger(1));
		array.append(factory.newInteger(2));
		root.set("array", array);
		root.set("s", factory.newString("s"));
		int total = factory.liveCount();

		root.free();
		assertEquals(total, factory.releasedCount());
		factory.assertNoLeaks();
		assertTrue(array.isFreed());
	}

	@Test
	void freeAttached_detachesFromParent() {
		ArrayNode root = factory.newArray();
		ArrayNode child = factory.newArray();
		child.append(factory.newString("inside"));
		root.append(factory.newInteger(0));
		root.append(child);
		root.append(factory.newInteger(2));

		child.free();
		assertEquals(2, root.size());
		assertEquals(2L, ((IntegerNode) root.get(1)).value());
		assertEquals(3, factory.liveCount());

		root.free();
		factory.assertNoLeaks();
	}

	@Test
	void freeKeyValue_keyRemains() {
		KeyNode key = factory.newKey("k", factory.newString("v"));
		key.value().free();
		assertNull(key.value());
		assertEquals(1, factory.liveCount());
		key.free();
		factory.assertNoLeaks();
	}

	@Test
	void doubleFree_rejected() {
		IntegerNode node = factory.newInteger(1);
		node.free();
		assertThrows(IllegalStateException.class, node::free);
	}

	@Test
	void freedNode_accessorsRejected() {
		StringNode node = factory.newString("s");
		node.free();
		assertTrue(node.isFreed());
		assertThrows(IllegalStateException.class, node::value);
		assertThrows(IllegalStateException.class, node::parent);
		assertThrows(IllegalStateException.class, node::copy);
	}

	@Test
	void freeDeepTree() {
		int depth = 200_000;
		DictionaryNode deep = factory.newDictionary();
		for (int i = 0; i < depth; i++) {
			DictionaryNode outer = factory.newDictionary();
			outer.set("d", deep);
			deep = outer;
		}
		deep.free();
		factory.assertNoLeaks();
	}

	@Test
	void freeWideTree() {
		ArrayNode wide = factory.newArray();
		for (int i = 0; i < 100_000; i++) {
			wide.append(factory.newInteger(i));
		}
		wide.free();
		factory.assertNoLeaks();
	}
}
