package works.plist.tree;

import java.util.Arrays;

/**
 * Binary data. The bytes are copied on the way in and on the way out,
 * so the node's contents can't be changed behind its back.
 */
public final class DataNode extends PlistNode {
	private byte[] bytes;

	DataNode(NodeFactory factory, byte[] bytes) {
		super(factory);
		this.bytes = bytes.clone();
	}

	@Override
	public Kind kind() {
		return Kind.DATA;
	}

	public byte[] bytes() {
		requireLive();
		return bytes.clone();
	}

	public int length() {
		requireLive();
		return bytes.length;
	}

	/**
	 * @return the byte at {@code index}, without copying the whole buffer
	 */
	public byte byteAt(int index) {
		requireLive();
		return bytes[index];
	}

	@Override
	DataNode shallowCopy(NodeFactory factory) {
		return factory.newData(bytes);
	}

	@Override
	boolean payloadEquals(PlistNode other) {
		return Arrays.equals(bytes, ((DataNode) other).bytes);
	}

	@Override
	void clearPayload() {
		bytes = null;
	}

	@Override
	public String toString() {
		return isFreed() ? "DataNode(freed)" : "DataNode[length=" + bytes.length + "]";
	}
}
