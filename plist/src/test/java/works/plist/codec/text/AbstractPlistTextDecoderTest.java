package works.plist.codec.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.Parameter;
import works.plist.codec.text.PlistTextDecoder.Status;
import works.plist.tree.PlistNode;
import works.plist.tree.TrackingNodeFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Base for decoder tests that should behave identically
 * no matter how the input is split into chunks.
 */
public class AbstractPlistTextDecoderTest {
	@Parameter
	Function<byte[], List<Slice>> chunker;

	TrackingNodeFactory factory;

	@BeforeEach
	void setupFactory() {
		factory = new TrackingNodeFactory();
	}

	/**
	 * A region of an array to pass to {@link PlistTextDecoder#parse(byte[], int, int)}.
	 */
	record Slice(byte[] array, int offset, int length) { }

	PlistTextDecoder newDecoder() {
		return new PlistTextDecoder(factory);
	}

	/**
	 * @return the status from the last chunk
	 */
	Status feed(PlistTextDecoder decoder, byte[] input) {
		Status status = Status.NEED_MORE;
		for (Slice slice: chunker.apply(input)) {
			status = decoder.parse(slice.array(), slice.offset(), slice.length());
		}
		return status;
	}

	Status feed(PlistTextDecoder decoder, String input) {
		return feed(decoder, input.getBytes(UTF_8));
	}

	PlistNode decode(String input) {
		return decode(input.getBytes(UTF_8));
	}

	PlistNode decode(byte[] input) {
		try (PlistTextDecoder decoder = newDecoder()) {
			feed(decoder, input);
			decoder.finish();
			return decoder.result();
		}
	}

	@SuppressWarnings("unused") // Subclasses use this to parameterize tests
	static Stream<Function<byte[], List<Slice>>> chunkers() {
		return Stream.of(
			new Whole(),
			new FixedSize(1),
			new FixedSize(2),
			new FixedSize(3),
			new FixedSize(7),
			new Padded()
		);
	}

	static final class Whole implements Function<byte[], List<Slice>> {
		@Override
		public List<Slice> apply(byte[] bytes) {
			return List.of(new Slice(bytes, 0, bytes.length));
		}

		@Override
		public String toString() {
			return "Whole";
		}
	}

	static final class FixedSize implements Function<byte[], List<Slice>> {
		final int size;

		FixedSize(int size) {
			this.size = size;
		}

		@Override
		public List<Slice> apply(byte[] bytes) {
			List<Slice> result = new ArrayList<>();
			for (int start = 0; start < bytes.length; start += size) {
				byte[] chunk = new byte[Math.min(size, bytes.length - start)];
				System.arraycopy(bytes, start, chunk, 0, chunk.length);
				result.add(new Slice(chunk, 0, chunk.length));
			}
			return result;
		}

		@Override
		public String toString() {
			return "Chunks of " + size;
		}
	}

	/**
	 * Chunks that sit in the middle of a larger array surrounded by junk,
	 * to check that the decoder respects the offset and length it's given.
	 */
	static final class Padded implements Function<byte[], List<Slice>> {
		static final int CHUNK_SIZE = 5;
		static final int PADDING = 3;

		@Override
		public List<Slice> apply(byte[] bytes) {
			List<Slice> result = new ArrayList<>();
			for (int start = 0; start < bytes.length; start += CHUNK_SIZE) {
				int length = Math.min(CHUNK_SIZE, bytes.length - start);
				byte[] array = new byte[length + 2 * PADDING];
				Arrays.fill(array, (byte) '!');
				System.arraycopy(bytes, start, array, PADDING, length);
				result.add(new Slice(array, PADDING, length));
			}
			return result;
		}

		@Override
		public String toString() {
			return "Padded chunks of " + CHUNK_SIZE;
		}
	}
}
