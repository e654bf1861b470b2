package works.plist.codec.text;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import works.plist.tree.ArrayNode;
import works.plist.tree.DictionaryNode;
import works.plist.tree.NodeFactory;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PlistDumperTest {
	final NodeFactory factory = new NodeFactory();

	static final String I1 = PlistDumper.INDENT;
	static final String I2 = I1.repeat(2);
	static final String I3 = I1.repeat(3);

	@Test
	void nestedStructure() {
		DictionaryNode dict = factory.newDictionary();
		dict.set("n", factory.newInteger(1));
		ArrayNode array = factory.newArray();
		array.append(factory.newString("s"));
		array.append(factory.newBoolean(true));
		array.append(factory.newReal(0.5));
		dict.set("list", array);
		dict.set("when", factory.newDate(OffsetDateTime.of(2020, 5, 6, 7, 8, 9, 0, ZoneOffset.ofHours(-7))));

		String expected = "dict\n"
			+ I1 + "key=n\n"
			+ I2 + "integer=1\n"
			+ I1 + "key=list\n"
			+ I2 + "array\n"
			+ I3 + "string=s\n"
			+ I3 + "boolean=true\n"
			+ I3 + "real=0.5\n"
			+ I1 + "key=when\n"
			+ I2 + "date=2020-05-06T07:08:09-07:00\n";
		assertEquals(expected, PlistDumper.dumpToString(dict));
	}

	@Test
	void data_hexDump() {
		DictionaryNode dict = factory.newDictionary();
		dict.set("d", factory.newData("Hello".getBytes(US_ASCII)));

		String hex = "48 65 6c 6c 6f " + "   ".repeat(11);
		String expected = "dict\n"
			+ I1 + "key=d\n"
			+ I2 + "data=5\n"
			+ I3 + "0000  " + hex + " Hello\n";
		assertEquals(expected, PlistDumper.dumpToString(dict));
	}

	@Test
	void data_multipleRows_nonPrintable() {
		byte[] bytes = new byte[18];
		for (int i = 0; i < bytes.length; i++) {
			bytes[i] = (byte) ('A' + i);
		}
		bytes[1] = 0;
		bytes[17] = (byte) 0xff;

		String expected = "data=18\n"
			+ I1 + "0000  41 00 43 44 45 46 47 48 49 4a 4b 4c 4d 4e 4f 50  A.CDEFGHIJKLMNOP\n"
			+ I1 + "0010  51 ff " + "   ".repeat(14) + " Q.\n";
		assertEquals(expected, PlistDumper.dumpToString(factory.newData(bytes)));
	}

	@Test
	void emptyData_noRows() {
		assertEquals("data=0\n", PlistDumper.dumpToString(factory.newData(new byte[0])));
	}
}
