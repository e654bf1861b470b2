/**
 * The property list text format.
 * {@link works.plist.codec.text.PlistTextDecoder} builds a tree from text delivered
 * in chunks of any size, resuming wherever the previous chunk left off;
 * {@link works.plist.codec.text.PlistTextEncoder} writes a tree back out.
 * {@link works.plist.codec.text.PlistDumper} is for humans only.
 */
package works.plist.codec.text;
