/**
 * Exceptions thrown by the property tree model and its text codecs.
 * All are unchecked and extend {@link works.plist.exceptions.PlistException}.
 */
package works.plist.exceptions;
