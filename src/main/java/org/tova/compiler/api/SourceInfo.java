package org.tova.compiler.api;

/**
 * A location in Tova source code.
 *
 * @param fileName     The logical name of the source file.
 * @param lineNumber   The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /**
     * Returns a location that carries only a file name. Used for synthesized nodes.
     * @param fileName The logical file name.
     * @return A location at line 0, column 0.
     */
    public static SourceInfo synthetic(String fileName) {
        return new SourceInfo(fileName, 0, 0);
    }

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
