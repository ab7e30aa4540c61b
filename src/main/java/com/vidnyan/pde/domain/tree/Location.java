package com.vidnyan.pde.domain.tree;

/**
 * Source code location.
 */
public record Location(
    String filePath,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    public static final Location UNKNOWN = new Location("", 0, 0, 0, 0);

    /**
     * Create a location with just line information.
     */
    public static Location at(String filePath, int line, int column) {
        return new Location(filePath, line, column, line, column);
    }

    /**
     * Copy of this location attributed to another file.
     */
    public Location inFile(String otherFilePath) {
        return new Location(otherFilePath, line, column, endLine, endColumn);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}
