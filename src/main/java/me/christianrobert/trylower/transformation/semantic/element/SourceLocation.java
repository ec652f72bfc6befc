package me.christianrobert.trylower.transformation.semantic.element;

import java.util.Objects;

/**
 * Position of a node in the host source file.
 */
public class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    private final String file;
    private final int line;
    private final int column;

    public SourceLocation(String file, int line, int column) {
        if (file == null || file.trim().isEmpty()) {
            throw new IllegalArgumentException("File cannot be null or empty");
        }
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Line and column cannot be negative");
        }
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
