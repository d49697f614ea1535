package org.shadowide.st.symbol;

/**
 * An identifier occurrence. Line is 1-based, column 0-based.
 */
public final class StReference {

    private final int line;
    private final int column;
    private final int length;

    public StReference(int line, int column, int length) {
        this.line = line;
        this.column = column;
        this.length = length;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getLength() {
        return length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StReference)) {
            return false;
        }
        StReference that = (StReference) o;
        return line == that.line && column == that.column && length == that.length;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * line + column) + length;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
