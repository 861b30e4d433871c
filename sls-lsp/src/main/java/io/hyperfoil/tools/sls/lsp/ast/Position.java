package io.hyperfoil.tools.sls.lsp.ast;

import org.yaml.snakeyaml.error.Mark;

/**
 * Zero-based (line, column) location in a document. Ordered lexicographically.
 */
public final class Position implements Comparable<Position> {

    private final int line;
    private final int col;

    public Position(int line, int col) {
        if (line < 0 || col < 0) {
            throw new IllegalArgumentException("negative position " + line + ":" + col);
        }
        this.line = line;
        this.col = col;
    }

    public static Position of(Mark mark) {
        return mark == null ? null : new Position(mark.getLine(), mark.getColumn());
    }

    public int getLine() {
        return line;
    }

    public int getCol() {
        return col;
    }

    public org.eclipse.lsp4j.Position toLsp() {
        return new org.eclipse.lsp4j.Position(line, col);
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Position)) {
            return false;
        }
        Position other = (Position) o;
        return line == other.line && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * line + col;
    }

    @Override
    public String toString() {
        return line + ":" + col;
    }
}
