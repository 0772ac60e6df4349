package com.descant;

/**
 * A one-based line/column position in program source.
 *
 * Positions order by line first, then column. Code synthesized by
 * metafunctions is lexed with negative line numbers so it never collides
 * with a user position.
 */
public record SourcePosition(int lineno, int colno) implements Comparable<SourcePosition> {

    public static final SourcePosition NONE = new SourcePosition(0, 0);

    public SourcePosition shifted(int columns) {
        return new SourcePosition(lineno, colno + columns);
    }

    public boolean isGenerated() {
        return lineno < 0;
    }

    @Override
    public int compareTo(SourcePosition that) {
        if (lineno != that.lineno) {
            return Integer.compare(lineno, that.lineno);
        }
        return Integer.compare(colno, that.colno);
    }

    @Override
    public String toString() {
        return "(" + lineno + "," + colno + ")";
    }
}
