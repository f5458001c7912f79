package org.pragmatica.veq.tree;

/**
 * A range of columns in the equation text from start (inclusive) to end (exclusive).
 * Columns are 0-based.
 */
public record SourceSpan(int start, int end) {

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(int position) {
        return new SourceSpan(position, position);
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
