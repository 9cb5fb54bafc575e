package org.brahmic;

import java.util.Comparator;

// Character span of a lexeme: 1-based start offset and inclusive end offset
public record Span(int start, int end) implements Comparable<Span> {
    @Override
    public String toString() {
        return String.format("(%d, %d)", start, end);
    }

    @Override
    public int compareTo(Span other) {
        return Comparator.comparingInt(Span::start)
            .thenComparingInt(Span::end)
            .compare(this, other);
    }
}
