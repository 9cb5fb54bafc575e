package org.brahmic;

// A token together with where it came from. `line` is 1-based.
public record Lexeme(Span span, Token token, int line) {
    @Override
    public String toString() {
        return String.format("%s at line %d %s", token, line, span);
    }
}
