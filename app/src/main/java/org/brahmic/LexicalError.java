package org.brahmic;

/**
 * A character sequence the lexer could not turn into a token.
 *
 * The lexer never throws these: it skips the offending character, records the
 * error and keeps going. Callers decide whether a non-empty error list is fatal.
 */
public class LexicalError extends RuntimeException {
    private final String code;
    private final String lexeme;
    private final int line;
    private final int column;

    public LexicalError(String code, String reason, String lexeme, Position position) {
        super(String.format("%s: at %d,%d %s: %s",
            code, position.line(), position.column(), reason, lexeme));
        this.code = code;
        this.lexeme = lexeme;
        this.line = position.line();
        this.column = position.column();
    }

    public String code() {
        return code;
    }

    public String lexeme() {
        return lexeme;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
