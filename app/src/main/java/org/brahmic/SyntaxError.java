package org.brahmic;

import java.text.MessageFormat;
import java.util.Optional;

/**
 * Structural failure of the parse. Always fatal: no tree is produced.
 *
 * Carries the offending token (empty at end of input), where it is, and a hint
 * naming the rule that was broken.
 */
public class SyntaxError extends RuntimeException {
    private final Optional<Token> token;
    private final int line;
    private final int column;
    private final String hint;

    public SyntaxError(Optional<Token> token, Position position, String hint) {
        super(MessageFormat.format("""
> At {0} unexpected {1}.
> Hint: {2}""",
            position.line() + "," + position.column(),
            token.map(t -> "token: " + t).orElse("end of input"),
            hint));
        this.token = token;
        this.line = position.line();
        this.column = position.column();
        this.hint = hint;
    }

    public Optional<Token> token() {
        return token;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String hint() {
        return hint;
    }
}
