package org.brahmic;

import java.util.Optional;

// A header that is almost a known construct but misses a trailing marker
public class IncompleteConstructError extends SyntaxError {
    public IncompleteConstructError(Optional<Token> token, Position position, String hint) {
        super(token, position, hint);
    }
}
