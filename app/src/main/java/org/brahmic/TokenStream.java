package org.brahmic;

import java.util.List;

/**
 * Cursor over an immutable list of lexemes.
 *
 * Lookahead never consumes: predicates peek at any offset, and speculative
 * scans restore the cursor with {@link #rollback(int)}.
 */
public class TokenStream {
    private final List<Lexeme> lexemes;
    private int numToken = 0;

    public TokenStream(List<Lexeme> lexemes) {
        this.lexemes = List.copyOf(lexemes);
    }

    // null past the end
    public Lexeme peek(int offset) {
        var index = this.numToken + offset;
        if (index < 0 || index >= this.lexemes.size()) {
            return null;
        }
        return this.lexemes.get(index);
    }

    public Lexeme peek() {
        return peek(0);
    }

    public Token peekToken(int offset) {
        var lexeme = peek(offset);
        return lexeme == null ? null : lexeme.token();
    }

    public Token peekToken() {
        return peekToken(0);
    }

    public Lexeme nextPair() {
        var lexeme = peek();
        if (lexeme != null) {
            this.numToken += 1;
        }
        return lexeme;
    }

    public void backPair() {
        this.numToken -= 1;
    }

    public boolean atEnd() {
        return this.numToken >= this.lexemes.size();
    }

    public int checkpoint() {
        return this.numToken;
    }

    public void rollback(int checkpoint) {
        this.numToken = checkpoint;
    }

    // last consumed lexeme, or the first one before anything was consumed
    public Lexeme last() {
        if (this.lexemes.isEmpty()) {
            return null;
        }
        return this.lexemes.get(Math.max(0, this.numToken - 1));
    }

    public int remaining() {
        return Math.max(0, this.lexemes.size() - this.numToken);
    }
}
