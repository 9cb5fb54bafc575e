package org.brahmic;

// Every token carries the text the parser works with. For keywords that is the
// resolved target meaning ("if", "while", "for i in items"), never the surface
// spelling.
public sealed interface Token
        permits Keyword, Ident, IntLiteral, StrLiteral, Symbol, Newline {
    String text();
}

record Keyword(String keyword) implements Token {
    boolean isKeyword(String other) {
        return keyword.equals(other);
    }

    // pure syntactic markers (`aite`, `ki`) resolve to nothing
    boolean isMarker() {
        return keyword.isEmpty();
    }

    @Override
    public String text() {
        return keyword;
    }

    @Override
    public String toString() {
        return "Keyword: " + '"' + keyword + '"';
    }
}

record Ident(String ident) implements Token {
    @Override
    public String text() {
        return ident;
    }

    @Override
    public String toString() {
        return "Ident: " + '"' + ident + '"';
    }
}

record IntLiteral(String intLiteral) implements Token {
    @Override
    public String text() {
        return intLiteral;
    }

    @Override
    public String toString() {
        return "Int: " + '"' + intLiteral + '"';
    }
}

// holds the decoded value, outer quotes stripped
record StrLiteral(String strLiteral) implements Token {
    @Override
    public String text() {
        return strLiteral;
    }

    @Override
    public String toString() {
        return "Str: " + '"' + strLiteral + '"';
    }
}

record Symbol(String symbol) implements Token {
    boolean isSym(String other) {
        return symbol.equals(other);
    }

    @Override
    public String text() {
        return symbol;
    }

    @Override
    public String toString() {
        return "Symbol: " + '"' + symbol + '"';
    }
}

// A run of line breaks at paren depth zero. `breaks` > 1 means the run
// contained at least one blank line.
record Newline(int breaks) implements Token {
    boolean isBlankLine() {
        return breaks > 1;
    }

    @Override
    public String text() {
        return "\n".repeat(breaks);
    }

    @Override
    public String toString() {
        return "Newline: " + breaks;
    }
}
