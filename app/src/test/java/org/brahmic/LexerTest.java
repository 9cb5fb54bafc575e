package org.brahmic;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;
import java.util.stream.Collectors;

import com.google.gson.GsonBuilder;

class LexerTest {
    private static Span span(int from, int to) {
        return new Span(from, to);
    }

    private static Lexer lex(String input) {
        var lexer = new Lexer(input);
        lexer.lex();
        return lexer;
    }

    private static String toJson(Object tokens) {
        var gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(tokens);
    }

    private static List<String> texts(Lexer lexer) {
        return lexer.lexemes()
            .stream()
            .map(lexeme -> lexeme.token().toString())
            .collect(Collectors.toList());
    }

    @Test void simple() {
        var lexer = lex("x = 5");

        Map<Span, Object> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put(span(1, 1), Map.of("ident", "x"));
        expectedTokens.put(span(3, 3), Map.of("symbol", "="));
        expectedTokens.put(span(5, 5), Map.of("intLiteral", "5"));

        assertEquals(toJson(expectedTokens), toJson(lexer.tokenTable));
        assertTrue(lexer.errors.isEmpty());
    }

    @Test
    void keywordsCarryTheirMeaning() {
        var lexer = lex("okavela x aite:");

        Map<Span, Object> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put(span(1, 7), Map.of("keyword", "if"));
        expectedTokens.put(span(9, 9), Map.of("ident", "x"));
        expectedTokens.put(span(11, 14), Map.of("keyword", ""));
        expectedTokens.put(span(15, 15), Map.of("symbol", ":"));

        assertEquals(toJson(expectedTokens), toJson(lexer.tokenTable));
    }

    @Test
    void multiWordKeywordIsOneToken() {
        var lexer = lex("munduku   vellu");

        Map<Span, Object> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put(span(1, 15), Map.of("keyword", "continue"));

        assertEquals(toJson(expectedTokens), toJson(lexer.tokenTable));
    }

    @Test
    void elifWinsOverElse() {
        var lexer = lex("lekapothe okavela x:");

        assertEquals(
            List.of("Keyword: \"elif\"", "Ident: \"x\"", "Symbol: \":\""),
            texts(lexer)
        );
    }

    @Test
    void phraseWordsStayIdentifiersElsewhere() {
        // `varaku` alone is just a name, the phrase after it is still a keyword
        var lexer = lex("varaku < unnanta unnanta varaku:");

        assertEquals(
            List.of(
                "Ident: \"varaku\"",
                "Symbol: \"<\"",
                "Ident: \"unnanta\"",
                "Keyword: \"while\"",
                "Symbol: \":\""
            ),
            texts(lexer)
        );
    }

    @Test
    void phraseDoesNotSpanLines() {
        var lexer = lex("unnanta\nvaraku");

        assertEquals(
            List.of("Ident: \"unnanta\"", "Newline: 1", "Ident: \"varaku\""),
            texts(lexer)
        );
    }

    @Test
    void packedLoopHeader() {
        var lexer = lex("items lo x ki:");

        Map<Span, Object> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put(span(1, 13), Map.of("keyword", "for x in items"));
        expectedTokens.put(span(14, 14), Map.of("symbol", ":"));

        assertEquals(toJson(expectedTokens), toJson(lexer.tokenTable));
    }

    @Test
    void loopHeaderIsOnlyPackedAtLineStart() {
        var lexer = lex("x.items lo k ki:");

        assertEquals(
            List.of(
                "Ident: \"x\"",
                "Symbol: \".\"",
                "Ident: \"items\"",
                "Keyword: \"in\"",
                "Ident: \"k\"",
                "Keyword: \"\"",
                "Symbol: \":\""
            ),
            texts(lexer)
        );
    }

    @Test
    void loopHeaderIsOnlyPackedForPlainWords() {
        assertEquals(
            List.of(
                "Keyword: \"True\"",
                "Keyword: \"in\"",
                "Ident: \"i\"",
                "Keyword: \"\"",
                "Symbol: \":\""
            ),
            texts(lex("Nijam lo i ki:"))
        );
        assertEquals(
            List.of(
                "Int: \"1\"",
                "Ident: \"abc\"",
                "Keyword: \"in\"",
                "Ident: \"i\"",
                "Keyword: \"\"",
                "Symbol: \":\""
            ),
            texts(lex("1abc lo i ki:"))
        );
        assertEquals(List.of("Keyword: \"for i in 42\"", "Symbol: \":\""), texts(lex("42 lo i ki:")));
    }

    @Test
    void membershipIsNotTheLoopMarker() {
        var lexer = lex("3 in xs");

        assertEquals(
            List.of("Int: \"3\"", "Symbol: \"in\"", "Ident: \"xs\""),
            texts(lexer)
        );
    }

    @Test
    void twoCharSymbols() {
        var lexer = lex("a <= b != c");

        assertEquals(
            List.of(
                "Ident: \"a\"",
                "Symbol: \"<=\"",
                "Ident: \"b\"",
                "Symbol: \"!=\"",
                "Ident: \"c\""
            ),
            texts(lexer)
        );
    }

    @Test
    void blankLinesCollapseIntoOneNewline() {
        var lexer = lex("a\n\n  \nb");

        Map<Span, Object> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put(span(1, 1), Map.of("ident", "a"));
        expectedTokens.put(span(2, 6), Map.of("breaks", 3));
        expectedTokens.put(span(7, 7), Map.of("ident", "b"));

        assertEquals(toJson(expectedTokens), toJson(lexer.tokenTable));
        assertEquals(List.of(0, 2, 3, 6), lexer.lineIndex);
    }

    @Test
    void lineBreaksInsideParensAreIgnored() {
        var lexer = lex("f(1,\n  2)\nx");

        assertEquals(
            List.of(
                "Ident: \"f\"",
                "Symbol: \"(\"",
                "Int: \"1\"",
                "Symbol: \",\"",
                "Int: \"2\"",
                "Symbol: \")\"",
                "Newline: 1",
                "Ident: \"x\""
            ),
            texts(lexer)
        );

        var last = lexer.lexemes().get(lexer.lexemes().size() - 1);
        assertEquals(3, last.line());
    }

    @Test
    void strayCloseParenKeepsNewlines() {
        var lexer = lex(")\nx");

        assertEquals(
            List.of("Symbol: \")\"", "Newline: 1", "Ident: \"x\""),
            texts(lexer)
        );
        assertEquals(0, lexer.parenDepth);
    }

    @Test
    void stringEscapesAreDecoded() {
        var lexer = lex("s = \"a\\\"b\\n\\\\\"");

        var str = lexer.lexemes().get(2).token();
        assertInstanceOf(StrLiteral.class, str);
        assertEquals("a\"b\n\\", str.text());
    }

    @Test
    void invalidSymbolIsReported() {
        var lexer = lex("x = 5 # 2");

        assertEquals(1, lexer.errors.size());
        var error = lexer.errors.get(0);
        assertEquals("E101", error.code());
        assertEquals("#", error.lexeme());
        assertEquals(1, error.line());
        assertEquals(7, error.column());
        assertTrue(error.getMessage().contains("E101"));

        // lexing went on after the bad character
        assertEquals(
            List.of("Ident: \"x\"", "Symbol: \"=\"", "Int: \"5\"", "Int: \"2\""),
            texts(lexer)
        );
    }

    @Test
    void loneBangIsReported() {
        var lexer = lex("a ! b");

        assertEquals(1, lexer.errors.size());
        assertEquals("E101", lexer.errors.get(0).code());
    }

    @Test
    void unclosedStringIsReported() {
        var lexer = lex("x = 1\ny = \"Hello");

        assertEquals(1, lexer.errors.size());
        var error = lexer.errors.get(0);
        assertEquals("E103", error.code());
        assertEquals(2, error.line());
        assertEquals(5, error.column());

        // only the quote is skipped
        var last = lexer.lexemes().get(lexer.lexemes().size() - 1);
        assertEquals(new Ident("Hello"), last.token());
    }

    @Test
    void lexemesKnowTheirLines() {
        var lexer = lex("a = 1\n\nb = 2");

        var lines = lexer.lexemes()
            .stream()
            .filter(lexeme -> lexeme.token() instanceof Ident)
            .map(Lexeme::line)
            .collect(Collectors.toList());

        assertEquals(List.of(1, 3), lines);
    }

    @Test
    void jsonDumpMatchesTokenTable() {
        var lexer = lex("(x) cheppu");

        Map<Span, Object> expectedTokens = new LinkedHashMap<>();
        expectedTokens.put(span(1, 1), Map.of("symbol", "("));
        expectedTokens.put(span(2, 2), Map.of("ident", "x"));
        expectedTokens.put(span(3, 3), Map.of("symbol", ")"));
        expectedTokens.put(span(5, 10), Map.of("keyword", "print"));

        assertEquals(toJson(expectedTokens), lexer.toJson());
    }
}
