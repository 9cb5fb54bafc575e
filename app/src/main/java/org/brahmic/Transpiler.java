package org.brahmic;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tenglish in, Python out: lex, parse, render.
 *
 * Lexical errors are collected and handed back with the result, a
 * {@link SyntaxError} escapes as is.
 */
public class Transpiler {
    private static final Logger log = LogManager.getLogger("transpiler");

    public record Result(String python, ST tree, List<LexicalError> lexicalErrors) {
        public Result {
            lexicalErrors = List.copyOf(lexicalErrors);
        }

        public boolean hasLexicalErrors() {
            return !lexicalErrors.isEmpty();
        }
    }

    public static Result transpile(String source) {
        var lexer = new Lexer(source);
        lexer.lex();
        log.debug("lexed {} tokens, {} errors", lexer.tokenTable.size(), lexer.errors.size());

        var parser = new Parser(lexer.lexemes(), lexer.lineIndex, source);
        var tree = parser.parse();
        log.debug("parsed {} top-level statements", tree.stmts().size());

        var python = tree.render();
        return new Result(python, tree, lexer.errors);
    }

    // Python text only, for callers that do not care about lexical errors
    public static String toPython(String source) {
        return transpile(source).python();
    }
}
