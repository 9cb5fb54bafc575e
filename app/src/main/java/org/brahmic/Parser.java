package org.brahmic;

import java.math.BigInteger;
import java.util.*;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class Parser {
    // words that start or close a statement on their own, a postfix `ivvu`
    // scan never looks past them
    static final Set<String> statementKeywords = Set.of(
        "if", "elif", "else", "def", "while", "break", "continue", "print"
    );

    /*
     * Parser state
     */
    TokenStream stream;

    /*
     * Output
     */
    public ST parseTree = new ST(List.of());

    /*
     * Parser data
     */
    final List<Lexeme> lexemes;
    final List<Integer> lineIndex;
    // without the source text blocks end only at blank lines or else/elif
    final String sourceCode;

    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("parser");

    public Parser(List<Lexeme> lexemes, List<Integer> lineIndex, String sourceCode) {
        this.lexemes = List.copyOf(lexemes);
        this.lineIndex = lineIndex;
        this.sourceCode = sourceCode;
        this.stream = new TokenStream(this.lexemes);
    }

    public Parser(List<Lexeme> lexemes) {
        this(lexemes, null, null);
    }

    public ST parse() {
        log.debug("parse prog");
        this.stream = new TokenStream(this.lexemes);

        var stmts = new ArrayList<ST.Stmt>();
        while (!this.stream.atEnd()) {
            if (this.stream.peekToken() instanceof Newline) {
                this.stream.nextPair();
                continue;
            }
            stmts.add(this.parseStmt());
            log.debug("parsed statement {}", stmts.size());
        }

        this.parseTree = new ST(stmts);
        return this.parseTree;
    }

    /*
     * Statements
     */

    ST.Stmt parseStmt() {
        var first = this.stream.peek();
        var headerIndent = this.indentOf(first);

        // 1. statements introduced by a keyword
        if (first.token() instanceof Keyword kw) {
            var stmt = this.parseKeywordStmt(first, kw, headerIndent);
            if (stmt != null) {
                return stmt;
            }
        }

        // 2. (args) cheppu
        if (this.isPostfixPrint()) {
            return this.parsePostfixPrint();
        }

        // 3. expr ivvu
        if (this.isPostfixReturn()) {
            return this.parsePostfixReturn();
        }

        // 4. iterable lo var ki:
        if (this.isForLoop()) {
            return this.parseForStmt(headerIndent);
        }

        // 5. cond unnanta varaku:
        if (this.isWhileLoop()) {
            return this.parseWhileStmt(headerIndent);
        }

        // 6. name = expr
        if (first.token() instanceof Ident && isSym(this.stream.peekToken(1), "=")) {
            return this.parseAssignStmt();
        }

        // 7. anything else has to be a bare expression
        this.checkIncompleteHeaders();
        return this.parseExprStmt();
    }

    // Returns null for keywords that may start an expression.
    ST.Stmt parseKeywordStmt(Lexeme first, Keyword kw, int headerIndent) {
        switch (kw.keyword()) {
            case "if" -> {
                return this.parseIfStmt(headerIndent);
            }
            case "def" -> {
                return this.parseFuncStmt(headerIndent);
            }
            case "return" -> {
                return this.parsePrefixReturn();
            }
            case "break" -> {
                this.stream.nextPair();
                this.expectStatementEnd();
                return new ST.BreakStmt();
            }
            case "continue" -> {
                this.stream.nextPair();
                this.expectStatementEnd();
                return new ST.ContinueStmt();
            }
            case "True", "False", "not" -> {
                return null;
            }
            case "else", "elif" -> throw fail(
                first,
                "'lekapothe' needs an 'okavela' at the same indentation right above it"
            );
            case "print" -> throw fail(
                first,
                "'cheppu' goes after a parenthesized argument list, as in (\"hi\") cheppu"
            );
            case "while" -> throw fail(
                first,
                "'unnanta varaku' goes after the loop condition, as in x < 5 unnanta varaku:"
            );
            case "in" -> throw fail(
                first,
                "'lo' goes after the iterable, as in items lo x ki:"
            );
            default -> {
                if (kw.keyword().startsWith("for ")) {
                    return this.parsePackedForStmt(kw, headerIndent);
                }
                throw fail(first, "a statement cannot start with this keyword");
            }
        }
    }

    ST.AssignStmt parseAssignStmt() {
        log.debug("parse assign");

        var ident = this.consumeIdent("expected a name to assign to");

        // expect `=`
        this.consumeSymbol("=");

        var expr = this.parseExpression();
        this.expectStatementEnd();

        return new ST.AssignStmt(ident, expr);
    }

    ST.PrintStmt parsePostfixPrint() {
        log.debug("parse print");

        var args = this.parseArgsFragment("(", ")");

        // expect `cheppu`
        this.consumeKeyword("print", "expected 'cheppu' after the argument list");
        this.expectStatementEnd();

        return new ST.PrintStmt(args);
    }

    ST.ReturnStmt parsePostfixReturn() {
        log.debug("parse postfix return");

        var expr = this.parseExpression();

        // expect `ivvu`
        this.consumeKeyword("return", "expected 'ivvu' after the returned value");
        this.expectStatementEnd();

        return new ST.ReturnStmt(Optional.of(expr));
    }

    ST.ReturnStmt parsePrefixReturn() {
        log.debug("parse return");

        this.stream.nextPair();
        if (this.atStatementEnd()) {
            return new ST.ReturnStmt(Optional.empty());
        }

        var expr = this.parseExpression();
        this.expectStatementEnd();

        return new ST.ReturnStmt(Optional.of(expr));
    }

    ST.ExprStmt parseExprStmt() {
        log.debug("parse expr stmt");

        var expr = this.parseExpression();
        this.expectStatementEnd();

        return new ST.ExprStmt(expr);
    }

    ST.IfStmt parseIfStmt(int headerIndent) {
        log.debug("parse if stmt");

        // `okavela`
        this.stream.nextPair();
        var cond = this.parseHeaderCondition();
        this.consumeHeaderColon("if");
        var thenBlock = this.parseBlock(headerIndent, "if statement");

        var elifClauses = new ArrayList<ST.ElifClause>();
        Optional<ST.Block> elseBlock = Optional.empty();

        while (true) {
            var next = this.stream.peek();
            if (next == null || !this.atLevel(next, headerIndent)) {
                break;
            }

            if (isKeyword(next.token(), "elif")) {
                log.debug("parse elif");
                this.stream.nextPair();
                var elifCond = this.parseHeaderCondition();
                this.consumeHeaderColon("elif");
                var block = this.parseBlock(headerIndent, "elif branch");
                elifClauses.add(new ST.ElifClause(elifCond, block));
            } else if (isKeyword(next.token(), "else")) {
                log.debug("parse else");
                this.stream.nextPair();
                this.consumeHeaderColon("else");
                elseBlock = Optional.of(this.parseBlock(headerIndent, "else branch"));
                break;
            } else {
                break;
            }
        }

        return new ST.IfStmt(cond, thenBlock, elifClauses, elseBlock);
    }

    // The condition may be followed by `aite` or by `avvakapote`, the latter
    // negates it.
    ST.Expression parseHeaderCondition() {
        var cond = this.parseExpression();

        if (this.stream.peekToken() instanceof Keyword kw) {
            if (kw.isMarker()) {
                this.stream.nextPair();
            } else if (kw.isKeyword("not")) {
                this.stream.nextPair();
                cond = new ST.UnaryOpExpr(ST.UNARY_OP.NOT, cond);
            }
        }

        return cond;
    }

    ST.ForStmt parseForStmt(int headerIndent) {
        log.debug("parse for stmt");

        var iterable = this.parseExpression();

        // expect `lo`
        this.consumeKeyword("in", "expected 'lo' after the iterable");
        var forIdent = this.consumeIdent("expected the loop variable after 'lo'");

        // expect `ki`
        this.consumeMarker("expected 'ki' after the loop variable");
        this.consumeHeaderColon("for");

        var block = this.parseBlock(headerIndent, "for loop");
        return new ST.ForStmt(forIdent, iterable, block);
    }

    // `items lo x ki` already arrives as a single keyword
    ST.ForStmt parsePackedForStmt(Keyword kw, int headerIndent) {
        log.debug("parse packed for stmt");

        var header = this.stream.nextPair();
        var parts = kw.keyword().split(" ");
        if (parts.length != 4) {
            throw fail(header, "malformed loop header");
        }

        var forIdent = parts[1];
        var word = parts[3];
        ST.Expression iterable = word.chars().allMatch(Character::isDigit)
            ? new ST.NumLiteralExpr(new BigInteger(word))
            : new ST.IdentExpr(word);

        this.consumeHeaderColon("for");

        var block = this.parseBlock(headerIndent, "for loop");
        return new ST.ForStmt(forIdent, iterable, block);
    }

    ST.WhileStmt parseWhileStmt(int headerIndent) {
        log.debug("parse while stmt");

        var cond = this.parseExpression();

        // expect `unnanta varaku`
        this.consumeKeyword("while", "expected 'unnanta varaku' after the condition");
        this.consumeHeaderColon("while");

        var block = this.parseBlock(headerIndent, "while loop");
        return new ST.WhileStmt(cond, block);
    }

    ST.FuncStmt parseFuncStmt(int headerIndent) {
        log.debug("parse func");

        // `vidhanam`
        this.stream.nextPair();
        var name = this.consumeIdent("expected a function name after 'vidhanam'");
        var params = this.parseParamList();
        this.consumeHeaderColon("function");

        var block = this.parseBlock(headerIndent, "function '" + name + "'");
        return new ST.FuncStmt(name, params, block);
    }

    ArrayList<String> parseParamList() {
        // expect `(`
        this.consumeSymbol("(");

        var paramList = new ArrayList<String>();

        boolean allowComma = false;
        while (true) {
            var next = this.stream.nextPair();
            if (next == null) {
                throw fail(null, "expected ')' to close the parameter list");
            }

            var token = next.token();
            if (isSym(token, ")")) {
                return paramList;
            }
            if (isSym(token, ",")) {
                if (!allowComma) {
                    throw fail(next, "',' can only follow a parameter");
                }
                allowComma = false;
                continue;
            }
            if (token instanceof Ident ident && !allowComma) {
                paramList.add(ident.ident());
                allowComma = true;
                continue;
            }
            throw fail(next, allowComma ? "expected ',' or ')'" : "expected a parameter name");
        }
    }

    // Not a *real* parsing function, just a helper.
    // Parses the arguments of a call, a print or the elements of a list.
    //
    // Will return zero or more expressions, a trailing comma is fine.
    ArrayList<ST.Expression> parseArgsFragment(String open, String close) {
        this.consumeSymbol(open);

        var exprs = new ArrayList<ST.Expression>();

        boolean allowComma = false;
        while (true) {
            var next = this.stream.nextPair();
            if (next == null) {
                throw fail(null, "expected '" + close + "'");
            }

            var token = next.token();
            // brackets do not suppress line breaks, parens do
            if (token instanceof Newline) {
                continue;
            }
            if (isSym(token, close)) {
                return exprs;
            }
            if (isSym(token, ",")) {
                if (!allowComma) {
                    throw fail(next, "',' can only follow an argument");
                }
                allowComma = false;
                continue;
            }
            if (allowComma) {
                throw fail(next, "expected ',' or '" + close + "'");
            }

            // There and Back Again
            this.stream.backPair();
            exprs.add(this.parseExpression());
            allowComma = true;
        }
    }

    ST.Block parseBlock(int baseIndent, String construct) {
        log.debug("parse block of {}", construct);

        // line break after the header
        while (this.stream.peekToken() instanceof Newline) {
            this.stream.nextPair();
        }

        var stmts = new ArrayList<ST.Stmt>();
        while (!this.stream.atEnd()) {
            var next = this.stream.peek();
            var token = next.token();

            if (token instanceof Newline newline) {
                this.stream.nextPair();
                // a blank line closes the innermost block
                if (newline.isBlankLine()) {
                    break;
                }
                continue;
            }
            if (isKeyword(token, "else") || isKeyword(token, "elif")) {
                break;
            }
            if (this.sourceCode != null && this.indentOf(next) <= baseIndent) {
                break;
            }

            stmts.add(this.parseStmt());
        }

        if (stmts.isEmpty()) {
            throw fail(
                this.stream.peek(),
                construct + " has an empty body, put indented statements after ':'"
            );
        }
        return new ST.Block(stmts);
    }

    /*
     * Lookahead
     *
     * None of these move the cursor for good.
     */

    // `(` ... matching `)` followed by `cheppu`
    boolean isPostfixPrint() {
        if (!isSym(this.stream.peekToken(), "(")) {
            return false;
        }

        // trial run up to the matching paren, then back
        var checkpoint = this.stream.checkpoint();
        try {
            int depth = 0;
            Lexeme next;
            while ((next = this.stream.nextPair()) != null) {
                if (isSym(next.token(), "(")) {
                    depth++;
                } else if (isSym(next.token(), ")")) {
                    depth--;
                    if (depth == 0) {
                        return isKeyword(this.stream.peekToken(), "print");
                    }
                }
            }
            return false;
        } finally {
            this.stream.rollback(checkpoint);
        }
    }

    // `ivvu` at depth zero before the line or another statement ends
    boolean isPostfixReturn() {
        int depth = 0;
        for (int pos = 0; pos < this.stream.remaining(); pos++) {
            var token = this.stream.peekToken(pos);
            if (token instanceof Newline) {
                return false;
            }
            if (isSym(token, "(") || isSym(token, "[")) {
                depth++;
            } else if (isSym(token, ")") || isSym(token, "]")) {
                depth--;
            } else if (depth == 0 && token instanceof Keyword kw) {
                if (kw.isKeyword("return")) {
                    return true;
                }
                if (statementKeywords.contains(kw.keyword()) || kw.keyword().startsWith("for ")) {
                    return false;
                }
            }
        }
        return false;
    }

    // `lo` <ident> `ki` `:` somewhere on this line
    boolean isForLoop() {
        int pos = this.findOnLine(t -> isKeyword(t, "in"));
        return pos >= 0
            && this.stream.peekToken(pos + 1) instanceof Ident
            && isMarker(this.stream.peekToken(pos + 2))
            && isSym(this.stream.peekToken(pos + 3), ":");
    }

    // `unnanta varaku` `:` somewhere on this line
    boolean isWhileLoop() {
        int pos = this.findOnLine(t -> isKeyword(t, "while"));
        return pos >= 0 && isSym(this.stream.peekToken(pos + 1), ":");
    }

    // A loop header that got this far is missing a piece.
    void checkIncompleteHeaders() {
        int loop = this.findOnLine(t -> isKeyword(t, "in"));
        if (loop >= 0) {
            if (!(this.stream.peekToken(loop + 1) instanceof Ident)) {
                throw fail(this.stream.peek(loop + 1), "expected the loop variable after 'lo'");
            }
            if (!isMarker(this.stream.peekToken(loop + 2))) {
                throw incomplete(this.stream.peek(loop + 2), "incomplete loop header, expected 'ki:' after the loop variable");
            }
            throw incomplete(this.stream.peek(loop + 3), "incomplete loop header, expected ':' after 'ki'");
        }

        int whileLoop = this.findOnLine(t -> isKeyword(t, "while"));
        if (whileLoop >= 0) {
            throw incomplete(this.stream.peek(whileLoop + 1), "incomplete while header, expected ':' after 'unnanta varaku'");
        }
    }

    // Offset of the first token at paren depth zero on the current logical
    // line that matches, or -1.
    int findOnLine(Predicate<Token> predicate) {
        int depth = 0;
        for (int pos = 0; pos < this.stream.remaining(); pos++) {
            var token = this.stream.peekToken(pos);
            if (token instanceof Newline) {
                return -1;
            }
            if (isSym(token, "(") || isSym(token, "[")) {
                depth++;
            } else if (isSym(token, ")") || isSym(token, "]")) {
                depth--;
            } else if (depth == 0 && predicate.test(token)) {
                return pos;
            }
        }
        return -1;
    }

    /*
     * Expressions
     */

    ST.Expression parseExpression() {
        return this.parseOr();
    }

    ST.Expression parseOr() {
        return this.parseLeftAssoc(this::parseAnd, EnumSet.of(ST.BIN_OP.OR));
    }

    ST.Expression parseAnd() {
        return this.parseLeftAssoc(this::parseEquality, EnumSet.of(ST.BIN_OP.AND));
    }

    ST.Expression parseEquality() {
        return this.parseLeftAssoc(this::parseRelation, EnumSet.of(ST.BIN_OP.EQ, ST.BIN_OP.NE));
    }

    ST.Expression parseRelation() {
        return this.parseLeftAssoc(
            this::parseArith,
            EnumSet.of(ST.BIN_OP.LT, ST.BIN_OP.LE, ST.BIN_OP.GT, ST.BIN_OP.GE, ST.BIN_OP.IN)
        );
    }

    ST.Expression parseArith() {
        return this.parseLeftAssoc(this::parseTerm, EnumSet.of(ST.BIN_OP.ADD, ST.BIN_OP.SUB));
    }

    ST.Expression parseTerm() {
        return this.parseLeftAssoc(
            this::parseUnary,
            EnumSet.of(ST.BIN_OP.MUL, ST.BIN_OP.DIV, ST.BIN_OP.MOD)
        );
    }

    ST.Expression parseLeftAssoc(Supplier<ST.Expression> operand, EnumSet<ST.BIN_OP> ops) {
        var expr = operand.get();

        while (true) {
            var op = binOpOf(this.stream.peekToken());
            if (op.isEmpty() || !ops.contains(op.get())) {
                return expr;
            }
            this.stream.nextPair();
            expr = new ST.BinOpExpr(op.get(), expr, operand.get());
        }
    }

    ST.Expression parseUnary() {
        var token = this.stream.peekToken();

        if (isSym(token, "-")) {
            this.stream.nextPair();
            return new ST.UnaryOpExpr(ST.UNARY_OP.MINUS, this.parseUnary());
        }
        if (isSym(token, "+")) {
            this.stream.nextPair();
            return new ST.UnaryOpExpr(ST.UNARY_OP.PLUS, this.parseUnary());
        }
        if (isKeyword(token, "not")) {
            this.stream.nextPair();
            return new ST.UnaryOpExpr(ST.UNARY_OP.NOT, this.parseUnary());
        }

        return this.parsePrimary();
    }

    ST.Expression parsePrimary() {
        var next = this.stream.nextPair();
        if (next == null) {
            throw fail(null, "expected an expression");
        }

        var token = next.token();
        ST.Expression expr;
        if (token instanceof IntLiteral t) {
            expr = new ST.NumLiteralExpr(new BigInteger(t.intLiteral()));
        } else if (token instanceof StrLiteral t) {
            expr = new ST.StrLiteralExpr(t.strLiteral());
        } else if (token instanceof Ident t) {
            expr = new ST.IdentExpr(t.ident());
        } else if (isKeyword(token, "True") || isKeyword(token, "False")) {
            expr = new ST.BoolLiteralExpr(isKeyword(token, "True"));
        } else if (isSym(token, "(")) {
            expr = this.parseExpression();
            this.consumeSymbol(")");
        } else if (isSym(token, "[")) {
            this.stream.backPair();
            expr = new ST.ListLiteralExpr(this.parseArgsFragment("[", "]"));
        } else {
            throw fail(next, "expected an expression");
        }

        return this.parsePostfix(expr);
    }

    // .name, .name(args) and (args), as many as there are
    ST.Expression parsePostfix(ST.Expression expr) {
        while (true) {
            var token = this.stream.peekToken();

            if (isSym(token, ".")) {
                this.stream.nextPair();
                var name = this.consumeIdent("expected a name after '.'");
                if (isSym(this.stream.peekToken(), "(")) {
                    expr = new ST.MethodCallExpr(expr, name, this.parseArgsFragment("(", ")"));
                } else {
                    expr = new ST.AttributeExpr(expr, name);
                }
            } else if (isSym(token, "(")) {
                var callee = expr instanceof ST.IdentExpr ident
                    ? ident.identExpr()
                    : ST.renderReceiver(expr);
                expr = new ST.FuncCallExpr(callee, this.parseArgsFragment("(", ")"));
            } else {
                return expr;
            }
        }
    }

    static Optional<ST.BIN_OP> binOpOf(Token token) {
        if (token instanceof Symbol s) {
            return ST.BIN_OP.ofSymbol(s.symbol());
        }
        if (isKeyword(token, "and") || isKeyword(token, "or")) {
            return ST.BIN_OP.ofSymbol(token.text());
        }
        return Optional.empty();
    }

    /*
     * Helpers
     */

    static boolean isSym(Token token, String symbol) {
        return token instanceof Symbol s && s.isSym(symbol);
    }

    static boolean isKeyword(Token token, String keyword) {
        return token instanceof Keyword kw && kw.isKeyword(keyword);
    }

    static boolean isMarker(Token token) {
        return token instanceof Keyword kw && kw.isMarker();
    }

    boolean atStatementEnd() {
        var token = this.stream.peekToken();
        return token == null || token instanceof Newline;
    }

    void expectStatementEnd() {
        if (!this.atStatementEnd()) {
            throw fail(this.stream.peek(), "expected end of line after the statement");
        }
    }

    int indentOf(Lexeme lexeme) {
        if (this.sourceCode == null || lexeme == null) {
            return 0;
        }
        var line = SpanUtils.lineText(this.sourceCode, lexeme.line(), this.lineIndex);
        return SpanUtils.indentOf(line);
    }

    // else/elif belong to an if only at the header's own indentation
    boolean atLevel(Lexeme lexeme, int headerIndent) {
        return this.sourceCode == null || this.indentOf(lexeme) == headerIndent;
    }

    void consumeSymbol(String symbol) {
        var next = this.stream.nextPair();
        if (!isSym(next == null ? null : next.token(), symbol)) {
            throw fail(next, "expected '" + symbol + "'");
        }
    }

    void consumeKeyword(String keyword, String hint) {
        var next = this.stream.nextPair();
        if (!isKeyword(next == null ? null : next.token(), keyword)) {
            throw fail(next, hint);
        }
    }

    void consumeMarker(String hint) {
        var next = this.stream.nextPair();
        if (!isMarker(next == null ? null : next.token())) {
            throw fail(next, hint);
        }
    }

    String consumeIdent(String hint) {
        var next = this.stream.nextPair();
        if (next != null && next.token() instanceof Ident ident) {
            return ident.ident();
        }
        throw fail(next, hint);
    }

    void consumeHeaderColon(String construct) {
        var next = this.stream.peek();
        if (next == null || !isSym(next.token(), ":")) {
            throw incomplete(next, "incomplete " + construct + " header, expected ':'");
        }
        this.stream.nextPair();
    }

    // null lexeme means end of input
    SyntaxError fail(Lexeme lexeme, String hint) {
        return new SyntaxError(tokenOf(lexeme), this.positionOf(lexeme), hint);
    }

    IncompleteConstructError incomplete(Lexeme lexeme, String hint) {
        return new IncompleteConstructError(tokenOf(lexeme), this.positionOf(lexeme), hint);
    }

    static Optional<Token> tokenOf(Lexeme lexeme) {
        return lexeme == null ? Optional.empty() : Optional.of(lexeme.token());
    }

    Position positionOf(Lexeme lexeme) {
        int offset;
        if (lexeme != null) {
            offset = lexeme.span().start();
        } else {
            var last = this.stream.last();
            if (last == null) {
                return new Position(1, 1);
            }
            lexeme = last;
            offset = last.span().end();
        }

        if (this.lineIndex == null) {
            return new Position(lexeme.line(), 0);
        }
        return SpanUtils.locate(offset, this.lineIndex);
    }
}
