package org.brahmic;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

// Program = { Stmt }
//
// ST short for Syntax Tree. Every node renders itself as Python source text;
// nodes are immutable and validated on construction, so rendering never fails.
public record ST(List<ST.Stmt> stmts) {
    static final String INDENT = "    ";

    public ST {
        stmts = List.copyOf(stmts);
    }

    public String render() {
        return render(0);
    }

    // Top-level compound statements are followed by one blank line,
    // simple statements are not.
    public String render(int indentLevel) {
        var lines = new ArrayList<String>();
        for (int i = 0; i < stmts.size(); i++) {
            var stmt = stmts.get(i);
            var code = stmt.render(indentLevel);
            if (code.isBlank()) {
                continue;
            }
            lines.add(code);

            if (i < stmts.size() - 1 && stmt instanceof CompoundStmt) {
                lines.add("");
            }
        }
        return String.join("\n", lines);
    }

    static String indent(int indentLevel) {
        return INDENT.repeat(indentLevel);
    }

    // header line followed by the block one level deeper
    static String renderBlock(String header, Block block, int indentLevel) {
        var sb = new StringBuilder();
        sb.append(indent(indentLevel)).append(header).append("\n");
        for (var stmt : block.stmts()) {
            sb.append(stmt.render(indentLevel + 1)).append("\n");
        }
        return sb.toString().stripTrailing();
    }

    static String renderArgs(List<Expression> args) {
        return args.stream()
            .map(arg -> arg.render(0))
            .collect(Collectors.joining(", "));
    }

    // Receivers of `.name` and callees of `(args)` keep their binding
    static String renderReceiver(Expression expr) {
        var code = expr.render(0);
        if (expr instanceof BinOpExpr
            || expr instanceof UnaryOpExpr
            || expr instanceof NumLiteralExpr) {
            return "(" + code + ")";
        }
        return code;
    }

    public sealed interface Node permits Stmt, Expression {
        String render(int indentLevel);

        default String render() {
            return render(0);
        }
    }

    public enum BIN_OP {
        OR("or", 1),
        AND("and", 2),
        EQ("==", 3), NE("!=", 3),
        LT("<", 4), LE("<=", 4), GT(">", 4), GE(">=", 4), IN("in", 4),
        ADD("+", 5), SUB("-", 5),
        MUL("*", 6), DIV("/", 6), MOD("%", 6);

        final String symbol;
        final int precedence;

        BIN_OP(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        // Python chains these, so they never nest bare
        boolean isComparison() {
            return precedence == 3 || precedence == 4;
        }

        static Optional<BIN_OP> ofSymbol(String symbol) {
            return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
        }
    }

    public enum UNARY_OP {
        PLUS("+"), MINUS("-"), NOT("not");

        final String symbol;

        UNARY_OP(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        boolean isWord() {
            return this == NOT;
        }
    }

    public sealed interface Stmt extends Node
            permits AssignStmt, PrintStmt, ReturnStmt, BreakStmt, ContinueStmt, ExprStmt, CompoundStmt {}
    public sealed interface CompoundStmt extends Stmt
            permits IfStmt, ForStmt, WhileStmt, FuncStmt {}

    public sealed interface Expression extends Node
            permits IdentExpr, LiteralExpr, ListLiteralExpr, BinOpExpr, UnaryOpExpr,
                    FuncCallExpr, MethodCallExpr, AttributeExpr {}

    public sealed interface LiteralExpr extends Expression
            permits StrLiteralExpr, NumLiteralExpr, BoolLiteralExpr {}

    // Block = NEWLINE INDENTED { Stmt }
    //
    // Never empty, the parser reports a missing body before getting here.
    public record Block(List<Stmt> stmts) {
        public Block {
            if (stmts.isEmpty()) {
                throw new IllegalArgumentException("a block needs at least one statement");
            }
            stmts = List.copyOf(stmts);
        }
    }

    // IdentExpr = Ident
    public record IdentExpr(String identExpr) implements Expression {
        @Override
        public String render(int indentLevel) {
            return identExpr;
        }
    }

    // StrLiteralExpr = String
    public record StrLiteralExpr(String strLiteral) implements LiteralExpr {
        @Override
        public String render(int indentLevel) {
            var escaped = strLiteral
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
            return '"' + escaped + '"';
        }
    }

    // NumLiteralExpr = Int
    public record NumLiteralExpr(BigInteger numLiteral) implements LiteralExpr {
        @Override
        public String render(int indentLevel) {
            return numLiteral.toString();
        }
    }

    // BoolLiteralExpr = 'Nijam' | 'Abaddam'
    public record BoolLiteralExpr(boolean boolLiteral) implements LiteralExpr {
        @Override
        public String render(int indentLevel) {
            return boolLiteral ? "True" : "False";
        }
    }

    // ListLiteralExpr = '[' [ Expression { ',' Expression } [ ',' ] ] ']'
    public record ListLiteralExpr(List<Expression> elements) implements Expression {
        public ListLiteralExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public String render(int indentLevel) {
            return "[" + renderArgs(elements) + "]";
        }
    }

    // Left-associative at every level. A child gets parentheses when it binds
    // looser than its parent, when it binds equally but sits on the right, or
    // when both are comparisons.
    public record BinOpExpr(BIN_OP op, Expression a, Expression b) implements Expression {
        @Override
        public String render(int indentLevel) {
            return operand(a, false) + " " + op.symbol() + " " + operand(b, true);
        }

        String operand(Expression child, boolean rightSide) {
            var code = child.render(0);
            return needsParens(child, rightSide) ? "(" + code + ")" : code;
        }

        boolean needsParens(Expression child, boolean rightSide) {
            if (child instanceof BinOpExpr bin) {
                if (bin.op().precedence() < op.precedence()) {
                    return true;
                }
                if (rightSide && bin.op().precedence() == op.precedence()) {
                    return true;
                }
                return bin.op().isComparison() && op.isComparison();
            }
            if (child instanceof UnaryOpExpr unary) {
                // `not` binds looser than comparisons and arithmetic
                return unary.op() == UNARY_OP.NOT && op.precedence() > BIN_OP.AND.precedence();
            }
            return false;
        }
    }

    public record UnaryOpExpr(UNARY_OP op, Expression expr) implements Expression {
        @Override
        public String render(int indentLevel) {
            var code = expr.render(0);
            if (expr instanceof BinOpExpr
                || (!op.isWord() && expr instanceof UnaryOpExpr inner && inner.op() == UNARY_OP.NOT)) {
                code = "(" + code + ")";
            }
            return op.isWord() ? op.symbol() + " " + code : op.symbol() + code;
        }
    }

    // FuncCallExpr = Primary ArgsFragment
    public record FuncCallExpr(String callIdent, List<Expression> args) implements Expression {
        public FuncCallExpr {
            args = List.copyOf(args);
        }

        @Override
        public String render(int indentLevel) {
            return callIdent + "(" + renderArgs(args) + ")";
        }
    }

    // MethodCallExpr = Primary '.' Ident ArgsFragment
    public record MethodCallExpr(Expression receiver, String method, List<Expression> args)
            implements Expression {
        public MethodCallExpr {
            args = List.copyOf(args);
        }

        @Override
        public String render(int indentLevel) {
            return renderReceiver(receiver) + "." + method + "(" + renderArgs(args) + ")";
        }
    }

    // AttributeExpr = Primary '.' Ident
    public record AttributeExpr(Expression receiver, String attribute) implements Expression {
        @Override
        public String render(int indentLevel) {
            return renderReceiver(receiver) + "." + attribute;
        }
    }

    // AssignStmt = Ident '=' Expression
    public record AssignStmt(String assignIdent, Expression expr) implements Stmt {
        @Override
        public String render(int indentLevel) {
            return indent(indentLevel) + assignIdent + " = " + expr.render(0);
        }
    }

    // PrintStmt = ArgsFragment 'cheppu'
    // ArgsFragment = '(' [ Expression { ',' Expression } [ ',' ] ] ')'
    public record PrintStmt(List<Expression> printExprs) implements Stmt {
        public PrintStmt {
            printExprs = List.copyOf(printExprs);
        }

        @Override
        public String render(int indentLevel) {
            return indent(indentLevel) + "print(" + renderArgs(printExprs) + ")";
        }
    }

    // ReturnStmt = Expression 'ivvu' | 'ivvu' [ Expression ]
    public record ReturnStmt(Optional<Expression> returnExpr) implements Stmt {
        @Override
        public String render(int indentLevel) {
            return indent(indentLevel) + returnExpr
                .map(expr -> "return " + expr.render(0))
                .orElse("return");
        }
    }

    // BreakStmt = 'aagipo'
    public record BreakStmt() implements Stmt {
        @Override
        public String render(int indentLevel) {
            return indent(indentLevel) + "break";
        }
    }

    // ContinueStmt = 'munduku vellu'
    public record ContinueStmt() implements Stmt {
        @Override
        public String render(int indentLevel) {
            return indent(indentLevel) + "continue";
        }
    }

    public record ExprStmt(Expression expr) implements Stmt {
        @Override
        public String render(int indentLevel) {
            return indent(indentLevel) + expr.render(0);
        }
    }

    // ElifClause = 'lekapothe okavela' Expression ( 'aite' | 'avvakapote' ) ':' Block
    public record ElifClause(Expression elifCond, Block block) {}

    // IfStmt = 'okavela' Expression ( 'aite' | 'avvakapote' ) ':' Block
    //          { ElifClause } [ 'lekapothe' ':' Block ]
    public record IfStmt(
        Expression ifCond, Block thenBlock, List<ElifClause> elifClauses, Optional<Block> elseBlock
    ) implements CompoundStmt {
        public IfStmt {
            elifClauses = List.copyOf(elifClauses);
        }

        @Override
        public String render(int indentLevel) {
            var parts = new ArrayList<String>();
            parts.add(renderBlock("if " + ifCond.render(0) + ":", thenBlock, indentLevel));
            for (var clause : elifClauses) {
                parts.add(renderBlock("elif " + clause.elifCond().render(0) + ":", clause.block(), indentLevel));
            }
            elseBlock.ifPresent(block -> parts.add(renderBlock("else:", block, indentLevel)));
            return String.join("\n", parts).stripTrailing();
        }
    }

    // ForStmt = Expression 'lo' Ident 'ki' ':' Block
    public record ForStmt(String forIdent, Expression iterable, Block block) implements CompoundStmt {
        @Override
        public String render(int indentLevel) {
            return renderBlock("for " + forIdent + " in " + iterable.render(0) + ":", block, indentLevel);
        }
    }

    // WhileStmt = Expression 'unnanta varaku' ':' Block
    public record WhileStmt(Expression whileCond, Block block) implements CompoundStmt {
        @Override
        public String render(int indentLevel) {
            return renderBlock("while " + whileCond.render(0) + ":", block, indentLevel);
        }
    }

    // FuncStmt = 'vidhanam' Ident ParamList ':' Block
    // ParamList = '(' [ Ident { ',' Ident } [ ',' ] ] ')'
    public record FuncStmt(String funcName, List<String> paramList, Block block) implements CompoundStmt {
        public FuncStmt {
            paramList = List.copyOf(paramList);
        }

        @Override
        public String render(int indentLevel) {
            var header = "def " + funcName + "(" + String.join(", ", paramList) + "):";
            return renderBlock(header, block, indentLevel);
        }
    }
}
