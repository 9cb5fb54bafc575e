package org.brahmic;

import java.util.List;

/**
 * Pretty-prints the *structure* of the tree in a human-readable outline,
 * one node per line. Used by the CLI's --tree switch.
 */
public class PrinterST {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;
    private static final String INDENT_CHAR = "  "; // 2 spaces per indent level

    public String print(ST ast) {
        sb.setLength(0);
        indentLevel = 0;

        printNode("ST");
        increaseIndent();
        for (var stmt : ast.stmts()) {
            print(stmt);
        }
        decreaseIndent();
        return sb.toString();
    }

    // --- Indentation & Node Helpers ---

    private void increaseIndent() { indentLevel++; }
    private void decreaseIndent() { indentLevel--; }

    private void printLine(String line) {
        sb.append(INDENT_CHAR.repeat(indentLevel)).append(line).append("\n");
    }

    private void printNode(String nodeName, String... fields) {
        StringBuilder fieldsStr = new StringBuilder();
        if (fields.length > 0) {
            fieldsStr.append(" (");
            fieldsStr.append(String.join(", ", fields));
            fieldsStr.append(")");
        }
        printLine(nodeName + fieldsStr);
    }

    // node name with its children one level deeper
    private void printSection(String name, ST.Expression expr) {
        printNode(name);
        increaseIndent();
        print(expr);
        decreaseIndent();
    }

    private void printSection(String name, ST.Block block) {
        printNode(name);
        increaseIndent();
        print(block);
        decreaseIndent();
    }

    private void printArguments(List<ST.Expression> args) {
        if (args.isEmpty()) {
            return;
        }
        printNode("Arguments");
        increaseIndent();
        for (var e : args) {
            print(e);
        }
        decreaseIndent();
    }

    // --- Dispatcher Methods ---

    private void print(ST.Stmt stmt) {
        if (stmt instanceof ST.AssignStmt s) {
            print(s);
        } else if (stmt instanceof ST.PrintStmt s) {
            print(s);
        } else if (stmt instanceof ST.ReturnStmt s) {
            print(s);
        } else if (stmt instanceof ST.BreakStmt) {
            printNode("BreakStmt");
        } else if (stmt instanceof ST.ContinueStmt) {
            printNode("ContinueStmt");
        } else if (stmt instanceof ST.ExprStmt s) {
            printSection("ExprStmt", s.expr());
        } else if (stmt instanceof ST.IfStmt s) {
            print(s);
        } else if (stmt instanceof ST.ForStmt s) {
            print(s);
        } else if (stmt instanceof ST.WhileStmt s) {
            print(s);
        } else if (stmt instanceof ST.FuncStmt s) {
            print(s);
        }
    }

    private void print(ST.Expression expr) {
        if (expr instanceof ST.BinOpExpr e) {
            print(e);
        } else if (expr instanceof ST.UnaryOpExpr e) {
            print(e);
        } else if (expr instanceof ST.FuncCallExpr e) {
            print(e);
        } else if (expr instanceof ST.MethodCallExpr e) {
            print(e);
        } else if (expr instanceof ST.AttributeExpr e) {
            printNode("AttributeExpr", "attribute=" + e.attribute());
            increaseIndent();
            print(e.receiver());
            decreaseIndent();
        } else if (expr instanceof ST.ListLiteralExpr e) {
            printNode("ListLiteralExpr", "size=" + e.elements().size());
            increaseIndent();
            for (var element : e.elements()) {
                print(element);
            }
            decreaseIndent();
        } else if (expr instanceof ST.IdentExpr e) {
            printNode("IdentExpr", "identExpr=" + e.identExpr());
        } else if (expr instanceof ST.NumLiteralExpr e) {
            printNode("NumLiteralExpr", "value=" + e.numLiteral());
        } else if (expr instanceof ST.StrLiteralExpr e) {
            printNode("StrLiteralExpr", "value=" + e.render());
        } else if (expr instanceof ST.BoolLiteralExpr e) {
            printNode("BoolLiteralExpr", "value=" + e.boolLiteral());
        }
    }

    // --- Statements ---

    private void print(ST.Block block) {
        printNode("Block");
        increaseIndent();
        for (var s : block.stmts()) {
            print(s);
        }
        decreaseIndent();
    }

    private void print(ST.FuncStmt stmt) {
        printNode("FuncStmt", "funcName=" + stmt.funcName());

        increaseIndent();
        if (!stmt.paramList().isEmpty()) {
            printNode("Parameters");
            increaseIndent();
            for (var param : stmt.paramList()) {
                printNode("Param", "name=" + param);
            }
            decreaseIndent();
        }

        print(stmt.block());
        decreaseIndent();
    }

    private void print(ST.AssignStmt stmt) {
        printNode("AssignStmt", "assignIdent=" + stmt.assignIdent());
        increaseIndent();
        print(stmt.expr());
        decreaseIndent();
    }

    private void print(ST.PrintStmt stmt) {
        printNode("PrintStmt");
        increaseIndent();
        for (ST.Expression e : stmt.printExprs()) {
            print(e);
        }
        decreaseIndent();
    }

    private void print(ST.ReturnStmt stmt) {
        printNode("ReturnStmt");
        increaseIndent();
        stmt.returnExpr().ifPresent(this::print);
        decreaseIndent();
    }

    private void print(ST.IfStmt stmt) {
        printNode("IfStmt");
        increaseIndent();

        printSection("Condition", stmt.ifCond());
        printSection("Then", stmt.thenBlock());

        for (var clause : stmt.elifClauses()) {
            printNode("Elif");
            increaseIndent();
            printSection("Condition", clause.elifCond());
            printSection("Then", clause.block());
            decreaseIndent();
        }

        stmt.elseBlock().ifPresent(elseBlock -> printSection("Else", elseBlock));

        decreaseIndent();
    }

    private void print(ST.WhileStmt stmt) {
        printNode("WhileStmt");
        increaseIndent();

        printSection("Condition", stmt.whileCond());
        printSection("Body", stmt.block());

        decreaseIndent();
    }

    private void print(ST.ForStmt stmt) {
        printNode("ForStmt", "forIdent=" + stmt.forIdent());
        increaseIndent();

        printSection("Iterable", stmt.iterable());
        printSection("Body", stmt.block());

        decreaseIndent();
    }

    // --- Expressions ---

    private void print(ST.BinOpExpr expr) {
        printNode("BinOpExpr", "op=" + expr.op());
        increaseIndent();
        print(expr.a());
        print(expr.b());
        decreaseIndent();
    }

    private void print(ST.UnaryOpExpr expr) {
        printNode("UnaryOpExpr", "op=" + expr.op());
        increaseIndent();
        print(expr.expr());
        decreaseIndent();
    }

    private void print(ST.FuncCallExpr expr) {
        printNode("FuncCallExpr", "callIdent=" + expr.callIdent());
        increaseIndent();
        printArguments(expr.args());
        decreaseIndent();
    }

    private void print(ST.MethodCallExpr expr) {
        printNode("MethodCallExpr", "method=" + expr.method());
        increaseIndent();
        printSection("Receiver", expr.receiver());
        printArguments(expr.args());
        decreaseIndent();
    }
}
