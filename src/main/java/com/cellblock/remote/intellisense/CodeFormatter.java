package com.cellblock.remote.intellisense;

import com.cellblock.remote.script.Expr;
import com.cellblock.remote.script.Parser;
import com.cellblock.remote.script.Stmt;
import com.cellblock.remote.script.Values;

import java.util.List;
import java.util.StringJoiner;

/**
 * Prints parsed cell code back in canonical layout: one statement per line, single spaces
 * around binary operators and after commas.
 */
public class CodeFormatter implements Expr.Visitor<String>, Stmt.Visitor<String> {

    public static String format(String code) {
        var formatter = new CodeFormatter();
        var lines = new StringJoiner("\n");
        for (Stmt stmt : Parser.parse(code)) {
            lines.add(stmt.accept(formatter));
        }
        return lines.toString();
    }

    @Override
    public String visitAssign(Stmt.Assign stmt) {
        return stmt.name().lexeme() + " = " + stmt.value().accept(this);
    }

    @Override
    public String visitExpression(Stmt.Expression stmt) {
        return stmt.expression().accept(this);
    }

    @Override
    public String visitLiteral(Expr.Literal expr) {
        return Values.render(expr.value());
    }

    @Override
    public String visitVariable(Expr.Variable expr) {
        return expr.name().lexeme();
    }

    @Override
    public String visitUnary(Expr.Unary expr) {
        return "-" + expr.right().accept(this);
    }

    @Override
    public String visitBinary(Expr.Binary expr) {
        return expr.left().accept(this) + " " + expr.operator().lexeme() + " " + expr.right().accept(this);
    }

    @Override
    public String visitGrouping(Expr.Grouping expr) {
        return "(" + expr.expression().accept(this) + ")";
    }

    @Override
    public String visitCall(Expr.Call expr) {
        return expr.callee().lexeme() + join(expr.arguments(), "(", ")");
    }

    @Override
    public String visitIndex(Expr.Index expr) {
        return expr.target().accept(this) + "[" + expr.index().accept(this) + "]";
    }

    @Override
    public String visitListLiteral(Expr.ListLiteral expr) {
        return join(expr.elements(), "[", "]");
    }

    @Override
    public String visitMapLiteral(Expr.MapLiteral expr) {
        var joiner = new StringJoiner(", ", "{", "}");
        for (int i = 0; i < expr.keys().size(); i++) {
            joiner.add(expr.keys().get(i).accept(this) + ": " + expr.values().get(i).accept(this));
        }
        return joiner.toString();
    }

    private String join(List<Expr> items, String open, String close) {
        var joiner = new StringJoiner(", ", open, close);
        items.forEach(item -> joiner.add(item.accept(this)));
        return joiner.toString();
    }
}
