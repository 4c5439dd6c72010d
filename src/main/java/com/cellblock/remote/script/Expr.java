package com.cellblock.remote.script;

import java.util.List;

public interface Expr {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLiteral(Literal expr);
        R visitVariable(Variable expr);
        R visitUnary(Unary expr);
        R visitBinary(Binary expr);
        R visitGrouping(Grouping expr);
        R visitCall(Call expr);
        R visitIndex(Index expr);
        R visitListLiteral(ListLiteral expr);
        R visitMapLiteral(MapLiteral expr);
    }

    record Literal(Object value) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitLiteral(this); }
    }

    record Variable(Token name) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitVariable(this); }
    }

    record Unary(Token operator, Expr right) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitUnary(this); }
    }

    record Binary(Expr left, Token operator, Expr right) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBinary(this); }
    }

    record Grouping(Expr expression) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitGrouping(this); }
    }

    record Call(Token callee, List<Expr> arguments) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCall(this); }
    }

    record Index(Expr target, Token bracket, Expr index) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitIndex(this); }
    }

    record ListLiteral(List<Expr> elements) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitListLiteral(this); }
    }

    record MapLiteral(List<Expr> keys, List<Expr> values) implements Expr {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitMapLiteral(this); }
    }
}
