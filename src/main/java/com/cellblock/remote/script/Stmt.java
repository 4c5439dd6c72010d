package com.cellblock.remote.script;

public interface Stmt {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitAssign(Assign stmt);
        R visitExpression(Expression stmt);
    }

    record Assign(Token name, Expr value) implements Stmt {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAssign(this); }
    }

    record Expression(Expr expression) implements Stmt {
        public <R> R accept(Visitor<R> visitor) { return visitor.visitExpression(this); }
    }
}
