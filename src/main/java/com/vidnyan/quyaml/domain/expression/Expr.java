package com.vidnyan.quyaml.domain.expression;

import java.util.List;

/**
 * Closed arithmetic AST for gate parameters.
 * Only the node types below exist; there is no statement, attribute or
 * index form, and calls are limited to whitelisted functions.
 */
public interface Expr {

    /**
     * Render back to expression text. Fully parenthesized for binary nodes.
     */
    String render();

    record Const(double value) implements Expr {
        @Override
        public String render() {
            return Double.toString(value);
        }
    }

    /**
     * Reference to a parameter or a whitelisted constant.
     */
    record Name(String name) implements Expr {
        @Override
        public String render() {
            return name;
        }
    }

    record BinOp(BinaryOperator op, Expr left, Expr right) implements Expr {
        @Override
        public String render() {
            return "(" + left.render() + " " + op.symbol() + " " + right.render() + ")";
        }
    }

    record UnaryOp(UnaryOperator op, Expr operand) implements Expr {
        @Override
        public String render() {
            return op.symbol() + operand.render();
        }
    }

    record Call(String function, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public String render() {
            StringBuilder sb = new StringBuilder(function).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(args.get(i).render());
            }
            return sb.append(')').toString();
        }
    }

    enum BinaryOperator {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        POW("**"),
        MOD("%");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum UnaryOperator {
        PLUS("+"),
        MINUS("-");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
