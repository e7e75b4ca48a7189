package com.vidnyan.quyaml.domain.expression;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Compiles parameter expression text into an {@link Expr} tree.
 * <p>
 * Grammar:
 * <pre>
 * expr    := term (('+'|'-') term)*
 * term    := unary (('*'|'/'|'%') unary)*
 * unary   := ('+'|'-') unary | power
 * power   := primary ('**' unary)?
 * primary := NUMBER | '$' IDENT | IDENT | IDENT '(' expr ')' | '(' expr ')'
 * </pre>
 * Identifiers resolve against the parameter names and the whitelist at
 * compile time; unknown names and functions fail closed. Both parenthesis
 * nesting and the height of the operator tree are capped at {@code maxDepth}.
 * Stateless and thread-safe.
 */
public class ExpressionParser {

    private final ExpressionWhitelist whitelist;
    private final int maxDepth;

    public ExpressionParser(ExpressionWhitelist whitelist, int maxDepth) {
        this.whitelist = whitelist;
        this.maxDepth = maxDepth;
    }

    /**
     * Compile expression text.
     * @param text raw expression, e.g. {@code 2*$theta + pi/2}
     * @param parameterNames names bound in the document's parameter block
     * @return the compiled AST, never null
     */
    public Expr compile(String text, Set<String> parameterNames) {
        if (text == null || text.isBlank()) {
            throw QuyamlException.of(ErrorKind.EXPRESSION_SYNTAX, "Empty expression");
        }
        List<Token> tokens = tokenize(text);
        Cursor cursor = new Cursor(text, tokens, parameterNames);
        Expr result = cursor.parseExpr(0).expr();
        if (!cursor.atEnd()) {
            Token extra = cursor.peek();
            throw syntax(text, extra.position(), "Unexpected '" + extra.text() + "'");
        }
        return result;
    }

    // --- tokenizer ---

    enum TokenType { NUMBER, IDENT, PARAM, OP, LPAREN, RPAREN, COMMA }

    record Token(TokenType type, String text, int position) {}

    private List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (Character.isDigit(ch) || (ch == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
                int end = scanNumber(text, i);
                tokens.add(new Token(TokenType.NUMBER, text.substring(i, end), i));
                i = end;
            } else if (isIdentStart(ch)) {
                int end = scanIdent(text, i);
                tokens.add(new Token(TokenType.IDENT, text.substring(i, end), i));
                i = end;
            } else if (ch == '$') {
                if (i + 1 >= n || !isIdentStart(text.charAt(i + 1))) {
                    throw syntax(text, i, "'$' must be followed by a parameter name");
                }
                int end = scanIdent(text, i + 1);
                tokens.add(new Token(TokenType.PARAM, text.substring(i + 1, end), i));
                i = end;
            } else if (ch == '*' && i + 1 < n && text.charAt(i + 1) == '*') {
                tokens.add(new Token(TokenType.OP, "**", i));
                i += 2;
            } else if (ch == '+' || ch == '-' || ch == '*' || ch == '/' || ch == '%') {
                tokens.add(new Token(TokenType.OP, String.valueOf(ch), i));
                i++;
            } else if (ch == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", i));
                i++;
            } else if (ch == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", i));
                i++;
            } else if (ch == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", i));
                i++;
            } else if (ch == '\'' || ch == '"') {
                throw disallowed(text, i, "string literals are not allowed");
            } else if (ch == '.' || ch == '[' || ch == ']') {
                throw disallowed(text, i, "attribute and index access are not allowed");
            } else if (ch == '=' || ch == ';' || ch == ':' || ch == '{' || ch == '}') {
                throw disallowed(text, i, "'" + ch + "' is not part of the expression language");
            } else {
                throw syntax(text, i, "Unexpected character '" + ch + "'");
            }
        }
        return tokens;
    }

    private static int scanNumber(String text, int start) {
        int i = start;
        int n = text.length();
        while (i < n && Character.isDigit(text.charAt(i))) i++;
        if (i < n && text.charAt(i) == '.') {
            i++;
            while (i < n && Character.isDigit(text.charAt(i))) i++;
        }
        // exponent only when digits follow, so "2e" stays NUMBER + IDENT
        if (i < n && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (text.charAt(j) == '+' || text.charAt(j) == '-')) j++;
            if (j < n && Character.isDigit(text.charAt(j))) {
                while (j < n && Character.isDigit(text.charAt(j))) j++;
                i = j;
            }
        }
        return i;
    }

    private static int scanIdent(String text, int start) {
        int i = start;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
        return i;
    }

    private static boolean isIdentStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static QuyamlException syntax(String text, int position, String message) {
        return QuyamlException.of(ErrorKind.EXPRESSION_SYNTAX,
                message + " at position " + position + " in '" + text + "'");
    }

    private static QuyamlException disallowed(String text, int position, String message) {
        return QuyamlException.of(ErrorKind.DISALLOWED_CONSTRUCT,
                message + " (position " + position + " in '" + text + "')");
    }

    // --- recursive descent ---

    /**
     * A parsed subtree and its operator height (leaves are 0).
     */
    private record Node(Expr expr, int height) {}

    private final class Cursor {
        private final String text;
        private final List<Token> tokens;
        private final Set<String> parameterNames;
        private int pos;

        Cursor(String text, List<Token> tokens, Set<String> parameterNames) {
            this.text = text;
            this.tokens = tokens;
            this.parameterNames = parameterNames;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return tokens.get(pos);
        }

        boolean peekOp(String op) {
            return !atEnd() && peek().type() == TokenType.OP && peek().text().equals(op);
        }

        Token next(String expectation) {
            if (atEnd()) {
                throw syntax(text, text.length(), "Unexpected end of expression, expected " + expectation);
            }
            return tokens.get(pos++);
        }

        void checkDepth(int depth) {
            if (depth > maxDepth) {
                throw syntax(text, atEnd() ? text.length() : peek().position(),
                        "Expression nested deeper than " + maxDepth);
            }
        }

        Node parseExpr(int depth) {
            checkDepth(depth);
            Node left = parseTerm(depth);
            while (peekOp("+") || peekOp("-")) {
                Token token = next("operator");
                Expr.BinaryOperator op = token.text().equals("+")
                        ? Expr.BinaryOperator.ADD : Expr.BinaryOperator.SUB;
                left = binary(op, left, parseTerm(depth), token);
            }
            return left;
        }

        Node parseTerm(int depth) {
            Node left = parseUnary(depth);
            while (peekOp("*") || peekOp("/") || peekOp("%")) {
                Token token = next("operator");
                Expr.BinaryOperator op = switch (token.text()) {
                    case "*" -> Expr.BinaryOperator.MUL;
                    case "/" -> Expr.BinaryOperator.DIV;
                    default -> Expr.BinaryOperator.MOD;
                };
                left = binary(op, left, parseUnary(depth), token);
            }
            return left;
        }

        Node parseUnary(int depth) {
            if (peekOp("+") || peekOp("-")) {
                checkDepth(depth + 1);
                Token token = next("operator");
                Expr.UnaryOperator op = token.text().equals("+")
                        ? Expr.UnaryOperator.PLUS : Expr.UnaryOperator.MINUS;
                Node operand = parseUnary(depth + 1);
                return node(new Expr.UnaryOp(op, operand.expr()), operand.height() + 1, token);
            }
            return parsePower(depth);
        }

        Node parsePower(int depth) {
            Node base = parsePrimary(depth);
            if (peekOp("**")) {
                Token token = next("operator");
                checkDepth(depth + 1);
                return binary(Expr.BinaryOperator.POW, base, parseUnary(depth + 1), token);
            }
            return base;
        }

        Node parsePrimary(int depth) {
            Token token = next("a number, name or '('");
            switch (token.type()) {
                case NUMBER:
                    try {
                        return new Node(new Expr.Const(Double.parseDouble(token.text())), 0);
                    } catch (NumberFormatException e) {
                        throw syntax(text, token.position(), "Malformed number '" + token.text() + "'");
                    }
                case PARAM:
                    if (!parameterNames.contains(token.text())) {
                        throw QuyamlException.of(ErrorKind.UNDEFINED_PARAMETER,
                                "Parameter '" + token.text() + "' not defined in parameters block");
                    }
                    return new Node(new Expr.Name(token.text()), 0);
                case IDENT:
                    return parseIdentifier(token, depth);
                case LPAREN:
                    Node inner = parseExpr(depth + 1);
                    expectRParen(token);
                    return inner;
                default:
                    throw syntax(text, token.position(), "Unexpected '" + token.text() + "'");
            }
        }

        Node parseIdentifier(Token token, int depth) {
            String name = token.text();
            boolean isCall = !atEnd() && peek().type() == TokenType.LPAREN;
            if (isCall) {
                if (!whitelist.isFunction(name)) {
                    throw disallowed(text, token.position(), "function '" + name + "' is not whitelisted");
                }
                Token open = next("'('");
                List<Expr> args = new ArrayList<>();
                Node arg = parseExpr(depth + 1);
                args.add(arg.expr());
                int height = arg.height();
                while (!atEnd() && peek().type() == TokenType.COMMA) {
                    next("','");
                    arg = parseExpr(depth + 1);
                    args.add(arg.expr());
                    height = Math.max(height, arg.height());
                }
                expectRParen(open);
                if (args.size() != 1) {
                    throw syntax(text, token.position(),
                            "Function '" + name + "' takes exactly one argument, got " + args.size());
                }
                return node(new Expr.Call(name, args), height + 1, token);
            }
            if (parameterNames.contains(name) || whitelist.isConstant(name)) {
                return new Node(new Expr.Name(name), 0);
            }
            throw disallowed(text, token.position(), "identifier '" + name + "' is neither a parameter nor a constant");
        }

        Node binary(Expr.BinaryOperator op, Node left, Node right, Token token) {
            return node(new Expr.BinOp(op, left.expr(), right.expr()),
                    Math.max(left.height(), right.height()) + 1, token);
        }

        // operator chains such as 1+1+... grow the tree without nesting
        Node node(Expr expr, int height, Token token) {
            if (height > maxDepth) {
                throw syntax(text, token.position(), "Expression nested deeper than " + maxDepth);
            }
            return new Node(expr, height);
        }

        void expectRParen(Token open) {
            if (atEnd() || peek().type() != TokenType.RPAREN) {
                throw syntax(text, open.position(), "Unbalanced '('");
            }
            pos++;
        }
    }
}
