package com.vidnyan.quyaml.domain.condition;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses classical conditions.
 * <pre>
 * cond    := orExpr
 * orExpr  := andExpr ( "||" andExpr )*
 * andExpr := atom ( "&amp;&amp;" atom )*
 * atom    := "(" cond ")" | bitEq | regEq
 * bitEq   := "c[" INT "]" "==" ("0"|"1")
 * regEq   := "c" "==" INT        ; decimal, 0b binary or 0x hex
 * </pre>
 * Only builds the predicate tree; truth is decided at execution time.
 * Parenthesis nesting and the height of the {@code &&}/{@code ||} tree are
 * both capped at {@code maxDepth}.
 */
public class ConditionParser {

    private final int maxDepth;

    public ConditionParser(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Parse a condition against a register of {@code bitCount} bits.
     */
    public Condition parse(String text, int bitCount) {
        if (text == null || text.isBlank()) {
            throw QuyamlException.of(ErrorKind.CONDITION_SYNTAX, "Empty condition");
        }
        Cursor cursor = new Cursor(text, tokenize(text), bitCount);
        Condition result = cursor.parseOr(0).condition();
        if (!cursor.atEnd()) {
            Token extra = cursor.peek();
            throw syntax(text, extra.position(), "Unexpected '" + extra.text() + "'");
        }
        return result;
    }

    enum TokenType { C, LBRACKET, RBRACKET, INT, EQ, AND, OR, LPAREN, RPAREN }

    record Token(TokenType type, String text, int position) {}

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (Character.isDigit(ch)) {
                int end = i;
                while (end < n && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) end++;
                tokens.add(new Token(TokenType.INT, text.substring(i, end), i));
                i = end;
            } else if (ch == 'c' && (i + 1 >= n || !Character.isLetterOrDigit(text.charAt(i + 1)))) {
                tokens.add(new Token(TokenType.C, "c", i++));
            } else if (text.startsWith("==", i)) {
                tokens.add(new Token(TokenType.EQ, "==", i));
                i += 2;
            } else if (text.startsWith("&&", i)) {
                tokens.add(new Token(TokenType.AND, "&&", i));
                i += 2;
            } else if (text.startsWith("||", i)) {
                tokens.add(new Token(TokenType.OR, "||", i));
                i += 2;
            } else if (ch == '[') {
                tokens.add(new Token(TokenType.LBRACKET, "[", i++));
            } else if (ch == ']') {
                tokens.add(new Token(TokenType.RBRACKET, "]", i++));
            } else if (ch == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", i++));
            } else if (ch == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", i++));
            } else {
                throw syntax(text, i, "Unsupported character '" + ch + "'. Use 'c[i] == 0/1' or 'c == <int>'");
            }
        }
        return tokens;
    }

    private static QuyamlException syntax(String text, int position, String message) {
        return QuyamlException.of(ErrorKind.CONDITION_SYNTAX,
                message + " at position " + position + " in '" + text + "'");
    }

    /**
     * A parsed subtree and its operator height (atoms are 0).
     */
    private record Node(Condition condition, int height) {}

    private final class Cursor {
        private final String text;
        private final List<Token> tokens;
        private final int bitCount;
        private int pos;

        Cursor(String text, List<Token> tokens, int bitCount) {
            this.text = text;
            this.tokens = tokens;
            this.bitCount = bitCount;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return tokens.get(pos);
        }

        boolean peekIs(TokenType type) {
            return !atEnd() && peek().type() == type;
        }

        Token expect(TokenType type, String description) {
            if (atEnd()) {
                throw syntax(text, text.length(), "Unexpected end of condition, expected " + description);
            }
            Token token = tokens.get(pos);
            if (token.type() != type) {
                throw syntax(text, token.position(), "Expected " + description + " but found '" + token.text() + "'");
            }
            pos++;
            return token;
        }

        Node parseOr(int depth) {
            if (depth > maxDepth) {
                throw syntax(text, atEnd() ? text.length() : peek().position(),
                        "Condition nested deeper than " + maxDepth);
            }
            Node left = parseAnd(depth);
            while (peekIs(TokenType.OR)) {
                Token token = tokens.get(pos++);
                Node right = parseAnd(depth);
                left = node(new Condition.Or(left.condition(), right.condition()), left, right, token);
            }
            return left;
        }

        Node parseAnd(int depth) {
            Node left = parseAtom(depth);
            while (peekIs(TokenType.AND)) {
                Token token = tokens.get(pos++);
                Node right = parseAtom(depth);
                left = node(new Condition.And(left.condition(), right.condition()), left, right, token);
            }
            return left;
        }

        Node node(Condition condition, Node left, Node right, Token token) {
            int height = Math.max(left.height(), right.height()) + 1;
            if (height > maxDepth) {
                throw syntax(text, token.position(), "Condition nested deeper than " + maxDepth);
            }
            return new Node(condition, height);
        }

        Node parseAtom(int depth) {
            if (peekIs(TokenType.LPAREN)) {
                Token open = tokens.get(pos++);
                Node inner = parseOr(depth + 1);
                if (!peekIs(TokenType.RPAREN)) {
                    throw syntax(text, open.position(), "Unbalanced '('");
                }
                pos++;
                return inner;
            }
            expect(TokenType.C, "'c', 'c[i]' or '('");
            if (peekIs(TokenType.LBRACKET)) {
                pos++;
                Token index = expect(TokenType.INT, "bit index");
                expect(TokenType.RBRACKET, "']'");
                expect(TokenType.EQ, "'=='");
                Token bit = expect(TokenType.INT, "0 or 1");
                if (!bit.text().equals("0") && !bit.text().equals("1")) {
                    throw syntax(text, bit.position(), "Bit comparison value must be 0 or 1, got '" + bit.text() + "'");
                }
                int bitIndex = parseBitIndex(index);
                if (bitIndex >= bitCount) {
                    throw QuyamlException.of(ErrorKind.INDEX_OUT_OF_RANGE,
                            "Condition references c[" + bitIndex + "] but circuit has " + bitCount + " bits");
                }
                return new Node(new Condition.BitEq(bitIndex, Integer.parseInt(bit.text())), 0);
            }
            expect(TokenType.EQ, "'=='");
            Token literal = expect(TokenType.INT, "integer literal");
            BigInteger value = parseRegisterLiteral(literal);
            if (value.bitLength() > bitCount) {
                throw QuyamlException.of(ErrorKind.INDEX_OUT_OF_RANGE,
                        "Condition value " + value + " doesn't fit in " + bitCount + " classical bits");
            }
            return new Node(new Condition.RegisterEq(value), 0);
        }

        int parseBitIndex(Token token) {
            try {
                return Integer.parseInt(token.text());
            } catch (NumberFormatException e) {
                throw syntax(text, token.position(), "Invalid bit index '" + token.text() + "'");
            }
        }

        BigInteger parseRegisterLiteral(Token token) {
            String literal = token.text().replace("_", "");
            int radix = 10;
            String digits = literal;
            if (literal.startsWith("0b") || literal.startsWith("0B")) {
                radix = 2;
                digits = literal.substring(2);
            } else if (literal.startsWith("0x") || literal.startsWith("0X")) {
                radix = 16;
                digits = literal.substring(2);
            }
            try {
                if (digits.isEmpty()) {
                    throw new NumberFormatException("no digits");
                }
                return new BigInteger(digits, radix);
            } catch (NumberFormatException e) {
                throw syntax(text, token.position(), "Invalid integer literal '" + token.text() + "'");
            }
        }
    }
}
