package dev.multiverse.engine;

import dev.multiverse.model.Condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses textual conditions such as {@code A == a1 && (B != "b 2" || !C == c1)}.
 *
 * <pre>
 * expr       := and ( "||" and )*
 * and        := unary ( "&amp;&amp;" unary )*
 * unary      := "!" unary | "(" expr ")" | comparison
 * comparison := name ( "==" | "!=" ) name
 * name       := [A-Za-z0-9_.-]+ | '"' chars '"'
 * </pre>
 */
public final class ConditionParser {

    private final String text;
    private int pos;

    private ConditionParser(String text) {
        this.text = text;
    }

    public static Condition parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConditionSyntaxException(String.valueOf(text), 0, "Empty condition");
        }
        var parser = new ConditionParser(text);
        Condition condition = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < text.length()) {
            throw parser.error("Unexpected '" + text.charAt(parser.pos) + "'");
        }
        return condition;
    }

    private Condition expression() {
        List<Condition> terms = new ArrayList<>();
        terms.add(conjunction());
        while (accept("||")) {
            terms.add(conjunction());
        }
        return terms.size() == 1 ? terms.get(0) : new Condition.Any(terms);
    }

    private Condition conjunction() {
        List<Condition> terms = new ArrayList<>();
        terms.add(unary());
        while (accept("&&")) {
            terms.add(unary());
        }
        return terms.size() == 1 ? terms.get(0) : new Condition.All(terms);
    }

    private Condition unary() {
        skipWhitespace();
        if (peek("!=")) {
            throw error("Expected a parameter name");
        }
        if (accept("!")) {
            return new Condition.Not(unary());
        }
        if (accept("(")) {
            Condition inner = expression();
            if (!accept(")")) {
                throw error("Expected ')'");
            }
            return inner;
        }
        return comparison();
    }

    private Condition comparison() {
        String parameter = name();
        if (accept("==")) {
            return new Condition.Equals(parameter, name());
        }
        if (accept("!=")) {
            return new Condition.Not(new Condition.Equals(parameter, name()));
        }
        throw error("Expected '==' or '!=' after '" + parameter + "'");
    }

    private String name() {
        skipWhitespace();
        if (pos >= text.length()) {
            throw error("Unexpected end of condition");
        }
        if (text.charAt(pos) == '"') {
            int close = text.indexOf('"', pos + 1);
            if (close < 0) {
                throw error("Unterminated quoted name");
            }
            String quoted = text.substring(pos + 1, close);
            pos = close + 1;
            return quoted;
        }
        int start = pos;
        while (pos < text.length() && Condition.isBareNameChar(text.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw error("Expected a name");
        }
        return text.substring(start, pos);
    }

    private boolean accept(String token) {
        skipWhitespace();
        if (peek(token)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private boolean peek(String token) {
        return text.startsWith(token, pos);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private ConditionSyntaxException error(String message) {
        return new ConditionSyntaxException(text, pos, message);
    }
}
