package io.github.drompincen.mockjira.runtime.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a query string into words, quoted strings, operators and punctuation.
 */
final class QueryTokenizer {

    private final String input;
    private int pos;

    QueryTokenizer(String input) {
        this.input = input;
    }

    List<QueryToken> tokenize() {
        List<QueryToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new QueryToken(QueryToken.Type.EOF, "", pos));
                return tokens;
            }
            char c = input.charAt(pos);
            int start = pos;
            switch (c) {
                case '(' -> {
                    pos++;
                    tokens.add(new QueryToken(QueryToken.Type.LPAREN, "(", start));
                }
                case ')' -> {
                    pos++;
                    tokens.add(new QueryToken(QueryToken.Type.RPAREN, ")", start));
                }
                case ',' -> {
                    pos++;
                    tokens.add(new QueryToken(QueryToken.Type.COMMA, ",", start));
                }
                case '"', '\'' -> tokens.add(readString(c));
                case '=', '!', '<', '>', '~' -> tokens.add(readOperator());
                default -> tokens.add(readWord());
            }
        }
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private QueryToken readString(char quote) {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == '\\' && pos < input.length()) {
                sb.append(input.charAt(pos++));
            } else if (c == quote) {
                return new QueryToken(QueryToken.Type.STRING, sb.toString(), start);
            } else {
                sb.append(c);
            }
        }
        throw new QuerySyntaxException("Unterminated string literal", start);
    }

    private QueryToken readOperator() {
        int start = pos;
        char c = input.charAt(pos++);
        if (pos < input.length() && input.charAt(pos) == '=' && c != '=') {
            pos++;
        }
        return new QueryToken(QueryToken.Type.OPERATOR, input.substring(start, pos), start);
    }

    private QueryToken readWord() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c) || "(),=!<>~\"'".indexOf(c) >= 0) {
                break;
            }
            pos++;
        }
        return new QueryToken(QueryToken.Type.WORD, input.substring(start, pos), start);
    }
}
