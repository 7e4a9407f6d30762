package io.github.drompincen.mockjira.runtime.query;

import java.util.Locale;

record QueryToken(Type type, String text, int position) {

    enum Type {
        WORD,
        STRING,
        OPERATOR,
        LPAREN,
        RPAREN,
        COMMA,
        EOF
    }

    boolean isKeyword(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    String lower() {
        return text.toLowerCase(Locale.ROOT);
    }
}
