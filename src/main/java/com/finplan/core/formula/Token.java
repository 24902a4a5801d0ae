package com.finplan.core.formula;

record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + (text != null ? "(" + text + ")" : "") + "@" + position;
    }
}
