package com.blockflow.pygen.api;

/**
 * The code produced by emitting one block: its text plus how tightly it binds.
 *
 * <p>
 * Statement blocks return their full line(s), newline-terminated, with
 * {@link Precedence#NONE}. Expression blocks return inline text.
 */
public record Fragment(String text, Precedence precedence) {

    public static final Fragment EMPTY = new Fragment("", Precedence.NONE);

    public Fragment {
        text = text == null ? "" : text;
        precedence = precedence == null ? Precedence.NONE : precedence;
    }

    public static Fragment of(String text, Precedence precedence) {
        return new Fragment(text, precedence);
    }

    public static Fragment statement(String text) {
        return new Fragment(text, Precedence.NONE);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /** Text to embed in a context of the given precedence. */
    public String textIn(Precedence outer) {
        if (text.isEmpty() || !Precedence.needsParens(outer, precedence))
            return text;
        return "(" + text + ")";
    }
}
