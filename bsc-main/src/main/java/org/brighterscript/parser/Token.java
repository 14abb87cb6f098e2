package org.brighterscript.parser;

import com.github.javaparser.Range;

import java.util.Objects;

/**
 * An immutable lexical unit. Edits made during lowering replace tokens rather than mutate them.
 */
public final class Token implements Located {

    private final TokenKind kind;
    private final String text;
    private final Range range;
    private final String leadingWhitespace;

    public Token(TokenKind kind, String text, Range range) {
        this(kind, text, range, "");
    }

    public Token(TokenKind kind, String text, Range range, String leadingWhitespace) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.range = Objects.requireNonNull(range, "range");
        this.leadingWhitespace = leadingWhitespace == null ? "" : leadingWhitespace;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    @Override
    public Range getRange() {
        return range;
    }

    public String getLeadingWhitespace() {
        return leadingWhitespace;
    }

    /**
     * A copy of this token at the same location with different text.
     */
    public Token withText(String newText) {
        return new Token(kind, newText, range, leadingWhitespace);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + range;
    }
}
