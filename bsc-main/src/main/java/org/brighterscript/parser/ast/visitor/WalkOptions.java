package org.brighterscript.parser.ast.visitor;

public final class WalkOptions {

    private final int walkMode;
    private final AstEditor editor;

    private WalkOptions(int walkMode, AstEditor editor) {
        this.walkMode = walkMode;
        this.editor = editor;
    }

    public static WalkOptions of(int walkMode) {
        return new WalkOptions(walkMode, null);
    }

    /**
     * Replacements returned by the visitor are applied through {@code editor} so they can be undone.
     */
    public static WalkOptions of(int walkMode, AstEditor editor) {
        return new WalkOptions(walkMode, editor);
    }

    public int getWalkMode() {
        return walkMode;
    }

    public boolean walks(int flag) {
        return WalkMode.has(walkMode, flag);
    }

    public AstEditor getEditor() {
        return editor;
    }
}
