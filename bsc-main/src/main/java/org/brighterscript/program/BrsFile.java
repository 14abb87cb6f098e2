package org.brighterscript.program;

import org.brighterscript.parser.ast.stmt.Body;

import java.util.Objects;

/**
 * A parsed source file: its path and the top-level body.
 */
public final class BrsFile {

    private final String srcPath;
    private final Body body;

    public BrsFile(String srcPath, Body body) {
        this.srcPath = Objects.requireNonNull(srcPath, "srcPath");
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getSrcPath() {
        return srcPath;
    }

    public Body getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "BrsFile(" + srcPath + ")";
    }
}
