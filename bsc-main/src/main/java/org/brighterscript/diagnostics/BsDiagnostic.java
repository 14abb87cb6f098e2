package org.brighterscript.diagnostics;

import com.github.javaparser.Range;

public record BsDiagnostic(int code, String message, DiagnosticSeverity severity, String srcPath, Range range) {

    /**
     * Identity used to collapse repeated reports of the same problem.
     */
    public String key() {
        return code + "|" + message + "|" + srcPath + "|" + range;
    }
}
