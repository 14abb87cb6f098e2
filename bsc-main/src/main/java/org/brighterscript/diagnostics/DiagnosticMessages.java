package org.brighterscript.diagnostics;

import com.github.javaparser.Range;

/**
 * Factory methods for the diagnostics the transpiler itself can raise.
 */
public final class DiagnosticMessages {

    public static final int CLASS_COULD_NOT_BE_FOUND = 1029;
    public static final int DUPLICATE_CLASS_DECLARATION = 1041;

    private DiagnosticMessages() {
    }

    public static BsDiagnostic classCouldNotBeFound(String className, String srcPath, Range range) {
        return new BsDiagnostic(CLASS_COULD_NOT_BE_FOUND,
                "Class '" + className + "' could not be found when this file is transpiled",
                DiagnosticSeverity.WARNING, srcPath, range);
    }

    public static BsDiagnostic duplicateClassDeclaration(String className, String srcPath, Range range) {
        return new BsDiagnostic(DUPLICATE_CLASS_DECLARATION,
                "Class '" + className + "' is declared more than once",
                DiagnosticSeverity.ERROR, srcPath, range);
    }
}
