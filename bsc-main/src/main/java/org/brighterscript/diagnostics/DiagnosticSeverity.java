package org.brighterscript.diagnostics;

public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFORMATION,
    HINT
}
