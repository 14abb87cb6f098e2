package org.brighterscript.diagnostics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects diagnostics for a program. Reporting the same diagnostic twice keeps a single entry.
 */
public class DiagnosticManager {

    private final Map<String, BsDiagnostic> diagnostics = new LinkedHashMap<>();

    public void register(BsDiagnostic diagnostic) {
        diagnostics.putIfAbsent(diagnostic.key(), diagnostic);
    }

    public void register(List<BsDiagnostic> list) {
        for (BsDiagnostic diagnostic : list) {
            register(diagnostic);
        }
    }

    public List<BsDiagnostic> getDiagnostics() {
        return List.copyOf(diagnostics.values());
    }

    public List<BsDiagnostic> getDiagnostics(String srcPath) {
        List<BsDiagnostic> result = new ArrayList<>();
        for (BsDiagnostic diagnostic : diagnostics.values()) {
            if (Objects.equals(diagnostic.srcPath(), srcPath)) {
                result.add(diagnostic);
            }
        }
        return result;
    }

    public void clearForFile(String srcPath) {
        diagnostics.values().removeIf(d -> Objects.equals(d.srcPath(), srcPath));
    }

    public void clear() {
        diagnostics.clear();
    }
}
