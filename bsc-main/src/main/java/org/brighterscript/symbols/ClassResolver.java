package org.brighterscript.symbols;

import org.brighterscript.parser.ast.stmt.ClassStatement;

import java.util.Optional;

/**
 * Whole-program class lookup used to resolve inheritance chains across files.
 */
@FunctionalInterface
public interface ClassResolver {

    ClassResolver NONE = (className, containingNamespace) -> Optional.empty();

    /**
     * Find a class by name. A name without dots is tried relative to {@code containingNamespace}
     * first, then as a global name.
     *
     * @param className           the name as written in source, possibly dotted
     * @param containingNamespace the BrighterScript name of the namespace the reference sits in, or {@code null}
     */
    Optional<ClassStatement> resolveClass(String className, String containingNamespace);
}
