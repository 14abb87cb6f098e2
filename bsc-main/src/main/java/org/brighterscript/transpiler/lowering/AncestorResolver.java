package org.brighterscript.transpiler.lowering;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.brighterscript.ClassHierarchyCycleException;
import org.brighterscript.diagnostics.DiagnosticMessages;
import org.brighterscript.parser.ParseMode;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Follows {@code extends} links through the whole program.
 * <p>
 * Each parent name is resolved relative to the namespace of the class that declares it. The walk
 * stops at the first class without a parent, or at a parent that cannot be found, which is
 * reported as a warning. A class reached twice, or a chain longer than the configured maximum,
 * is a broken hierarchy and fails with {@link ClassHierarchyCycleException}.
 */
public final class AncestorResolver {

    private static final Logger logger = LogManager.getLogger(AncestorResolver.class);

    private AncestorResolver() {
    }

    /**
     * The resolved ancestors of {@code cls}, nearest first. Empty when the class has no parent or
     * its parent cannot be found.
     */
    public static List<ClassStatement> resolve(ClassStatement cls, BrsTranspileState state) {
        List<ClassStatement> ancestors = new ArrayList<>();
        Set<ClassStatement> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visited.add(cls);
        int maxDepth = state.getConfig().getMaxInheritanceDepth();

        ClassStatement current = cls;
        while (current.hasParentClass()) {
            String parentName = current.getParentClassName().getName(ParseMode.BRIGHTERSCRIPT);
            String namespaceName = current.getNamespaceName();
            Optional<ClassStatement> parent = state.resolveClass(parentName, namespaceName);
            if (parent.isEmpty()) {
                logger.warn("Parent class '{}' of '{}' could not be found in {}",
                        parentName, current.getName(ParseMode.BRIGHTERSCRIPT), state.getSrcPath());
                state.report(DiagnosticMessages.classCouldNotBeFound(
                        parentName, state.getSrcPath(), current.getParentClassName().getRange()));
                break;
            }
            ClassStatement resolved = parent.get();
            if (!visited.add(resolved) || ancestors.size() >= maxDepth) {
                List<String> chain = names(cls, ancestors);
                chain.add(resolved.getName(ParseMode.BRIGHTERSCRIPT));
                throw new ClassHierarchyCycleException(cls.getName(ParseMode.BRIGHTERSCRIPT), chain);
            }
            ancestors.add(resolved);
            current = resolved;
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Ancestors of {}: {}", cls.getName(ParseMode.BRIGHTERSCRIPT), names(cls, ancestors));
        }
        return ancestors;
    }

    /**
     * The index used in {@code super<index>_<name>} keys: the ancestor count minus one, or empty
     * for a class without resolved ancestors.
     */
    public static OptionalInt parentClassIndex(List<ClassStatement> ancestors) {
        return ancestors.isEmpty() ? OptionalInt.empty() : OptionalInt.of(ancestors.size() - 1);
    }

    private static List<String> names(ClassStatement cls, List<ClassStatement> ancestors) {
        List<String> names = new ArrayList<>();
        names.add(cls.getName(ParseMode.BRIGHTERSCRIPT));
        for (ClassStatement ancestor : ancestors) {
            names.add(ancestor.getName(ParseMode.BRIGHTERSCRIPT));
        }
        return names;
    }
}
