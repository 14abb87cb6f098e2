package org.brighterscript.symbols;

import org.brighterscript.parser.ast.stmt.ConstStatement;
import org.brighterscript.parser.ast.stmt.EnumStatement;
import org.brighterscript.parser.ast.stmt.FunctionStatement;

import java.util.Optional;

/**
 * Whole-program lookups used while lowering. Every lookup takes the name as written and the
 * namespace the reference sits in; names are tried relative to that namespace first, then globally.
 */
public interface SymbolIndex extends ClassResolver {

    Optional<EnumStatement> resolveEnum(String enumName, String containingNamespace);

    Optional<ConstStatement> resolveConst(String constName, String containingNamespace);

    Optional<FunctionStatement> resolveFunction(String functionName, String containingNamespace);

    boolean isNamespace(String namespaceName);
}
