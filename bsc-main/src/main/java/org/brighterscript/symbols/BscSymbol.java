package org.brighterscript.symbols;

import com.github.javaparser.Range;
import org.brighterscript.parser.ast.Statement;

/**
 * A declared name and the statement that declares it.
 */
public record BscSymbol(String name, SymbolKind kind, Range range, Statement declaration) {
}
