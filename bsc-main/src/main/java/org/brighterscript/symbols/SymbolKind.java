package org.brighterscript.symbols;

public enum SymbolKind {
    FUNCTION,
    CLASS,
    INTERFACE,
    ENUM,
    CONST,
    NAMESPACE
}
