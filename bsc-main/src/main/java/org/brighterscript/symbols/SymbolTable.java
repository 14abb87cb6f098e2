package org.brighterscript.symbols;

import com.github.javaparser.Range;
import org.brighterscript.parser.ast.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Names declared directly in one scope-owning node. Lookups are case-insensitive and fall back
 * to the enclosing table, which is found through {@code parentProvider} on every call rather than
 * held, so a table never keeps its parent alive.
 */
public class SymbolTable {

    private final String name;
    private final Supplier<SymbolTable> parentProvider;
    private final Map<String, List<BscSymbol>> symbols = new LinkedHashMap<>();

    public SymbolTable(String name) {
        this(name, () -> null);
    }

    public SymbolTable(String name, Supplier<SymbolTable> parentProvider) {
        this.name = name;
        this.parentProvider = parentProvider;
    }

    public String getName() {
        return name;
    }

    public SymbolTable getParent() {
        return parentProvider.get();
    }

    public void addSymbol(String symbolName, SymbolKind kind, Range range, Statement declaration) {
        symbols.computeIfAbsent(key(symbolName), k -> new ArrayList<>())
                .add(new BscSymbol(symbolName, kind, range, declaration));
    }

    /**
     * Symbols with the given name declared in this table, or in the nearest enclosing table that
     * declares it. Empty when no table in the chain knows the name.
     */
    public List<BscSymbol> getSymbol(String symbolName) {
        SymbolTable table = this;
        String key = key(symbolName);
        while (table != null) {
            List<BscSymbol> found = table.symbols.get(key);
            if (found != null && !found.isEmpty()) {
                return Collections.unmodifiableList(found);
            }
            table = table.getParent();
        }
        return Collections.emptyList();
    }

    public boolean hasSymbol(String symbolName) {
        return !getSymbol(symbolName).isEmpty();
    }

    public List<BscSymbol> getOwnSymbols() {
        List<BscSymbol> result = new ArrayList<>();
        for (List<BscSymbol> list : symbols.values()) {
            result.addAll(list);
        }
        return result;
    }

    public void clear() {
        symbols.clear();
    }

    private static String key(String symbolName) {
        return symbolName.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "SymbolTable(" + name + ")";
    }
}
