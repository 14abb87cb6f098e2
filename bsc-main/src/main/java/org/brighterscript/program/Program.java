package org.brighterscript.program;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.brighterscript.config.TranspileConfig;
import org.brighterscript.diagnostics.DiagnosticManager;
import org.brighterscript.diagnostics.DiagnosticMessages;
import org.brighterscript.parser.ParseMode;
import org.brighterscript.parser.ast.AstNode;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.stmt.Body;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.stmt.ConstStatement;
import org.brighterscript.parser.ast.stmt.EnumStatement;
import org.brighterscript.parser.ast.stmt.FunctionStatement;
import org.brighterscript.parser.ast.stmt.InterfaceStatement;
import org.brighterscript.parser.ast.stmt.NamespaceStatement;
import org.brighterscript.parser.ast.visitor.GenericVisitorWithDefaults;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.symbols.SymbolIndex;
import org.brighterscript.symbols.SymbolKind;
import org.brighterscript.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The set of files being compiled together, and the index of their top-level declarations.
 * <p>
 * Declarations are keyed by their lower-case dotted name. The first declaration of a class wins;
 * later ones are reported as duplicates. Adding a file under an existing path replaces it.
 */
public class Program implements SymbolIndex {

    private static final Logger logger = LogManager.getLogger(Program.class);

    private final TranspileConfig config;
    private final DiagnosticManager diagnostics;
    private final Map<String, BrsFile> files = new LinkedHashMap<>();

    private final Map<String, ClassStatement> classes = new HashMap<>();
    private final Map<String, EnumStatement> enums = new HashMap<>();
    private final Map<String, ConstStatement> consts = new HashMap<>();
    private final Map<String, FunctionStatement> functions = new HashMap<>();
    private final Map<String, InterfaceStatement> interfaces = new HashMap<>();
    private final Set<String> namespaces = new HashSet<>();

    public Program() {
        this(TranspileConfig.fromSystemProperties());
    }

    public Program(TranspileConfig config) {
        this(config, new DiagnosticManager());
    }

    public Program(TranspileConfig config, DiagnosticManager diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public TranspileConfig getConfig() {
        return config;
    }

    public DiagnosticManager getDiagnostics() {
        return diagnostics;
    }

    public BrsFile addFile(String srcPath, Body body) {
        return addFile(new BrsFile(srcPath, body));
    }

    public BrsFile addFile(BrsFile file) {
        if (files.containsKey(file.getSrcPath())) {
            removeFile(file.getSrcPath());
        }
        files.put(file.getSrcPath(), file);
        file.getBody().link();
        index(file);
        logger.debug("Added {}", file.getSrcPath());
        return file;
    }

    /**
     * Remove a file and everything it declared. Diagnostics raised for the file are cleared.
     */
    public void removeFile(String srcPath) {
        BrsFile removed = files.remove(srcPath);
        if (removed == null) {
            return;
        }
        diagnostics.clearForFile(srcPath);
        reindex();
        logger.debug("Removed {}", srcPath);
    }

    public Optional<BrsFile> getFile(String srcPath) {
        return Optional.ofNullable(files.get(srcPath));
    }

    public Collection<BrsFile> getFiles() {
        return Collections.unmodifiableCollection(files.values());
    }

    @Override
    public Optional<ClassStatement> resolveClass(String className, String containingNamespace) {
        return lookup(classes, className, containingNamespace);
    }

    @Override
    public Optional<EnumStatement> resolveEnum(String enumName, String containingNamespace) {
        return lookup(enums, enumName, containingNamespace);
    }

    @Override
    public Optional<ConstStatement> resolveConst(String constName, String containingNamespace) {
        return lookup(consts, constName, containingNamespace);
    }

    @Override
    public Optional<FunctionStatement> resolveFunction(String functionName, String containingNamespace) {
        return lookup(functions, functionName, containingNamespace);
    }

    public Optional<InterfaceStatement> resolveInterface(String interfaceName, String containingNamespace) {
        return lookup(interfaces, interfaceName, containingNamespace);
    }

    @Override
    public boolean isNamespace(String namespaceName) {
        return namespaceName != null && namespaces.contains(key(namespaceName));
    }

    private static <T> Optional<T> lookup(Map<String, T> map, String name, String containingNamespace) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        if (containingNamespace != null && !containingNamespace.isEmpty()) {
            T relative = map.get(key(containingNamespace + "." + name));
            if (relative != null) {
                return Optional.of(relative);
            }
        }
        return Optional.ofNullable(map.get(key(name)));
    }

    private void reindex() {
        classes.clear();
        enums.clear();
        consts.clear();
        functions.clear();
        interfaces.clear();
        namespaces.clear();
        for (BrsFile file : files.values()) {
            index(file);
        }
    }

    private void index(BrsFile file) {
        Indexer indexer = new Indexer(file);
        file.getBody().getSymbolTable().clear();
        file.getBody().walk(WalkVisitor.of(indexer), WalkOptions.of(WalkMode.VISIT_STATEMENTS));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Records the declarations of one file in the program maps and in the symbol table of the body
     * that declares them.
     */
    private class Indexer extends GenericVisitorWithDefaults<AstNode, AstNode> {

        private final BrsFile file;

        Indexer(BrsFile file) {
            this.file = file;
        }

        @Override
        public AstNode visit(ClassStatement n, AstNode parent) {
            String name = n.getName(ParseMode.BRIGHTERSCRIPT);
            ClassStatement existing = classes.putIfAbsent(key(name), n);
            if (existing != null && existing != n) {
                logger.warn("Duplicate class declaration {} in {}", name, file.getSrcPath());
                diagnostics.register(DiagnosticMessages.duplicateClassDeclaration(name, file.getSrcPath(),
                        n.getNameToken().getRange()));
            }
            declare(n, n.getNameToken().getText(), SymbolKind.CLASS);
            return null;
        }

        @Override
        public AstNode visit(FunctionStatement n, AstNode parent) {
            functions.putIfAbsent(key(n.getName(ParseMode.BRIGHTERSCRIPT)), n);
            declare(n, n.getName().getText(), SymbolKind.FUNCTION);
            return null;
        }

        @Override
        public AstNode visit(EnumStatement n, AstNode parent) {
            enums.putIfAbsent(key(n.getFullName()), n);
            declare(n, n.getName(), SymbolKind.ENUM);
            return null;
        }

        @Override
        public AstNode visit(ConstStatement n, AstNode parent) {
            consts.putIfAbsent(key(n.getFullName()), n);
            declare(n, n.getName(), SymbolKind.CONST);
            return null;
        }

        @Override
        public AstNode visit(InterfaceStatement n, AstNode parent) {
            interfaces.putIfAbsent(key(n.getFullName()), n);
            declare(n, n.getName(), SymbolKind.INTERFACE);
            return null;
        }

        @Override
        public AstNode visit(NamespaceStatement n, AstNode parent) {
            String name = n.getName(ParseMode.BRIGHTERSCRIPT);
            // every prefix of a dotted namespace is a namespace too
            List<String> prefixes = new ArrayList<>();
            StringBuilder prefix = new StringBuilder();
            for (String part : name.split("\\.")) {
                if (prefix.length() > 0) {
                    prefix.append('.');
                }
                prefix.append(part);
                prefixes.add(prefix.toString());
            }
            for (String namespace : prefixes) {
                namespaces.add(key(namespace));
            }
            n.getBody().getSymbolTable().clear();
            declare(n, n.getNameExpression().getName(ParseMode.BRIGHTERSCRIPT), SymbolKind.NAMESPACE);
            return null;
        }

        private void declare(Statement statement, String name, SymbolKind kind) {
            AstNode owner = statement.getParent();
            SymbolTable table = owner == null ? null : owner.getSymbolTable();
            if (table != null) {
                table.addSymbol(name, kind, statement.getRange(), statement);
            }
        }
    }
}
