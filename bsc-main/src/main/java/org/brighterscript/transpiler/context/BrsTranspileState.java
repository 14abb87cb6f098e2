package org.brighterscript.transpiler.context;

import com.github.javaparser.Range;
import org.brighterscript.config.TranspileConfig;
import org.brighterscript.diagnostics.BsDiagnostic;
import org.brighterscript.diagnostics.DiagnosticManager;
import org.brighterscript.parser.Located;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.ast.AstNode;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.visitor.AstEditor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.sourcemap.SourceNode;
import org.brighterscript.symbols.ClassResolver;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.lowering.AncestorResolver;

import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Mutable context threaded through the lowering of one file. Not shared between threads; create a
 * fresh instance per file.
 */
public class BrsTranspileState {

    private static final String NEWLINE = "\n";

    private final String srcPath;
    private final ClassResolver classResolver;
    private final DiagnosticManager diagnostics;
    private final TranspileConfig config;
    private final AstEditor editor;

    // entries may be null for composites without a source token
    private final Deque<Located> lineage = new LinkedList<>();
    private int blockDepth;
    private String indentText = "";
    private ClassStatement classStatement;
    private final Map<ClassStatement, List<ClassStatement>> ancestorCache = new IdentityHashMap<>();

    public BrsTranspileState(String srcPath, ClassResolver classResolver) {
        this(srcPath, classResolver, new DiagnosticManager(), TranspileConfig.defaults(), new AstEditor());
    }

    public BrsTranspileState(String srcPath, ClassResolver classResolver, DiagnosticManager diagnostics,
                             TranspileConfig config, AstEditor editor) {
        this.srcPath = srcPath;
        this.classResolver = classResolver;
        this.diagnostics = diagnostics;
        this.config = config;
        this.editor = editor;
    }

    public String getSrcPath() {
        return srcPath;
    }

    public TranspileConfig getConfig() {
        return config;
    }

    public AstEditor getEditor() {
        return editor;
    }

    public Optional<ClassStatement> resolveClass(String className, String containingNamespace) {
        return classResolver.resolveClass(className, containingNamespace);
    }

    /**
     * The resolved ancestors of {@code cls}, nearest first. Resolved once per class and state.
     */
    public List<ClassStatement> getAncestors(ClassStatement cls) {
        List<ClassStatement> ancestors = ancestorCache.get(cls);
        if (ancestors == null) {
            ancestors = List.copyOf(AncestorResolver.resolve(cls, this));
            ancestorCache.put(cls, ancestors);
        }
        return ancestors;
    }

    public void report(BsDiagnostic diagnostic) {
        diagnostics.register(diagnostic);
    }

    // indentation

    public int getBlockDepth() {
        return blockDepth;
    }

    public void setBlockDepth(int blockDepth) {
        if (blockDepth < 0) {
            throw new IllegalStateException("Block depth cannot be negative: " + blockDepth);
        }
        this.blockDepth = blockDepth;
        this.indentText = config.getIndent().repeat(blockDepth);
    }

    public void incrementBlockDepth() {
        setBlockDepth(blockDepth + 1);
    }

    public void decrementBlockDepth() {
        setBlockDepth(blockDepth - 1);
    }

    public String indent() {
        return indentText;
    }

    public String newline() {
        return NEWLINE;
    }

    // lineage

    public void pushLineage(Located node) {
        lineage.push(node);
    }

    public void popLineage() {
        lineage.pop();
    }

    /**
     * The innermost enclosing composite, or {@code null} at the top level.
     */
    public Located getLineageHead() {
        return lineage.peek();
    }

    /**
     * Run {@code action} with {@code node} pushed onto the lineage, popping it on every exit path.
     */
    public <T> T withLineage(Located node, Supplier<T> action) {
        pushLineage(node);
        try {
            return action.get();
        } finally {
            popLineage();
        }
    }

    // current class

    public ClassStatement getClassStatement() {
        return classStatement;
    }

    /**
     * Run {@code action} while {@code cls} is the class being lowered. The previous value is
     * restored afterwards, including when {@code action} throws.
     */
    public <T> T withClassStatement(ClassStatement cls, Supplier<T> action) {
        ClassStatement previous = classStatement;
        classStatement = cls;
        try {
            return action.get();
        } finally {
            classStatement = previous;
        }
    }

    // source nodes

    public SourceNode transpileToken(Token token) {
        return sourceNode(token, token.getText());
    }

    /**
     * The token's text, or {@code defaultText} unmapped when the token is missing.
     */
    public SourceNode transpileToken(Token token, String defaultText) {
        return token == null ? SourceNode.text(defaultText) : transpileToken(token);
    }

    /**
     * A fragment of {@code text} mapped to the start of {@code located}; unmapped when the location
     * is missing or synthesized.
     */
    public SourceNode sourceNode(Located located, String text) {
        Range range = located == null ? null : located.getRange();
        if (range == null || AstUtils.isInterpolated(range)) {
            return SourceNode.text(text);
        }
        return SourceNode.leaf(range.begin.line, range.begin.column - 1, srcPath, text);
    }

    public SourceNode toSourceNode(AstNode node, TranspileResult result) {
        Range range = node.getRange();
        if (range == null || AstUtils.isInterpolated(range)) {
            return SourceNode.composite(result.getChunks());
        }
        return SourceNode.composite(range.begin.line, range.begin.column - 1, srcPath, result.getChunks());
    }
}
