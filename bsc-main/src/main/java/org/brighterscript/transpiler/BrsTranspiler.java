package org.brighterscript.transpiler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.brighterscript.config.TranspileConfig;
import org.brighterscript.diagnostics.DiagnosticManager;
import org.brighterscript.parser.ast.stmt.Body;
import org.brighterscript.parser.ast.visitor.AstEditor;
import org.brighterscript.program.BrsFile;
import org.brighterscript.program.Program;
import org.brighterscript.sourcemap.CodeWithSourceMap;
import org.brighterscript.sourcemap.SourceNode;
import org.brighterscript.symbols.SymbolIndex;
import org.brighterscript.transpiler.context.BrsTranspileState;
import org.brighterscript.transpiler.lowering.NamespacedReferenceRewriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers BrighterScript files to BrightScript.
 * <p>
 * Each file gets a fresh {@link BrsTranspileState}. Every tree edit made while lowering is undone
 * before returning, so a file can be lowered again with the same result.
 */
public class BrsTranspiler {

    private static final Logger logger = LogManager.getLogger(BrsTranspiler.class);

    private final SymbolIndex index;
    private final DiagnosticManager diagnostics;
    private final TranspileConfig config;

    public BrsTranspiler(Program program) {
        this(program, program.getDiagnostics(), program.getConfig());
    }

    public BrsTranspiler(SymbolIndex index, DiagnosticManager diagnostics, TranspileConfig config) {
        this.index = index;
        this.diagnostics = diagnostics;
        this.config = config;
    }

    public TranspiledResult transpile(BrsFile file) {
        logger.debug("Transpiling {}", file.getSrcPath());
        Body body = file.getBody();
        body.link();
        AstEditor editor = new AstEditor();
        BrsTranspileState state = newState(file, editor);
        try {
            new NamespacedReferenceRewriter(index, state).rewrite(body);
            SourceNode sourceNode = state.toSourceNode(body, body.transpile(state));
            if (config.isSourceMaps()) {
                CodeWithSourceMap output = sourceNode.toStringWithSourceMap();
                return new TranspiledResult(file.getSrcPath(), output.code(), sourceNode, output.mappings());
            }
            return new TranspiledResult(file.getSrcPath(), sourceNode.toString(), sourceNode, List.of());
        } finally {
            logger.debug("Reverting {} edits in {}", editor.getEditCount(), file.getSrcPath());
            editor.undoAll();
            body.link();
        }
    }

    public List<TranspiledResult> transpileAll(Iterable<BrsFile> files) {
        List<TranspiledResult> results = new ArrayList<>();
        for (BrsFile file : files) {
            results.add(transpile(file));
        }
        return results;
    }

    /**
     * The declaration-only view of a file, as written to its {@code .d.bs} companion.
     */
    public String getTypedef(BrsFile file) {
        Body body = file.getBody();
        body.link();
        BrsTranspileState state = newState(file, new AstEditor());
        return body.getTypedef(state).toString();
    }

    private BrsTranspileState newState(BrsFile file, AstEditor editor) {
        return new BrsTranspileState(file.getSrcPath(), index, diagnostics, config, editor);
    }
}
