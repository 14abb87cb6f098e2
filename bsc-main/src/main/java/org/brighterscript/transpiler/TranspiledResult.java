package org.brighterscript.transpiler;

import org.brighterscript.sourcemap.Mapping;
import org.brighterscript.sourcemap.SourceNode;

import java.util.List;

/**
 * The output of lowering one file.
 *
 * @param srcPath    the file that was lowered
 * @param code       the emitted BrightScript
 * @param sourceNode the position-tagged tree the code was rendered from
 * @param mappings   generated-to-original positions; empty when source maps are disabled
 */
public record TranspiledResult(String srcPath, String code, SourceNode sourceNode, List<Mapping> mappings) {

    public TranspiledResult {
        mappings = List.copyOf(mappings);
    }
}
