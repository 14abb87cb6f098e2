package org.brighterscript.benchmark;

import java.util.concurrent.TimeUnit;

import org.brighterscript.config.TranspileConfig;
import org.brighterscript.program.BrsFile;
import org.brighterscript.program.Program;
import org.brighterscript.transpiler.BrsTranspiler;
import org.brighterscript.transpiler.TranspiledResult;
import org.openjdk.jmh.annotations.*;

/**
 * Measures transpiling a file whose classes form one long inheritance chain. Every class resolves
 * its ancestors and rewrites enum references, so cost grows with the depth of the chain.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ClassLoweringBenchmark {

    @State(Scope.Thread)
    public static class HierarchyState {

        @Param({"4", "16", "48"})
        int depth;

        @Param({"true", "false"})
        boolean sourceMaps;

        BrsTranspiler transpiler;
        BrsFile file;

        @Setup(Level.Trial)
        public void init() {
            Program program = new Program(TranspileConfig.defaults().withSourceMaps(sourceMaps));
            file = program.addFile("source/zoo.bs", ProgramFixtures.classHierarchy(depth));
            transpiler = new BrsTranspiler(program);
        }
    }

    @Benchmark
    public TranspiledResult transpileHierarchy(HierarchyState state) {
        return state.transpiler.transpile(state.file);
    }

    @Benchmark
    public String typedefHierarchy(HierarchyState state) {
        return state.transpiler.getTypedef(state.file);
    }
}
