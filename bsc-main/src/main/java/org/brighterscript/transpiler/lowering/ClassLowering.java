package org.brighterscript.transpiler.lowering;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.brighterscript.parser.ParseMode;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.expr.FunctionParameterExpression;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.stmt.FieldStatement;
import org.brighterscript.parser.ast.stmt.MethodStatement;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.List;
import java.util.OptionalInt;

/**
 * Lowers a class to its builder function followed by its class function.
 *
 * <pre>
 * function __Dog_builder()
 *     instance = __Animal_builder()
 *     instance.super0_new = instance.new
 *     instance.new = sub()
 *         m.super0_new()
 *     end sub
 *     return instance
 * end function
 * function Dog()
 *     instance = __Dog_builder()
 *     instance.new()
 *     return instance
 * end function
 * </pre>
 */
public final class ClassLowering {

    private static final Logger logger = LogManager.getLogger(ClassLowering.class);

    private ClassLowering() {
    }

    public static TranspileResult transpile(ClassStatement cls, BrsTranspileState state) {
        List<ClassStatement> ancestors = state.getAncestors(cls);
        logger.debug("Lowering class {} in {} ({} ancestors)",
                cls.getName(ParseMode.BRIGHTERSCRIPT), state.getSrcPath(), ancestors.size());
        return transpileBuilder(cls, ancestors, state)
                .add("\n")
                .add(state.indent())
                .addAll(transpileClassFunction(cls, state));
    }

    /**
     * The builder assigns every method onto an instance without running any constructor, so a
     * derived builder can start from its parent's builder.
     */
    static TranspileResult transpileBuilder(ClassStatement cls, List<ClassStatement> ancestors, BrsTranspileState state) {
        TranspileResult result = TranspileResult.of(
                "function ", AstUtils.getBuilderName(cls.getName(ParseMode.BRIGHTSCRIPT)), "()\n");
        state.incrementBlockDepth();
        result.add(state.indent());

        if (!ancestors.isEmpty()) {
            ClassStatement parent = ancestors.get(0);
            String parentName = AstUtils.getFullyQualifiedClassName(
                    parent.getName(ParseMode.BRIGHTERSCRIPT), parent.getNamespaceName());
            result.add("instance = ").add(AstUtils.getBuilderName(parentName)).add("()");
        } else {
            result.add("instance = {}");
        }
        result.add(state.newline()).add(state.indent());

        OptionalInt parentClassIndex = AncestorResolver.parentClassIndex(ancestors);
        for (Statement statement : cls.getBodyWithConstructor()) {
            if (statement instanceof FieldStatement) {
                // fields are assigned by the constructor
                continue;
            }
            if (statement instanceof MethodStatement) {
                MethodStatement method = (MethodStatement) statement;
                String name = method.getName().getText();
                if (parentClassIndex.isPresent() && (method.isOverride() || method.isConstructor())) {
                    result.add("instance.super" + parentClassIndex.getAsInt() + "_" + name + " = instance." + name)
                            .add(state.newline())
                            .add(state.indent());
                }
                result.add("instance.")
                        .add(state.transpileToken(method.getName()))
                        .add(" = ")
                        .addAll(state.withClassStatement(cls, () -> method.transpile(state)))
                        .add(state.newline())
                        .add(state.indent());
            } else {
                result.addAll(statement.transpile(state))
                        .add(state.newline())
                        .add(state.indent());
            }
        }
        result.add("return instance\n");
        state.decrementBlockDepth();
        return result.add(state.indent()).add("end function");
    }

    /**
     * The public function named after the class: builds an instance, runs {@code new} with the
     * constructor's parameters and returns the instance.
     */
    static TranspileResult transpileClassFunction(ClassStatement cls, BrsTranspileState state) {
        List<FunctionParameterExpression> params = cls.getConstructorFunction()
                .map(ctor -> ctor.getFunc().getParameters())
                .orElse(List.of());
        String brsName = cls.getName(ParseMode.BRIGHTSCRIPT);

        TranspileResult result = new TranspileResult()
                .add(state.sourceNode(cls.getClassKeyword(), "function"))
                .add(state.sourceNode(cls.getClassKeyword(), " "))
                .add(state.sourceNode(cls.getNameToken(), brsName))
                .add("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                result.add(", ");
            }
            result.addAll(params.get(i).transpile(state));
        }
        result.add(")").add("\n");

        state.incrementBlockDepth();
        result.add(state.indent())
                .add("instance = " + AstUtils.getBuilderName(brsName) + "()\n")
                .add(state.indent())
                .add("instance.new(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                result.add(", ");
            }
            result.add(state.transpileToken(params.get(i).getName()));
        }
        result.add(")").add("\n")
                .add(state.indent())
                .add("return instance\n");
        state.decrementBlockDepth();
        return result.add(state.indent()).add("end function");
    }
}
