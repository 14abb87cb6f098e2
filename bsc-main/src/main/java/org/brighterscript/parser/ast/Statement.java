/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.brighterscript.parser.ast;

import org.brighterscript.parser.ast.expr.AnnotationExpression;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayList;
import java.util.List;

public abstract class Statement extends AstNode {

    private List<AnnotationExpression> annotations = new ArrayList<>();

    @Override
    public int getVisitMode() {
        return WalkMode.VISIT_STATEMENTS_FLAG;
    }

    public List<AnnotationExpression> getAnnotations() {
        return annotations;
    }

    public void setAnnotations(List<AnnotationExpression> annotations) {
        this.annotations = annotations == null ? new ArrayList<>() : new ArrayList<>(annotations);
    }

    /**
     * One typedef line per annotation, each followed by a newline and the current indent.
     */
    protected TranspileResult getAnnotationTypedef(BrsTranspileState state) {
        TranspileResult result = new TranspileResult();
        for (AnnotationExpression annotation : annotations) {
            result.addAll(annotation.getTypedef(state))
                    .add(state.newline())
                    .add(state.indent());
        }
        return result;
    }
}
