package com.twbconvert.translate;

import com.twbconvert.formula.ast.FunctionCallNode;
import com.twbconvert.translate.dax.DaxExpr;
import java.util.List;

@FunctionalInterface
interface FunctionRule {
    /**
     * @param arguments the call's arguments, already translated, in source order
     */
    DaxExpr apply(FunctionCallNode call, List<DaxExpr> arguments, RuleContext context);
}
