package com.twbconvert.translate;

import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.translate.dax.DaxExpr;
import com.twbconvert.workbook.DataType;
import java.util.Optional;

/** Services a function rule may use while translating one call. */
interface RuleContext {

    /** Records one assumption for {@code node} and returns {@code approximation}. */
    DaxExpr closestMatch(ExprNode node, DaxExpr approximation, String reason);

    /** Lower-case text of a string literal argument, such as the date part of {@code DATEDIFF}. */
    Optional<String> literalText(ExprNode node);

    DataType typeOf(ExprNode node);
}
