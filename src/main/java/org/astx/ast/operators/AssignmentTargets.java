package org.astx.ast.operators;

import org.astx.api.MalformedNodeException;
import org.astx.ast.Expr;
import org.astx.ast.variables.Variable;

final class AssignmentTargets {

    private AssignmentTargets() {}

    static Variable requireAddressable(Expr target, String construct) {
        if (target instanceof Variable variable) {
            return variable;
        }
        throw new MalformedNodeException(String.format(
                "%s requires a variable as its target, got %s", construct, target));
    }
}
