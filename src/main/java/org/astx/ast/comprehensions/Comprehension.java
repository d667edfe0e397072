package org.astx.ast.comprehensions;

import org.astx.api.MalformedNodeException;
import org.astx.ast.Expr;

import java.util.List;

/**
 * Base of the comprehension forms. Clauses run left to right; the element expression is
 * evaluated in the scope of every clause target.
 */
public abstract class Comprehension extends Expr {

    private final List<ComprehensionClause> clauses;

    protected Comprehension(List<ComprehensionClause> clauses) {
        if (clauses == null || clauses.isEmpty()) {
            throw new MalformedNodeException(getClass().getSimpleName() + " requires at least one clause");
        }
        this.clauses = adoptAll(clauses);
    }

    public List<ComprehensionClause> clauses() {
        return clauses;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
