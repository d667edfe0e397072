package org.astx.ast.classes;

import org.astx.api.MalformedNodeException;
import org.astx.ast.callables.FunctionDef;
import org.astx.ast.modifiers.VisibilityKind;
import org.astx.ast.variables.VariableDeclaration;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Member name checks of class-like declarations: one name per visibility level.
 */
final class Members {

    private Members() {}

    static void requireUnique(String owner, List<VariableDeclaration> attributes, List<? extends FunctionDef> methods) {
        Set<String> seen = new HashSet<>();
        for (VariableDeclaration attribute : attributes) {
            claim(seen, owner, attribute.name(), attribute.visibility());
        }
        for (FunctionDef method : methods) {
            claim(seen, owner, method.name(), method.prototype().visibility());
        }
    }

    private static void claim(Set<String> seen, String owner, String name, VisibilityKind visibility) {
        if (!seen.add(visibility.label() + " " + name)) {
            throw new MalformedNodeException(String.format(
                    "Duplicate %s member '%s' in %s", visibility.label(), name, owner));
        }
    }
}
