package org.astx.ast.callables;

import org.astx.api.MalformedNodeException;
import org.astx.ast.AstKind;
import org.astx.ast.AstNodes;
import org.astx.ast.visitor.AstVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * The ordered, mutable parameter list of a function or lambda. Names stay unique:
 * appending or inserting a name already present fails.
 */
public final class Arguments extends AstNodes<Argument> {

    public Arguments(Argument... arguments) {
        this(Arrays.asList(arguments));
    }

    public Arguments(List<Argument> arguments) {
        super("args");
        arguments.forEach(this::append);
    }

    @Override
    public int append(Argument argument) {
        requireNewName(argument);
        return super.append(argument);
    }

    @Override
    public void insert(int index, Argument argument) {
        requireNewName(argument);
        super.insert(index, argument);
    }

    /**
     * @return How many leading arguments have no default value.
     */
    public int requiredCount() {
        int required = 0;
        for (Argument argument : this) {
            if (!argument.hasDefault()) {
                required++;
            }
        }
        return required;
    }

    private void requireNewName(Argument argument) {
        for (Argument existing : this) {
            if (existing.name().equals(argument.name())) {
                throw new MalformedNodeException("Duplicate argument name '" + argument.name() + "'");
            }
        }
    }

    @Override
    public AstKind kind() {
        return AstKind.ARGUMENTS;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArguments(this);
    }
}
