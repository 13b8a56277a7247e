package com.spreadsheet.formula.parsing;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A call such as "sum(A0, B0, 3)". The name is kept as written;
 * resolving it to a built-in happens at evaluation time.
 */
public final class FunctionCallExpression implements Expression {

    private final String name;
    private final List<Expression> arguments;

    public FunctionCallExpression(String name, List<Expression> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCallExpression)) {
            return false;
        }
        FunctionCallExpression that = (FunctionCallExpression) o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return name + arguments.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
