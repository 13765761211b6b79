package io.usymbol.core.model;

import java.util.List;

/** Application of an uninterpreted function. Argument order is significant. */
public final class Call extends Node {

    private final String name;
    private final List<Expression> arguments;

    Call(InternStore store, int hash, String name, List<Expression> arguments) {
        super(store, hash);
        this.name = name;
        this.arguments = arguments;
    }

    public String name() {
        return name;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public Kind kind() {
        return Kind.CALL;
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
