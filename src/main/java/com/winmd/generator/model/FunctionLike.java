package com.winmd.generator.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Common shape of everything that has a return type and an ordered argument list:
 * free functions, function pointer types and interface methods.
 *
 * The set of variants is closed; callers that need per-variant data go through
 * {@link FunctionLikeVisitor} so every variant must be handled.
 */
@Getter
public abstract class FunctionLike {
    protected final String name;
    protected final TypeReference returnType;
    private final List<Argument> arguments = new ArrayList<>();

    protected FunctionLike(String name, TypeReference returnType) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = Objects.requireNonNull(returnType, "returnType");
    }

    public void addArgument(Argument argument) {
        arguments.add(Objects.requireNonNull(argument, "argument"));
    }

    /**
     * Arguments in declaration order, which is also their parameter order.
     */
    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public abstract <R> R accept(FunctionLikeVisitor<R> visitor);
}
