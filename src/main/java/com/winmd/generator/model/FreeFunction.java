package com.winmd.generator.model;

import lombok.Getter;

import java.util.Objects;

/**
 * A function exported by a DLL.
 */
@Getter
public class FreeFunction extends FunctionLike {
    private final String dll;
    private final CallingConvention callingConvention;

    public FreeFunction(String dll, String name, TypeReference returnType, CallingConvention callingConvention) {
        super(name, returnType);
        this.dll = Objects.requireNonNull(dll, "dll");
        this.callingConvention = callingConvention != null ? callingConvention : CallingConvention.WINAPI;
    }

    @Override
    public <R> R accept(FunctionLikeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
