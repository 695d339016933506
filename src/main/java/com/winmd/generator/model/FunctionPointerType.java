package com.winmd.generator.model;

import lombok.Getter;

/**
 * A named function pointer (delegate) type.
 */
@Getter
public class FunctionPointerType extends FunctionLike {

    /** System.Runtime.InteropServices.CallingConvention.Winapi */
    public static final long WINAPI_CODE = 1;

    public static final long MAX_CALLING_CONVENTION_CODE = 0xFFFF_FFFFL;

    private final long callingConventionCode;

    public FunctionPointerType(String name, TypeReference returnType, long callingConventionCode) {
        super(name, returnType);
        if (callingConventionCode < 0 || callingConventionCode > MAX_CALLING_CONVENTION_CODE) {
            throw new IllegalArgumentException("calling convention code must be between 0 and "
                    + MAX_CALLING_CONVENTION_CODE + ", got " + callingConventionCode);
        }
        this.callingConventionCode = callingConventionCode;
    }

    public FunctionPointerType(String name, TypeReference returnType) {
        this(name, returnType, WINAPI_CODE);
    }

    @Override
    public <R> R accept(FunctionLikeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
