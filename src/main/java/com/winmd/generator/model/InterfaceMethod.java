package com.winmd.generator.model;

/**
 * An abstract method of a COM interface.
 */
public class InterfaceMethod extends FunctionLike {

    /** Return type of methods declared with the standard-method shorthand. */
    public static final String STANDARD_RESULT_TYPE = "HRESULT";

    public InterfaceMethod(String name, TypeReference returnType) {
        super(name, returnType);
    }

    @Override
    public <R> R accept(FunctionLikeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
