package com.winmd.generator.model;

/**
 * Visitor over the function-like variants.
 */
public interface FunctionLikeVisitor<R> {
    R visit(FreeFunction function);
    R visit(FunctionPointerType functionPointer);
    R visit(InterfaceMethod method);
}
