package com.winmd.generator.parser;

import com.winmd.generator.model.ComInterface;
import com.winmd.generator.model.Enumeration;
import com.winmd.generator.model.FunctionLike;
import com.winmd.generator.model.MetadataHeader;
import com.winmd.generator.model.StructDefinition;
import com.winmd.generator.parser.exception.ContextException;

/**
 * The "current" declarations later commands attach to.
 *
 * Each slot is set independently; only the function-like slot is replaced whenever a
 * new function, function pointer or method starts. The {@code require*} accessors raise
 * a {@link ContextException} naming the missing declaration.
 */
class DeclarationContext {
    static final String HEADER = "meta";
    static final String DLL = "dll";
    static final String FUNCTION_LIKE = "fn/fptr/meth";
    static final String INTERFACE = "iface";
    static final String ENUMERATION = "enum";
    static final String STRUCT = "struct";

    private MetadataHeader header;
    private String dll;
    private FunctionLike functionLike;
    private ComInterface comInterface;
    private Enumeration enumeration;
    private StructDefinition struct;

    boolean hasHeader() {
        return header != null;
    }

    void setHeader(MetadataHeader header) {
        this.header = header;
    }

    void setDll(String dll) {
        this.dll = dll;
    }

    String requireDll(MetatextLine line) {
        return require(dll, line, DLL);
    }

    void setFunctionLike(FunctionLike functionLike) {
        this.functionLike = functionLike;
    }

    void clearFunctionLike() {
        this.functionLike = null;
    }

    FunctionLike requireFunctionLike(MetatextLine line) {
        return require(functionLike, line, FUNCTION_LIKE);
    }

    void setInterface(ComInterface comInterface) {
        this.comInterface = comInterface;
    }

    ComInterface requireInterface(MetatextLine line) {
        return require(comInterface, line, INTERFACE);
    }

    void setEnumeration(Enumeration enumeration) {
        this.enumeration = enumeration;
    }

    Enumeration requireEnumeration(MetatextLine line) {
        return require(enumeration, line, ENUMERATION);
    }

    void setStruct(StructDefinition struct) {
        this.struct = struct;
    }

    StructDefinition requireStruct(MetatextLine line) {
        return require(struct, line, STRUCT);
    }

    private static <T> T require(T value, MetatextLine line, String contextName) {
        if (value == null) {
            throw new ContextException(line.getLocation(), line.getCommand().getKeyword(), contextName);
        }
        return value;
    }
}
