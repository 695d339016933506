package com.winmd.generator.codegen.blob;

/**
 * Custom attribute constructors referenced by the generated IL.
 */
public enum MetadataAttribute {
    CONST(Constants.WIN32_METADATA + "ConstAttribute::.ctor()"),
    COM_OUT_PTR(Constants.WIN32_METADATA + "ComOutPtrAttribute::.ctor()"),
    NATIVE_ARRAY_INFO(Constants.WIN32_METADATA + "NativeArrayInfoAttribute::.ctor()"),
    ASSOCIATED_ENUM(Constants.WIN32_METADATA + "AssociatedEnumAttribute::.ctor(string)"),
    GUID(Constants.WIN32_METADATA + "GuidAttribute::.ctor(uint32, uint16, uint16, uint8, uint8, uint8, uint8, uint8, uint8, uint8, uint8)"),
    UNMANAGED_FUNCTION_POINTER("[netstandard]System.Runtime.InteropServices.UnmanagedFunctionPointerAttribute::.ctor("
            + "valuetype [netstandard]System.Runtime.InteropServices.CallingConvention)"),
    FLAGS("[netstandard]System.FlagsAttribute::.ctor()");

    private final String constructor;

    MetadataAttribute(String constructor) {
        this.constructor = constructor;
    }

    /**
     * Constructor reference as written after {@code .custom instance void}.
     */
    public String getConstructor() {
        return constructor;
    }

    private static final class Constants {
        static final String WIN32_METADATA = "[Windows.Win32.winmd]Windows.Win32.Foundation.Metadata.";
    }
}
