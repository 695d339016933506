package com.winmd.generator.codegen.mapper;

import com.winmd.generator.model.IntegerType;
import com.winmd.generator.model.MetadataHeader;
import com.winmd.generator.model.MetadataModel;
import com.winmd.generator.model.TypeReference;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps metatext type names to IL type syntax.
 *
 * Resolution order: well-known names, then COM interface names ({@code I} + upper + lower),
 * then declared function pointer types, otherwise the name is passed through.
 */
public class IlTypeMapper {

    private static final String WIN32 = "[Windows.Win32.winmd]Windows.Win32.";

    private static final Map<String, String> WELL_KNOWN_TYPES = Map.ofEntries(
            Map.entry("BOOL", "valuetype " + WIN32 + "Foundation.BOOL"),
            Map.entry("BSTR", "valuetype " + WIN32 + "Foundation.BSTR"),
            Map.entry("FILETIME", "valuetype " + WIN32 + "Foundation.FILETIME"),
            Map.entry("GUID", "valuetype [netstandard]System.Guid"),
            Map.entry("HRESULT", "valuetype " + WIN32 + "Foundation.HRESULT"),
            Map.entry("IUnknown", WIN32 + "System.Com.IUnknown"),
            Map.entry("PROPID", "uint32"),
            Map.entry("PROPVARIANT", "valuetype " + WIN32 + "System.Com.StructuredStorage.PROPVARIANT"),
            Map.entry("PWSTR", "valuetype " + WIN32 + "Foundation.PWSTR"),
            Map.entry("PSTR", "valuetype " + WIN32 + "Foundation.PSTR"),
            Map.entry("size_t", "native uint"),
            Map.entry("VARTYPE", "uint16"),
            Map.entry("BYTE", "uint8"),
            Map.entry("UINT8", "uint8"),
            Map.entry("INT8", "int8"),
            Map.entry("WORD", "uint16"),
            Map.entry("UINT16", "uint16"),
            Map.entry("INT16", "int16"),
            Map.entry("DWORD", "uint32"),
            Map.entry("UINT32", "uint32"),
            Map.entry("UINT", "uint32"),
            Map.entry("ULONG", "uint32"),
            Map.entry("INT32", "int32"),
            Map.entry("INT", "int32"),
            Map.entry("LONG", "int32"),
            Map.entry("UINT64", "uint64"),
            Map.entry("ULONGLONG", "uint64"),
            Map.entry("INT64", "int64"),
            Map.entry("LONGLONG", "int64")
    );

    private final MetadataModel model;

    public IlTypeMapper(MetadataModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    /**
     * IL syntax for the reference, including one {@code *} per pointer level.
     */
    public String ilType(TypeReference type) {
        return starlessIlType(type.getBaseName()) + "*".repeat(type.getPointerDepth());
    }

    /**
     * IL syntax for a bare type name.
     */
    public String starlessIlType(String name) {
        String wellKnown = WELL_KNOWN_TYPES.get(name);
        if (wellKnown != null) {
            return wellKnown;
        }
        if (isComInterfaceName(name) || model.isFunctionPointerName(name)) {
            return "class " + metadataName() + "." + name;
        }
        return name;
    }

    /**
     * The IL integer type a name resolves to, if any.
     */
    public Optional<IntegerType> integerType(TypeReference type) {
        if (type.getPointerDepth() != 0) {
            return Optional.empty();
        }
        return IntegerType.fromIlName(starlessIlType(type.getBaseName()));
    }

    static boolean isComInterfaceName(String name) {
        return name.length() > 2
                && name.charAt(0) == 'I'
                && isAsciiUpper(name.charAt(1))
                && isAsciiLower(name.charAt(2));
    }

    private String metadataName() {
        return model.getHeader()
                .map(MetadataHeader::getName)
                .orElseThrow(() -> new IllegalStateException("local types cannot be resolved before the metadata header"));
    }

    private static boolean isAsciiUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isAsciiLower(char c) {
        return c >= 'a' && c <= 'z';
    }
}
