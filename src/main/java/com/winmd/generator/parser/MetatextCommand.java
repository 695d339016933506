package com.winmd.generator.parser;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Command keywords of the metatext language with their accepted field counts.
 */
public enum MetatextCommand {
    META("meta", "NAME VERSION", 2, 2),
    FPTR("fptr", "NAME RETTYPE RETSTARS [CALLCONVCODE]", 3, 4),
    DLL("dll", "NAME", 1, 1),
    FN("fn", "NAME RETTYPE RETSTARS [CALLCONV]", 3, 4),
    ARG("arg", "DIRECTION NAME TYPE STARS [ATTRIBS]", 4, 5),
    OPTARG("optarg", "DIRECTION NAME TYPE STARS [ATTRIBS]", 4, 5),
    IFACE("iface", "NAME GROUP VALUE BASETYPE", 4, 4),
    METH("meth", "NAME RETTYPE RETSTARS", 3, 3),
    STDMETH("stdmeth", "NAME", 1, 1),
    INCLUDE("include", "PATH", 1, 1),
    ENUM("enum", "NAME BASETYPE [flags]", 2, 3),
    VARIANT("variant", "NAME VALUE", 2, 2),
    STRUCT("struct", "NAME", 1, 1),
    FIELD("field", "NAME TYPE STARS", 3, 3),
    GUID("guid", "NAME GUID", 2, 2);

    private static final Map<String, MetatextCommand> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MetatextCommand::getKeyword, Function.identity()));

    private final String keyword;
    private final String arguments;
    private final int minFields;
    private final int maxFields;

    MetatextCommand(String keyword, String arguments, int minFields, int maxFields) {
        this.keyword = keyword;
        this.arguments = arguments;
        this.minFields = minFields;
        this.maxFields = maxFields;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getUsage() {
        return "Usage: " + keyword + " " + arguments;
    }

    public boolean acceptsFieldCount(int fieldCount) {
        return fieldCount >= minFields && fieldCount <= maxFields;
    }

    public static Optional<MetatextCommand> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }
}
