package com.winmd.generator.parser;

import com.winmd.generator.codegen.enrich.EnumTypeEnricher;
import com.winmd.generator.codegen.mapper.IlTypeMapper;
import com.winmd.generator.model.Argument;
import com.winmd.generator.model.ArgumentDirection;
import com.winmd.generator.model.CallingConvention;
import com.winmd.generator.model.ComInterface;
import com.winmd.generator.model.EnumVariant;
import com.winmd.generator.model.Enumeration;
import com.winmd.generator.model.FreeFunction;
import com.winmd.generator.model.FunctionLike;
import com.winmd.generator.model.FunctionPointerType;
import com.winmd.generator.model.GuidConstant;
import com.winmd.generator.model.IntegerType;
import com.winmd.generator.model.InterfaceMethod;
import com.winmd.generator.model.MetadataHeader;
import com.winmd.generator.model.MetadataModel;
import com.winmd.generator.model.StructDefinition;
import com.winmd.generator.model.StructField;
import com.winmd.generator.model.TypeReference;
import com.winmd.generator.parser.exception.ContextException;
import com.winmd.generator.parser.exception.SemanticException;
import com.winmd.generator.parser.exception.SourceReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.CharacterCodingException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link MetadataModel} from metatext lines.
 *
 * Collecting only:
 * - validates field counts, required context and values
 * - expands includes in place, depth first
 * - enriches return and argument types against enums declared so far
 *
 * It does NOT resolve IL syntax for output; that happens at render time.
 * The first error aborts collection.
 */
public class MetatextCollector {
    private static final Logger log = LoggerFactory.getLogger(MetatextCollector.class);

    private static final String FLAGS_KEYWORD = "flags";

    private final MetadataModel model = new MetadataModel();
    private final DeclarationContext context = new DeclarationContext();
    private final MetatextLineParser lineParser = new MetatextLineParser();
    private final ArgumentAttributeParser attributeParser = new ArgumentAttributeParser();
    private final IncludeResolver includeResolver = new IncludeResolver();
    private final IlTypeMapper typeMapper = new IlTypeMapper(model);
    private final EnumTypeEnricher enricher = new EnumTypeEnricher(model, typeMapper);

    /**
     * Collects the declarations of a metatext file and everything it includes.
     */
    public MetadataModel collectPath(Path path) {
        collectFile(includeResolver.resolve(null, path.toString()), null);
        return model;
    }

    /**
     * Collects already-read lines. Includes are resolved against {@code baseDir}.
     */
    public MetadataModel collectLines(String sourceName, Path baseDir, List<String> lines) {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(lines, "lines");
        int lineNumber = 0;
        for (String rawLine : lines) {
            lineNumber++;
            SourceLocation location = new SourceLocation(sourceName, lineNumber);
            Optional<MetatextLine> line = lineParser.parse(rawLine, location);
            if (line.isPresent()) {
                handle(line.get(), baseDir);
            }
        }
        return model;
    }

    private void collectFile(Path file, SourceLocation includedFrom) {
        includeResolver.enter(file, includedFrom);
        try {
            log.info("Collecting metatext file: {}", file);
            List<String> lines = readLines(file, includedFrom);
            collectLines(file.getFileName().toString(), file.getParent(), lines);
        } finally {
            includeResolver.exit(file);
        }
    }

    private List<String> readLines(Path file, SourceLocation includedFrom) {
        try {
            return includeResolver.readLines(file);
        } catch (IOException e) {
            SourceLocation location = includedFrom != null
                    ? includedFrom
                    : new SourceLocation(String.valueOf(file.getFileName()), 0);
            throw new SourceReadException(location, "cannot read " + file + ": " + describe(e), e);
        }
    }

    private static String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "file not found";
        }
        if (e instanceof CharacterCodingException) {
            return "not valid UTF-8 text";
        }
        if (e instanceof AccessDeniedException) {
            return "access denied";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void handle(MetatextLine line, Path baseDir) {
        line.requireFieldCount();

        if (line.getCommand() != MetatextCommand.META && !context.hasHeader()) {
            throw new ContextException(line.getLocation(), line.getCommand().getKeyword(), DeclarationContext.HEADER);
        }

        switch (line.getCommand()) {
            case META -> declareHeader(line);
            case FPTR -> declareFunctionPointer(line);
            case DLL -> declareDll(line);
            case FN -> declareFunction(line);
            case ARG -> declareArgument(line, false);
            case OPTARG -> declareArgument(line, true);
            case IFACE -> declareInterface(line);
            case METH -> declareMethod(line);
            case STDMETH -> declareStandardMethod(line);
            case INCLUDE -> include(line, baseDir);
            case ENUM -> declareEnum(line);
            case VARIANT -> declareVariant(line);
            case STRUCT -> declareStruct(line);
            case FIELD -> declareField(line);
            case GUID -> declareGuid(line);
        }
    }

    private void declareHeader(MetatextLine line) {
        if (context.hasHeader()) {
            throw new SemanticException(line.getLocation(), "duplicate \"meta\" entry; the header must be declared exactly once");
        }
        MetadataHeader header = new MetadataHeader(line.field(0), line.field(1));
        model.setHeader(header);
        context.setHeader(header);
        log.debug("Metadata header {} version {}", header.getName(), header.getVersion());
    }

    private void declareFunctionPointer(MetatextLine line) {
        TypeReference returnType = enricher.enrich(typeReference(line, 1, 2));
        long callingConventionCode = line.hasField(3)
                ? parseUnsigned(line, line.field(3), FunctionPointerType.MAX_CALLING_CONVENTION_CODE, "calling convention code")
                : FunctionPointerType.WINAPI_CODE;

        FunctionPointerType functionPointer = new FunctionPointerType(line.field(0), returnType, callingConventionCode);
        model.addFunctionPointer(functionPointer);
        context.setFunctionLike(functionPointer);
        log.debug("Function pointer {} returning {}", functionPointer.getName(), returnType);
    }

    private void declareDll(MetatextLine line) {
        String dll = line.field(0);
        context.setDll(dll);
        model.addImportedDll(dll);
        log.debug("DLL {}", dll);
    }

    private void declareFunction(MetatextLine line) {
        String dll = context.requireDll(line);
        TypeReference returnType = enricher.enrich(typeReference(line, 1, 2));
        CallingConvention callingConvention = CallingConvention.WINAPI;
        if (line.hasField(3)) {
            callingConvention = CallingConvention.fromKeyword(line.field(3))
                    .orElseThrow(() -> new SemanticException(line.getLocation(),
                            "unknown calling convention '" + line.field(3) + "'"));
        }

        FreeFunction function = new FreeFunction(dll, line.field(0), returnType, callingConvention);
        model.addFunction(function);
        context.setFunctionLike(function);
        log.debug("Function {}!{} returning {}", dll, function.getName(), returnType);
    }

    private void declareArgument(MetatextLine line, boolean optional) {
        FunctionLike owner = context.requireFunctionLike(line);

        ArgumentDirection direction = ArgumentDirection.fromKeyword(line.field(0))
                .orElseThrow(() -> new SemanticException(line.getLocation(),
                        "unknown argument direction '" + line.field(0) + "' (expected in, out or inout)"));
        TypeReference type = enricher.enrich(typeReference(line, 2, 3));
        ArgumentAttributeParser.ParsedAttributes parsed =
                attributeParser.parse(line.hasField(4) ? line.field(4) : "", line.getLocation());

        Argument argument = Argument.builder()
                .name(line.field(1))
                .type(type)
                .direction(direction)
                .optional(optional)
                .attributes(parsed.getAttributes())
                .arraySize(parsed.getArraySize())
                .build();
        owner.addArgument(argument);
        log.debug("Argument {} {} of {}", type, argument.getName(), owner.getName());
    }

    private void declareInterface(MetatextLine line) {
        int group = parseByte(line, line.field(1), "group");
        int value = parseByte(line, line.field(2), "value");
        TypeReference baseType = typeReference(line, line.field(3), 0);

        ComInterface comInterface = new ComInterface(line.field(0), group, value, baseType);
        model.addInterface(comInterface);
        context.setInterface(comInterface);
        log.debug("Interface {} ({}) extends {}", comInterface.getName(), comInterface.getIidString(), baseType);
    }

    private void declareMethod(MetatextLine line) {
        ComInterface comInterface = context.requireInterface(line);
        TypeReference returnType = enricher.enrich(typeReference(line, 1, 2));

        InterfaceMethod method = new InterfaceMethod(line.field(0), returnType);
        comInterface.addMethod(method);
        context.setFunctionLike(method);
        log.debug("Method {}::{} returning {}", comInterface.getName(), method.getName(), returnType);
    }

    private void declareStandardMethod(MetatextLine line) {
        ComInterface comInterface = context.requireInterface(line);
        InterfaceMethod method = new InterfaceMethod(line.field(0), TypeReference.of(InterfaceMethod.STANDARD_RESULT_TYPE));
        comInterface.addMethod(method);
        // the shorthand takes no arguments
        context.clearFunctionLike();
        log.debug("Standard method {}::{}", comInterface.getName(), method.getName());
    }

    private void include(MetatextLine line, Path baseDir) {
        Path included = includeResolver.resolve(baseDir, line.field(0));
        log.debug("Including {} from {}", included, line.getLocation());
        collectFile(included, line.getLocation());
    }

    private void declareEnum(MetatextLine line) {
        String name = line.field(0);
        if (model.hasEnumeration(name)) {
            throw new SemanticException(line.getLocation(), "duplicate enum '" + name + "'");
        }

        boolean flags = false;
        if (line.hasField(2)) {
            if (!FLAGS_KEYWORD.equals(line.field(2).toLowerCase(Locale.ROOT))) {
                throw new SemanticException(line.getLocation(),
                        "unknown enum option '" + line.field(2) + "' (expected " + FLAGS_KEYWORD + ")");
            }
            flags = true;
        }

        TypeReference baseType = typeReference(line, line.field(1), 0);
        IntegerType integerType = typeMapper.integerType(baseType)
                .orElseThrow(() -> new SemanticException(line.getLocation(),
                        "enum base type '" + line.field(1) + "' is not an integer type"));

        Enumeration enumeration = new Enumeration(name, baseType, integerType, flags);
        model.addEnumeration(enumeration);
        context.setEnumeration(enumeration);
        log.debug("Enum {} : {}{}", name, integerType.getIlName(), flags ? " (flags)" : "");
    }

    private void declareVariant(MetatextLine line) {
        Enumeration enumeration = context.requireEnumeration(line);
        String name = line.field(0);
        if (enumeration.hasVariant(name)) {
            throw new SemanticException(line.getLocation(),
                    "duplicate variant '" + name + "' in enum '" + enumeration.getName() + "'");
        }

        BigInteger value = parseInteger(line, line.field(1));
        if (!enumeration.getIntegerType().fits(value)) {
            throw new SemanticException(line.getLocation(), "value " + value + " of variant '" + name
                    + "' does not fit " + enumeration.getIntegerType().getIlName());
        }
        enumeration.addVariant(new EnumVariant(name, value));
    }

    private void declareStruct(MetatextLine line) {
        StructDefinition struct = new StructDefinition(line.field(0));
        model.addStruct(struct);
        context.setStruct(struct);
        log.debug("Struct {}", struct.getName());
    }

    private void declareField(MetatextLine line) {
        StructDefinition struct = context.requireStruct(line);
        struct.addField(new StructField(line.field(0), typeReference(line, 1, 2)));
    }

    private void declareGuid(MetatextLine line) {
        try {
            model.addGuidConstant(GuidConstant.parse(line.field(0), line.field(1)));
        } catch (IllegalArgumentException e) {
            throw new SemanticException(line.getLocation(), e.getMessage(), e);
        }
    }

    private TypeReference typeReference(MetatextLine line, int nameField, int depthField) {
        return typeReference(line, line.field(nameField), parsePointerDepth(line, line.field(depthField)));
    }

    private static TypeReference typeReference(MetatextLine line, String name, int pointerDepth) {
        try {
            return TypeReference.of(name, pointerDepth);
        } catch (IllegalArgumentException e) {
            throw new SemanticException(line.getLocation(), e.getMessage(), e);
        }
    }

    private static int parsePointerDepth(MetatextLine line, String text) {
        int depth;
        try {
            depth = Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new SemanticException(line.getLocation(), "invalid pointer depth '" + text + "' (expected a non-negative integer)", e);
        }
        if (depth < 0) {
            throw new SemanticException(line.getLocation(), "invalid pointer depth " + depth + " (must not be negative)");
        }
        return depth;
    }

    private static int parseByte(MetatextLine line, String text, String what) {
        return (int) parseUnsigned(line, text, 0xFF, what);
    }

    private static long parseUnsigned(MetatextLine line, String text, long max, String what) {
        long value;
        try {
            value = Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new SemanticException(line.getLocation(), "invalid " + what + " '" + text + "'", e);
        }
        if (value < 0 || value > max) {
            throw new SemanticException(line.getLocation(), what + " must be between 0 and " + max + ", got " + value);
        }
        return value;
    }

    private static BigInteger parseInteger(MetatextLine line, String text) {
        String trimmed = text.trim();
        boolean negative = trimmed.startsWith("-");
        String digits = negative ? trimmed.substring(1) : trimmed;
        try {
            BigInteger magnitude = digits.startsWith("0x") || digits.startsWith("0X")
                    ? new BigInteger(digits.substring(2), 16)
                    : new BigInteger(digits, 10);
            if (magnitude.signum() < 0 || digits.startsWith("+")) {
                throw new NumberFormatException("sign inside magnitude");
            }
            return negative ? magnitude.negate() : magnitude;
        } catch (NumberFormatException e) {
            throw new SemanticException(line.getLocation(), "invalid integer value '" + text + "'", e);
        }
    }
}
