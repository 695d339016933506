package com.winmd.generator.codegen.render;

import com.winmd.generator.codegen.blob.AttributeBlobEncoder;
import com.winmd.generator.codegen.blob.CustomAttributeBlobs;
import com.winmd.generator.codegen.blob.MetadataAttribute;
import com.winmd.generator.codegen.mapper.IlTypeMapper;
import com.winmd.generator.model.Argument;
import com.winmd.generator.model.ArgumentAttribute;
import com.winmd.generator.model.ArraySizeSpec;
import com.winmd.generator.model.ComInterface;
import com.winmd.generator.model.EnumVariant;
import com.winmd.generator.model.Enumeration;
import com.winmd.generator.model.FreeFunction;
import com.winmd.generator.model.FunctionLike;
import com.winmd.generator.model.FunctionLikeVisitor;
import com.winmd.generator.model.FunctionPointerType;
import com.winmd.generator.model.GuidConstant;
import com.winmd.generator.model.InterfaceMethod;
import com.winmd.generator.model.MetadataHeader;
import com.winmd.generator.model.MetadataModel;
import com.winmd.generator.model.StructDefinition;
import com.winmd.generator.model.StructField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves a collected {@link MetadataModel} into an {@link IlDocument}:
 * IL type syntax for every type reference and hex text for every attribute blob.
 *
 * The model is only read.
 */
public class IlDocumentBuilder {
    private static final Logger log = LoggerFactory.getLogger(IlDocumentBuilder.class);

    private static final Pattern VERSION_PATTERN = Pattern.compile("^[0-9]+([.:][0-9]+){0,3}$");

    private final MetadataModel model;
    private final IlTypeMapper typeMapper;

    public IlDocumentBuilder(MetadataModel model) {
        this.model = Objects.requireNonNull(model, "model");
        this.typeMapper = new IlTypeMapper(model);
    }

    public IlDocument build() {
        MetadataHeader header = model.getHeader()
                .orElseThrow(() -> new RenderException("no \"meta\" entry was declared; nothing to render"));

        IlDocument.IlDocumentBuilder document = IlDocument.builder()
                .name(header.getName())
                .version(assemblyVersion(header.getVersion()))
                .moduleExterns(model.getImportedDlls());

        for (FunctionPointerType functionPointer : model.getFunctionPointers()) {
            document.delegate(IlDelegate.builder()
                    .name(functionPointer.getName())
                    .callingConvention(attribute(MetadataAttribute.UNMANAGED_FUNCTION_POINTER,
                            CustomAttributeBlobs.unmanagedFunctionPointer(functionPointer.getCallingConventionCode()),
                            "CallingConvention " + functionPointer.getCallingConventionCode()))
                    .invoke(method(functionPointer))
                    .build());
        }

        for (FreeFunction function : model.getFunctions()) {
            document.function(method(function));
        }

        for (GuidConstant guidConstant : model.getGuidConstants()) {
            document.guidConstant(IlGuidField.builder()
                    .name(guidConstant.getName())
                    .guid(attribute(MetadataAttribute.GUID, CustomAttributeBlobs.guid(guidConstant.getBytes()),
                            guidConstant.getDisplay()))
                    .build());
        }

        for (ComInterface comInterface : model.getInterfaces()) {
            document.comInterface(IlInterface.builder()
                    .name(comInterface.getName())
                    .baseType(typeMapper.ilType(comInterface.getBaseType()))
                    .guid(attribute(MetadataAttribute.GUID, CustomAttributeBlobs.guid(comInterface.getIid()),
                            comInterface.getIidString()))
                    .methods(comInterface.getMethods().stream().map(this::method).collect(Collectors.toList()))
                    .build());
        }

        for (Enumeration enumeration : model.getEnumerations()) {
            document.enumeration(enumeration(enumeration));
        }

        for (StructDefinition struct : model.getStructs()) {
            IlStruct.IlStructBuilder view = IlStruct.builder().name(struct.getName());
            for (StructField field : struct.getFields()) {
                view.field(new IlStruct.Field(typeMapper.ilType(field.getType()), field.getName()));
            }
            document.struct(view.build());
        }

        IlDocument built = document.build();
        log.debug("Resolved {} delegates, {} functions, {} interfaces, {} enums, {} structs",
                built.getDelegates().size(), built.getFunctions().size(), built.getInterfaces().size(),
                built.getEnums().size(), built.getStructs().size());
        return built;
    }

    private IlMethod method(FunctionLike functionLike) {
        IlMethod.IlMethodBuilder view = IlMethod.builder()
                .name(functionLike.getName())
                .returnType(typeMapper.ilType(functionLike.getReturnType()))
                .parameters(parameters(functionLike.getArguments()))
                .paramAttributes(paramAttributes(functionLike.getArguments()));

        return functionLike.accept(new FunctionLikeVisitor<IlMethod>() {
            @Override
            public IlMethod visit(FreeFunction function) {
                return view.dll(function.getDll())
                        .callingConvention(function.getCallingConvention().getIlKeyword())
                        .build();
            }

            @Override
            public IlMethod visit(FunctionPointerType functionPointer) {
                return view.build();
            }

            @Override
            public IlMethod visit(InterfaceMethod method) {
                return view.build();
            }
        });
    }

    private String parameters(List<Argument> arguments) {
        return arguments.stream()
                .map(this::parameter)
                .collect(Collectors.joining(", "));
    }

    private String parameter(Argument argument) {
        StringBuilder sb = new StringBuilder();
        if (argument.getDirection().isIn()) {
            sb.append("[in] ");
        }
        if (argument.getDirection().isOut()) {
            sb.append("[out] ");
        }
        if (argument.isOptional()) {
            sb.append("[opt] ");
        }
        return sb.append(typeMapper.ilType(argument.getType()))
                .append(" '").append(argument.getName()).append('\'')
                .toString();
    }

    private List<IlParamAttributes> paramAttributes(List<Argument> arguments) {
        List<IlParamAttributes> result = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            Argument argument = arguments.get(i);
            if (!argument.needsParamMetadata()) {
                continue;
            }

            IlParamAttributes.IlParamAttributesBuilder param = IlParamAttributes.builder().index(i + 1);
            if (argument.hasAttribute(ArgumentAttribute.CONST)) {
                param.attribute(attribute(MetadataAttribute.CONST, CustomAttributeBlobs.marker(), ""));
            }
            if (argument.hasAttribute(ArgumentAttribute.COM_OUT)) {
                param.attribute(attribute(MetadataAttribute.COM_OUT_PTR, CustomAttributeBlobs.marker(), ""));
            }

            ArraySizeSpec arraySize = argument.getArraySize();
            switch (arraySize.getKind()) {
                case COUNT_PARAM_INDEX -> param.attribute(attribute(MetadataAttribute.NATIVE_ARRAY_INFO,
                        CustomAttributeBlobs.countParamIndex((int) arraySize.getValue()),
                        CustomAttributeBlobs.COUNT_PARAM_INDEX + " = " + arraySize.getValue()));
                case COUNT_CONST -> param.attribute(attribute(MetadataAttribute.NATIVE_ARRAY_INFO,
                        CustomAttributeBlobs.countConst(arraySize.getValue()),
                        CustomAttributeBlobs.COUNT_CONST + " = " + arraySize.getValue()));
                case NONE -> {
                }
            }

            argument.getType().getBackingEnum().ifPresent(enumName ->
                    param.attribute(attribute(MetadataAttribute.ASSOCIATED_ENUM,
                            CustomAttributeBlobs.associatedEnum(enumName), enumName)));

            result.add(param.build());
        }
        return result;
    }

    private IlEnum enumeration(Enumeration enumeration) {
        String baseType = typeMapper.ilType(enumeration.getBaseType());
        IlEnum.IlEnumBuilder view = IlEnum.builder()
                .name(enumeration.getName())
                .baseType(baseType);
        if (enumeration.isFlags()) {
            view.flags(attribute(MetadataAttribute.FLAGS, CustomAttributeBlobs.marker(), ""));
        }
        for (EnumVariant variant : enumeration.getVariants()) {
            view.literal(new IlEnum.Literal(variant.getName(), variant.getValue().toString()));
        }
        return view.build();
    }

    private static IlAttribute attribute(MetadataAttribute attribute, byte[] blob, String comment) {
        return IlAttribute.builder()
                .constructor(attribute.getConstructor())
                .hex(AttributeBlobEncoder.hex(blob))
                .comment(comment)
                .build();
    }

    /**
     * Turns {@code 1.2} or {@code 1:2:0:0} into the four-part form {@code .ver} expects.
     */
    static String assemblyVersion(String version) {
        String trimmed = version.trim();
        if (!VERSION_PATTERN.matcher(trimmed).matches()) {
            throw new RenderException("metadata version '" + version + "' is not of the form major[.minor[.build[.revision]]]");
        }
        String[] parts = trimmed.split("[.:]");
        List<String> fourParts = new ArrayList<>(List.of(parts));
        while (fourParts.size() < 4) {
            fourParts.add("0");
        }
        return String.join(":", fourParts);
    }
}
