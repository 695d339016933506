package com.winmd.generator.codegen.enrich;

import com.winmd.generator.codegen.mapper.IlTypeMapper;
import com.winmd.generator.model.Enumeration;
import com.winmd.generator.model.MetadataModel;
import com.winmd.generator.model.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites references to declared enumerations into the enumeration's integer base type
 * and records the association so the renderer can emit an AssociatedEnum attribute.
 *
 * Runs once per freshly declared return or argument type and only sees enumerations
 * that were declared before it. Forward references stay unresolved.
 */
public class EnumTypeEnricher {
    private static final Logger log = LoggerFactory.getLogger(EnumTypeEnricher.class);

    private final MetadataModel model;
    private final IlTypeMapper typeMapper;

    public EnumTypeEnricher(MetadataModel model, IlTypeMapper typeMapper) {
        this.model = Objects.requireNonNull(model, "model");
        this.typeMapper = Objects.requireNonNull(typeMapper, "typeMapper");
    }

    public TypeReference enrich(TypeReference type) {
        Objects.requireNonNull(type, "type");
        if (type.getPointerDepth() != 0 || type.isEnumBacked()) {
            return type;
        }

        String ilName = typeMapper.ilType(type);
        Optional<Enumeration> enumeration = model.findEnumeration(ilName);
        if (enumeration.isEmpty()) {
            return type;
        }

        Enumeration target = enumeration.get();
        TypeReference enriched = type.enrichedTo(target.getBaseType(), target.getName());
        log.debug("Linked type {} to enum {} (base {})", type, target.getName(), enriched);
        return enriched;
    }
}
