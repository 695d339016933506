package com.winmd.generator.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sequential-layout value type.
 */
@Getter
public class StructDefinition {
    private final String name;
    private final List<StructField> fields = new ArrayList<>();

    public StructDefinition(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public void addField(StructField field) {
        fields.add(Objects.requireNonNull(field, "field"));
    }

    public List<StructField> getFields() {
        return Collections.unmodifiableList(fields);
    }
}
