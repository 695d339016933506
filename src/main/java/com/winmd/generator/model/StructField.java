package com.winmd.generator.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class StructField {
    @NonNull
    String name;
    @NonNull
    TypeReference type;
}
