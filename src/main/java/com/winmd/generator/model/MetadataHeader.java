package com.winmd.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Name and version of the generated metadata assembly.
 */
@Value
public class MetadataHeader {
    @NonNull
    String name;
    @NonNull
    String version;
}
