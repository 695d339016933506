package com.winmd.generator.model;

import lombok.NonNull;
import lombok.Value;

import java.math.BigInteger;

/**
 * A named value of an enumeration.
 */
@Value
public class EnumVariant {
    @NonNull
    String name;
    @NonNull
    BigInteger value;
}
