package com.winmd.generator.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * IL integer types usable as the underlying type of an enumeration.
 */
public enum IntegerType {
    INT8("int8", true, 8),
    UINT8("uint8", false, 8),
    INT16("int16", true, 16),
    UINT16("uint16", false, 16),
    INT32("int32", true, 32),
    UINT32("uint32", false, 32),
    INT64("int64", true, 64),
    UINT64("uint64", false, 64);

    private final String ilName;
    private final BigInteger min;
    private final BigInteger max;

    IntegerType(String ilName, boolean signed, int bits) {
        this.ilName = ilName;
        if (signed) {
            this.min = BigInteger.ONE.shiftLeft(bits - 1).negate();
            this.max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        } else {
            this.min = BigInteger.ZERO;
            this.max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        }
    }

    public String getIlName() {
        return ilName;
    }

    public boolean fits(BigInteger value) {
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    public static Optional<IntegerType> fromIlName(String ilName) {
        for (IntegerType type : values()) {
            if (type.ilName.equals(ilName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
