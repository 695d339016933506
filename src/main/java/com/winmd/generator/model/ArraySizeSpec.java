package com.winmd.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * How the element count of an array argument is determined.
 * Count-by-index and constant-count are mutually exclusive by construction.
 */
@Value
public class ArraySizeSpec {

    public enum Kind {
        NONE,
        /** Element count is passed in another argument (zero-based index). */
        COUNT_PARAM_INDEX,
        /** Element count is a fixed constant. */
        COUNT_CONST
    }

    public static final int MAX_PARAM_INDEX = 0xFFFF;
    public static final long MAX_CONST_COUNT = 0xFFFF_FFFFL;

    private static final ArraySizeSpec NONE = new ArraySizeSpec(Kind.NONE, 0);

    @NonNull
    Kind kind;
    long value;

    private ArraySizeSpec(Kind kind, long value) {
        this.kind = kind;
        this.value = value;
    }

    public static ArraySizeSpec none() {
        return NONE;
    }

    public static ArraySizeSpec countParamIndex(int index) {
        if (index < 0 || index > MAX_PARAM_INDEX) {
            throw new IllegalArgumentException("count parameter index must be between 0 and " + MAX_PARAM_INDEX + ", got " + index);
        }
        return new ArraySizeSpec(Kind.COUNT_PARAM_INDEX, index);
    }

    public static ArraySizeSpec countConst(long count) {
        if (count < 0 || count > MAX_CONST_COUNT) {
            throw new IllegalArgumentException("constant count must be between 0 and " + MAX_CONST_COUNT + ", got " + count);
        }
        return new ArraySizeSpec(Kind.COUNT_CONST, count);
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }
}
