package com.winmd.generator.codegen.blob;

import lombok.experimental.UtilityClass;

/**
 * Complete custom attribute blobs: prolog, fixed arguments, named arguments.
 */
@UtilityClass
public class CustomAttributeBlobs {

    private static final byte[] PROLOG = {0x01, 0x00};
    private static final byte[] NO_NAMED_ARGUMENTS = {0x00, 0x00};
    private static final byte[] ONE_NAMED_ARGUMENT = {0x01, 0x00};

    private static final byte NAMED_FIELD = 0x53;
    private static final byte ELEMENT_TYPE_I2 = 0x06;
    private static final byte ELEMENT_TYPE_I4 = 0x08;

    public static final String COUNT_PARAM_INDEX = "CountParamIndex";
    public static final String COUNT_CONST = "CountConst";

    /**
     * Blob of a parameterless attribute: {@code 01 00 00 00}.
     */
    public byte[] marker() {
        return AttributeBlobEncoder.concat(PROLOG, NO_NAMED_ARGUMENTS);
    }

    public byte[] countParamIndex(int index) {
        return namedField(ELEMENT_TYPE_I2, COUNT_PARAM_INDEX, AttributeBlobEncoder.littleEndian(index, 2));
    }

    public byte[] countConst(long count) {
        return namedField(ELEMENT_TYPE_I4, COUNT_CONST, AttributeBlobEncoder.littleEndian(count, 4));
    }

    public byte[] associatedEnum(String enumName) {
        return AttributeBlobEncoder.concat(PROLOG, AttributeBlobEncoder.compressedString(enumName), NO_NAMED_ARGUMENTS);
    }

    public byte[] unmanagedFunctionPointer(long callingConventionCode) {
        return AttributeBlobEncoder.concat(PROLOG, AttributeBlobEncoder.littleEndian(callingConventionCode, 4), NO_NAMED_ARGUMENTS);
    }

    /**
     * GuidAttribute blob for a GUID given in written byte order.
     */
    public byte[] guid(byte[] canonical) {
        return AttributeBlobEncoder.concat(PROLOG, AttributeBlobEncoder.reorderGuid(canonical), NO_NAMED_ARGUMENTS);
    }

    private byte[] namedField(byte elementType, String fieldName, byte[] value) {
        return AttributeBlobEncoder.concat(
                PROLOG,
                ONE_NAMED_ARGUMENT,
                new byte[] {NAMED_FIELD, elementType},
                AttributeBlobEncoder.pascalString(fieldName),
                value);
    }
}
