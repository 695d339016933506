package com.winmd.generator.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A COM interface whose IID is derived from a fixed template by substituting
 * the group and value bytes.
 */
@Getter
public class ComInterface {

    /**
     * IID template {@code 23170F69-40C1-278A-0000-00gg00vv0000} in canonical byte order.
     */
    private static final byte[] IID_TEMPLATE = {
            0x23, 0x17, 0x0F, 0x69,
            0x40, (byte) 0xC1,
            0x27, (byte) 0x8A,
            0x00, 0x00,
            0x00, 0x00, 0x00, 0x00, 0x00, 0x00
    };
    static final int GROUP_OFFSET = 11;
    static final int VALUE_OFFSET = 13;

    private final String name;
    private final int group;
    private final int value;
    private final TypeReference baseType;
    private final List<InterfaceMethod> methods = new ArrayList<>();

    public ComInterface(String name, int group, int value, TypeReference baseType) {
        if (group < 0 || group > 255) {
            throw new IllegalArgumentException("group must be between 0 and 255, got " + group);
        }
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("value must be between 0 and 255, got " + value);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.group = group;
        this.value = value;
        this.baseType = Objects.requireNonNull(baseType, "baseType");
    }

    public void addMethod(InterfaceMethod method) {
        methods.add(Objects.requireNonNull(method, "method"));
    }

    public List<InterfaceMethod> getMethods() {
        return Collections.unmodifiableList(methods);
    }

    /**
     * The interface identifier in canonical (big-endian, as written) byte order.
     */
    public byte[] getIid() {
        byte[] iid = IID_TEMPLATE.clone();
        iid[GROUP_OFFSET] = (byte) group;
        iid[VALUE_OFFSET] = (byte) value;
        return iid;
    }

    public String getIidString() {
        return GuidConstant.format(getIid());
    }
}
