/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.schema;

/**
 * Primitive value kinds that may appear in a layout.
 * <p>
 * Each kind accepts exactly one Java type as fill value. Unsigned kinds take
 * the signed type of the same width and store its bit pattern unchanged, so
 * e.g. {@code uint8} 255 is filled as {@code (byte) -1}.
 * </p>
 */
public enum PrimitiveKind {
    BOOL("bool", Boolean.class, 1, false),
    INT8("int8", Byte.class, 8, true),
    INT16("int16", Short.class, 16, true),
    INT32("int32", Integer.class, 32, true),
    INT64("int64", Long.class, 64, true),
    UINT8("uint8", Byte.class, 8, false),
    UINT16("uint16", Short.class, 16, false),
    UINT32("uint32", Integer.class, 32, false),
    UINT64("uint64", Long.class, 64, false),
    FLOAT("float", Float.class, 32, true),
    DOUBLE("double", Double.class, 64, true);

    private final String typeName;
    private final Class<?> javaType;
    private final int bitWidth;
    private final boolean signed;

    PrimitiveKind(String typeName, Class<?> javaType, int bitWidth, boolean signed) {
        this.typeName = typeName;
        this.javaType = javaType;
        this.bitWidth = bitWidth;
        this.signed = signed;
    }

    /**
     * Name used for this kind in layout JSON.
     */
    public String typeName() {
        return typeName;
    }

    /**
     * The only Java type accepted as fill value for this kind.
     */
    public Class<?> javaType() {
        return javaType;
    }

    public int bitWidth() {
        return bitWidth;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isInteger() {
        return this != BOOL && this != FLOAT && this != DOUBLE;
    }

    /**
     * Returns true if values of this kind are stored as 64 bit integers.
     */
    public boolean isWide() {
        return isInteger() && bitWidth == 64;
    }

    /**
     * Resolves a layout type name, accepting {@code float32} and
     * {@code float64} as aliases. Returns null for unknown names.
     */
    public static PrimitiveKind forTypeName(String name) {
        if ("float32".equals(name)) {
            return FLOAT;
        }
        if ("float64".equals(name)) {
            return DOUBLE;
        }
        for (PrimitiveKind kind : values()) {
            if (kind.typeName.equals(name)) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
