/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.buffer;

import java.util.Arrays;

import dev.parquetwriter.FillTypeException;
import dev.parquetwriter.internal.array.ColumnArray;
import dev.parquetwriter.schema.PrimitiveKind;

/**
 * Buffer for values of a single primitive kind.
 * <p>
 * Values of every kind are kept as raw 64 bit patterns in one {@code long[]}
 * (booleans as 0/1, floating point values via their raw IEEE bits) and only
 * widened back into typed arrays on {@link #materialize(ColumnArray[])}.
 * </p>
 */
public final class PrimitiveBuffer implements ColumnBuffer {

    private static final int INITIAL_CAPACITY = 64;

    private final PrimitiveKind kind;
    private long[] bits = new long[INITIAL_CAPACITY];
    private int size;

    public PrimitiveBuffer(PrimitiveKind kind) {
        this.kind = kind;
    }

    public PrimitiveKind kind() {
        return kind;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void check(Object value, String path) {
        if (!kind.javaType().isInstance(value)) {
            throw new FillTypeException("Column '" + path + "' of type " + kind + " expects a "
                    + kind.javaType().getSimpleName() + " value, got " + ColumnBuffer.describe(value));
        }
    }

    @Override
    public void append(Object value) {
        if (size == bits.length) {
            bits = Arrays.copyOf(bits, size << 1);
        }
        bits[size++] = toBits(value);
    }

    private long toBits(Object value) {
        return switch (kind) {
            case BOOL -> (Boolean) value ? 1L : 0L;
            case INT8, UINT8 -> (Byte) value;
            case INT16, UINT16 -> (Short) value;
            case INT32, UINT32 -> (Integer) value;
            case INT64, UINT64 -> (Long) value;
            case FLOAT -> Float.floatToRawIntBits((Float) value);
            case DOUBLE -> Double.doubleToRawLongBits((Double) value);
        };
    }

    @Override
    public ColumnArray materialize(ColumnArray[] structFields) {
        switch (kind) {
            case BOOL -> {
                boolean[] values = new boolean[size];
                for (int i = 0; i < size; i++) {
                    values[i] = bits[i] != 0;
                }
                return new ColumnArray.BooleanArray(values, size);
            }
            case FLOAT -> {
                float[] values = new float[size];
                for (int i = 0; i < size; i++) {
                    values[i] = Float.intBitsToFloat((int) bits[i]);
                }
                return new ColumnArray.FloatArray(values, size);
            }
            case DOUBLE -> {
                double[] values = new double[size];
                for (int i = 0; i < size; i++) {
                    values[i] = Double.longBitsToDouble(bits[i]);
                }
                return new ColumnArray.DoubleArray(values, size);
            }
            default -> {
                if (kind.isWide()) {
                    return new ColumnArray.LongArray(kind, Arrays.copyOf(bits, size), size);
                }
                // uint8 and uint16 are zero-extended into the INT32 physical type,
                // uint32 keeps its bit pattern
                long mask = kind == PrimitiveKind.UINT8 ? 0xFFL : kind == PrimitiveKind.UINT16 ? 0xFFFFL : -1L;
                int[] values = new int[size];
                for (int i = 0; i < size; i++) {
                    values[i] = (int) (bits[i] & mask);
                }
                return new ColumnArray.IntArray(kind, values, size);
            }
        }
    }

    @Override
    public void clear() {
        size = 0;
    }

    @Override
    public String toString() {
        return "PrimitiveBuffer[" + kind + ", size=" + size + "]";
    }
}
