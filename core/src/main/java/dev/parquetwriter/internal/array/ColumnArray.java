/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.array;

import java.util.List;

import dev.parquetwriter.schema.PrimitiveKind;

/**
 * Materialized data of one column for a row group, handed over to the file sink.
 * <p>
 * Primitive values are kept in typed primitive arrays. Lists use Arrow-style
 * offsets: element {@code i} spans {@code values[offsets[i], offsets[i + 1])}.
 * Structs hold one child array per declared field, all of the same length.
 * </p>
 */
public sealed interface ColumnArray {

    /** Number of entries (rows at the top level, elements below a list). */
    int length();

    record BooleanArray(boolean[] values, int length) implements ColumnArray {
        public boolean get(int index) {
            return values[index];
        }
    }

    /**
     * Values of kinds up to 32 bits wide. {@code uint8} and {@code uint16} are
     * zero-extended, {@code uint32} holds its bit pattern.
     */
    record IntArray(PrimitiveKind kind, int[] values, int length) implements ColumnArray {
        public int get(int index) {
            return values[index];
        }
    }

    record LongArray(PrimitiveKind kind, long[] values, int length) implements ColumnArray {
        public long get(int index) {
            return values[index];
        }
    }

    record FloatArray(float[] values, int length) implements ColumnArray {
        public float get(int index) {
            return values[index];
        }
    }

    record DoubleArray(double[] values, int length) implements ColumnArray {
        public double get(int index) {
            return values[index];
        }
    }

    record ListArray(int[] offsets, ColumnArray values) implements ColumnArray {

        @Override
        public int length() {
            return offsets.length - 1;
        }

        public int start(int index) {
            return offsets[index];
        }

        public int end(int index) {
            return offsets[index + 1];
        }
    }

    record StructArray(List<String> names, List<ColumnArray> children, int length) implements ColumnArray {

        public ColumnArray child(int index) {
            return children.get(index);
        }
    }
}
