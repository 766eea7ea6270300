/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.buffer;

import java.util.Collection;

import dev.parquetwriter.FillTypeException;
import dev.parquetwriter.internal.array.ColumnArray;

/**
 * Accumulates the values of one addressable node of a layout between flushes.
 * <p>
 * A fill first runs {@link #check(Object, String)} over the complete value and
 * only then {@link #append(Object)}, so a rejected value leaves the buffer
 * untouched.
 * </p>
 */
public sealed interface ColumnBuffer permits PrimitiveBuffer, ListBuffer, StructBuffer {

    /**
     * Number of units (scalars, lists or structs) appended since the last clear.
     */
    int size();

    /**
     * Validates that the value matches this buffer's type.
     *
     * @param value the value to validate
     * @param path the path of the value, used in error messages
     * @throws FillTypeException if the value does not match
     */
    void check(Object value, String path);

    /**
     * Appends one unit. The value must have passed {@link #check(Object, String)}.
     */
    void append(Object value);

    /**
     * Converts the buffered units into a column array.
     *
     * @param structFields for struct data, arrays of the struct-valued fields indexed
     *                     by declared field position; null entries (or a null array)
     *                     where the field is buffered locally
     */
    ColumnArray materialize(ColumnArray[] structFields);

    /**
     * Drops all buffered units, keeping the buffer's shape for reuse.
     */
    void clear();

    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Collection<?> collection) {
            return value.getClass().getSimpleName() + " of size " + collection.size();
        }
        return value.getClass().getSimpleName() + " " + value;
    }
}
