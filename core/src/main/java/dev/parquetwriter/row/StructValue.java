/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.row;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Positional value of one struct instance.
 * <p>
 * Holds one value per non-struct field of the struct, in declaration order.
 * Fields that are themselves structs (or lists of structs) are not part of the
 * value; they are filled separately on their dotted path.
 * </p>
 *
 * <pre>{@code
 * // struct with fields (pt: float, charge: int8, hits: list<uint32>)
 * writer.fill("track", StructValue.of(42.5f, (byte) -1, List.of(3, 7)));
 * }</pre>
 */
public final class StructValue {

    private final List<Object> values;

    private StructValue(Object[] values) {
        // Arrays.asList keeps nulls so they are reported by the type check
        this.values = Collections.unmodifiableList(Arrays.asList(values));
    }

    public static StructValue of(Object... values) {
        return new StructValue(values.clone());
    }

    public static StructValue of(List<?> values) {
        return new StructValue(values.toArray());
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    public List<Object> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructValue other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StructValue" + values;
    }
}
