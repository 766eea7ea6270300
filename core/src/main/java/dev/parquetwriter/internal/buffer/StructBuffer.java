/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.buffer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import dev.parquetwriter.FillTypeException;
import dev.parquetwriter.internal.array.ColumnArray;
import dev.parquetwriter.row.StructValue;
import dev.parquetwriter.schema.Field;
import dev.parquetwriter.schema.TypeSpec;

/**
 * Buffer for struct instances.
 * <p>
 * A struct is filled either positionally, as a {@link StructValue} holding the
 * non-struct fields in declaration order, or by name, as a {@link Map} from
 * each non-struct field name to its value.
 * </p>
 * <p>
 * Holds one child buffer per non-struct field. Struct-valued fields are not
 * buffered here; their arrays are supplied by the caller on
 * {@link #materialize(ColumnArray[])}.
 * </p>
 */
public final class StructBuffer implements ColumnBuffer {

    private final TypeSpec.Struct type;
    private final ColumnBuffer[] columns;
    private final int[] valuePositions;
    private int size;

    public StructBuffer(TypeSpec.Struct type) {
        this.type = type;
        List<Field> fields = type.fields();
        this.columns = new ColumnBuffer[fields.size()];
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            TypeSpec fieldType = fields.get(i).type();
            if (!fieldType.isStructValued()) {
                columns[i] = createValueBuffer(fieldType);
                positions.add(i);
            }
        }
        this.valuePositions = positions.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Creates the buffer for a primitive or a list of primitives.
     */
    static ColumnBuffer createValueBuffer(TypeSpec type) {
        if (type instanceof TypeSpec.Primitive primitive) {
            return new PrimitiveBuffer(primitive.kind());
        }
        if (type instanceof TypeSpec.ListOf list && list.element() instanceof TypeSpec.Primitive element) {
            return new ListBuffer(list.dimension(), new PrimitiveBuffer(element.kind()));
        }
        throw new IllegalArgumentException("Not a value type: " + type);
    }

    public TypeSpec.Struct type() {
        return type;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void check(Object value, String path) {
        if (value instanceof Map<?, ?> map) {
            checkMap(map, path);
            return;
        }
        if (!(value instanceof StructValue struct)) {
            throw new FillTypeException("Column '" + path + "' expects a StructValue or a Map keyed by field name, got "
                    + ColumnBuffer.describe(value));
        }
        if (struct.size() != valuePositions.length) {
            throw new FillTypeException("Column '" + path + "' expects a StructValue with " + valuePositions.length
                    + " values " + describeValueFields() + ", got " + struct.size());
        }
        for (int i = 0; i < valuePositions.length; i++) {
            Field field = type.fields().get(valuePositions[i]);
            try {
                columns[valuePositions[i]].check(struct.get(i), path + "." + field.name());
            }
            catch (FillTypeException e) {
                throw new FillTypeException("Value at position " + i + " of struct '" + path
                        + "' does not match field '" + field.name() + "' (" + field.type() + "): " + e.getMessage());
            }
        }
    }

    /**
     * Checks a struct given by field name. Keys must be exactly the names of the
     * non-struct fields.
     */
    private void checkMap(Map<?, ?> map, String path) {
        for (Object key : map.keySet()) {
            Field field = key instanceof String name ? fieldNamed(name) : null;
            if (field == null) {
                throw new FillTypeException("Struct '" + path + "' has no field " + key + ", expected "
                        + describeValueFields());
            }
            if (field.type().isStructValued()) {
                throw new FillTypeException("Field '" + key + "' of struct '" + path + "' holds structs and must be filled as '"
                        + path + "." + key + "'");
            }
        }
        for (int position : valuePositions) {
            Field field = type.fields().get(position);
            if (!map.containsKey(field.name())) {
                throw new FillTypeException("Struct '" + path + "' is missing field '" + field.name() + "' (" + field.type() + ")");
            }
            columns[position].check(map.get(field.name()), path + "." + field.name());
        }
    }

    private Field fieldNamed(String name) {
        for (Field field : type.fields()) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        return null;
    }

    private String describeValueFields() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < valuePositions.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(type.fields().get(valuePositions[i]));
        }
        return sb.append(")").toString();
    }

    @Override
    public void append(Object value) {
        if (value instanceof Map<?, ?> map) {
            for (int position : valuePositions) {
                columns[position].append(map.get(type.fields().get(position).name()));
            }
        }
        else {
            StructValue struct = (StructValue) value;
            for (int i = 0; i < valuePositions.length; i++) {
                columns[valuePositions[i]].append(struct.get(i));
            }
        }
        size++;
    }

    @Override
    public ColumnArray materialize(ColumnArray[] structFields) {
        List<Field> fields = type.fields();
        List<String> names = new ArrayList<>(fields.size());
        List<ColumnArray> children = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            names.add(fields.get(i).name());
            ColumnArray child = columns[i] != null
                    ? columns[i].materialize(null)
                    : structFields != null ? structFields[i] : null;
            if (child == null) {
                throw new IllegalStateException("No data supplied for struct field '" + fields.get(i).name() + "'");
            }
            children.add(child);
        }
        return new ColumnArray.StructArray(names, children, size);
    }

    @Override
    public void clear() {
        for (ColumnBuffer column : columns) {
            if (column != null) {
                column.clear();
            }
        }
        size = 0;
    }

    @Override
    public String toString() {
        return "StructBuffer[" + type + ", size=" + size + "]";
    }
}
