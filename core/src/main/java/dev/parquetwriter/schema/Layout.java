/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.schema;

import java.util.List;

/**
 * Validated layout of a dataset: the ordered top-level columns.
 * Instances are created by {@link SchemaParser}.
 */
public record Layout(List<Field> fields) {

    public Layout {
        fields = List.copyOf(fields);
    }

    public int getColumnCount() {
        return fields.size();
    }

    /**
     * Finds a top-level field by name.
     */
    Field getField(String name) {
        for (Field field : fields) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Field not found: " + name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("layout {\n");
        for (Field field : fields) {
            appendField(sb, field, 1);
        }
        sb.append("}");
        return sb.toString();
    }

    private void appendField(StringBuilder sb, Field field, int indent) {
        String prefix = "  ".repeat(indent);
        TypeSpec.Struct struct = field.type().structElement();
        if (struct == null) {
            sb.append(prefix).append(field.type()).append(" ").append(field.name()).append(";\n");
            return;
        }
        sb.append(prefix);
        sb.append("list<".repeat(field.type().listDimension()));
        sb.append("struct ").append(field.name()).append(" {\n");
        for (Field child : struct.fields()) {
            appendField(sb, child, indent + 1);
        }
        sb.append(prefix).append("}");
        sb.append(">".repeat(field.type().listDimension()));
        sb.append("\n");
    }
}
