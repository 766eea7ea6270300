/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.parquet;

import java.util.ArrayList;
import java.util.List;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;

import dev.parquetwriter.schema.Field;
import dev.parquetwriter.schema.Layout;
import dev.parquetwriter.schema.PrimitiveKind;
import dev.parquetwriter.schema.TypeSpec;

/**
 * Converts a layout to a parquet-java schema.
 * <p>
 * All fields are REQUIRED. Integer kinds carry an {@code INT(bitWidth, signed)}
 * annotation, lists use the standard three-level encoding
 * ({@code <name> (LIST) -> repeated group list -> element}), one LIST group per
 * list dimension, and structs become plain groups in declaration order.
 * </p>
 */
public final class SchemaConverter {

    static final String LIST_GROUP = "list";
    static final String ELEMENT = "element";

    private SchemaConverter() {
    }

    public static MessageType toMessageType(String name, Layout layout) {
        List<Type> fields = new ArrayList<>();
        for (Field field : layout.fields()) {
            fields.add(toType(field.name(), field.type()));
        }
        return new MessageType(name, fields);
    }

    static Type toType(String name, TypeSpec type) {
        if (type instanceof TypeSpec.Primitive primitive) {
            return toPrimitiveType(name, primitive.kind());
        }
        else if (type instanceof TypeSpec.ListOf list) {
            Type element = toType(ELEMENT, list.element());
            for (int level = list.dimension() - 1; level >= 0; level--) {
                element = toListType(level == 0 ? name : ELEMENT, element);
            }
            return element;
        }
        else if (type instanceof TypeSpec.Struct struct) {
            List<Type> children = new ArrayList<>();
            for (Field field : struct.fields()) {
                children.add(toType(field.name(), field.type()));
            }
            return Types.buildGroup(Type.Repetition.REQUIRED)
                    .addFields(children.toArray(new Type[0]))
                    .named(name);
        }
        throw new IllegalArgumentException("Unknown type: " + type);
    }

    private static Type toListType(String name, Type element) {
        return Types.buildGroup(Type.Repetition.REQUIRED)
                .as(LogicalTypeAnnotation.listType())
                .addField(Types.repeatedGroup().addField(element).named(LIST_GROUP))
                .named(name);
    }

    private static Type toPrimitiveType(String name, PrimitiveKind kind) {
        PrimitiveTypeName typeName = toPrimitiveTypeName(kind);
        if (kind.isInteger()) {
            return Types.required(typeName)
                    .as(LogicalTypeAnnotation.intType(kind.bitWidth(), kind.isSigned()))
                    .named(name);
        }
        return Types.required(typeName).named(name);
    }

    private static PrimitiveTypeName toPrimitiveTypeName(PrimitiveKind kind) {
        return switch (kind) {
            case BOOL -> PrimitiveTypeName.BOOLEAN;
            case INT8, INT16, INT32, UINT8, UINT16, UINT32 -> PrimitiveTypeName.INT32;
            case INT64, UINT64 -> PrimitiveTypeName.INT64;
            case FLOAT -> PrimitiveTypeName.FLOAT;
            case DOUBLE -> PrimitiveTypeName.DOUBLE;
        };
    }
}
