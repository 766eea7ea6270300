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
 * Declared type of one field of a layout.
 * <p>
 * A closed tree of three node kinds: primitives, lists and structs. Nested
 * list declarations are collapsed into a single {@link ListOf} node carrying
 * the number of list levels, so a list element is never itself a list.
 * </p>
 */
public sealed interface TypeSpec permits TypeSpec.Primitive, TypeSpec.ListOf, TypeSpec.Struct {

    int MAX_LIST_DIMENSION = 3;

    /**
     * Returns the struct carried by this type: the struct itself, the element of
     * a list of structs, or null for primitives and lists of primitives.
     */
    Struct structElement();

    /**
     * Returns true for structs and lists of structs. Such fields of a struct are
     * not part of the struct's positional value and are filled on their own
     * dotted path.
     */
    default boolean isStructValued() {
        return structElement() != null;
    }

    /**
     * Number of list levels wrapped around the element, 0 for non-list types.
     */
    default int listDimension() {
        return 0;
    }

    /**
     * A single value of the given kind.
     */
    record Primitive(PrimitiveKind kind) implements TypeSpec {

        @Override
        public Struct structElement() {
            return null;
        }

        @Override
        public String toString() {
            return kind.typeName();
        }
    }

    /**
     * A list nested {@code dimension} levels deep around a primitive or struct element.
     */
    record ListOf(TypeSpec element, int dimension) implements TypeSpec {

        public ListOf {
            if (element instanceof ListOf) {
                throw new IllegalArgumentException("List element must not be a list, raise the dimension instead");
            }
            if (dimension < 1 || dimension > MAX_LIST_DIMENSION) {
                throw new IllegalArgumentException("Invalid list dimension: " + dimension);
            }
        }

        @Override
        public Struct structElement() {
            return element instanceof Struct struct ? struct : null;
        }

        @Override
        public int listDimension() {
            return dimension;
        }

        @Override
        public String toString() {
            return "list<".repeat(dimension) + element + ">".repeat(dimension);
        }
    }

    /**
     * An ordered group of named fields.
     */
    record Struct(List<Field> fields) implements TypeSpec {

        public Struct {
            fields = List.copyOf(fields);
        }

        @Override
        public Struct structElement() {
            return this;
        }

        /**
         * Returns the fields whose values travel in the struct's positional value,
         * i.e. all fields that are not struct-valued, in declaration order.
         */
        public List<Field> valueFields() {
            return fields.stream().filter(f -> !f.type().isStructValued()).toList();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("struct<");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(fields.get(i));
            }
            return sb.append(">").toString();
        }
    }
}
