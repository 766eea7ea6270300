/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.schema;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.parquetwriter.SchemaException;

/**
 * Parses the JSON description of a layout into a {@link Layout}.
 *
 * <pre>{@code
 * {"fields": [
 *     {"name": "id", "type": "int64"},
 *     {"name": "hits", "type": "list", "contains": {"type": "list", "contains": {"type": "uint32"}}},
 *     {"name": "track", "type": "struct", "fields": [
 *         {"name": "pt", "type": "float"},
 *         {"name": "vertex", "type": "struct", "fields": [{"name": "x", "type": "double"}]}
 *     ]}
 * ]}
 * }</pre>
 * <p>
 * Structs may be nested one level: a struct (or the struct element of a list)
 * declared inside another struct must not itself declare struct fields.
 * </p>
 */
public final class SchemaParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String FIELDS = "fields";
    private static final String NAME = "name";
    private static final String TYPE = "type";
    private static final String CONTAINS = "contains";
    private static final String LIST = "list";
    private static final String STRUCT = "struct";
    private static final char PATH_SEPARATOR = '.';

    // Number of structs a struct declaration may be enclosed in
    private static final int MAX_STRUCT_DEPTH = 1;

    private SchemaParser() {
    }

    public static Layout parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        }
        catch (JsonProcessingException e) {
            throw new SchemaException("Layout is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public static Layout parse(Path file) {
        JsonNode root;
        try {
            root = MAPPER.readTree(file.toFile());
        }
        catch (IOException e) {
            throw new SchemaException("Cannot read layout file " + file + ": " + e.getMessage(), e);
        }
        return parse(root);
    }

    /**
     * Parses a layout object of the form {@code {"fields": [...]}}.
     *
     * @throws SchemaException if the layout is malformed
     */
    public static Layout parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new SchemaException("Layout must be a JSON object with a \"fields\" array");
        }
        return new Layout(parseFields(root, "", 0));
    }

    /**
     * Parses the {@code fields} array of a layout or struct object.
     *
     * @param structDepth number of structs enclosing the parsed fields
     */
    private static List<Field> parseFields(JsonNode owner, String ownerPath, int structDepth) {
        JsonNode fieldsNode = owner.get(FIELDS);
        String where = ownerPath.isEmpty() ? "layout" : "struct '" + ownerPath + "'";
        if (fieldsNode == null) {
            throw new SchemaException("Missing \"fields\" array in " + where);
        }
        if (!fieldsNode.isArray()) {
            throw new SchemaException("\"fields\" of " + where + " must be an array");
        }
        if (fieldsNode.isEmpty()) {
            throw new SchemaException("\"fields\" of " + where + " must not be empty");
        }

        List<Field> fields = new ArrayList<>(fieldsNode.size());
        Set<String> names = new HashSet<>();
        for (JsonNode fieldNode : fieldsNode) {
            Field field = parseField(fieldNode, ownerPath, structDepth);
            if (!names.add(field.name())) {
                throw new SchemaException("Duplicate field name '" + field.name() + "' in " + where);
            }
            fields.add(field);
        }
        return fields;
    }

    private static Field parseField(JsonNode node, String ownerPath, int structDepth) {
        if (!node.isObject()) {
            throw new SchemaException("Field declarations in " + (ownerPath.isEmpty() ? "layout" : "'" + ownerPath + "'")
                    + " must be JSON objects, got: " + node);
        }
        JsonNode nameNode = node.get(NAME);
        if (nameNode == null || !nameNode.isTextual()) {
            throw new SchemaException("Missing \"name\" in field declaration " + node
                    + (ownerPath.isEmpty() ? "" : " of '" + ownerPath + "'"));
        }
        String name = nameNode.asText();
        if (name.isEmpty()) {
            throw new SchemaException("Empty field name in " + (ownerPath.isEmpty() ? "layout" : "'" + ownerPath + "'"));
        }
        // '.' separates the segments of fill paths
        if (name.indexOf(PATH_SEPARATOR) >= 0) {
            throw new SchemaException("Field name '" + name + "'" + (ownerPath.isEmpty() ? "" : " in '" + ownerPath + "'")
                    + " must not contain '" + PATH_SEPARATOR + "'");
        }
        String path = ownerPath.isEmpty() ? name : ownerPath + "." + name;
        return new Field(name, parseType(node, path, structDepth));
    }

    /**
     * Parses the {@code type} of a field declaration or a {@code contains} object.
     */
    private static TypeSpec parseType(JsonNode node, String path, int structDepth) {
        JsonNode typeNode = node.get(TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new SchemaException("Missing \"type\" for field '" + path + "'");
        }
        String type = typeNode.asText();

        if (LIST.equals(type)) {
            return parseList(node, path, structDepth);
        }
        if (STRUCT.equals(type)) {
            if (structDepth > MAX_STRUCT_DEPTH) {
                throw new SchemaException("Field '" + path + "' declares a struct inside a nested struct;"
                        + " structs may only be nested one level deep");
            }
            return new TypeSpec.Struct(parseFields(node, path, structDepth + 1));
        }

        PrimitiveKind kind = PrimitiveKind.forTypeName(type);
        if (kind == null) {
            throw new SchemaException("Unknown type '" + type + "' for field '" + path + "'");
        }
        return new TypeSpec.Primitive(kind);
    }

    private static TypeSpec parseList(JsonNode node, String path, int structDepth) {
        JsonNode contains = node.get(CONTAINS);
        if (contains == null) {
            throw new SchemaException("List field '" + path + "' requires a \"contains\" object");
        }
        if (!contains.isObject() || contains.isEmpty()) {
            throw new SchemaException("\"contains\" of list field '" + path + "' must be a non-empty object");
        }

        TypeSpec element = parseType(contains, path, structDepth);
        if (element instanceof TypeSpec.ListOf inner) {
            if (inner.dimension() == TypeSpec.MAX_LIST_DIMENSION) {
                throw new SchemaException("List field '" + path + "' is nested deeper than "
                        + TypeSpec.MAX_LIST_DIMENSION + " levels");
            }
            return new TypeSpec.ListOf(inner.element(), inner.dimension() + 1);
        }
        return new TypeSpec.ListOf(element, 1);
    }
}
