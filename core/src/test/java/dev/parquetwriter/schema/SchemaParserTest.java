/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.schema;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.parquetwriter.SchemaException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SchemaParserTest {

    @Test
    void testPrimitiveFields() {
        Layout layout = SchemaParser.parse("""
                {"fields": [
                    {"name": "flag", "type": "bool"},
                    {"name": "id", "type": "uint64"},
                    {"name": "energy", "type": "float32"},
                    {"name": "weight", "type": "double"}
                ]}""");

        assertThat(layout.getColumnCount()).isEqualTo(4);
        assertThat(layout.fields()).extracting(Field::name).containsExactly("flag", "id", "energy", "weight");
        assertThat(layout.getField("flag").type()).isEqualTo(new TypeSpec.Primitive(PrimitiveKind.BOOL));
        assertThat(layout.getField("id").type()).isEqualTo(new TypeSpec.Primitive(PrimitiveKind.UINT64));
        assertThat(layout.getField("energy").type()).isEqualTo(new TypeSpec.Primitive(PrimitiveKind.FLOAT));
        assertThat(layout.getField("weight").type()).isEqualTo(new TypeSpec.Primitive(PrimitiveKind.DOUBLE));
    }

    @Test
    void testNestedListsCollapseIntoDimension() {
        Layout layout = SchemaParser.parse("""
                {"fields": [
                    {"name": "hits", "type": "list", "contains":
                        {"type": "list", "contains": {"type": "list", "contains": {"type": "uint32"}}}}
                ]}""");

        var type = (TypeSpec.ListOf) layout.getField("hits").type();
        assertThat(type.dimension()).isEqualTo(3);
        assertThat(type.element()).isEqualTo(new TypeSpec.Primitive(PrimitiveKind.UINT32));
        assertThat(type.isStructValued()).isFalse();
    }

    @Test
    void testStructsAndListsOfStructs() {
        Layout layout = SchemaParser.parse("""
                {"fields": [
                    {"name": "track", "type": "struct", "fields": [
                        {"name": "pt", "type": "float"},
                        {"name": "vertex", "type": "struct", "fields": [{"name": "x", "type": "double"}]},
                        {"name": "clusters", "type": "list", "contains":
                            {"type": "struct", "fields": [{"name": "size", "type": "int16"}]}}
                    ]}
                ]}""");

        var track = (TypeSpec.Struct) layout.getField("track").type();
        assertThat(track.fields()).extracting(Field::name).containsExactly("pt", "vertex", "clusters");
        assertThat(track.valueFields()).extracting(Field::name).containsExactly("pt");

        var clusters = (TypeSpec.ListOf) track.fields().get(2).type();
        assertThat(clusters.dimension()).isEqualTo(1);
        assertThat(clusters.isStructValued()).isTrue();
        assertThat(clusters.structElement().fields()).extracting(Field::name).containsExactly("size");
    }

    @Test
    void testParsingIsIdempotent() {
        String json = """
                {"fields": [
                    {"name": "a", "type": "int8"},
                    {"name": "b", "type": "list", "contains": {"type": "struct", "fields": [{"name": "c", "type": "int32"}]}}
                ]}""";

        assertThat(SchemaParser.parse(json)).isEqualTo(SchemaParser.parse(json));
    }

    @Test
    void testParseFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("layout.json");
        Files.writeString(file, "{\"fields\": [{\"name\": \"x\", \"type\": \"int16\"}]}");

        assertThat(SchemaParser.parse(file).getField("x").type()).isEqualTo(new TypeSpec.Primitive(PrimitiveKind.INT16));
    }

    @Test
    void testStructInsideNestedStructIsRejected() {
        assertThatThrownBy(() -> SchemaParser.parse("""
                {"fields": [
                    {"name": "outer", "type": "struct", "fields": [
                        {"name": "inner", "type": "struct", "fields": [
                            {"name": "deepest", "type": "struct", "fields": [{"name": "x", "type": "int32"}]}
                        ]}
                    ]}
                ]}"""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("outer.inner.deepest");
    }

    @Test
    void testStructFieldInListOfStructInsideStructIsRejected() {
        assertThatThrownBy(() -> SchemaParser.parse("""
                {"fields": [
                    {"name": "event", "type": "struct", "fields": [
                        {"name": "tracks", "type": "list", "contains": {"type": "struct", "fields": [
                            {"name": "vertex", "type": "struct", "fields": [{"name": "x", "type": "float"}]}
                        ]}}
                    ]}
                ]}"""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("event.tracks.vertex");
    }

    @Test
    void testDotInFieldNameIsRejected() {
        assertThatThrownBy(() -> SchemaParser.parse("""
                {"fields": [
                    {"name": "a", "type": "struct", "fields": [
                        {"name": "x", "type": "int32"},
                        {"name": "b", "type": "struct", "fields": [{"name": "y", "type": "int32"}]}
                    ]},
                    {"name": "a.b", "type": "int32"}
                ]}"""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Field name 'a.b' must not contain '.'");

        assertThatThrownBy(() -> SchemaParser.parse("""
                {"fields": [
                    {"name": "s", "type": "struct", "fields": [{"name": "x.y", "type": "float"}]}
                ]}"""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Field name 'x.y' in 's'");
    }

    @Test
    void testListNestedTooDeep() {
        assertThatThrownBy(() -> SchemaParser.parse("""
                {"fields": [
                    {"name": "hits", "type": "list", "contains": {"type": "list", "contains":
                        {"type": "list", "contains": {"type": "list", "contains": {"type": "int32"}}}}}
                ]}"""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("nested deeper than 3 levels");
    }

    @Test
    void testMalformedDeclarations() {
        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": [{\"type\": \"int32\"}]}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Missing \"name\"");

        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": [{\"name\": \"x\"}]}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Missing \"type\" for field 'x'");

        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": [{\"name\": \"x\", \"type\": \"int128\"}]}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Unknown type 'int128'");

        assertThatThrownBy(() -> SchemaParser.parse("""
                {"fields": [{"name": "x", "type": "int32"}, {"name": "x", "type": "float"}]}"""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Duplicate field name 'x'");
    }

    @Test
    void testMissingOrEmptyContainers() {
        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": []}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("must not be empty");

        assertThatThrownBy(() -> SchemaParser.parse("{\"columns\": []}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Missing \"fields\"");

        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": [{\"name\": \"l\", \"type\": \"list\"}]}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("requires a \"contains\" object");

        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": [{\"name\": \"l\", \"type\": \"list\", \"contains\": {}}]}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("must be a non-empty object");

        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": [{\"name\": \"s\", \"type\": \"struct\", \"fields\": []}]}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("struct 's'");
    }

    @Test
    void testInvalidJson() {
        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": ["))
                .isInstanceOf(SchemaException.class)
                .hasMessageStartingWith("Layout is not valid JSON");
    }
}
