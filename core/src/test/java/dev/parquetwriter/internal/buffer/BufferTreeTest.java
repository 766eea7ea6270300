/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.buffer;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.parquetwriter.AlignmentException;
import dev.parquetwriter.FillTypeException;
import dev.parquetwriter.internal.array.ColumnArray;
import dev.parquetwriter.internal.array.RowGroup;
import dev.parquetwriter.row.StructValue;
import dev.parquetwriter.schema.Field;
import dev.parquetwriter.schema.Layout;
import dev.parquetwriter.schema.PrimitiveKind;
import dev.parquetwriter.schema.SchemaParser;
import dev.parquetwriter.schema.TypeSpec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BufferTreeTest {

    private static final String LAYOUT = """
            {"fields": [
                {"name": "id", "type": "int32"},
                {"name": "track", "type": "struct", "fields": [
                    {"name": "pt", "type": "float"},
                    {"name": "vertex", "type": "struct", "fields": [{"name": "x", "type": "double"}]}
                ]},
                {"name": "clusters", "type": "list", "contains": {"type": "struct", "fields": [
                    {"name": "size", "type": "int16"},
                    {"name": "pos", "type": "struct", "fields": [{"name": "x", "type": "float"}]}
                ]}}
            ]}""";

    private BufferTree tree;

    @BeforeEach
    void setUp() {
        tree = BufferTree.build(SchemaParser.parse(LAYOUT));
    }

    @Test
    void testPathIndex() {
        assertThat(tree.nodes()).extracting(BufferTree.Node::path)
                .containsExactly("id", "track", "track.vertex", "clusters", "clusters.pos");
        assertThat(tree.columns()).extracting(BufferTree.Node::path).containsExactly("id", "track", "clusters");

        var track = (StructBuffer) tree.lookup("track").buffer();
        assertThat(track.type().valueFields()).hasSize(1);
        assertThat(((PrimitiveBuffer) tree.lookup("id").buffer()).kind()).isEqualTo(PrimitiveKind.INT32);
        assertThat(tree.lookup("clusters").dimension()).isEqualTo(1);
        // Struct field below a list of structs buffers the parent's list level
        assertThat(tree.lookup("clusters.pos").buffer()).isInstanceOf(ListBuffer.class);
        assertThat(tree.lookup("clusters.pos").dimension()).isEqualTo(1);
        assertThat(tree.lookup("track.pt")).isNull();
        assertThat(tree.lookup("nope")).isNull();
    }

    @Test
    void testCollidingPathsAreRejected() {
        var inner = new TypeSpec.Struct(List.of(new Field("y", new TypeSpec.Primitive(PrimitiveKind.INT32))));
        var outer = new TypeSpec.Struct(List.of(
                new Field("x", new TypeSpec.Primitive(PrimitiveKind.INT32)),
                new Field("b", inner)));
        var layout = new Layout(List.of(
                new Field("a", outer),
                new Field("a.b", new TypeSpec.Primitive(PrimitiveKind.INT32))));

        assertThatThrownBy(() -> BufferTree.build(layout))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate path 'a.b'");
    }

    @Test
    void testCompleteRowsAndMaterialize() {
        fillRow(1, List.of((short) 3, (short) 4), List.of(10f, 20f));
        fillRow(2, List.of(), List.of());

        assertThat(tree.bufferedRows()).isEqualTo(2);
        assertThat(tree.hasPendingData()).isFalse();

        RowGroup group = tree.materialize();
        assertThat(group.rowCount()).isEqualTo(2);
        assertThat(group.names()).containsExactly("id", "track", "clusters");

        var ids = (ColumnArray.IntArray) group.columns().get(0);
        assertThat(ids.get(0)).isEqualTo(1);
        assertThat(ids.get(1)).isEqualTo(2);

        var track = (ColumnArray.StructArray) group.columns().get(1);
        assertThat(track.names()).containsExactly("pt", "vertex");
        assertThat(((ColumnArray.FloatArray) track.child(0)).get(1)).isEqualTo(2.5f);
        var vertex = (ColumnArray.StructArray) track.child(1);
        assertThat(((ColumnArray.DoubleArray) vertex.child(0)).get(1)).isEqualTo(2.0);

        var clusters = (ColumnArray.ListArray) group.columns().get(2);
        assertThat(clusters.offsets()).containsExactly(0, 2, 2);
        var element = (ColumnArray.StructArray) clusters.values();
        assertThat(element.length()).isEqualTo(2);
        assertThat(((ColumnArray.IntArray) element.child(0)).get(1)).isEqualTo(4);
        var pos = (ColumnArray.StructArray) element.child(1);
        assertThat(pos.length()).isEqualTo(2);
        assertThat(((ColumnArray.FloatArray) pos.child(0)).get(0)).isEqualTo(10f);
        assertThat(((ColumnArray.FloatArray) pos.child(0)).get(1)).isEqualTo(20f);
    }

    @Test
    void testMissingAndRepeatedFills() {
        fill("id", 1);
        fill("id", 2);
        fill("track", StructValue.of(1.0f));

        assertThat(tree.hasPendingData()).isTrue();
        assertThatThrownBy(() -> tree.endRow(0))
                .isInstanceOf(AlignmentException.class)
                .hasMessageContaining("Row 0 is misaligned")
                .hasMessageContaining("not filled: track.vertex, clusters, clusters.pos")
                .hasMessageContaining("filled more than once: id (2 times)");
    }

    @Test
    void testStructFieldMustMatchParentListShape() {
        fill("id", 1);
        fill("track", StructValue.of(1.0f));
        fill("track.vertex", StructValue.of(0.0));
        fill("clusters", List.of(StructValue.of((short) 1), StructValue.of((short) 2)));
        fill("clusters.pos", List.of(StructValue.of(1f)));

        assertThatThrownBy(() -> tree.endRow(0))
                .isInstanceOf(AlignmentException.class)
                .hasMessageContaining("'clusters.pos' must hold one struct per element of 'clusters'");
    }

    @Test
    void testStructValueIsPositional() {
        var track = tree.lookup("track").buffer();

        assertThatThrownBy(() -> track.check(StructValue.of(1.0f, 2.0), "track"))
                .isInstanceOf(FillTypeException.class)
                .hasMessageContaining("expects a StructValue with 1 values");
        assertThatThrownBy(() -> track.check(StructValue.of(1.0), "track"))
                .isInstanceOf(FillTypeException.class)
                .hasMessageContaining("Value at position 0 of struct 'track' does not match field 'pt'");
        assertThatThrownBy(() -> track.check(List.of(1.0f), "track"))
                .isInstanceOf(FillTypeException.class)
                .hasMessageContaining("expects a StructValue");
    }

    @Test
    void testStructFilledByFieldName() {
        fill("id", 1);
        fill("track", Map.of("pt", 1.5f));
        fill("track.vertex", Map.of("x", 3.0));
        fill("clusters", List.of(Map.of("size", (short) 9), StructValue.of((short) 8)));
        fill("clusters.pos", List.of(Map.of("x", 1f), Map.of("x", 2f)));
        tree.endRow(0);

        RowGroup group = tree.materialize();
        var track = (ColumnArray.StructArray) group.columns().get(1);
        assertThat(((ColumnArray.FloatArray) track.child(0)).get(0)).isEqualTo(1.5f);
        assertThat(((ColumnArray.DoubleArray) ((ColumnArray.StructArray) track.child(1)).child(0)).get(0)).isEqualTo(3.0);
        var element = (ColumnArray.StructArray) ((ColumnArray.ListArray) group.columns().get(2)).values();
        assertThat(((ColumnArray.IntArray) element.child(0)).get(0)).isEqualTo(9);
        assertThat(((ColumnArray.IntArray) element.child(0)).get(1)).isEqualTo(8);
        var pos = (ColumnArray.StructArray) element.child(1);
        assertThat(((ColumnArray.FloatArray) pos.child(0)).get(1)).isEqualTo(2f);
    }

    @Test
    void testStructByNameRejectsMismatchedKeys() {
        var track = tree.lookup("track").buffer();

        assertThatThrownBy(() -> track.check(Map.of(), "track"))
                .isInstanceOf(FillTypeException.class)
                .hasMessageContaining("Struct 'track' is missing field 'pt'");
        assertThatThrownBy(() -> track.check(Map.of("pt", 1f, "eta", 2f), "track"))
                .isInstanceOf(FillTypeException.class)
                .hasMessageContaining("Struct 'track' has no field eta");
        assertThatThrownBy(() -> track.check(Map.of("pt", 1f, "vertex", Map.of("x", 1.0)), "track"))
                .isInstanceOf(FillTypeException.class)
                .hasMessageContaining("Field 'vertex' of struct 'track' holds structs and must be filled as 'track.vertex'");
        assertThatThrownBy(() -> track.check(Map.of("pt", 1.0), "track"))
                .isInstanceOf(FillTypeException.class)
                .hasMessageContaining("track.pt");

        var clusters = tree.lookup("clusters").buffer();
        assertThatThrownBy(() -> clusters.check(List.of(Map.of("size", 1)), "clusters"))
                .isInstanceOf(FillTypeException.class)
                .hasMessageContaining("clusters[0].size");
    }

    @Test
    void testClearKeepsStructure() {
        fillRow(1, List.of((short) 1), List.of(1f));
        tree.clear();

        assertThat(tree.bufferedRows()).isZero();
        fillRow(7, List.of(), List.of());
        var ids = (ColumnArray.IntArray) tree.materialize().columns().get(0);
        assertThat(ids.length()).isEqualTo(1);
        assertThat(ids.get(0)).isEqualTo(7);
    }

    private void fillRow(int id, List<Short> sizes, List<Float> positions) {
        fill("id", id);
        fill("track", StructValue.of(id + 0.5f));
        fill("track.vertex", StructValue.of((double) id));
        fill("clusters", sizes.stream().map(size -> StructValue.of(size)).toList());
        fill("clusters.pos", positions.stream().map(x -> StructValue.of(x)).toList());
        tree.endRow(tree.bufferedRows());
    }

    private void fill(String path, Object value) {
        var buffer = tree.lookup(path).buffer();
        buffer.check(value, path);
        buffer.append(value);
    }
}
