/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.buffer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.parquetwriter.AlignmentException;
import dev.parquetwriter.internal.array.ColumnArray;
import dev.parquetwriter.internal.array.RowGroup;
import dev.parquetwriter.schema.Field;
import dev.parquetwriter.schema.Layout;
import dev.parquetwriter.schema.TypeSpec;

/**
 * All buffers of a dataset, indexed by dotted path.
 * <p>
 * Every top-level column is a node. In addition every struct-valued field of a
 * struct (or of the struct element of a list) is a node of its own, addressed
 * as {@code parent.field}, because it is filled separately from the parent's
 * positional value. A node below a list of structs of dimension {@code p}
 * buffers {@code p} extra list levels so that its values can be checked against,
 * and later attached to, the individual elements of its parent.
 * </p>
 * <p>
 * The tree is built once and never restructured; flushing only clears buffers.
 * </p>
 */
public final class BufferTree {

    private final List<Node> columns;
    private final Map<String, Node> nodesByPath;
    private int bufferedRows;

    private BufferTree(List<Node> columns, Map<String, Node> nodesByPath) {
        this.columns = columns;
        this.nodesByPath = nodesByPath;
    }

    /**
     * One addressable buffer.
     *
     * @param path         dotted path of the node
     * @param type         declared type of the field
     * @param buffer       buffer receiving the fills of this path
     * @param dimension    list levels of {@code buffer}, including those of enclosing lists of structs
     * @param structFields child nodes of struct-valued fields, indexed by declared position;
     *                     null entries for other fields, null if the type carries no struct
     */
    public record Node(String path, TypeSpec type, ColumnBuffer buffer, int dimension, Node[] structFields) {

        /**
         * Child nodes of this node in declaration order.
         */
        public List<Node> children() {
            if (structFields == null) {
                return List.of();
            }
            List<Node> children = new ArrayList<>();
            for (Node child : structFields) {
                if (child != null) {
                    children.add(child);
                }
            }
            return children;
        }
    }

    public static BufferTree build(Layout layout) {
        Map<String, Node> nodesByPath = new LinkedHashMap<>();
        List<Node> columns = new ArrayList<>();
        for (Field field : layout.fields()) {
            columns.add(buildNode(field.name(), field.type(), 0, nodesByPath));
        }
        return new BufferTree(Collections.unmodifiableList(columns), Collections.unmodifiableMap(nodesByPath));
    }

    /**
     * Builds the node for {@code type} and all nodes below it.
     *
     * @param outerDimension list levels of the enclosing list of structs, 0 if none
     */
    private static Node buildNode(String path, TypeSpec type, int outerDimension, Map<String, Node> nodesByPath) {
        TypeSpec.Struct struct = type.structElement();
        int dimension = outerDimension + type.listDimension();

        ColumnBuffer buffer;
        Node[] structFields = null;
        if (struct == null) {
            buffer = StructBuffer.createValueBuffer(type);
        }
        else {
            StructBuffer structBuffer = new StructBuffer(struct);
            buffer = dimension == 0 ? structBuffer : new ListBuffer(dimension, structBuffer);
        }

        // Register the parent before its children so iteration runs top-down
        Node[] children = struct != null ? new Node[struct.fields().size()] : null;
        Node node = new Node(path, type, buffer, dimension, children);
        if (nodesByPath.putIfAbsent(path, node) != null) {
            throw new IllegalArgumentException("Duplicate path '" + path + "' in layout");
        }

        if (struct != null) {
            for (int i = 0; i < struct.fields().size(); i++) {
                Field field = struct.fields().get(i);
                if (field.type().isStructValued()) {
                    children[i] = buildNode(path + "." + field.name(), field.type(), dimension, nodesByPath);
                }
            }
        }
        return node;
    }

    /**
     * Returns the node at the given dotted path, or null if there is none.
     */
    public Node lookup(String path) {
        return nodesByPath.get(path);
    }

    public Collection<Node> nodes() {
        return nodesByPath.values();
    }

    /**
     * Top-level nodes in layout order.
     */
    public List<Node> columns() {
        return columns;
    }

    /**
     * Number of completed rows held in the buffers.
     */
    public int bufferedRows() {
        return bufferedRows;
    }

    /**
     * Returns true if any buffer received data for a row that was not ended yet.
     */
    public boolean hasPendingData() {
        for (Node node : nodesByPath.values()) {
            if (node.buffer().size() != bufferedRows) {
                return true;
            }
        }
        return false;
    }

    /**
     * Closes the current row.
     *
     * @throws AlignmentException if any node did not receive exactly one unit
     *                            during the row, or a node below a list of structs
     *                            does not match the shape of its parent's lists
     */
    public void endRow(long rowIndex) {
        int expected = bufferedRows + 1;
        List<String> missing = new ArrayList<>();
        List<String> repeated = new ArrayList<>();
        for (Node node : nodesByPath.values()) {
            int size = node.buffer().size();
            if (size < expected) {
                missing.add(node.path());
            }
            else if (size > expected) {
                repeated.add(node.path() + " (" + (size - bufferedRows) + " times)");
            }
        }
        if (!missing.isEmpty() || !repeated.isEmpty()) {
            StringBuilder message = new StringBuilder("Row ").append(rowIndex).append(" is misaligned:");
            if (!missing.isEmpty()) {
                message.append(" not filled: ").append(String.join(", ", missing)).append(";");
            }
            if (!repeated.isEmpty()) {
                message.append(" filled more than once: ").append(String.join(", ", repeated)).append(";");
            }
            throw new AlignmentException(message.toString());
        }

        for (Node node : nodesByPath.values()) {
            if (node.dimension() == 0 || node.structFields() == null) {
                continue;
            }
            ListBuffer parent = (ListBuffer) node.buffer();
            for (Node child : node.children()) {
                if (!((ListBuffer) child.buffer()).rowShapeMatches(parent, node.dimension())) {
                    throw new AlignmentException("Row " + rowIndex + " is misaligned: '" + child.path()
                            + "' must hold one struct per element of '" + node.path() + "'");
                }
            }
        }

        for (Node node : nodesByPath.values()) {
            if (node.buffer() instanceof ListBuffer list) {
                list.commitRow();
            }
        }
        bufferedRows++;
    }

    /**
     * Converts all buffered rows into a row group, leaving the buffers untouched.
     */
    public RowGroup materialize() {
        List<String> names = new ArrayList<>(columns.size());
        List<ColumnArray> arrays = new ArrayList<>(columns.size());
        for (Node column : columns) {
            names.add(column.path());
            arrays.add(materialize(column, 0));
        }
        return new RowGroup(names, arrays, bufferedRows);
    }

    private ColumnArray materialize(Node node, int fromLevel) {
        ColumnArray[] structFields = null;
        if (node.structFields() != null) {
            structFields = new ColumnArray[node.structFields().length];
            for (int i = 0; i < structFields.length; i++) {
                Node child = node.structFields()[i];
                if (child != null) {
                    // Skip the levels shared with this node, leaving one entry per struct
                    structFields[i] = materialize(child, node.dimension());
                }
            }
        }
        if (node.buffer() instanceof ListBuffer list) {
            return list.materialize(fromLevel, structFields);
        }
        return node.buffer().materialize(structFields);
    }

    /**
     * Drops all buffered rows. Must only be called on a row boundary.
     */
    public void clear() {
        for (Node node : nodesByPath.values()) {
            node.buffer().clear();
        }
        bufferedRows = 0;
    }
}
