/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.buffer;

import java.util.List;

import dev.parquetwriter.FillTypeException;
import dev.parquetwriter.internal.array.ColumnArray;

/**
 * Buffer for lists nested {@code dimension} levels deep.
 * <p>
 * Leaf elements go into a single flat value buffer (primitive or struct). Each
 * level keeps Arrow-style offsets starting at 0: entry {@code i} of level
 * {@code l} points into level {@code l + 1}, or into the value buffer for the
 * innermost level. One appended unit adds exactly one entry to level 0.
 * </p>
 * <pre>
 * [[42], [19, 27, 32], [], [72, 101]]   (dimension 2, one unit)
 *   level 0: [0, 4]
 *   level 1: [0, 1, 4, 4, 6]
 *   values:  [42, 19, 27, 32, 72, 101]
 * </pre>
 */
public final class ListBuffer implements ColumnBuffer {

    private final int dimension;
    private final ColumnBuffer values;
    private final IntList[] offsets;

    // Size of each offset level when the current row started
    private final int[] rowStart;

    public ListBuffer(int dimension, ColumnBuffer values) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Invalid list dimension: " + dimension);
        }
        this.dimension = dimension;
        this.values = values;
        this.offsets = new IntList[dimension];
        this.rowStart = new int[dimension];
        for (int level = 0; level < dimension; level++) {
            offsets[level] = new IntList();
            offsets[level].add(0);
            rowStart[level] = 1;
        }
    }

    public int dimension() {
        return dimension;
    }

    @Override
    public int size() {
        return offsets[0].size() - 1;
    }

    @Override
    public void check(Object value, String path) {
        checkLevel(value, 0, path);
    }

    private void checkLevel(Object value, int level, String path) {
        if (!(value instanceof List<?> list)) {
            throw new FillTypeException("Column '" + path + "' expects a list nested " + (dimension - level)
                    + (dimension - level == 1 ? " level" : " levels") + " deep, got " + ColumnBuffer.describe(value));
        }
        for (int i = 0; i < list.size(); i++) {
            Object element = list.get(i);
            String elementPath = path + "[" + i + "]";
            if (level + 1 < dimension) {
                checkLevel(element, level + 1, elementPath);
            }
            else {
                values.check(element, elementPath);
            }
        }
    }

    @Override
    public void append(Object value) {
        appendLevel((List<?>) value, 0);
    }

    private void appendLevel(List<?> list, int level) {
        for (Object element : list) {
            if (level + 1 < dimension) {
                appendLevel((List<?>) element, level + 1);
            }
            else {
                values.append(element);
            }
        }
        int end = level + 1 < dimension ? offsets[level + 1].size() - 1 : values.size();
        offsets[level].add(end);
    }

    /**
     * Returns true if the outermost {@code levels} offset levels appended during
     * the current row are identical in this buffer and {@code other}, i.e. both
     * received lists of the same shape since the last {@link #commitRow()}.
     */
    public boolean rowShapeMatches(ListBuffer other, int levels) {
        for (int level = 0; level < levels; level++) {
            IntList mine = offsets[level];
            IntList theirs = other.offsets[level];
            if (mine.size() - rowStart[level] != theirs.size() - other.rowStart[level]) {
                return false;
            }
            // Both levels start from equal totals, so compare the increments of this row
            int myBase = mine.get(rowStart[level] - 1);
            int theirBase = theirs.get(other.rowStart[level] - 1);
            for (int i = 0; i < mine.size() - rowStart[level]; i++) {
                if (mine.get(rowStart[level] + i) - myBase != theirs.get(other.rowStart[level] + i) - theirBase) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Marks the end of a row for {@link #rowShapeMatches(ListBuffer, int)}.
     */
    public void commitRow() {
        for (int level = 0; level < dimension; level++) {
            rowStart[level] = offsets[level].size();
        }
    }

    @Override
    public ColumnArray materialize(ColumnArray[] structFields) {
        return materialize(0, structFields);
    }

    /**
     * Materializes the levels from {@code fromLevel} inwards. Starting below level
     * 0 yields one entry per list element of the skipped outer levels, which is how
     * struct fields below a list of structs line up with their parent elements.
     */
    public ColumnArray materialize(int fromLevel, ColumnArray[] structFields) {
        if (fromLevel == dimension) {
            return values.materialize(structFields);
        }
        return new ColumnArray.ListArray(offsets[fromLevel].toArray(), materialize(fromLevel + 1, structFields));
    }

    @Override
    public void clear() {
        for (int level = 0; level < dimension; level++) {
            offsets[level].clear();
            offsets[level].add(0);
            rowStart[level] = 1;
        }
        values.clear();
    }

    @Override
    public String toString() {
        return "ListBuffer[dimension=" + dimension + ", size=" + size() + ", values=" + values + "]";
    }
}
