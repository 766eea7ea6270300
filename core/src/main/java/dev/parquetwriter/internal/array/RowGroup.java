/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.array;

import java.util.List;

/**
 * A batch of flushed rows: one materialized array per top-level column, in layout order.
 */
public record RowGroup(List<String> names, List<ColumnArray> columns, int rowCount) {

    public RowGroup {
        names = List.copyOf(names);
        columns = List.copyOf(columns);
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).length() != rowCount) {
                throw new IllegalStateException("Column '" + names.get(i) + "' has " + columns.get(i).length()
                        + " entries, expected " + rowCount);
            }
        }
    }

    public Row row(int index) {
        return new Row(this, index);
    }

    /**
     * Reference to a single row of a row group.
     */
    public record Row(RowGroup group, int index) {
    }
}
