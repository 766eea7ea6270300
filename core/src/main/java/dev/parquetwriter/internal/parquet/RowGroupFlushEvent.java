/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.parquet;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted when buffered rows are flushed to a Parquet file.
 * <p>
 * The duration covers materializing the buffers and handing every row to
 * parquet-java, which may itself write out a physical row group.
 * </p>
 */
@Name("dev.parquetwriter.RowGroupFlush")
@Label("Row Group Flush")
@Category({"Parquet Writer", "I/O"})
@Description("Flush of buffered rows into a Parquet file")
public class RowGroupFlushEvent extends Event {

    @Label("Dataset")
    @Description("Name of the dataset being written")
    public String dataset;

    @Label("File Path")
    @Description("Path of the file receiving the rows, the first one if the flush rolled over")
    public String path;

    @Label("Rows")
    @Description("Number of rows flushed")
    public long rows;

    @Label("Columns")
    @Description("Number of top-level columns")
    public int columns;
}
