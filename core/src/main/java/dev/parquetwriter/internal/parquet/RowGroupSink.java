/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.parquet;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import dev.parquetwriter.internal.array.RowGroup;

/**
 * Output of a dataset receiving flushed row groups.
 */
public interface RowGroupSink extends Closeable {

    /**
     * Paths of all files opened so far, in order.
     */
    List<Path> files();

    /**
     * Path of the file receiving the next row.
     */
    Path currentFile();

    boolean isOpen();

    void write(RowGroup group) throws IOException;

    /**
     * Completes the output, attaching the metadata.
     */
    void finish() throws IOException;

    /**
     * Closes the output without metadata, keeping the rows written so far.
     */
    void abort() throws IOException;

    @Override
    default void close() throws IOException {
        abort();
    }
}
