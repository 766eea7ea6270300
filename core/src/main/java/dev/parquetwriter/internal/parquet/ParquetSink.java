/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.parquet;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.api.WriteSupport;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.schema.MessageType;

import dev.parquetwriter.internal.array.RowGroup;

/**
 * Writes row groups into one or more Parquet files of a dataset.
 * <p>
 * Without a per-file row limit all rows go to {@code <dataset>.parquet}. With a
 * limit, files are named {@code <dataset>_0.parquet}, {@code <dataset>_1.parquet},
 * and so on, and a new file is started as soon as the current one holds the
 * maximum number of rows. Each completed file carries the schema and the
 * key-value metadata.
 * </p>
 * <p>
 * The first file is opened eagerly, so that a dataset without rows still
 * produces a (row-less) file.
 * </p>
 */
public final class ParquetSink implements RowGroupSink {

    private static final System.Logger LOG = System.getLogger(ParquetSink.class.getName());

    private static final String EXTENSION = ".parquet";

    private final Path directory;
    private final String datasetName;
    private final MessageType schema;
    private final CompressionCodecName codec;
    private final long maxRowsPerFile;
    private final Map<String, String> metadata;
    private final List<Path> files = new ArrayList<>();

    private ParquetWriter<RowGroup.Row> writer;
    private RowGroupWriteSupport writeSupport;
    private long rowsInFile;

    private ParquetSink(Path directory, String datasetName, MessageType schema, CompressionCodecName codec,
                        long maxRowsPerFile, Map<String, String> metadata) {
        this.directory = directory;
        this.datasetName = datasetName;
        this.schema = schema;
        this.codec = codec;
        this.maxRowsPerFile = maxRowsPerFile;
        this.metadata = Map.copyOf(metadata);
    }

    /**
     * Opens the first file of a dataset.
     *
     * @param maxRowsPerFile rows per file before rolling over to the next file, 0 for a single file
     * @param metadata       key-value pairs attached to the footer of every completed file
     */
    public static ParquetSink open(Path directory, String datasetName, MessageType schema, CompressionCodecName codec,
                                   long maxRowsPerFile, Map<String, String> metadata)
            throws IOException {
        ParquetSink sink = new ParquetSink(directory, datasetName, schema, codec, maxRowsPerFile, metadata);
        sink.openNextFile();
        return sink;
    }

    @Override
    public List<Path> files() {
        return Collections.unmodifiableList(files);
    }

    @Override
    public Path currentFile() {
        return files.get(files.size() - 1);
    }

    @Override
    public boolean isOpen() {
        return writer != null;
    }

    /**
     * Writes all rows of the given group, rolling over to new files as needed.
     */
    @Override
    public void write(RowGroup group) throws IOException {
        for (int i = 0; i < group.rowCount(); i++) {
            if (writer == null) {
                openNextFile();
            }
            writer.write(group.row(i));
            rowsInFile++;
            if (maxRowsPerFile > 0 && rowsInFile >= maxRowsPerFile) {
                closeFile(true);
            }
        }
    }

    /**
     * Completes the current file, attaching the metadata.
     */
    @Override
    public void finish() throws IOException {
        closeFile(true);
    }

    /**
     * Closes the current file without metadata. The file keeps all rows written
     * so far, but whatever parquet-java still buffered is written as well.
     */
    @Override
    public void abort() throws IOException {
        closeFile(false);
    }

    private void openNextFile() throws IOException {
        Path path = directory.resolve(maxRowsPerFile > 0
                ? datasetName + "_" + files.size() + EXTENSION
                : datasetName + EXTENSION);

        RowGroupWriteSupport support = new RowGroupWriteSupport(schema, metadata);
        writer = new Builder(new LocalOutputFile(path), support)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .withCompressionCodec(codec)
                .build();
        writeSupport = support;
        files.add(path);
        rowsInFile = 0;

        LOG.log(System.Logger.Level.DEBUG, "Opened file ''{0}'' for dataset ''{1}'' ({2} compression)",
                path, datasetName, codec);
    }

    private void closeFile(boolean complete) throws IOException {
        if (writer == null) {
            return;
        }
        ParquetWriter<RowGroup.Row> closing = writer;
        writer = null;
        if (complete) {
            writeSupport.markComplete();
        }
        closing.close();

        LOG.log(System.Logger.Level.DEBUG, "Closed file ''{0}'' with {1} rows{2}",
                currentFile(), rowsInFile, complete ? "" : " (incomplete)");
    }

    private static final class Builder extends ParquetWriter.Builder<RowGroup.Row, Builder> {

        private final RowGroupWriteSupport writeSupport;

        private Builder(OutputFile file, RowGroupWriteSupport writeSupport) {
            super(file);
            this.writeSupport = writeSupport;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected WriteSupport<RowGroup.Row> getWriteSupport(Configuration conf) {
            return writeSupport;
        }
    }
}
