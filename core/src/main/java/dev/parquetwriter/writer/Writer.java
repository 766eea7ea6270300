/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.schema.MessageType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.parquetwriter.AlignmentException;
import dev.parquetwriter.FillTypeException;
import dev.parquetwriter.LifecycleException;
import dev.parquetwriter.internal.array.RowGroup;
import dev.parquetwriter.internal.buffer.BufferTree;
import dev.parquetwriter.internal.parquet.ParquetSink;
import dev.parquetwriter.internal.parquet.RowGroupFlushEvent;
import dev.parquetwriter.internal.parquet.RowGroupSink;
import dev.parquetwriter.internal.parquet.SchemaConverter;
import dev.parquetwriter.row.StructValue;
import dev.parquetwriter.schema.Layout;
import dev.parquetwriter.schema.SchemaParser;

/**
 * Writes a dataset row by row into Parquet files.
 *
 * <pre>{@code
 * try (Writer writer = new Writer()) {
 *     writer.setLayout("""
 *             {"fields": [
 *                 {"name": "id", "type": "int32"},
 *                 {"name": "hits", "type": "list", "contains": {"type": "float"}}
 *             ]}""");
 *     writer.setDatasetName("events");
 *     writer.initialize();
 *
 *     writer.fill("id", 1);
 *     writer.fill("hits", List.of(0.5f, 1.5f));
 *     writer.endRow();
 *
 *     writer.finish();
 * }
 * }</pre>
 * <p>
 * Every column, and every struct field addressed by a dotted path such as
 * {@code "track.vertex"}, must be filled exactly once per row before
 * {@link #endRow()}. Buffered rows are flushed to the file every
 * {@link #setFlushThreshold(int) flush threshold} rows and on {@link #finish()}.
 * </p>
 * <p>
 * A rejected fill or a misaligned row is fatal: the output file is closed with
 * the rows flushed so far and the writer cannot be used any further.
 * Instances are not thread-safe.
 * </p>
 */
public final class Writer implements AutoCloseable {

    private static final String FLUSH_ROWS_PROPERTY = "parquetwriter.flushrows";
    private static final int DEFAULT_FLUSH_ROWS = 10_000;

    /** Footer key under which the dataset metadata is stored. */
    public static final String METADATA_KEY = "metadata";

    private static final System.Logger LOG = System.getLogger(Writer.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WriterState state = WriterState.UNCONFIGURED;
    private Layout layout;
    private String datasetName;
    private String metadata;
    private Path outputDirectory = Path.of(".");
    private int flushThreshold = defaultFlushThreshold();
    private Compression compression = Compression.SNAPPY;
    private long maxRowsPerFile;

    private BufferTree buffers;
    private final SinkFactory sinkFactory;
    private RowGroupSink sink;
    private long rowCount;

    /**
     * Opens the output of a dataset.
     */
    @FunctionalInterface
    interface SinkFactory {

        RowGroupSink open(Path directory, String datasetName, MessageType schema, CompressionCodecName codec,
                          long maxRowsPerFile, Map<String, String> metadata)
                throws IOException;
    }

    private static int defaultFlushThreshold() {
        Integer rows = Integer.getInteger(FLUSH_ROWS_PROPERTY);
        if (rows == null) {
            return DEFAULT_FLUSH_ROWS;
        }
        if (rows < 1) {
            LOG.log(System.Logger.Level.WARNING, "Ignoring system property ''{0}'' with non-positive value {1}, using {2}",
                    FLUSH_ROWS_PROPERTY, rows, DEFAULT_FLUSH_ROWS);
            return DEFAULT_FLUSH_ROWS;
        }
        return rows;
    }

    public Writer() {
        this(ParquetSink::open);
    }

    Writer(SinkFactory sinkFactory) {
        this.sinkFactory = sinkFactory;
    }

    // ==================== Configuration ====================

    /**
     * Sets the layout from its JSON text.
     *
     * @throws dev.parquetwriter.SchemaException if the layout is invalid
     */
    public void setLayout(String json) {
        setLayout(SchemaParser.parse(json));
    }

    public void setLayout(JsonNode json) {
        setLayout(SchemaParser.parse(json));
    }

    public void setLayout(Path file) {
        setLayout(SchemaParser.parse(file));
    }

    /**
     * Sets an already parsed layout. May be called again to replace the layout
     * until the writer is initialized.
     */
    public void setLayout(Layout layout) {
        requireState("setLayout", WriterState.UNCONFIGURED, WriterState.LAYOUT_SET);
        this.layout = layout;
        state = WriterState.LAYOUT_SET;
    }

    public void setDatasetName(String datasetName) {
        requireConfigurable("setDatasetName");
        if (datasetName == null || datasetName.isBlank()) {
            throw new IllegalArgumentException("Dataset name must not be empty");
        }
        this.datasetName = datasetName;
    }

    /**
     * Sets metadata stored verbatim in the footer of the output files under
     * {@link #METADATA_KEY}.
     *
     * @param json a JSON object
     */
    public void setMetadata(JsonNode json) {
        requireConfigurable("setMetadata");
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Metadata must be a JSON object, got: " + json);
        }
        try {
            this.metadata = MAPPER.writeValueAsString(json);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize metadata: " + e.getOriginalMessage(), e);
        }
    }

    public void setMetadata(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not valid JSON: " + e.getOriginalMessage(), e);
        }
        setMetadata(node);
    }

    /**
     * Directory receiving the output files, the working directory by default.
     * Created on {@link #initialize()} if missing.
     */
    public void setOutputDirectory(Path outputDirectory) {
        requireConfigurable("setOutputDirectory");
        this.outputDirectory = outputDirectory;
    }

    /**
     * Number of buffered rows that triggers a flush. Defaults to the value of the
     * system property {@code parquetwriter.flushrows}, or 10000.
     */
    public void setFlushThreshold(int rows) {
        requireConfigurable("setFlushThreshold");
        if (rows < 1) {
            throw new IllegalArgumentException("Flush threshold must be positive: " + rows);
        }
        this.flushThreshold = rows;
    }

    public void setCompression(Compression compression) {
        requireConfigurable("setCompression");
        this.compression = compression;
    }

    /**
     * Maximum number of rows per output file; 0 (the default) writes a single file.
     */
    public void setMaxRowsPerFile(long rows) {
        requireConfigurable("setMaxRowsPerFile");
        if (rows < 0) {
            throw new IllegalArgumentException("Maximum rows per file must not be negative: " + rows);
        }
        this.maxRowsPerFile = rows;
    }

    // ==================== Lifecycle ====================

    /**
     * Allocates the buffers and opens the first output file.
     *
     * @throws LifecycleException if the layout or the dataset name is not set
     */
    public void initialize() {
        if (state == WriterState.UNCONFIGURED) {
            throw new LifecycleException("Cannot initialize writer: no layout set");
        }
        requireState("initialize", WriterState.LAYOUT_SET);
        if (datasetName == null) {
            throw new LifecycleException("Cannot initialize writer: no dataset name set");
        }

        Map<String, String> footer = metadata != null ? Map.of(METADATA_KEY, metadata) : Map.of();
        try {
            Files.createDirectories(outputDirectory);
            sink = sinkFactory.open(outputDirectory, datasetName, SchemaConverter.toMessageType(datasetName, layout),
                    compression.codecName(), maxRowsPerFile, footer);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Cannot open output for dataset '" + datasetName + "' in " + outputDirectory, e);
        }
        buffers = BufferTree.build(layout);
        state = WriterState.INITIALIZED;

        LOG.log(System.Logger.Level.DEBUG, "Initialized dataset ''{0}'' with {1} columns ({2} addressable paths), flushing every {3} rows",
                datasetName, layout.getColumnCount(), buffers.nodes().size(), flushThreshold);
    }

    /**
     * Appends one value to the column or struct field at the given dotted path.
     * <p>
     * The value must match the declared type: the boxed type of a primitive kind
     * (see {@link dev.parquetwriter.schema.PrimitiveKind}), a {@link List} nested
     * as deep as the list's dimension, and for a struct either a {@link StructValue}
     * holding its non-struct fields in declaration order or a {@link Map} from
     * each non-struct field name to its value.
     * </p>
     *
     * @throws FillTypeException if the path is unknown or the value does not match
     */
    public void fill(String path, Object value) {
        requireState("fill", WriterState.INITIALIZED, WriterState.FILLING);
        BufferTree.Node node = buffers.lookup(path);
        if (node == null) {
            throw fail(new FillTypeException("Unknown column path '" + path + "', expected one of "
                    + buffers.nodes().stream().map(BufferTree.Node::path).toList()));
        }
        try {
            node.buffer().check(value, path);
        }
        catch (FillTypeException e) {
            throw fail(e);
        }
        node.buffer().append(value);
        state = WriterState.FILLING;
    }

    /**
     * Closes the current row, flushing the buffered rows once the flush threshold is reached.
     *
     * @throws AlignmentException if any path was not filled exactly once in this row
     */
    public void endRow() {
        requireState("endRow", WriterState.INITIALIZED, WriterState.FILLING);
        try {
            buffers.endRow(rowCount);
        }
        catch (AlignmentException e) {
            throw fail(e);
        }
        rowCount++;
        if (buffers.bufferedRows() >= flushThreshold) {
            flush();
        }
    }

    /**
     * Flushes the remaining rows, attaches the metadata and closes the output.
     *
     * @throws AlignmentException if the last row was filled but not ended
     */
    public void finish() {
        requireState("finish", WriterState.INITIALIZED, WriterState.FILLING);
        if (buffers.hasPendingData()) {
            throw fail(new AlignmentException("Row " + rowCount + " was filled but not ended"));
        }
        if (buffers.bufferedRows() > 0) {
            flush();
        }
        try {
            sink.finish();
        }
        catch (IOException e) {
            throw fail(new UncheckedIOException("Cannot complete dataset '" + datasetName + "'", e));
        }
        catch (RuntimeException e) {
            throw fail(e);
        }
        state = WriterState.FINALIZED;

        LOG.log(System.Logger.Level.DEBUG, "Finished dataset ''{0}'': {1} rows in {2} file(s)",
                datasetName, rowCount, sink.files().size());
    }

    /**
     * Releases the output if {@link #finish()} was not called. Buffered rows are
     * discarded and the file carries no metadata.
     */
    @Override
    public void close() {
        if (state != WriterState.INITIALIZED && state != WriterState.FILLING) {
            return;
        }
        state = WriterState.CLOSED;
        LOG.log(System.Logger.Level.WARNING, "Closing dataset ''{0}'' without finish(), discarding {1} buffered rows",
                datasetName, buffers.bufferedRows());
        try {
            sink.abort();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Cannot close dataset '" + datasetName + "'", e);
        }
    }

    private void flush() {
        RowGroupFlushEvent event = new RowGroupFlushEvent();
        event.begin();

        String file = sink.isOpen() ? sink.currentFile().toString() : null;
        RowGroup group;
        try {
            group = buffers.materialize();
            sink.write(group);
        }
        catch (IOException e) {
            throw fail(new UncheckedIOException("Cannot write rows of dataset '" + datasetName + "'", e));
        }
        catch (RuntimeException e) {
            throw fail(e);
        }
        buffers.clear();

        event.dataset = datasetName;
        event.path = file;
        event.rows = group.rowCount();
        event.columns = group.columns().size();
        event.commit();

        LOG.log(System.Logger.Level.DEBUG, "Flushed {0} rows of dataset ''{1}'' ({2} rows written)",
                group.rowCount(), datasetName, rowCount);
    }

    /**
     * Moves to the failed state and closes the output, keeping the flushed rows.
     */
    private <E extends RuntimeException> E fail(E error) {
        state = WriterState.FAILED;
        try {
            sink.abort();
        }
        catch (IOException | RuntimeException e) {
            error.addSuppressed(e);
        }
        return error;
    }

    private void requireConfigurable(String operation) {
        requireState(operation, WriterState.UNCONFIGURED, WriterState.LAYOUT_SET);
    }

    private void requireState(String operation, WriterState... allowed) {
        for (WriterState candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new LifecycleException("Cannot call " + operation + "() in state " + state
                + ", allowed in " + Arrays.toString(allowed));
    }

    // ==================== Accessors ====================

    public WriterState getState() {
        return state;
    }

    public Layout getLayout() {
        return layout;
    }

    public String getDatasetName() {
        return datasetName;
    }

    public int getFlushThreshold() {
        return flushThreshold;
    }

    /**
     * Number of rows ended so far.
     */
    public long getRowCount() {
        return rowCount;
    }

    /**
     * Files opened so far, empty before {@link #initialize()}.
     */
    public List<Path> getOutputFiles() {
        return sink != null ? sink.files() : List.of();
    }
}
