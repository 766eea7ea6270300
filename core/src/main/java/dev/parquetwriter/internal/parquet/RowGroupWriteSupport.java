/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.parquet;

import java.util.HashMap;
import java.util.Map;

import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.api.WriteSupport;
import org.apache.parquet.io.api.RecordConsumer;
import org.apache.parquet.schema.MessageType;

import dev.parquetwriter.internal.array.RowGroup;

/**
 * parquet-java write support for rows of materialized row groups.
 * <p>
 * The key-value metadata is only attached to the footer if the file was
 * completed with {@link #markComplete()}; files closed after a failure carry
 * none.
 * </p>
 */
final class RowGroupWriteSupport extends WriteSupport<RowGroup.Row> {

    private static final String WRITER_NAME = "parquet-writer";

    private final MessageType schema;
    private final Map<String, String> metadata;
    private RecordEmitter emitter;
    private boolean complete;

    RowGroupWriteSupport(MessageType schema, Map<String, String> metadata) {
        this.schema = schema;
        this.metadata = metadata;
    }

    @Override
    public WriteContext init(Configuration configuration) {
        return new WriteContext(schema, new HashMap<>());
    }

    @Override
    public String getName() {
        return WRITER_NAME;
    }

    @Override
    public void prepareForWrite(RecordConsumer recordConsumer) {
        emitter = new RecordEmitter(recordConsumer, schema);
    }

    @Override
    public void write(RowGroup.Row row) {
        emitter.write(row);
    }

    void markComplete() {
        complete = true;
    }

    @Override
    public FinalizedWriteContext finalizeWrite() {
        return new FinalizedWriteContext(complete ? new HashMap<>(metadata) : new HashMap<>());
    }
}
