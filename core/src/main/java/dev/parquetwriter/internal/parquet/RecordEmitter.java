/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.internal.parquet;

import org.apache.parquet.io.api.RecordConsumer;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

import dev.parquetwriter.internal.array.ColumnArray;
import dev.parquetwriter.internal.array.RowGroup;

/**
 * Replays one row of a {@link RowGroup} as parquet-java record events.
 * <p>
 * The arrays must have been produced for the schema created by
 * {@link SchemaConverter}; list groups are walked through their
 * {@code list}/{@code element} levels.
 * </p>
 */
final class RecordEmitter {

    private final RecordConsumer consumer;
    private final MessageType schema;

    RecordEmitter(RecordConsumer consumer, MessageType schema) {
        this.consumer = consumer;
        this.schema = schema;
    }

    void write(RowGroup.Row row) {
        RowGroup group = row.group();
        consumer.startMessage();
        for (int i = 0; i < schema.getFieldCount(); i++) {
            Type field = schema.getType(i);
            consumer.startField(field.getName(), i);
            writeValue(field, group.columns().get(i), row.index());
            consumer.endField(field.getName(), i);
        }
        consumer.endMessage();
    }

    private void writeValue(Type type, ColumnArray array, int index) {
        if (array instanceof ColumnArray.ListArray list) {
            writeList(type.asGroupType(), list, index);
        }
        else if (array instanceof ColumnArray.StructArray struct) {
            writeStruct(type.asGroupType(), struct, index);
        }
        else if (array instanceof ColumnArray.IntArray ints) {
            consumer.addInteger(ints.get(index));
        }
        else if (array instanceof ColumnArray.LongArray longs) {
            consumer.addLong(longs.get(index));
        }
        else if (array instanceof ColumnArray.FloatArray floats) {
            consumer.addFloat(floats.get(index));
        }
        else if (array instanceof ColumnArray.DoubleArray doubles) {
            consumer.addDouble(doubles.get(index));
        }
        else if (array instanceof ColumnArray.BooleanArray booleans) {
            consumer.addBoolean(booleans.get(index));
        }
        else {
            throw new IllegalArgumentException("Unsupported array: " + array.getClass());
        }
    }

    private void writeList(GroupType listType, ColumnArray.ListArray list, int index) {
        GroupType repeated = listType.getType(0).asGroupType();
        Type element = repeated.getType(0);
        int start = list.start(index);
        int end = list.end(index);

        consumer.startGroup();
        // An empty list is a LIST group without any repetition of its inner group
        if (end > start) {
            consumer.startField(repeated.getName(), 0);
            for (int i = start; i < end; i++) {
                consumer.startGroup();
                consumer.startField(element.getName(), 0);
                writeValue(element, list.values(), i);
                consumer.endField(element.getName(), 0);
                consumer.endGroup();
            }
            consumer.endField(repeated.getName(), 0);
        }
        consumer.endGroup();
    }

    private void writeStruct(GroupType structType, ColumnArray.StructArray struct, int index) {
        consumer.startGroup();
        for (int i = 0; i < structType.getFieldCount(); i++) {
            Type field = structType.getType(i);
            consumer.startField(field.getName(), i);
            writeValue(field, struct.child(i), index);
            consumer.endField(field.getName(), i);
        }
        consumer.endGroup();
    }
}
