/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.writer;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;

/**
 * Compression codecs available for the written pages.
 */
public enum Compression {
    UNCOMPRESSED(CompressionCodecName.UNCOMPRESSED),
    SNAPPY(CompressionCodecName.SNAPPY),
    GZIP(CompressionCodecName.GZIP),
    ZSTD(CompressionCodecName.ZSTD),
    LZ4_RAW(CompressionCodecName.LZ4_RAW);

    private final CompressionCodecName codecName;

    Compression(CompressionCodecName codecName) {
        this.codecName = codecName;
    }

    CompressionCodecName codecName() {
        return codecName;
    }
}
