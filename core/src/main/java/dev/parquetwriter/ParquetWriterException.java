/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter;

/**
 * Base class of all errors raised while describing or writing a dataset.
 * Every subclass is fatal for the operation that raised it.
 */
public class ParquetWriterException extends RuntimeException {

    public ParquetWriterException(String message) {
        super(message);
    }

    public ParquetWriterException(String message, Throwable cause) {
        super(message, cause);
    }
}
