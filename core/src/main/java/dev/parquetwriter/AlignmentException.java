/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter;

/**
 * Raised when closing a row while some column received no value, or more than
 * one value, during that row.
 */
public class AlignmentException extends ParquetWriterException {

    public AlignmentException(String message) {
        super(message);
    }
}
