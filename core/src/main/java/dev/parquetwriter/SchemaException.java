/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter;

/**
 * Raised when a layout is malformed or violates the nesting rules, e.g. a
 * missing {@code type}, an unknown type name, or a struct nested too deeply.
 */
public class SchemaException extends ParquetWriterException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
