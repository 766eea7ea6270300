/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter;

/**
 * Raised when an operation is invoked in a writer state that does not permit it.
 */
public class LifecycleException extends ParquetWriterException {

    public LifecycleException(String message) {
        super(message);
    }
}
