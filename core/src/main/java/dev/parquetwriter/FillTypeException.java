/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter;

/**
 * Raised by {@code fill} when a value does not match the declared type of the
 * addressed column, including struct values whose positions do not line up
 * with the declared field order.
 */
public class FillTypeException extends ParquetWriterException {

    public FillTypeException(String message) {
        super(message);
    }
}
