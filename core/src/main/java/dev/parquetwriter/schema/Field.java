/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.schema;

/**
 * A named field of a layout or of a struct.
 */
public record Field(String name, TypeSpec type) {

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
