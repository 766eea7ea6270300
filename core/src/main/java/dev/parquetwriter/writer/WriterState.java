/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.parquetwriter.writer;

/**
 * Lifecycle states of a {@link Writer}.
 */
public enum WriterState {
    UNCONFIGURED,
    LAYOUT_SET,
    INITIALIZED,
    FILLING,
    FINALIZED,
    // Terminal: a fill or row error closed the output
    FAILED,
    // Terminal: closed before finish()
    CLOSED
}
