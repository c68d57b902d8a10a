/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.core.ResultFormatter;

/**
 * SPI Factory for result formatters.
 * The plugin id doubles as the format id callers pass to the executor.
 *
 * @param <R> raw result type produced by the remote executor
 * @param <F> formatted value type stored in the cache
 */
public interface FormatterPlugin<R, F> extends ServicePlugin {

    ResultFormatter<R, F> create(KernelConfig config);
}
