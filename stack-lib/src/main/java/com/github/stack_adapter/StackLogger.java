// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. All classes in this package log through the one package level logger.
public final class StackLogger {
  public static final Logger LOGGER = Logger.getLogger(StackLogger.class.getPackageName());

  private StackLogger() {
  }
}
