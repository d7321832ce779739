/*
 * Copyright 2025 The Qunroll Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.qunroll.compiler;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns Diagnostics into ValidationErrors. Every error is logged (with its location and source
 * snippet) before it is returned to be thrown, so the log and the exception always agree.
 */
public final class DiagnosticsReporter {
  private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticsReporter.class);

  private final String sourceName;

  /**
   * @param sourceName identifies the program in error locations, e.g. a file name
   */
  public DiagnosticsReporter(String sourceName) {
    this.sourceName = sourceName;
  }

  public String sourceName() {
    return sourceName;
  }

  /** Logs the diagnostic at ERROR and returns the corresponding ValidationError. */
  public ValidationError report(Diagnostic diagnostic) {
    ValidationError error = new ValidationError(diagnostic, sourceName);
    LOGGER.error("{}", error.getMessage());
    return error;
  }

  /**
   * Returns the value of a successful Outcome; reports and throws the Diagnostic of a failed one.
   */
  @CanIgnoreReturnValue
  public <T> T check(Outcome<T> outcome) {
    if (outcome.failed()) {
      throw report(outcome.diagnostic());
    }
    return outcome.value();
  }
}
