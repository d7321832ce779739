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

import org.jspecify.annotations.Nullable;

/** All errors detected while loading, validating or unrolling a program throw a ValidationError. */
public class ValidationError extends RuntimeException {
  public final Diagnostic.Kind kind;
  public final String msg;
  public final int lineNum;
  public final int charPositionInLine;
  public final @Nullable String snippet;
  public final String sourceName;

  public ValidationError(Diagnostic diagnostic, String sourceName) {
    super(diagnostic.message());
    this.kind = diagnostic.kind();
    this.msg = diagnostic.message();
    this.lineNum = diagnostic.position().line();
    this.charPositionInLine = diagnostic.position().column();
    this.snippet = diagnostic.snippet();
    this.sourceName = sourceName;
  }

  /**
   * Returns the location of the error, followed by the rendered source construct if there is one,
   * e.g.
   *
   * <pre>
   * Error at line 8, column 4 in QASM file
   *  >>>>>> switch (i) {...}
   * </pre>
   */
  public String location() {
    String result =
        String.format("Error at line %s, column %s in %s", lineNum, charPositionInLine, sourceName);
    return (snippet == null) ? result : result + "\n >>>>>> " + snippet;
  }

  @Override
  public String getMessage() {
    return msg + "\n" + location();
  }
}
