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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qunroll.ast.SourcePosition;
import org.qunroll.compiler.Diagnostic.Kind;

@RunWith(JUnit4.class)
public class DiagnosticsReporterTest {

  private final DiagnosticsReporter reporter = new DiagnosticsReporter("prog.qasm");

  @Test
  public void checkPassesValueThrough() {
    assertThat(reporter.check(Outcome.of("ok"))).isEqualTo("ok");
  }

  @Test
  public void checkThrowsFailure() {
    Outcome<String> failed =
        Outcome.failure(
            new Diagnostic(
                Kind.EMPTY_SWITCH,
                "Switch statement must have at least one case",
                new SourcePosition(3, 2),
                "switch (i) {...}"));
    ValidationError e = assertThrows(ValidationError.class, () -> reporter.check(failed));
    assertThat(e.kind).isEqualTo(Kind.EMPTY_SWITCH);
    assertThat(e.sourceName).isEqualTo("prog.qasm");
    assertThat(e.lineNum).isEqualTo(3);
    assertThat(e.charPositionInLine).isEqualTo(2);
    assertThat(e.getMessage())
        .isEqualTo(
            "Switch statement must have at least one case\n"
                + "Error at line 3, column 2 in prog.qasm\n"
                + " >>>>>> switch (i) {...}");
  }

  @Test
  public void reportWithoutSnippet() {
    ValidationError e =
        reporter.report(Diagnostic.at(Kind.SYNTAX, new SourcePosition(1, 0), "bad %s", "token"));
    assertThat(e.msg).isEqualTo("bad token");
    assertThat(e.snippet).isNull();
    assertThat(e.getMessage()).isEqualTo("bad token\nError at line 1, column 0 in prog.qasm");
  }
}
