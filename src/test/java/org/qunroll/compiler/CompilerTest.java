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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.qunroll.ast.AstPrinter;
import org.qunroll.testing.TestdataScanner;
import org.qunroll.testing.TestdataScanner.TestProgram;

/**
 * Loads and unrolls each program in the .qasm files of the testdata directory, checking the result
 * against the comment that follows it.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/resources/org/qunroll/compiler/testdata");

  /**
   * Each program is followed by a comment in one of two forms:
   *
   * <ul>
   *   <li>"{@code /* UNROLL qubits=N clbits=M}" followed by the expected unrolled statements, up to
   *       the end of the comment: the test passes if the program unrolls to exactly those
   *       statements (ignoring indentation and blank lines) with the given counts.
   *   <li>"{@code /* ERROR KIND: message}": the test passes if loading or unrolling the program
   *       throws a ValidationError of that kind whose message starts with the given text.
   * </ul>
   *
   * <p>A single file may contain many programs; each is loaded independently.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* ((?:UNROLL|ERROR) .*?)\\*/\\n*", Pattern.DOTALL);

  private static final Pattern UNROLL_PATTERN =
      Pattern.compile("UNROLL qubits=(\\d+) clbits=(\\d+) *\n?");

  private static final Pattern ERROR_PATTERN =
      Pattern.compile("ERROR ([A-Z_]+): *(.*)", Pattern.DOTALL);

  @Test
  public void unrollTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    String comment = checkNotNull(testProgram.comment(), "No UNROLL or ERROR comment found");
    Matcher unroll = UNROLL_PATTERN.matcher(comment);
    Matcher error = ERROR_PATTERN.matcher(comment);
    if (unroll.lookingAt()) {
      FlatProgram result = Compiler.load(testProgram.code(), testProgram.name()).unroll();
      String output = AstPrinter.print(result.unrolledAst());
      System.out.format("** %s:\n%s\n", testProgram.name(), output);
      assertWithMessage("Unrolled statements don't match")
          .that(cleanLines(output))
          .isEqualTo(cleanLines(comment.substring(unroll.end())));
      assertWithMessage("numQubits")
          .that(result.numQubits())
          .isEqualTo(Integer.parseInt(unroll.group(1)));
      assertWithMessage("numClbits")
          .that(result.numClbits())
          .isEqualTo(Integer.parseInt(unroll.group(2)));
    } else {
      assertWithMessage("Bad comment").that(error.matches()).isTrue();
      Diagnostic.Kind kind = Diagnostic.Kind.valueOf(error.group(1));
      String errMsg = error.group(2).trim();
      try {
        Compiler.load(testProgram.code(), testProgram.name()).validate();
        assertWithMessage("Expected error %s, unrolled OK", errMsg).fail();
      } catch (ValidationError e) {
        assertWithMessage("Unexpected error %s", e).that(e.kind).isEqualTo(kind);
        assertWithMessage("Unexpected error %s", e).that(e.msg).startsWith(errMsg);
      }
    }
  }

  /** Returns each code chunk from a ".qasm" file in our testdata directory. */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, ".qasm", COMMENT_PATTERN);
    }
  }

  /**
   * Removes all whitespace at the beginning and end of lines in the given output, and removes all
   * completely blank lines.
   */
  private static String cleanLines(String output) {
    return output.replaceAll(" *\n[ \n]*", "\n").trim();
  }
}
