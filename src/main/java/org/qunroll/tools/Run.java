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

package org.qunroll.tools;

import java.io.IOException;
import java.nio.file.Path;
import org.qunroll.compiler.Compiler;
import org.qunroll.compiler.FlatProgram;
import org.qunroll.compiler.UnrollOptions;
import org.qunroll.compiler.ValidationError;

/** A simple command-line tool for unrolling a single OpenQASM program. */
public class Run {
  private Run() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: run <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length == 1);
    UnrollOptions options = UnrollOptions.fromSystemProperties();
    Path file = Path.of(args[0]);
    try {
      FlatProgram result = Compiler.loadFile(file).unroll(options);
      System.out.printf(
          "/* UNROLL qubits=%s clbits=%s */\n", result.numQubits(), result.numClbits());
      System.out.println(result);
    } catch (ValidationError e) {
      // The error has already been logged with its location.
      System.out.printf("/* ERROR %s: %s */\n", e.kind, e.msg);
      System.exit(1);
    }
  }
}
