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

import java.io.IOException;
import java.nio.file.Path;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.qunroll.ast.SourcePosition;
import org.qunroll.compiler.QasmParser.UnitContext;

/** Parses OpenQASM source code into a {@link Program}. */
public final class Compiler {

  /** The source name used for programs that are loaded from a string. */
  public static final String DEFAULT_SOURCE_NAME = "QASM file";

  // Static methods only
  private Compiler() {}

  /** Loads a program from a string. */
  public static Program load(String source) {
    return load(source, DEFAULT_SOURCE_NAME);
  }

  /**
   * Loads a program from a string.
   *
   * @param source the program text
   * @param sourceName identifies the program in error messages, e.g. a file name
   */
  public static Program load(String source, String sourceName) {
    return load(CharStreams.fromString(source, sourceName), sourceName);
  }

  /** Loads a program from a file, using the file's path as its source name. */
  public static Program loadFile(Path path) throws IOException {
    return load(CharStreams.fromPath(path), path.toString());
  }

  /**
   * Loads a program. Syntax errors (and the few semantic errors that are detected while building
   * the AST) are thrown as ValidationErrors with kind SYNTAX.
   */
  public static Program load(CharStream input, String sourceName) {
    DiagnosticsReporter reporter = new DiagnosticsReporter(sourceName);
    return new StatementBuilder(reporter).build(parse(input, reporter));
  }

  /** Parses an OpenQASM program. */
  static UnitContext parse(CharStream input, DiagnosticsReporter reporter) {
    // Throw ValidationErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw reporter.report(
                Diagnostic.at(
                    Diagnostic.Kind.SYNTAX,
                    new SourcePosition(lineNum, charPositionInLine),
                    "%s",
                    msg));
          }
        };
    QasmLexer lexer = new QasmLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    QasmParser parser = new QasmParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.unit();
  }

  /** Returns the position of the given token. */
  static SourcePosition position(Token token) {
    if (token == null) {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      return SourcePosition.UNKNOWN;
    }
    return new SourcePosition(token.getLine(), token.getCharPositionInLine());
  }
}
