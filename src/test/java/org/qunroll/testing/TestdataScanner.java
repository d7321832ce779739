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

package org.qunroll.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameterValuesProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides the test programs found in a testdata directory. Each file is split into chunks, each
 * consisting of some source code followed by a comment that matches the given pattern; the
 * pattern's first group is the body of the comment.
 */
public abstract class TestdataScanner extends TestParameterValuesProvider {

  /**
   * One chunk of a testdata file.
   *
   * @param name the file name and the line number where the chunk starts
   * @param code the source code of the chunk
   * @param comment the body of the comment that followed the code, or null if the file ended
   *     without one
   */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path directory;
  private final String extension;
  private final Pattern commentPattern;

  protected TestdataScanner(Path directory, String extension, Pattern commentPattern) {
    this.directory = directory;
    this.extension = extension;
    this.commentPattern = commentPattern;
  }

  @Override
  protected List<TestProgram> provideValues(Context context) throws IOException {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    try (Stream<Path> files = Files.list(directory)) {
      for (Path file : files.filter(f -> f.toString().endsWith(extension)).sorted().toList()) {
        scan(file, result);
      }
    }
    return result.build();
  }

  private void scan(Path file, ImmutableList.Builder<TestProgram> result) throws IOException {
    String text = Files.readString(file, StandardCharsets.UTF_8);
    String fileName = file.getFileName().toString();
    Matcher matcher = commentPattern.matcher(text);
    int start = 0;
    while (start < text.length()) {
      int line = 1 + (int) text.substring(0, start).chars().filter(c -> c == '\n').count();
      String name = fileName + ":" + line;
      if (!matcher.find(start)) {
        String rest = text.substring(start);
        if (!rest.isBlank()) {
          result.add(new TestProgram(name, rest, null));
        }
        break;
      }
      result.add(new TestProgram(name, text.substring(start, matcher.start()), matcher.group(1)));
      start = matcher.end();
    }
  }
}
