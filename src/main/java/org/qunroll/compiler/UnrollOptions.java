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

import com.google.common.base.Preconditions;

/** Settings for a validation or unrolling pass. Instances are immutable. */
public final class UnrollOptions {

  /** The default limit on nested subroutine inlining. */
  public static final int DEFAULT_MAX_INLINE_DEPTH = 64;

  public static final UnrollOptions DEFAULT = new UnrollOptions(DEFAULT_MAX_INLINE_DEPTH);

  /** Calls nested more deeply than this (e.g. by recursion) fail with INLINE_DEPTH. */
  public final int maxInlineDepth;

  private UnrollOptions(int maxInlineDepth) {
    Preconditions.checkArgument(maxInlineDepth >= 0, "negative maxInlineDepth");
    this.maxInlineDepth = maxInlineDepth;
  }

  public UnrollOptions withMaxInlineDepth(int maxInlineDepth) {
    return new UnrollOptions(maxInlineDepth);
  }

  /** Returns the defaults, overridden by the {@code maxInlineDepth} system property if set. */
  public static UnrollOptions fromSystemProperties() {
    String depth = System.getProperty("maxInlineDepth");
    return (depth == null) ? DEFAULT : DEFAULT.withMaxInlineDepth(Integer.parseInt(depth.trim()));
  }

  @Override
  public String toString() {
    return "UnrollOptions{maxInlineDepth=" + maxInlineDepth + "}";
  }
}
