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
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * The result of a check: either a value, or the {@link Diagnostic} that stopped it.
 *
 * <p>The validation passes return Outcomes rather than throwing, and each caller tests {@link
 * #failed} and returns early. Only the public entry points turn a failed Outcome into a {@link
 * ValidationError}.
 */
public final class Outcome<T> {

  private static final Outcome<Void> OK = new Outcome<>(null, null);

  private final @Nullable T value;
  private final @Nullable Diagnostic diagnostic;

  private Outcome(@Nullable T value, @Nullable Diagnostic diagnostic) {
    this.value = value;
    this.diagnostic = diagnostic;
  }

  /** The successful Outcome of a check that produces no value. */
  public static Outcome<Void> ok() {
    return OK;
  }

  public static <T> Outcome<T> of(T value) {
    return new Outcome<>(Preconditions.checkNotNull(value), null);
  }

  public static <T> Outcome<T> failure(Diagnostic diagnostic) {
    return new Outcome<>(null, Preconditions.checkNotNull(diagnostic));
  }

  public boolean failed() {
    return diagnostic != null;
  }

  /** Returns this Outcome's value; should only be called if it did not fail. */
  public T value() {
    Preconditions.checkState(diagnostic == null, "value() called on failure: %s", diagnostic);
    return value;
  }

  /** Returns the Diagnostic of a failed Outcome. */
  public Diagnostic diagnostic() {
    Preconditions.checkState(diagnostic != null, "diagnostic() called on success");
    return diagnostic;
  }

  /** True if this Outcome failed with a Diagnostic of the given kind. */
  public boolean failedWith(Diagnostic.Kind kind) {
    return diagnostic != null && diagnostic.kind() == kind;
  }

  /** Re-types a failed Outcome so that it can be returned from a caller with a different type. */
  @SuppressWarnings("unchecked")
  public <U> Outcome<U> propagate() {
    Preconditions.checkState(diagnostic != null, "propagate() called on success");
    return (Outcome<U>) this;
  }

  public <U> Outcome<U> map(Function<? super T, ? extends U> fn) {
    return failed() ? propagate() : Outcome.of(fn.apply(value));
  }

  @Override
  public String toString() {
    return failed() ? "failure(" + diagnostic + ")" : "ok(" + value + ")";
  }
}
