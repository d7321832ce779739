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
import org.qunroll.ast.BaseType;
import org.qunroll.ast.Expr;
import org.qunroll.ast.SourcePosition;

/** A classical value known at compile time: a 64-bit int, a double, or a boolean. */
public final class Value {

  public enum Kind {
    INT,
    FLOAT,
    BOOL
  }

  public final Kind kind;
  private final long longValue;
  private final double doubleValue;

  private Value(Kind kind, long longValue, double doubleValue) {
    this.kind = kind;
    this.longValue = longValue;
    this.doubleValue = doubleValue;
  }

  public static Value of(long value) {
    return new Value(Kind.INT, value, value);
  }

  public static Value of(double value) {
    return new Value(Kind.FLOAT, (long) value, value);
  }

  public static Value of(boolean value) {
    return new Value(Kind.BOOL, value ? 1 : 0, value ? 1 : 0);
  }

  public boolean isInt() {
    return kind == Kind.INT;
  }

  public long asLong() {
    Preconditions.checkState(kind == Kind.INT, "%s is not an int", this);
    return longValue;
  }

  /** Valid for any INT or FLOAT value. */
  public double asDouble() {
    Preconditions.checkState(kind != Kind.BOOL, "%s is not a number", this);
    return doubleValue;
  }

  public boolean asBoolean() {
    Preconditions.checkState(kind == Kind.BOOL, "%s is not a bool", this);
    return longValue != 0;
  }

  /**
   * Converts this value to the representation used for a variable of the given type: {@code int}
   * and {@code uint} truncate floats, {@code bool} tests for non-zero, and {@code bit} stores 0 or
   * 1.
   */
  public Value castTo(BaseType type) {
    switch (type) {
      case INT:
      case UINT:
        return (kind == Kind.INT) ? this : Value.of(longValue);
      case FLOAT:
        return (kind == Kind.FLOAT) ? this : Value.of(doubleValue);
      case BOOL:
        return (kind == Kind.BOOL) ? this : Value.of(doubleValue != 0);
      case BIT:
        return Value.of(doubleValue != 0 ? 1L : 0L);
      default:
        throw new IllegalArgumentException("Cannot cast a value to " + type);
    }
  }

  /** False if this value is negative and {@code type} is {@code uint}, which can't hold it. */
  public boolean fitsIn(BaseType type) {
    return type != BaseType.UINT || castTo(type).asLong() >= 0;
  }

  /** Returns a literal expression for this value, located at {@code pos}. */
  public Expr toLiteral(SourcePosition pos) {
    switch (kind) {
      case INT:
        return new Expr.IntLiteral(longValue, pos);
      case FLOAT:
        return new Expr.FloatLiteral(doubleValue, Double.toString(doubleValue), pos);
      default:
        return new Expr.BoolLiteral(longValue != 0, pos);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Value other)) {
      return false;
    }
    return kind == other.kind
        && longValue == other.longValue
        && Double.compare(doubleValue, other.doubleValue) == 0;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + Double.hashCode(doubleValue);
  }

  @Override
  public String toString() {
    switch (kind) {
      case INT:
        return Long.toString(longValue);
      case FLOAT:
        return Double.toString(doubleValue);
      default:
        return Boolean.toString(longValue != 0);
    }
  }
}
