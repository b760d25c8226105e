/*
 * Copyright 2016 Google Inc. All Rights Reserved.
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

package com.google.suitelex.lex;

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * A single cell of a statement.
 *
 * <p>The value is fixed when the token is created by the statement splitter. The type is assigned
 * exactly once, when the lexer tree is lexed; until then it is {@code null}.
 */
public final class Token {

  private final String value;

  /** The one-indexed line of the token, or {@code -1}. */
  private final int lineno;

  /** The zero-indexed column of the token, or {@code -1}. */
  private final int colOffset;

  private @Nullable TokenType type;
  private @Nullable String error;

  /** Whether an end-of-statement must be emitted immediately before this token. */
  private boolean eosBefore;

  /** Whether an end-of-statement must be emitted immediately after this token. */
  private boolean eosAfter;

  public Token(String value) {
    this(value, -1, -1);
  }

  public Token(String value, int lineno, int colOffset) {
    this(null, value, lineno, colOffset);
  }

  private Token(@Nullable TokenType type, String value, int lineno, int colOffset) {
    this.type = type;
    this.value = requireNonNull(value);
    this.lineno = lineno;
    this.colOffset = colOffset;
  }

  /**
   * Creates a synthetic end-of-statement token, positioned at the start of {@code anchor} if
   * {@code before} is set and at its end otherwise.
   */
  public static Token eos(Token anchor, boolean before) {
    int col = before ? anchor.colOffset : anchor.endColOffset();
    return new Token(TokenType.EOS, "", anchor.lineno, col);
  }

  public String value() {
    return value;
  }

  public @Nullable TokenType type() {
    return type;
  }

  public void setType(@Nullable TokenType type) {
    this.type = type;
  }

  public int lineno() {
    return lineno;
  }

  public int colOffset() {
    return colOffset;
  }

  public int endColOffset() {
    if (colOffset < 0) {
      return -1;
    }
    return colOffset + value.length();
  }

  /** The error message attached to this token, if it was lexed as an error. */
  public @Nullable String error() {
    return error;
  }

  public void setError(String error, boolean fatal) {
    this.type = fatal ? TokenType.FATAL_ERROR : TokenType.ERROR;
    this.error = requireNonNull(error);
  }

  boolean eosBefore() {
    return eosBefore;
  }

  boolean eosAfter() {
    return eosAfter;
  }

  void requestEosBefore() {
    eosBefore = true;
  }

  void requestEosAfter() {
    eosAfter = true;
  }

  @Override
  public String toString() {
    if (type == null) {
      return value;
    }
    if (type == TokenType.EOS) {
      return type.name();
    }
    return String.format("%s(%s)", type.name(), value);
  }
}
