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

package com.google.suitelex.diag;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.suitelex.diag.LexError.ErrorKind;
import java.util.Objects;

/** A recoverable problem found while lexing, reported on the offending token. */
public class LexDiagnostic {

  private final ErrorKind kind;
  private final String message;
  private final int lineno;
  private final boolean fatal;
  private final ImmutableList<Object> args;

  private LexDiagnostic(
      ErrorKind kind, String message, int lineno, boolean fatal, ImmutableList<Object> args) {
    this.kind = requireNonNull(kind);
    this.message = requireNonNull(message);
    this.lineno = lineno;
    this.fatal = fatal;
    this.args = requireNonNull(args);
  }

  /**
   * Formats a diagnostic.
   *
   * @param lineno the one-indexed line, or {@code -1} if unknown
   * @param fatal whether the problem makes the whole document invalid
   * @param kind the error kind
   * @param args format args
   */
  public static LexDiagnostic format(int lineno, boolean fatal, ErrorKind kind, Object... args) {
    return new LexDiagnostic(kind, kind.format(args), lineno, fatal, ImmutableList.copyOf(args));
  }

  static String formatMessage(int lineno, String message) {
    StringBuilder sb = new StringBuilder("<>");
    if (lineno > 0) {
      sb.append(':').append(lineno);
    }
    return sb.append(": error: ").append(message.trim()).toString();
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The unformatted message, as attached to the offending token. */
  public String message() {
    return message;
  }

  /** The one-indexed line of the offending token, or {@code -1}. */
  public int lineno() {
    return lineno;
  }

  public boolean fatal() {
    return fatal;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }

  /** The diagnostic message, with position information. */
  public String diagnostic() {
    return formatMessage(lineno, message);
  }

  @Override
  public String toString() {
    return diagnostic();
  }

  @Override
  public int hashCode() {
    return Objects.hash(message, kind, lineno);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LexDiagnostic)) {
      return false;
    }
    LexDiagnostic that = (LexDiagnostic) obj;
    return message.equals(that.message) && kind.equals(that.kind) && lineno == that.lineno;
  }
}
