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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;

/** A lexing error that aborts the whole document. */
public class LexError extends Error {

  /** A diagnostic kind. */
  public enum ErrorKind {
    NO_LEXER_FOR_STATEMENT("%s does not have lexer for statement %s"),
    UNRECOGNIZED_SECTION("Unrecognized section header '%s'. Valid sections: %s."),
    INVALID_RESOURCE_SECTION("Resource file with '%s' section is invalid."),
    INVALID_INIT_SECTION("'%s' section is not allowed in suite initialization file."),
    NON_EXISTING_SETTING("Non-existing setting '%s'."),
    SETTING_NOT_ALLOWED("Setting '%s' is not allowed in %s file."),
    DUPLICATE_SETTING("Setting '%s' is allowed only once. Only the first value is used."),
    TOO_MANY_SETTING_VALUES("Setting '%s' accepts only one value, got %s.");

    private final String message;

    ErrorKind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  /**
   * Formats an error without position information.
   *
   * @param kind the error kind
   * @param args format args
   */
  public static LexError format(ErrorKind kind, Object... args) {
    return format(-1, kind, args);
  }

  /**
   * Formats an error.
   *
   * @param lineno the one-indexed line of the offending statement, or {@code -1} if unknown
   * @param kind the error kind
   * @param args format args
   */
  public static LexError format(int lineno, ErrorKind kind, Object... args) {
    String diagnostic = LexDiagnostic.formatMessage(lineno, kind.format(args));
    return new LexError(kind, diagnostic, ImmutableList.copyOf(args));
  }

  private final ErrorKind kind;
  private final ImmutableList<Object> args;

  private LexError(ErrorKind kind, String diagnostic, ImmutableList<Object> args) {
    super(diagnostic);
    checkArgument(!args.isEmpty(), "diagnostic (%s) has no arguments", diagnostic);
    this.kind = kind;
    this.args = args;
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }
}
