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

import com.google.common.base.CharMatcher;

/** Helpers for comparing token values. */
public final class TokenValues {

  private static final CharMatcher ASSIGN_MARK = CharMatcher.anyOf("= ");

  /** Collapses every run of whitespace to a single space. */
  public static String normalizeWhitespace(String value) {
    return CharMatcher.whitespace().collapseFrom(value, ' ');
  }

  /** Upper-cases the first letter of every word and lower-cases the rest. */
  public static String titleCase(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    boolean wordStart = true;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      sb.append(wordStart ? Character.toUpperCase(c) : Character.toLowerCase(c));
      wordStart = !Character.isLetter(c);
    }
    return sb.toString();
  }

  /**
   * Returns true if {@code value} is an assignment target: a scalar, list or dictionary variable
   * such as {@code ${x}}, optionally followed by {@code =} if {@code allowAssignMark} is set.
   */
  public static boolean isAssign(String value, boolean allowAssignMark) {
    if (allowAssignMark && value.endsWith("=")) {
      value = ASSIGN_MARK.trimTrailingFrom(value);
    }
    if (value.length() < 4 || "$@&".indexOf(value.charAt(0)) < 0 || value.charAt(1) != '{') {
      return false;
    }
    // the opening brace must be closed by the last character, and by nothing before it
    int depth = 0;
    for (int i = 1; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return i == value.length() - 1;
        }
      }
    }
    return false;
  }

  private TokenValues() {}
}
