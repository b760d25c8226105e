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

import com.google.common.base.Ascii;

/** The semantic type of a {@link Token}. */
public enum TokenType {
  SETTING_HEADER,
  VARIABLE_HEADER,
  TESTCASE_HEADER,
  TASK_HEADER,
  KEYWORD_HEADER,
  COMMENT_HEADER,

  TESTCASE_NAME,
  KEYWORD_NAME,

  // file settings
  DOCUMENTATION,
  METADATA,
  SUITE_SETUP,
  SUITE_TEARDOWN,
  TEST_SETUP,
  TEST_TEARDOWN,
  TEST_TEMPLATE,
  TEST_TIMEOUT,
  FORCE_TAGS,
  DEFAULT_TAGS,
  LIBRARY,
  RESOURCE,
  VARIABLES,

  // test case and keyword settings
  SETUP,
  TEARDOWN,
  TEMPLATE,
  TIMEOUT,
  TAGS,
  ARGUMENTS,
  RETURN,

  NAME,
  VARIABLE,
  ARGUMENT,
  ASSIGN,
  KEYWORD,
  WITH_NAME,
  OPTION,

  FOR,
  FOR_SEPARATOR,
  END,
  IF,
  INLINE_IF,
  ELSE_IF,
  ELSE,
  TRY,
  EXCEPT,
  FINALLY,
  AS,
  WHILE,
  RETURN_STATEMENT,
  CONTINUE,
  BREAK,

  COMMENT,
  EOS,
  ERROR,
  FATAL_ERROR,

  /** Indentation and other cells that carry no data. Never emitted. */
  IGNORE;

  /** Returns the type of a setting, given its canonical name (e.g. {@code Suite Setup}). */
  public static TokenType forSetting(String name) {
    return valueOf(Ascii.toUpperCase(name).replace(' ', '_'));
  }
}
