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

package com.google.suitelex.context;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.suitelex.diag.LexLog;
import com.google.suitelex.lex.Token;

/** The settings of a test case or task, written in brackets (e.g. {@code [Setup]}). */
class TestCaseSettings extends Settings {

  private final FileSettings parent;

  TestCaseSettings(FileSettings parent, LexLog log) {
    super(
        ImmutableSet.of("Documentation", "Tags", "Setup", "Teardown", "Template", "Timeout"),
        ImmutableMap.of(),
        log);
    this.parent = parent;
  }

  @Override
  String formatName(String name) {
    return name.substring(1, name.length() - 1).trim();
  }

  /**
   * Whether the test uses a template: its own {@code [Template]}, or the file's default unless the
   * test disables it with an empty or {@code NONE} template.
   */
  boolean templateSet() {
    ImmutableList<Token> template = value("Template");
    if (template != null
        && (template.isEmpty() || Ascii.toUpperCase(template.get(0).value()).equals("NONE"))) {
      return false;
    }
    return hasValue(template) || parent.hasTestTemplate();
  }
}
