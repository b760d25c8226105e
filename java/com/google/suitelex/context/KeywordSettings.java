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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.suitelex.diag.LexLog;

/** The settings of a keyword, written in brackets (e.g. {@code [Arguments]}). */
class KeywordSettings extends Settings {

  KeywordSettings(LexLog log) {
    super(
        ImmutableSet.of("Documentation", "Arguments", "Teardown", "Timeout", "Tags", "Return"),
        ImmutableMap.of(),
        log);
  }

  @Override
  String formatName(String name) {
    return name.substring(1, name.length() - 1).trim();
  }
}
