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
import com.google.suitelex.diag.LexError.ErrorKind;
import com.google.suitelex.diag.LexLog;
import com.google.suitelex.lex.Token;

/** The settings of a settings section. */
class FileSettings extends Settings {

  private final FileKind kind;

  FileSettings(FileKind kind, LexLog log) {
    super(
        kind.settingNames(),
        kind == FileKind.RESOURCE ? ImmutableMap.of() : FileKind.TASK_ALIASES,
        log);
    this.kind = kind;
  }

  FileKind kind() {
    return kind;
  }

  @Override
  void reportUnknown(Token setting, String orig, String name) {
    if (kind != FileKind.SUITE && FileKind.SUITE.settingNames().contains(name)) {
      log().error(setting, ErrorKind.SETTING_NOT_ALLOWED, orig, kind.description());
    } else {
      super.reportUnknown(setting, orig, name);
    }
  }

  /** The default template of the tests in this file, if any. */
  boolean hasTestTemplate() {
    return hasValue(value("Test Template"));
  }
}
