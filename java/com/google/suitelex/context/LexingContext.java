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

import com.google.suitelex.diag.LexLog;
import com.google.suitelex.lex.Token;
import java.util.List;

/**
 * The scope a statement is lexed in. Contexts are created per nesting level and handed down to
 * child lexers, which may only read them or derive narrower contexts from them.
 */
public abstract class LexingContext {

  private final Settings settings;
  private final LexLog log;

  LexingContext(Settings settings, LexLog log) {
    this.settings = settings;
    this.log = log;
  }

  /** Lexes a setting statement, reporting invalid settings to the log. */
  public void lexSetting(List<Token> statement) {
    settings.lex(statement);
  }

  public LexLog log() {
    return log;
  }
}
