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

import com.google.suitelex.context.LexingContext;
import java.util.List;

/** Lexes a setting using the settings table of its scope. */
public class SettingLexer extends StatementLexer {

  private final LexingContext ctx;

  public SettingLexer(LexingContext ctx) {
    this.ctx = ctx;
  }

  /** Returns true for test case and keyword settings, which are written in brackets. */
  static boolean isBodySetting(List<Token> statement) {
    String marker = statement.get(0).value();
    return marker.length() > 1 && marker.startsWith("[") && marker.endsWith("]");
  }

  @Override
  public void lex() {
    ctx.lexSetting(statement());
  }
}
