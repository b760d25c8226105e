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

import com.google.suitelex.context.FileContext;

/** Lexes the header of a section the file does not support. */
public class ErrorSectionHeaderLexer extends StatementLexer {

  private final FileContext ctx;

  public ErrorSectionHeaderLexer(FileContext ctx) {
    this.ctx = ctx;
  }

  @Override
  public void lex() {
    ctx.lexInvalidSection(statement());
  }
}
