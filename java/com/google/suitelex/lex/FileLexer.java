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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.suitelex.context.FileContext;

/** The root of the lexer tree: splits a file into sections. */
public class FileLexer extends BlockLexer<FileContext, SectionKind> {

  /** Settings such as a default test template affect how test bodies are lexed. */
  private static final ImmutableSet<SectionKind> PRIORITY =
      ImmutableSet.of(SectionKind.SETTING, SectionKind.KEYWORD);

  public FileLexer(FileContext ctx) {
    super(ctx, ImmutableList.copyOf(SectionKind.values()));
  }

  @Override
  public void lex() {
    lexWithPriority(PRIORITY);
  }
}
