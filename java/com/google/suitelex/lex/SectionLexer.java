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
import com.google.suitelex.context.FileContext;
import java.util.List;

/** A section, from its header up to the next header. */
public class SectionLexer extends BlockLexer<FileContext, SectionItemKind> {

  SectionLexer(FileContext ctx, ImmutableList<SectionItemKind> candidates) {
    super(ctx, candidates);
  }

  @Override
  public boolean acceptsMore(List<Token> statement) {
    return !statement.get(0).value().startsWith("*");
  }
}
