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

/**
 * A candidate for a new child of a {@link BlockLexer}. Candidates are evaluated in a fixed order,
 * and the first one that handles a statement wins.
 *
 * @param <C> the context of the scope the candidate appears in
 */
public interface LexerKind<C extends LexingContext> {

  /** Returns true if a new lexer of this kind should be created to own {@code statement}. */
  boolean handles(List<Token> statement, C ctx);

  /** Creates a new lexer of this kind. */
  Lexer create(C ctx);
}
