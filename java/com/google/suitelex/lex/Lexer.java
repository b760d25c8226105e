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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;

/**
 * A node of the lexer tree.
 *
 * <p>Lexing happens in two phases. Every statement of a document is first passed to {@link
 * #input}, which builds the tree; only then is {@link #lex} called, once, to assign the token
 * types. Whether a new node should be created for a statement is decided by its {@link
 * LexerKind}.
 */
public interface Lexer {

  /**
   * Returns true if this node, the last child created by its parent, should also own {@code
   * statement}.
   */
  boolean acceptsMore(List<Token> statement);

  /**
   * Records {@code statement} as owned by this node or one of its descendants, and returns the
   * node that accepted it.
   *
   * <p>The statement may be modified.
   */
  @CanIgnoreReturnValue
  Lexer input(List<Token> statement);

  /** Assigns the types of all tokens owned by this node and its descendants. */
  void lex();
}
