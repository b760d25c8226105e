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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.Iterables.getLast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.suitelex.context.LexingContext;
import com.google.suitelex.diag.LexError;
import com.google.suitelex.diag.LexError.ErrorKind;
import java.util.ArrayList;
import java.util.List;

/**
 * A lexer that owns an ordered list of child lexers and routes each statement to one of them.
 *
 * <p>A statement goes to the last child if that child {@link Lexer#acceptsMore accepts more}
 * input. Otherwise a new child is created from the first candidate kind that {@link
 * LexerKind#handles handles} the statement. Children are only ever appended, so the child list is
 * in document order and only its last element can be open.
 *
 * @param <C> the context shared by the candidates
 * @param <K> the candidate kinds
 */
public abstract class BlockLexer<C extends LexingContext, K extends Enum<K> & LexerKind<C>>
    implements Lexer {

  protected final C ctx;
  private final ImmutableList<K> candidates;

  /** The kind of each child, parallel to {@link #lexers}. */
  private final List<K> kinds = new ArrayList<>();

  private final List<Lexer> lexers = new ArrayList<>();

  protected BlockLexer(C ctx, ImmutableList<K> candidates) {
    this.ctx = ctx;
    this.candidates = candidates;
  }

  @Override
  public boolean acceptsMore(List<Token> statement) {
    return true;
  }

  @CanIgnoreReturnValue
  @Override
  public Lexer input(List<Token> statement) {
    route(statement);
    return lastChild();
  }

  /** The most recently created child. */
  protected final Lexer lastChild() {
    return getLast(lexers);
  }

  /**
   * Passes {@code statement} to the open child, or to a newly created one, and returns the kind of
   * the child that received it.
   */
  @CanIgnoreReturnValue
  protected final K route(List<Token> statement) {
    K kind;
    if (!lexers.isEmpty() && getLast(lexers).acceptsMore(statement)) {
      kind = getLast(kinds);
    } else {
      kind = kindFor(statement);
      kinds.add(kind);
      lexers.add(kind.create(ctx));
    }
    getLast(lexers).input(statement);
    return kind;
  }

  private K kindFor(List<Token> statement) {
    for (K kind : candidates) {
      if (kind.handles(statement, ctx)) {
        return kind;
      }
    }
    int lineno = statement.isEmpty() ? -1 : statement.get(0).lineno();
    throw LexError.format(
        lineno,
        ErrorKind.NO_LEXER_FOR_STATEMENT,
        getClass().getSimpleName(),
        statement.stream().map(Token::value).collect(toImmutableList()));
  }

  @Override
  public void lex() {
    for (Lexer lexer : lexers) {
      lexer.lex();
    }
  }

  /**
   * Lexes the children of the {@code priority} kinds first, and then the rest, each group in
   * document order.
   */
  protected final void lexWithPriority(ImmutableSet<K> priority) {
    for (int i = 0; i < lexers.size(); i++) {
      if (priority.contains(kinds.get(i))) {
        lexers.get(i).lex();
      }
    }
    for (int i = 0; i < lexers.size(); i++) {
      if (!priority.contains(kinds.get(i))) {
        lexers.get(i).lex();
      }
    }
  }

  ImmutableList<Lexer> children() {
    return ImmutableList.copyOf(lexers);
  }

  ImmutableList<K> childKinds() {
    return ImmutableList.copyOf(kinds);
  }
}
