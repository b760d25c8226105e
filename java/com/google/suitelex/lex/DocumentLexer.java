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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.suitelex.context.FileContext;
import com.google.suitelex.diag.LexDiagnostic;
import com.google.suitelex.diag.LexLog;
import com.google.suitelex.options.LexerOptions;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lexes one document.
 *
 * <p>All statements are passed to {@link #input} first. The first call to {@link #getTokens} or
 * {@link #getStatements} lexes the whole document and ends the input phase; no statement can be
 * added after that.
 */
public final class DocumentLexer {

  private enum Phase {
    INPUT,
    LEXED
  }

  private final LexerOptions options;
  private final LexLog log;
  private final FileLexer root;

  /** The statements as they were input, before any lexer removed or split tokens. */
  private final List<ImmutableList<Token>> statements = new ArrayList<>();

  private Phase phase = Phase.INPUT;
  private @Nullable ImmutableList<Token> tokens;

  private DocumentLexer(LexerOptions options, LexLog log) {
    this.options = options;
    this.log = log;
    this.root = new FileLexer(new FileContext(options.fileKind(), log));
  }

  public static DocumentLexer create(LexerOptions options) {
    return new DocumentLexer(options, new LexLog());
  }

  /** Lexes {@code statements} as one document and returns the emitted tokens. */
  public static ImmutableList<Token> lex(
      LexerOptions options, Iterable<? extends List<Token>> statements) {
    return create(options).inputAll(statements).getTokens();
  }

  /** Adds the next statement of the document. Empty statements are skipped. */
  public void input(List<Token> statement) {
    checkState(phase == Phase.INPUT, "cannot add statements after the document was lexed");
    if (statement.isEmpty()) {
      return;
    }
    statements.add(ImmutableList.copyOf(statement));
    root.input(new ArrayList<>(statement));
  }

  @CanIgnoreReturnValue
  public DocumentLexer inputAll(Iterable<? extends List<Token>> statements) {
    for (List<Token> statement : statements) {
      input(statement);
    }
    return this;
  }

  /**
   * Returns the classified tokens of the document in order, with an {@link TokenType#EOS} token
   * after every statement.
   */
  public ImmutableList<Token> getTokens() {
    if (phase == Phase.INPUT) {
      phase = Phase.LEXED;
      root.lex();
      tokens = emit();
    }
    return requireNonNull(tokens);
  }

  /** Returns the classified statements of the document, split at end-of-statement tokens. */
  public ImmutableList<ImmutableList<Token>> getStatements() {
    ImmutableList.Builder<ImmutableList<Token>> result = ImmutableList.builder();
    ImmutableList.Builder<Token> current = ImmutableList.builder();
    for (Token token : getTokens()) {
      if (token.type() == TokenType.EOS) {
        result.add(current.build());
        current = ImmutableList.builder();
      } else {
        current.add(token);
      }
    }
    return result.build();
  }

  public ImmutableList<LexDiagnostic> diagnostics() {
    return log.diagnostics();
  }

  /** Whether the document is invalid as a whole, e.g. a resource file with test cases. */
  public boolean hasFatalErrors() {
    return log.anyFatal();
  }

  private ImmutableList<Token> emit() {
    ImmutableList.Builder<Token> result = ImmutableList.builder();
    for (ImmutableList<Token> statement : statements) {
      @Nullable Token prev = null;
      for (Token token : statement) {
        if (!emitted(token)) {
          continue;
        }
        if (token.eosBefore() && prev != null && !prev.eosAfter()) {
          result.add(Token.eos(token, /* before= */ true));
        }
        result.add(token);
        if (token.eosAfter()) {
          result.add(Token.eos(token, /* before= */ false));
        }
        prev = token;
      }
      if (prev != null && !prev.eosAfter()) {
        result.add(Token.eos(prev, /* before= */ false));
      }
    }
    return result.build();
  }

  private boolean emitted(Token token) {
    TokenType type = token.type();
    if (type == null || type == TokenType.IGNORE) {
      return false;
    }
    return !(options.dataOnly()
        && (type == TokenType.COMMENT || type == TokenType.COMMENT_HEADER));
  }
}
