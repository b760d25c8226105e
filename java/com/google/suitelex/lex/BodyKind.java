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

import com.google.suitelex.context.TestOrKeywordContext;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * The statements and control structures that can appear in the body of a test case or keyword.
 *
 * <p>{@link #FOR}, {@link #WHILE}, {@link #TRY} and {@link #IF} open a nested block that owns
 * every statement up to the matching {@link #END}. The header kinds are the statements that open
 * such a block when they appear directly inside one.
 */
public enum BodyKind implements LexerKind<TestOrKeywordContext> {
  SETTING(SettingLexer::isBodySetting, SettingLexer::new),

  FOR(ForHeaderLexer::handles, ctx -> new NestedBlockLexer(ctx, NestedBlockLexer.FOR_BLOCK)),
  WHILE(
      WhileHeaderLexer::handles, ctx -> new NestedBlockLexer(ctx, NestedBlockLexer.WHILE_BLOCK)),
  TRY(BodyKind::isTry, ctx -> new NestedBlockLexer(ctx, NestedBlockLexer.TRY_BLOCK)),
  IF(BodyKind::isIf, ctx -> new NestedBlockLexer(ctx, NestedBlockLexer.IF_BLOCK)),
  INLINE_IF(
      statement -> statement.size() > 2 && InlineIfHeaderLexer.handles(statement),
      InlineIfLexer::new),

  FOR_HEADER(ForHeaderLexer::handles, ctx -> new ForHeaderLexer(), /* opensBlock= */ true),
  WHILE_HEADER(WhileHeaderLexer::handles, ctx -> new WhileHeaderLexer(), /* opensBlock= */ true),
  TRY_HEADER(
      BodyKind::isTry, ctx -> new TypeAndArgumentsLexer(TokenType.TRY), /* opensBlock= */ true),
  IF_HEADER(
      BodyKind::isIf, ctx -> new TypeAndArgumentsLexer(TokenType.IF), /* opensBlock= */ true),
  INLINE_IF_HEADER(InlineIfHeaderLexer::handles, ctx -> new InlineIfHeaderLexer()),
  ELSE_IF_HEADER(
      statement -> TokenValues.normalizeWhitespace(statement.get(0).value()).equals("ELSE IF"),
      ctx -> new TypeAndArgumentsLexer(TokenType.ELSE_IF)),
  ELSE_HEADER(
      statement -> startsWith(statement, "ELSE"),
      ctx -> new TypeAndArgumentsLexer(TokenType.ELSE)),
  EXCEPT_HEADER(ExceptHeaderLexer::handles, ctx -> new ExceptHeaderLexer()),
  FINALLY_HEADER(
      statement -> startsWith(statement, "FINALLY"),
      ctx -> new TypeAndArgumentsLexer(TokenType.FINALLY)),
  END(statement -> startsWith(statement, "END"), ctx -> new TypeAndArgumentsLexer(TokenType.END)),

  RETURN(
      statement -> startsWith(statement, "RETURN"),
      ctx -> new TypeAndArgumentsLexer(TokenType.RETURN_STATEMENT)),
  CONTINUE(
      statement -> startsWith(statement, "CONTINUE"),
      ctx -> new TypeAndArgumentsLexer(TokenType.CONTINUE)),
  BREAK(
      statement -> startsWith(statement, "BREAK"),
      ctx -> new TypeAndArgumentsLexer(TokenType.BREAK)),
  KEYWORD_CALL(statement -> true, KeywordCallLexer::new);

  private final Predicate<List<Token>> handles;
  private final Function<TestOrKeywordContext, Lexer> factory;
  private final boolean opensBlock;

  BodyKind(Predicate<List<Token>> handles, Function<TestOrKeywordContext, Lexer> factory) {
    this(handles, factory, /* opensBlock= */ false);
  }

  BodyKind(
      Predicate<List<Token>> handles,
      Function<TestOrKeywordContext, Lexer> factory,
      boolean opensBlock) {
    this.handles = handles;
    this.factory = factory;
    this.opensBlock = opensBlock;
  }

  @Override
  public boolean handles(List<Token> statement, TestOrKeywordContext ctx) {
    return handles.test(statement);
  }

  @Override
  public Lexer create(TestOrKeywordContext ctx) {
    return factory.apply(ctx);
  }

  /** Whether a statement of this kind raises the nesting depth of the enclosing block. */
  boolean opensBlock() {
    return opensBlock;
  }

  private static boolean startsWith(List<Token> statement, String marker) {
    return statement.get(0).value().equals(marker);
  }

  private static boolean isTry(List<Token> statement) {
    return startsWith(statement, "TRY");
  }

  /** Block form only; longer statements are single-line {@code IF}s. */
  private static boolean isIf(List<Token> statement) {
    return startsWith(statement, "IF") && statement.size() <= 2;
  }
}
