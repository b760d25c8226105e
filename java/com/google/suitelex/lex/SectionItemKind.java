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
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Function;

/** The statements and named blocks that can appear directly inside a section. */
public enum SectionItemKind implements LexerKind<FileContext> {
  SETTING_HEADER(SectionItemKind::isHeader, ctx -> new SingleTypeLexer(TokenType.SETTING_HEADER)),
  VARIABLE_HEADER(
      SectionItemKind::isHeader, ctx -> new SingleTypeLexer(TokenType.VARIABLE_HEADER)),
  TEST_CASE_HEADER(
      SectionItemKind::isHeader, ctx -> new SingleTypeLexer(TokenType.TESTCASE_HEADER)),
  TASK_HEADER(SectionItemKind::isHeader, ctx -> new SingleTypeLexer(TokenType.TASK_HEADER)),
  KEYWORD_HEADER(SectionItemKind::isHeader, ctx -> new SingleTypeLexer(TokenType.KEYWORD_HEADER)),
  COMMENT_HEADER(SectionItemKind::isHeader, ctx -> new SingleTypeLexer(TokenType.COMMENT_HEADER)),
  ERROR_HEADER(SectionItemKind::isHeader, ErrorSectionHeaderLexer::new),
  SETTING(SectionItemKind::always, SettingLexer::new),
  VARIABLE(SectionItemKind::always, ctx -> new TypeAndArgumentsLexer(TokenType.VARIABLE)),
  TEST_CASE(
      SectionItemKind::always,
      ctx -> new TestOrKeywordLexer(ctx.testCaseContext(), TokenType.TESTCASE_NAME)),
  KEYWORD(
      SectionItemKind::always,
      ctx -> new TestOrKeywordLexer(ctx.keywordContext(), TokenType.KEYWORD_NAME)),
  COMMENT(SectionItemKind::always, ctx -> new SingleTypeLexer(TokenType.COMMENT)),
  IMPLICIT_COMMENT(SectionItemKind::always, ctx -> new SingleTypeLexer(TokenType.COMMENT));

  private final BiPredicate<List<Token>, FileContext> handles;
  private final Function<FileContext, Lexer> factory;

  SectionItemKind(
      BiPredicate<List<Token>, FileContext> handles, Function<FileContext, Lexer> factory) {
    this.handles = handles;
    this.factory = factory;
  }

  @Override
  public boolean handles(List<Token> statement, FileContext ctx) {
    return handles.test(statement, ctx);
  }

  @Override
  public Lexer create(FileContext ctx) {
    return factory.apply(ctx);
  }

  static boolean isHeader(List<Token> statement, FileContext ctx) {
    return statement.get(0).value().startsWith("*");
  }

  private static boolean always(List<Token> statement, FileContext ctx) {
    return true;
  }
}
