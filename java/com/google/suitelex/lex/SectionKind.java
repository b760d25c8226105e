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
import java.util.function.BiPredicate;

/**
 * The sections of a file, in the order their headers are tried. A statement that starts with an
 * unknown header opens an {@link #ERROR} section, and content before the first header belongs to
 * an {@link #IMPLICIT_COMMENT} section.
 */
public enum SectionKind implements LexerKind<FileContext> {
  SETTING(
      (statement, ctx) -> ctx.isSettingSection(statement),
      ImmutableList.of(SectionItemKind.SETTING_HEADER, SectionItemKind.SETTING)),
  VARIABLE(
      (statement, ctx) -> ctx.isVariableSection(statement),
      ImmutableList.of(SectionItemKind.VARIABLE_HEADER, SectionItemKind.VARIABLE)),
  TEST_CASE(
      (statement, ctx) -> ctx.isTestCaseSection(statement),
      ImmutableList.of(SectionItemKind.TEST_CASE_HEADER, SectionItemKind.TEST_CASE)),
  TASK(
      (statement, ctx) -> ctx.isTaskSection(statement),
      ImmutableList.of(SectionItemKind.TASK_HEADER, SectionItemKind.TEST_CASE)),
  KEYWORD(
      (statement, ctx) -> ctx.isKeywordSection(statement),
      ImmutableList.of(SectionItemKind.KEYWORD_HEADER, SectionItemKind.KEYWORD)),
  COMMENT(
      (statement, ctx) -> ctx.isCommentSection(statement),
      ImmutableList.of(SectionItemKind.COMMENT_HEADER, SectionItemKind.COMMENT)),
  ERROR(
      SectionItemKind::isHeader,
      ImmutableList.of(SectionItemKind.ERROR_HEADER, SectionItemKind.COMMENT)),
  IMPLICIT_COMMENT((statement, ctx) -> true, ImmutableList.of(SectionItemKind.IMPLICIT_COMMENT));

  private final BiPredicate<List<Token>, FileContext> handles;
  private final ImmutableList<SectionItemKind> candidates;

  SectionKind(
      BiPredicate<List<Token>, FileContext> handles, ImmutableList<SectionItemKind> candidates) {
    this.handles = handles;
    this.candidates = candidates;
  }

  @Override
  public boolean handles(List<Token> statement, FileContext ctx) {
    return handles.test(statement, ctx);
  }

  @Override
  public Lexer create(FileContext ctx) {
    return new SectionLexer(ctx, candidates);
  }
}
