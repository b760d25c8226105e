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

package com.google.suitelex.context;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;
import com.google.suitelex.diag.LexError.ErrorKind;
import com.google.suitelex.diag.LexLog;
import com.google.suitelex.lex.Token;
import com.google.suitelex.lex.TokenType;
import com.google.suitelex.lex.TokenValues;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** The top-level context of a file; recognizes section headers. */
public class FileContext extends LexingContext {

  private enum Section {
    SETTINGS("Settings"),
    VARIABLES("Variables"),
    TEST_CASES("Test Cases"),
    TASKS("Tasks"),
    KEYWORDS("Keywords"),
    COMMENTS("Comments");

    final String title;

    Section(String title) {
      this.title = title;
    }
  }

  /** Normalized header names, in singular and plural form. */
  private static final ImmutableMap<String, Section> HEADERS =
      ImmutableMap.<String, Section>builder()
          .put("Setting", Section.SETTINGS)
          .put("Settings", Section.SETTINGS)
          .put("Variable", Section.VARIABLES)
          .put("Variables", Section.VARIABLES)
          .put("Test Case", Section.TEST_CASES)
          .put("Test Cases", Section.TEST_CASES)
          .put("Task", Section.TASKS)
          .put("Tasks", Section.TASKS)
          .put("Keyword", Section.KEYWORDS)
          .put("Keywords", Section.KEYWORDS)
          .put("Comment", Section.COMMENTS)
          .put("Comments", Section.COMMENTS)
          .buildOrThrow();

  private static final CharMatcher HEADER_MARKER = CharMatcher.anyOf("* ");

  private final FileKind kind;
  private final FileSettings settings;

  public FileContext(FileKind kind, LexLog log) {
    this(new FileSettings(kind, log), log);
  }

  private FileContext(FileSettings settings, LexLog log) {
    super(settings, log);
    this.kind = settings.kind();
    this.settings = settings;
  }

  public FileKind kind() {
    return kind;
  }

  public boolean isSettingSection(List<Token> statement) {
    return section(statement) == Section.SETTINGS;
  }

  public boolean isVariableSection(List<Token> statement) {
    return section(statement) == Section.VARIABLES;
  }

  public boolean isTestCaseSection(List<Token> statement) {
    return kind.allowsTests() && section(statement) == Section.TEST_CASES;
  }

  public boolean isTaskSection(List<Token> statement) {
    return kind.allowsTests() && section(statement) == Section.TASKS;
  }

  public boolean isKeywordSection(List<Token> statement) {
    return section(statement) == Section.KEYWORDS;
  }

  public boolean isCommentSection(List<Token> statement) {
    return section(statement) == Section.COMMENTS;
  }

  /** Creates the context of a test case or task body. */
  public TestCaseContext testCaseContext() {
    return new TestCaseContext(new TestCaseSettings(settings, log()), log());
  }

  /** Creates the context of a keyword body. */
  public KeywordContext keywordContext() {
    return new KeywordContext(new KeywordSettings(log()), log());
  }

  /**
   * Lexes the header of a section this file does not support. The header becomes an error, and
   * the rest of the header line a comment.
   */
  public void lexInvalidSection(List<Token> statement) {
    Token header = statement.get(0);
    String name = normalize(header.value());
    Section section = HEADERS.get(name);
    boolean testSection = section == Section.TEST_CASES || section == Section.TASKS;
    LexLog log = log();
    switch (kind) {
      case RESOURCE -> {
        if (testSection) {
          log.fatal(header, ErrorKind.INVALID_RESOURCE_SECTION, name);
        } else {
          log.error(header, ErrorKind.UNRECOGNIZED_SECTION, header.value(), validSections());
        }
      }
      case INIT -> {
        if (testSection) {
          log.error(header, ErrorKind.INVALID_INIT_SECTION, name);
        } else {
          log.error(header, ErrorKind.UNRECOGNIZED_SECTION, header.value(), validSections());
        }
      }
      case SUITE ->
          log.error(header, ErrorKind.UNRECOGNIZED_SECTION, header.value(), validSections());
    }
    for (Token token : statement.subList(1, statement.size())) {
      token.setType(TokenType.COMMENT);
    }
  }

  /** The valid section names for this kind of file, e.g. {@code 'Settings', ... and 'Comments'}. */
  private String validSections() {
    StringBuilder sb = new StringBuilder();
    Section[] sections = Section.values();
    int count = 0;
    for (Section section : sections) {
      if (!kind.allowsTests() && (section == Section.TEST_CASES || section == Section.TASKS)) {
        continue;
      }
      if (count > 0) {
        sb.append(section == Section.COMMENTS ? " and " : ", ");
      }
      sb.append('\'').append(section.title).append('\'');
      count++;
    }
    return sb.toString();
  }

  private static @Nullable Section section(List<Token> statement) {
    String marker = statement.get(0).value();
    if (!marker.startsWith("*")) {
      return null;
    }
    return HEADERS.get(normalize(marker));
  }

  private static String normalize(String marker) {
    return TokenValues.titleCase(
        HEADER_MARKER.trimFrom(TokenValues.normalizeWhitespace(marker)));
  }
}
