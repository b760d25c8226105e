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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.suitelex.diag.LexError.ErrorKind;
import com.google.suitelex.diag.LexLog;
import com.google.suitelex.lex.Token;
import com.google.suitelex.lex.TokenType;
import com.google.suitelex.lex.TokenValues;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The settings allowed in one scope, and the values seen so far.
 *
 * <p>A setting statement is the setting name followed by its values. Invalid settings are
 * reported on the name token, and their values are lexed as comments.
 */
public abstract class Settings {

  private static final ImmutableSet<String> MULTI_USE =
      ImmutableSet.of("Metadata", "Library", "Resource", "Variables");

  private static final ImmutableSet<String> SINGLE_VALUE =
      ImmutableSet.of("Resource", "Test Timeout", "Test Template", "Timeout", "Template");

  private static final ImmutableSet<String> NAME_AND_ARGUMENTS =
      ImmutableSet.of(
          "Metadata",
          "Suite Setup",
          "Suite Teardown",
          "Test Setup",
          "Test Teardown",
          "Test Template",
          "Setup",
          "Teardown",
          "Template",
          "Resource",
          "Variables",
          "Library");

  private final ImmutableSet<String> names;
  private final ImmutableMap<String, String> aliases;
  private final LexLog log;
  private final Map<String, ImmutableList<Token>> values = new HashMap<>();

  Settings(ImmutableSet<String> names, ImmutableMap<String, String> aliases, LexLog log) {
    this.names = names;
    this.aliases = aliases;
    this.log = log;
  }

  public void lex(List<Token> statement) {
    Token setting = statement.get(0);
    List<Token> rest = statement.subList(1, statement.size());
    String orig = formatName(setting.value());
    String name = TokenValues.titleCase(TokenValues.normalizeWhitespace(orig));
    name = aliases.getOrDefault(name, name);
    if (!names.contains(name)) {
      reportUnknown(setting, orig, name);
      lexError(rest);
      return;
    }
    List<Token> previous = values.get(name);
    if (previous != null && !previous.isEmpty() && !MULTI_USE.contains(name)) {
      log.error(setting, ErrorKind.DUPLICATE_SETTING, orig);
      lexError(rest);
      return;
    }
    if (SINGLE_VALUE.contains(name) && rest.size() > 1) {
      log.error(setting, ErrorKind.TOO_MANY_SETTING_VALUES, orig, rest.size());
      lexError(rest);
      return;
    }
    values.put(name, ImmutableList.copyOf(rest));
    setting.setType(TokenType.forSetting(name));
    if (NAME_AND_ARGUMENTS.contains(name)) {
      lexNameAndArguments(rest);
    } else {
      lexArguments(rest);
    }
    if (name.equals("Library")) {
      lexWithName(rest);
    }
  }

  /** Returns the setting name as written, without any decoration of this scope. */
  String formatName(String name) {
    return name;
  }

  void reportUnknown(Token setting, String orig, String name) {
    log.error(setting, ErrorKind.NON_EXISTING_SETTING, orig);
  }

  LexLog log() {
    return log;
  }

  /** The values of the named setting, or {@code null} if it has not been set. */
  @Nullable ImmutableList<Token> value(String name) {
    return values.get(name);
  }

  /** Whether the setting was given a value, i.e. its first value is not empty. */
  static boolean hasValue(@Nullable List<Token> setting) {
    return setting != null && !setting.isEmpty() && !Strings.isNullOrEmpty(setting.get(0).value());
  }

  private static void lexError(List<Token> values) {
    for (Token token : values) {
      token.setType(TokenType.COMMENT);
    }
  }

  private static void lexNameAndArguments(List<Token> tokens) {
    if (!tokens.isEmpty()) {
      tokens.get(0).setType(TokenType.NAME);
      lexArguments(tokens.subList(1, tokens.size()));
    }
  }

  private static void lexArguments(List<Token> tokens) {
    for (Token token : tokens) {
      token.setType(TokenType.ARGUMENT);
    }
  }

  /** Lexes a trailing {@code WITH NAME  alias} of a library import. */
  private static void lexWithName(List<Token> tokens) {
    int size = tokens.size();
    if (size > 2
        && TokenValues.normalizeWhitespace(tokens.get(size - 2).value()).equals("WITH NAME")) {
      tokens.get(size - 2).setType(TokenType.WITH_NAME);
      tokens.get(size - 1).setType(TokenType.NAME);
    }
  }
}
