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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** The kind of file being lexed, which decides the sections and settings it may contain. */
public enum FileKind {
  SUITE(
      "suite",
      /* allowsTests= */ true,
      ImmutableSet.of(
          "Documentation",
          "Metadata",
          "Suite Setup",
          "Suite Teardown",
          "Test Setup",
          "Test Teardown",
          "Test Template",
          "Test Timeout",
          "Force Tags",
          "Default Tags",
          "Library",
          "Resource",
          "Variables")),
  RESOURCE(
      "resource",
      /* allowsTests= */ false,
      ImmutableSet.of("Documentation", "Library", "Resource", "Variables")),
  INIT(
      "suite initialization",
      /* allowsTests= */ false,
      ImmutableSet.of(
          "Documentation",
          "Metadata",
          "Suite Setup",
          "Suite Teardown",
          "Test Setup",
          "Test Teardown",
          "Test Timeout",
          "Force Tags",
          "Library",
          "Resource",
          "Variables"));

  /** Task settings are spelled like test settings when the suite contains tasks. */
  static final ImmutableMap<String, String> TASK_ALIASES =
      ImmutableMap.of(
          "Task Setup", "Test Setup",
          "Task Teardown", "Test Teardown",
          "Task Template", "Test Template",
          "Task Timeout", "Test Timeout");

  private final String description;
  private final boolean allowsTests;
  private final ImmutableSet<String> settingNames;

  FileKind(String description, boolean allowsTests, ImmutableSet<String> settingNames) {
    this.description = description;
    this.allowsTests = allowsTests;
    this.settingNames = settingNames;
  }

  /** How error messages refer to the file, e.g. {@code resource}. */
  public String description() {
    return description;
  }

  /** Whether test case and task sections are allowed. */
  public boolean allowsTests() {
    return allowsTests;
  }

  ImmutableSet<String> settingNames() {
    return settingNames;
  }
}
