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

package com.google.suitelex.options;

import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoBuilder;
import com.google.suitelex.context.FileKind;

/**
 * Lexing options.
 *
 * @param fileKind The kind of file being lexed, which decides the valid sections and settings.
 * @param dataOnly Omit comments and comment section headers from the emitted tokens.
 */
public record LexerOptions(FileKind fileKind, boolean dataOnly) {
  public LexerOptions {
    requireNonNull(fileKind, "fileKind");
  }

  public static LexerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoBuilder_LexerOptions_Builder().setFileKind(FileKind.SUITE).setDataOnly(false);
  }

  /** A {@link Builder} for {@link LexerOptions}. */
  @AutoBuilder
  public abstract static class Builder {
    public abstract Builder setFileKind(FileKind fileKind);

    public abstract Builder setDataOnly(boolean dataOnly);

    public abstract LexerOptions build();
  }
}
