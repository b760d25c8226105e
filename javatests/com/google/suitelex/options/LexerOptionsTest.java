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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.suitelex.context.FileKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LexerOptionsTest {

  @Test
  public void defaults() {
    LexerOptions options = LexerOptions.defaults();
    assertThat(options.fileKind()).isEqualTo(FileKind.SUITE);
    assertThat(options.dataOnly()).isFalse();
  }

  @Test
  public void builder() {
    LexerOptions options =
        LexerOptions.builder().setFileKind(FileKind.RESOURCE).setDataOnly(true).build();
    assertThat(options.fileKind()).isEqualTo(FileKind.RESOURCE);
    assertThat(options.dataOnly()).isTrue();
    assertThat(options).isEqualTo(new LexerOptions(FileKind.RESOURCE, true));
  }

  @Test
  public void fileKindIsRequired() {
    assertThrows(NullPointerException.class, () -> new LexerOptions(null, false));
  }
}
