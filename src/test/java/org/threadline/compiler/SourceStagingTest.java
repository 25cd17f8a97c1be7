/*
 * Copyright 2025 The Threadline Authors
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

package org.threadline.compiler;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SourceStagingTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  @Before
  @After
  public void reset() {
    SourceStaging.shutdown();
  }

  @Test
  public void stagesIntoDirectory() throws Exception {
    Path dir = tmp.getRoot().toPath().resolve("staging");
    assertThat(SourceStaging.isInitialized()).isFalse();
    assertThat(SourceStaging.initialize(dir, false)).isEqualTo(dir);
    assertThat(Files.isDirectory(dir)).isTrue();
    Path file = SourceStaging.stage("f_0", "def f():\n    pass\n");
    assertThat(file).isEqualTo(dir.resolve("f_0" + SourceStaging.EXTENSION));
    assertThat(new String(Files.readAllBytes(file), UTF_8)).isEqualTo("def f():\n    pass\n");
  }

  @Test
  public void initializeIsIdempotent() {
    Path first = tmp.getRoot().toPath().resolve("first");
    Path second = tmp.getRoot().toPath().resolve("second");
    SourceStaging.initialize(first, false);
    assertThat(SourceStaging.initialize(second, false)).isEqualTo(first);
    assertThat(SourceStaging.directory()).isEqualTo(first);
    assertThat(Files.exists(second)).isFalse();
  }

  @Test
  public void shutdownDeletesWhenRequested() throws Exception {
    Path dir = tmp.getRoot().toPath().resolve("deleted");
    SourceStaging.initialize(dir, true);
    assertThat(SourceStaging.isHookRegistered()).isTrue();
    SourceStaging.stage("g_0", "pass\n");
    SourceStaging.shutdown();
    assertThat(SourceStaging.isInitialized()).isFalse();
    assertThat(Files.exists(dir)).isFalse();

    // Staging can be started again; the hook stays registered.
    Path again = tmp.getRoot().toPath().resolve("again");
    SourceStaging.initialize(again, true);
    assertThat(SourceStaging.isHookRegistered()).isTrue();
    assertThat(SourceStaging.directory()).isEqualTo(again);
  }

  @Test
  public void shutdownKeepsDirectoryOtherwise() throws Exception {
    Path dir = tmp.getRoot().toPath().resolve("kept");
    SourceStaging.initialize(dir, false);
    Path file = SourceStaging.stage("h_0", "pass\n");
    SourceStaging.shutdown();
    assertThat(Files.exists(file)).isTrue();
    // Shutting down again does nothing.
    SourceStaging.shutdown();
  }

  @Test
  public void stageRequiresInitialization() {
    assertThrows(IllegalStateException.class, () -> SourceStaging.stage("f", "pass\n"));
  }

  @Test
  public void stageRejectsBadNames() {
    SourceStaging.initialize(tmp.getRoot().toPath(), false);
    assertThrows(IllegalArgumentException.class, () -> SourceStaging.stage("../f", "pass\n"));
  }

  @Test
  public void defaultDirectoryIsPerProcess() {
    Path dir = SourceStaging.defaultDirectory();
    assertThat(dir.getFileName().toString())
        .isEqualTo(String.valueOf(ProcessHandle.current().pid()));
    assertThat(dir.getParent().getFileName().toString()).isEqualTo("staging");
  }
}
