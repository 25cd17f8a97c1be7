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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.nio.file.Path;

/**
 * Settings for a {@link FunctionTransformer}.
 *
 * <p>{@link #fromSystemProperties} reads
 *
 * <ul>
 *   <li>{@code threadline.stagingDir}: where transformed source is written (default {@link
 *       SourceStaging#defaultDirectory()})
 *   <li>{@code threadline.stageSource}: whether to write it at all (default true)
 *   <li>{@code threadline.deleteOnExit}: whether to delete the staging directory when the JVM exits
 *       (default true)
 * </ul>
 */
public final class TransformOptions {
  public static final String STAGING_DIR_PROPERTY = "threadline.stagingDir";
  public static final String STAGE_SOURCE_PROPERTY = "threadline.stageSource";
  public static final String DELETE_ON_EXIT_PROPERTY = "threadline.deleteOnExit";

  public final Path stagingDir;
  public final boolean stageSource;
  public final boolean deleteOnExit;

  private TransformOptions(Builder builder) {
    this.stagingDir = builder.stagingDir;
    this.stageSource = builder.stageSource;
    this.deleteOnExit = builder.deleteOnExit;
  }

  public static TransformOptions fromSystemProperties() {
    String dir = System.getProperty(STAGING_DIR_PROPERTY);
    return builder()
        .stagingDir((dir == null) ? SourceStaging.defaultDirectory() : Path.of(dir))
        .stageSource(Boolean.parseBoolean(System.getProperty(STAGE_SOURCE_PROPERTY, "true")))
        .deleteOnExit(Boolean.parseBoolean(System.getProperty(DELETE_ON_EXIT_PROPERTY, "true")))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return String.format(
        "TransformOptions{stagingDir=%s, stageSource=%s, deleteOnExit=%s}",
        stagingDir, stageSource, deleteOnExit);
  }

  public static final class Builder {
    private Path stagingDir = SourceStaging.defaultDirectory();
    private boolean stageSource = true;
    private boolean deleteOnExit = true;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder stagingDir(Path stagingDir) {
      this.stagingDir = Preconditions.checkNotNull(stagingDir);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder stageSource(boolean stageSource) {
      this.stageSource = stageSource;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder deleteOnExit(boolean deleteOnExit) {
      this.deleteOnExit = deleteOnExit;
      return this;
    }

    public TransformOptions build() {
      return new TransformOptions(this);
    }
  }
}
