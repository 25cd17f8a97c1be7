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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Preconditions;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadline.ast.QualifiedNames;

/**
 * A process-wide directory where transformed source is written before it is handed to whatever
 * makes it callable.
 *
 * <p>The lifecycle is explicit: {@link #initialize} creates the directory (calling it again while
 * initialized just returns the current directory), {@link #stage} writes files into it, and {@link
 * #shutdown} deletes it if it was initialized with {@code deleteOnExit}. The first initialization
 * that requests {@code deleteOnExit} also registers a JVM shutdown hook that calls {@link
 * #shutdown}; the hook is registered at most once per process, however many times the directory is
 * initialized and shut down.
 */
public final class SourceStaging {

  private static final Logger logger = LoggerFactory.getLogger(SourceStaging.class);

  /** The extension of staged source files. */
  public static final String EXTENSION = ".tl";

  @GuardedBy("SourceStaging.class")
  private static @Nullable Path directory;

  @GuardedBy("SourceStaging.class")
  private static boolean deleteOnExit;

  @GuardedBy("SourceStaging.class")
  private static boolean hookRegistered;

  private SourceStaging() {}

  /** Returns {@code ~/.cache/threadline/staging/<pid>}. */
  public static Path defaultDirectory() {
    return Path.of(
        System.getProperty("user.home"),
        ".cache",
        "threadline",
        "staging",
        String.valueOf(ProcessHandle.current().pid()));
  }

  /**
   * Creates the staging directory if it doesn't already exist and makes it the current one. If
   * staging is already initialized this does nothing and returns the existing directory.
   *
   * @throws UncheckedIOException if the directory cannot be created
   */
  @CanIgnoreReturnValue
  public static synchronized Path initialize(Path dir, boolean deleteOnExit) {
    if (directory != null) {
      if (!directory.equals(dir)) {
        logger.debug("Staging already initialized at {}; ignoring {}", directory, dir);
      }
      return directory;
    }
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create staging directory " + dir, e);
    }
    directory = dir;
    SourceStaging.deleteOnExit = deleteOnExit;
    if (deleteOnExit && !hookRegistered) {
      Thread hook = new Thread(SourceStaging::shutdownQuietly, "threadline-staging-cleanup");
      Runtime.getRuntime().addShutdownHook(hook);
      hookRegistered = true;
    }
    logger.info("Staging transformed source in {}", dir);
    return dir;
  }

  /** Initializes staging from the given options; see {@link #initialize(Path, boolean)}. */
  @CanIgnoreReturnValue
  public static Path initialize(TransformOptions options) {
    return initialize(options.stagingDir, options.deleteOnExit);
  }

  public static synchronized boolean isInitialized() {
    return directory != null;
  }

  /** Returns the current staging directory, or null if staging is not initialized. */
  public static synchronized @Nullable Path directory() {
    return directory;
  }

  static synchronized boolean isHookRegistered() {
    return hookRegistered;
  }

  /**
   * Writes the given source to {@code <name>.tl} in the staging directory, replacing any previous
   * file with that name, and returns its path.
   *
   * @throws IllegalStateException if staging has not been initialized
   */
  public static Path stage(String name, String source) throws IOException {
    Preconditions.checkArgument(QualifiedNames.isIdentifier(name), "Bad file name '%s'", name);
    Path dir;
    synchronized (SourceStaging.class) {
      Preconditions.checkState(directory != null, "Staging has not been initialized");
      dir = directory;
    }
    Path file = dir.resolve(name + EXTENSION);
    try (Writer writer = Files.newBufferedWriter(file, UTF_8)) {
      writer.write(source);
    }
    logger.debug("Staged {}", file);
    return file;
  }

  /**
   * Ends staging: if the directory was initialized with {@code deleteOnExit} it is deleted along
   * with its contents. Does nothing if staging is not initialized. Staging may be initialized again
   * afterwards.
   *
   * @throws UncheckedIOException if the directory cannot be deleted
   */
  public static synchronized void shutdown() {
    if (directory == null) {
      return;
    }
    Path dir = directory;
    boolean delete = deleteOnExit;
    directory = null;
    deleteOnExit = false;
    if (delete && Files.exists(dir)) {
      try {
        MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to delete staging directory " + dir, e);
      }
      logger.debug("Deleted staging directory {}", dir);
    }
  }

  /** Called from the shutdown hook, where there is no one left to throw to. */
  private static void shutdownQuietly() {
    try {
      shutdown();
    } catch (UncheckedIOException e) {
      logger.warn("Staging cleanup failed", e);
    }
  }
}
