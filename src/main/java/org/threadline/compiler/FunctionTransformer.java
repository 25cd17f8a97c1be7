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

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.io.IOException;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadline.ast.SourcePrinter;
import org.threadline.ast.Stmt;

/**
 * Runs the transformation pipeline (scope analysis, undefined-variable declaration, printing, and
 * optionally staging) at most once for each function.
 *
 * <p>Functions are identified by node identity. The first caller for a function does the work;
 * anyone else who asks for the same function while it is in progress waits for that result rather
 * than starting another, and later callers get the memoized result. If the transformation fails,
 * every waiting caller sees the failure and the function is forgotten, so a later call will try
 * again.
 *
 * <p>Results (and so the trees they were computed from) are kept until they are removed with
 * {@link #forget} or {@link #clear}; a transformer that sees an unbounded stream of functions
 * should either do that or be discarded itself.
 */
public final class FunctionTransformer {

  private static final Logger logger = LoggerFactory.getLogger(FunctionTransformer.class);

  private final TransformOptions options;
  private final Diagnostics diagnostics;

  @GuardedBy("this")
  private final Map<Stmt.FunctionDef, FutureTask<TransformedFunction>> results =
      new IdentityHashMap<>();

  /** The number of times the pipeline has actually run. */
  private final AtomicInteger runs = new AtomicInteger();

  public FunctionTransformer(TransformOptions options, Diagnostics diagnostics) {
    this.options = options;
    this.diagnostics = diagnostics;
  }

  public FunctionTransformer(TransformOptions options) {
    this(options, Diagnostics.LOGGING);
  }

  /**
   * Returns the transformed form of {@code function}, transforming it if this is the first request.
   *
   * @throws AnalysisError if the function cannot be analyzed
   * @throws TransformException if transformation failed with a checked exception
   */
  public TransformedFunction transform(Stmt.FunctionDef function) {
    FutureTask<TransformedFunction> task;
    boolean owner = false;
    synchronized (this) {
      task = results.get(function);
      if (task == null) {
        task = new FutureTask<>(() -> run(function));
        results.put(function, task);
        owner = true;
      }
    }
    if (owner) {
      // Run on this thread; callers that arrive meanwhile block in get() below.
      task.run();
    }
    try {
      return Uninterruptibles.getUninterruptibly(task);
    } catch (ExecutionException e) {
      synchronized (this) {
        results.remove(function, task);
      }
      Throwable cause = e.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new TransformException(function.name, cause);
    }
  }

  /** Returns true if {@code function} has been successfully transformed (or is in progress). */
  public synchronized boolean isTransformed(Stmt.FunctionDef function) {
    return results.containsKey(function);
  }

  /**
   * Drops the memoized result for {@code function}, so that the next call to {@link #transform}
   * runs the pipeline again. A transformation already in progress is unaffected; callers waiting
   * for it still get its result. Returns false if there was nothing to drop.
   */
  @CanIgnoreReturnValue
  public synchronized boolean forget(Stmt.FunctionDef function) {
    return results.remove(function) != null;
  }

  /** Drops every memoized result; see {@link #forget}. */
  public synchronized void clear() {
    results.clear();
  }

  /** Returns the number of functions with a memoized (or in-progress) result. */
  public synchronized int size() {
    return results.size();
  }

  int runCount() {
    return runs.get();
  }

  private TransformedFunction run(Stmt.FunctionDef function) throws IOException {
    runs.incrementAndGet();
    ScopeAnalysis analysis = LivenessAnalysis.analyze(function, diagnostics);
    int declared = UndefinedVarDeclarer.declare(analysis);
    String source = SourcePrinter.toSource(function);
    Optional<Path> staged = Optional.empty();
    if (options.stageSource) {
      SourceStaging.initialize(options);
      // Different functions may share a name, so each staged file gets a fresh one.
      String fileName = UniqueNames.GLOBAL.generate(function.name);
      staged = Optional.of(SourceStaging.stage(fileName, source));
    }
    logger.debug(
        "Transformed '{}' ({} scopes, {} undefined declarations)",
        function.name,
        analysis.size(),
        declared);
    return new TransformedFunction(function, analysis, source, staged);
  }
}
