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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Diagnostics object receives each {@link Diagnostic} as it is produced, to enable logging or
 * other tracking.
 */
@FunctionalInterface
public interface Diagnostics {

  /** Called once for each diagnostic. */
  void report(Diagnostic diagnostic);

  /** Logs each diagnostic as an SLF4J warning. */
  Diagnostics LOGGING = new Diagnostics() {
    private final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    @Override
    public void report(Diagnostic diagnostic) {
      logger.warn("{}", diagnostic.message);
    }
  };
}
