/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cykgen.compile;

import java.util.List;
import net.hydromatic.cykgen.ast.Procedure;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during code generation. */
public interface Tracer {
  /** Called when a traversal skeleton has been built and decorated with
   * evaluation calls. */
  void onSkeleton(CykMode mode, String code);

  /** Called when the procedure is complete. */
  void onProcedure(Procedure procedure);

  /** Called with the list of warnings found while validating the
   * program. */
  void onWarnings(List<CompileException> warningList);

  /**
   * Called with the exception thrown during generation, or null if no
   * exception was thrown. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
