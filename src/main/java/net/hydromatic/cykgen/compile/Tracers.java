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
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.cykgen.ast.Procedure;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each skeleton,
   * then calls the underlying tracer. */
  public static Tracer withOnSkeleton(Tracer tracer,
      BiConsumer<CykMode, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSkeleton(CykMode mode, String code) {
        consumer.accept(mode, code);
        super.onSkeleton(mode, code);
      }
    };
  }

  /** Returns a tracer that performs the given action on the generated
   * procedure, then calls the underlying tracer. */
  public static Tracer withOnProcedure(Tracer tracer,
      Consumer<Procedure> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onProcedure(Procedure procedure) {
        consumer.accept(procedure);
        super.onProcedure(procedure);
      }
    };
  }

  public static Tracer withOnWarnings(Tracer tracer,
      Consumer<List<CompileException>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onWarnings(List<CompileException> warningList) {
        consumer.accept(warningList);
        super.onWarnings(warningList);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleCompileException(
          @Nullable CompileException e) {
        if (e != null) {
          consumer.accept(e);
        }
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onSkeleton(CykMode mode, String code) {
    }

    @Override public void onProcedure(Procedure procedure) {
    }

    @Override public void onWarnings(List<CompileException> warningList) {
    }

    @Override public boolean handleCompileException(
        @Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onSkeleton(CykMode mode, String code) {
      tracer.onSkeleton(mode, code);
    }

    @Override public void onProcedure(Procedure procedure) {
      tracer.onProcedure(procedure);
    }

    @Override public void onWarnings(List<CompileException> warningList) {
      tracer.onWarnings(warningList);
    }

    @Override public boolean handleCompileException(
        @Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
