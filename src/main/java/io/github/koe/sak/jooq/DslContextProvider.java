/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.koe.sak.jooq;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import org.jooq.DSLContext;

/**
 * Chooses the {@link DSLContext} which holds the log of a given case, allowing cases to be spread
 * over several databases.
 */
public interface DslContextProvider extends Function<String, DSLContext> {
  /**
   * @return every {@link DSLContext} this provider can route to, used for operations spanning all
   *     cases
   */
  Collection<DSLContext> all();

  /**
   * Similar to {@link Function#identity()}.
   *
   * @param dslContext to create {@link DslContextProvider} with
   * @return a new instance of {@link DslContextProvider} which simply returns provided {@link
   *     DSLContext} for every case
   */
  static DslContextProvider dslContextIdentity(DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return new DslContextProvider() {
      private final DSLContext context = dslContext;

      @Override
      public DSLContext apply(String sakId) {
        return context;
      }

      @Override
      public Collection<DSLContext> all() {
        return List.of(context);
      }
    };
  }
}
