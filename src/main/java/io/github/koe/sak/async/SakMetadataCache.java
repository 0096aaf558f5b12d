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

package io.github.koe.sak.async;

import java.util.List;
import java.util.Optional;

/**
 * Title and status cache for case listings.
 *
 * <p>Never authoritative: every entry can be recomputed from the case log at any time.
 */
public interface SakMetadataCache {
  /**
   * @return an instance of cache which does not remember anything
   */
  static SakMetadataCache empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Inserts or replaces the entry of a case.
   *
   * @param metadata to store
   */
  void update(final SakMetadata metadata);

  Optional<SakMetadata> find(final String sakId);

  List<SakMetadata> list();

  /** Default implementation of the fake cache */
  final class NoOp implements SakMetadataCache {
    private static final SakMetadataCache INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void update(final SakMetadata metadata) {
      // Do nothing
    }

    @Override
    public Optional<SakMetadata> find(final String sakId) {
      return Optional.empty();
    }

    @Override
    public List<SakMetadata> list() {
      return List.of();
    }
  }
}
