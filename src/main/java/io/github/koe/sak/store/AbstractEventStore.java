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

package io.github.koe.sak.store;

import io.github.koe.sak.event.SakEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements the append algorithm once: check the batch, take the per-case lock, then let the
 * persistence medium compare the version and write.
 *
 * <p>Implementations only have to make {@link #compareAndWrite(String, List, int)} atomic for the
 * medium they use.
 */
public abstract class AbstractEventStore implements EventStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractEventStore.class);

  private final SakLocks sakLocks = new SakLocks();

  /** {@inheritDoc} */
  @Override
  public final int appendBatch(List<? extends SakEvent> events, int expectedVersion) {
    if (events == null || events.isEmpty()) {
      throw new IllegalArgumentException("Kan ikke legge til tom event-liste");
    }

    final String sakId = events.get(0).sakId();
    for (SakEvent event : events) {
      if (event == null) {
        throw new IllegalArgumentException("Event cannot be null");
      }

      if (sakId == null || !sakId.equals(event.sakId())) {
        throw new IllegalArgumentException("Alle events må tilhøre samme sak_id");
      }
    }

    final List<SakEvent> batch = List.copyOf(events);

    try {
      final int newVersion =
          sakLocks.withLock(sakId, () -> compareAndWrite(sakId, batch, expectedVersion));
      LOGGER.info(
          "Appended {} event(s) to sak {}, version {} -> {}",
          batch.size(),
          sakId,
          expectedVersion,
          newVersion);
      return newVersion;
    } catch (ConcurrencyException e) {
      LOGGER.warn("Rejected append to sak {}: {}", sakId, e.getMessage());
      throw e;
    }
  }

  /**
   * Compares the current version of the log with {@code expectedVersion} and, when they match,
   * durably appends the batch. Both steps must be atomic with respect to other writers of the
   * same medium; writers of this instance are already serialised per case.
   *
   * @param sakId shared by every event of the batch
   * @param batch non-empty events to append, in order
   * @param expectedVersion the caller observed
   * @return the new version
   * @throws ConcurrencyException when the log version differs from {@code expectedVersion}
   */
  protected abstract int compareAndWrite(String sakId, List<SakEvent> batch, int expectedVersion);
}
