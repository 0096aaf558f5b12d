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

import static io.github.koe.sak.jooq.KoeTables.SAK_EVENT;
import static io.github.koe.sak.jooq.KoeTables.SAK_EVENT_EVENT_ID;
import static io.github.koe.sak.jooq.KoeTables.SAK_EVENT_EVENT_TYPE;
import static io.github.koe.sak.jooq.KoeTables.SAK_EVENT_PAYLOAD;
import static io.github.koe.sak.jooq.KoeTables.SAK_EVENT_SAK_ID;
import static io.github.koe.sak.jooq.KoeTables.SAK_EVENT_SEKVENS;
import static io.github.koe.sak.jooq.KoeTables.SAK_EVENT_TIDSSTEMPEL;

import io.github.koe.sak.event.EventParser;
import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.jooq.DslContextProvider;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.InsertValuesStep6;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps every event in its own row of {@code koe_sak_event}, numbered by {@code sekvens}.
 *
 * <p>An append counts the rows of the case and inserts the batch in one transaction. The primary
 * key on {@code (sak_id, sekvens)} is the compare-and-swap: if another process appended between
 * the count and the insert, the insert collides on an occupied slot and the whole batch is rolled
 * back.
 */
public final class JooqEventStore extends AbstractEventStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqEventStore.class);

  private final DslContextProvider dslContextProvider;
  private final EventParser eventParser;

  public JooqEventStore(DslContextProvider dslContextProvider, EventParser eventParser) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (eventParser == null) {
      throw new IllegalArgumentException("Event parser cannot be null");
    }

    this.dslContextProvider = dslContextProvider;
    this.eventParser = eventParser;
  }

  /** {@inheritDoc} */
  @Override
  protected int compareAndWrite(String sakId, List<SakEvent> batch, int expectedVersion) {
    final DSLContext dsl = dslFor(sakId);

    try {
      return dsl.transactionResult(
          (final Configuration trx) -> insertBatch(trx.dsl(), sakId, batch, expectedVersion));
    } catch (DataAccessException e) {
      if (e.sqlStateClass() != SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw e;
      }

      final int actualVersion = dsl.fetchCount(SAK_EVENT, SAK_EVENT_SAK_ID.eq(sakId));
      throw new ConcurrencyException(expectedVersion, actualVersion, e);
    }
  }

  private int insertBatch(
      DSLContext trxDsl, String sakId, List<SakEvent> batch, int expectedVersion) {
    final int actualVersion = trxDsl.fetchCount(SAK_EVENT, SAK_EVENT_SAK_ID.eq(sakId));
    if (actualVersion != expectedVersion) {
      throw new ConcurrencyException(expectedVersion, actualVersion);
    }

    // @formatter:off
    InsertValuesStep6<Record, String, Integer, UUID, String, Instant, String> insert =
        trxDsl.insertInto(
            SAK_EVENT,
            SAK_EVENT_SAK_ID,
            SAK_EVENT_SEKVENS,
            SAK_EVENT_EVENT_ID,
            SAK_EVENT_EVENT_TYPE,
            SAK_EVENT_TIDSSTEMPEL,
            SAK_EVENT_PAYLOAD);
    // @formatter:on

    int sekvens = actualVersion;
    for (SakEvent event : batch) {
      sekvens++;
      insert =
          insert.values(
              sakId,
              sekvens,
              event.eventId(),
              event.eventType().value(),
              event.tidsstempel(),
              eventParser.toJson(event));
    }

    insert.execute();
    return sekvens;
  }

  /** {@inheritDoc} */
  @Override
  public EventLog getEvents(String sakId) {
    if (sakId == null) {
      throw new IllegalArgumentException("Sak ID cannot be null");
    }

    // A single statement sees a single snapshot, so the version is the number of rows read
    final List<String> payloads =
        dslFor(sakId)
            .select(SAK_EVENT_PAYLOAD)
            .from(SAK_EVENT)
            .where(SAK_EVENT_SAK_ID.eq(sakId))
            .orderBy(SAK_EVENT_SEKVENS)
            .fetch(SAK_EVENT_PAYLOAD);

    LOGGER.debug("Read {} event(s) of sak {}", payloads.size(), sakId);
    return EventLog.of(payloads.stream().map(eventParser::read).toList());
  }

  /** {@inheritDoc} */
  @Override
  public List<String> listSakIds() {
    return dslContextProvider.all().stream()
        .flatMap(
            dsl ->
                dsl.selectDistinct(SAK_EVENT_SAK_ID)
                    .from(SAK_EVENT)
                    .fetch(SAK_EVENT_SAK_ID)
                    .stream())
        .distinct()
        .sorted()
        .toList();
  }

  private DSLContext dslFor(String sakId) {
    final DSLContext dsl = dslContextProvider.apply(sakId);
    if (dsl == null) {
      throw new IllegalStateException("No DSLContext for sak %s".formatted(sakId));
    }

    return dsl;
  }
}
