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

import static io.github.koe.sak.jooq.KoeTables.SAK_METADATA;
import static io.github.koe.sak.jooq.KoeTables.SAK_METADATA_SAKSTITTEL;
import static io.github.koe.sak.jooq.KoeTables.SAK_METADATA_SAK_ID;
import static io.github.koe.sak.jooq.KoeTables.SAK_METADATA_SISTE_AKTIVITET;
import static io.github.koe.sak.jooq.KoeTables.SAK_METADATA_STATUS;

import io.github.koe.sak.state.OverordnetStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Record4;
import org.jooq.SelectJoinStep;

/** Keeps {@link SakMetadata} in {@code koe_sak_metadata}. */
public final class JooqSakMetadataCache implements SakMetadataCache {
  private final DSLContext dsl;

  public JooqSakMetadataCache(DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    this.dsl = dsl;
  }

  @Override
  public void update(final SakMetadata metadata) {
    if (metadata == null) {
      throw new IllegalArgumentException("Metadata cannot be null");
    }

    dsl.insertInto(
            SAK_METADATA,
            SAK_METADATA_SAK_ID,
            SAK_METADATA_SAKSTITTEL,
            SAK_METADATA_STATUS,
            SAK_METADATA_SISTE_AKTIVITET)
        .values(
            metadata.sakId(),
            metadata.sakstittel(),
            metadata.status().name(),
            metadata.sisteAktivitet())
        .onConflict(SAK_METADATA_SAK_ID)
        .doUpdate()
        .set(SAK_METADATA_SAKSTITTEL, metadata.sakstittel())
        .set(SAK_METADATA_STATUS, metadata.status().name())
        .set(SAK_METADATA_SISTE_AKTIVITET, metadata.sisteAktivitet())
        .execute();
  }

  @Override
  public Optional<SakMetadata> find(final String sakId) {
    return selectMetadata()
        .where(SAK_METADATA_SAK_ID.eq(sakId))
        .fetchOptional()
        .map(JooqSakMetadataCache::toMetadata);
  }

  @Override
  public List<SakMetadata> list() {
    return selectMetadata()
        .orderBy(SAK_METADATA_SISTE_AKTIVITET.desc(), SAK_METADATA_SAK_ID)
        .fetch()
        .map(JooqSakMetadataCache::toMetadata);
  }

  private SelectJoinStep<Record4<String, String, String, Instant>> selectMetadata() {
    return dsl.select(
            SAK_METADATA_SAK_ID,
            SAK_METADATA_SAKSTITTEL,
            SAK_METADATA_STATUS,
            SAK_METADATA_SISTE_AKTIVITET)
        .from(SAK_METADATA);
  }

  private static SakMetadata toMetadata(Record4<String, String, String, Instant> dbRecord) {
    return new SakMetadata(
        dbRecord.value1(),
        dbRecord.value2(),
        OverordnetStatus.valueOf(dbRecord.value3()),
        dbRecord.value4());
  }
}
