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

import static org.jooq.impl.DSL.constraint;
import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

import java.time.Instant;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.SQLDataType;

/** Tables of the case core, declared without code generation. */
public final class KoeTables {
  /** One row per event. The primary key on the slot makes a second writer of a slot fail. */
  public static final Table<Record> SAK_EVENT = table(name("koe_sak_event"));

  public static final Field<String> SAK_EVENT_SAK_ID =
      field(name("sak_id"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<Integer> SAK_EVENT_SEKVENS =
      field(name("sekvens"), SQLDataType.INTEGER.nullable(false));
  public static final Field<UUID> SAK_EVENT_EVENT_ID =
      field(name("event_id"), SQLDataType.UUID.nullable(false));
  public static final Field<String> SAK_EVENT_EVENT_TYPE =
      field(name("event_type"), SQLDataType.VARCHAR(64).nullable(false));
  public static final Field<Instant> SAK_EVENT_TIDSSTEMPEL =
      field(name("tidsstempel"), SQLDataType.INSTANT.nullable(false));
  public static final Field<String> SAK_EVENT_PAYLOAD =
      field(name("payload"), SQLDataType.CLOB.nullable(false));

  /** Rebuildable title and status cache for case listings. */
  public static final Table<Record> SAK_METADATA = table(name("koe_sak_metadata"));

  public static final Field<String> SAK_METADATA_SAK_ID =
      field(name("sak_id"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> SAK_METADATA_SAKSTITTEL =
      field(name("sakstittel"), SQLDataType.VARCHAR(500));
  public static final Field<String> SAK_METADATA_STATUS =
      field(name("status"), SQLDataType.VARCHAR(64).nullable(false));
  public static final Field<Instant> SAK_METADATA_SISTE_AKTIVITET =
      field(name("siste_aktivitet"), SQLDataType.INSTANT);

  private KoeTables() {
    // Cannot be instantiated from the outside
  }

  /**
   * Creates missing tables.
   *
   * @param dsl to execute the DDL with
   */
  public static void createIfNotExists(DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    dsl.createTableIfNotExists(SAK_EVENT)
        .column(SAK_EVENT_SAK_ID)
        .column(SAK_EVENT_SEKVENS)
        .column(SAK_EVENT_EVENT_ID)
        .column(SAK_EVENT_EVENT_TYPE)
        .column(SAK_EVENT_TIDSSTEMPEL)
        .column(SAK_EVENT_PAYLOAD)
        .constraints(
            constraint("pk_koe_sak_event").primaryKey(SAK_EVENT_SAK_ID, SAK_EVENT_SEKVENS),
            constraint("uk_koe_sak_event_event_id").unique(SAK_EVENT_EVENT_ID))
        .execute();

    dsl.createTableIfNotExists(SAK_METADATA)
        .column(SAK_METADATA_SAK_ID)
        .column(SAK_METADATA_SAKSTITTEL)
        .column(SAK_METADATA_STATUS)
        .column(SAK_METADATA_SISTE_AKTIVITET)
        .constraints(constraint("pk_koe_sak_metadata").primaryKey(SAK_METADATA_SAK_ID))
        .execute();
  }
}
