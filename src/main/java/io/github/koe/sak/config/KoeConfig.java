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

package io.github.koe.sak.config;

import io.github.koe.sak.async.JooqSakMetadataCache;
import io.github.koe.sak.async.SakMetadataCache;
import io.github.koe.sak.async.SakNotificationSink;
import io.github.koe.sak.cqrs.SakService;
import io.github.koe.sak.event.EventParser;
import io.github.koe.sak.jooq.DriverManagerConnectionProvider;
import io.github.koe.sak.jooq.DslContextProvider;
import io.github.koe.sak.jooq.KoeTables;
import io.github.koe.sak.rules.BusinessRuleValidator;
import io.github.koe.sak.state.StateProjector;
import io.github.koe.sak.store.EventStore;
import io.github.koe.sak.store.JooqEventStore;
import io.github.koe.sak.store.JsonFileEventStore;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of the case core and the wiring that depends on them.
 *
 * <p>Every key is looked up in three places, the later ones winning:
 *
 * <ol>
 *   <li>{@value #RESOURCE} on the classpath, as {@code store.type}
 *   <li>system properties, as {@code koe.store.type}
 *   <li>environment variables, as {@code KOE_STORE_TYPE}
 * </ol>
 */
public final class KoeConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(KoeConfig.class);

  public static final String RESOURCE = "koe.properties";

  public static final String STORE_TYPE = "store.type";
  public static final String STORE_FILE_DIRECTORY = "store.file.directory";
  public static final String JDBC_URL = "jdbc.url";
  public static final String JDBC_USER = "jdbc.user";
  public static final String JDBC_PASSWORD = "jdbc.password";
  public static final String JOOQ_DIALECT = "jooq.dialect";
  public static final String JOOQ_CREATE_SCHEMA = "jooq.create-schema";

  private static final List<String> KEYS =
      List.of(
          STORE_TYPE,
          STORE_FILE_DIRECTORY,
          JDBC_URL,
          JDBC_USER,
          JDBC_PASSWORD,
          JOOQ_DIALECT,
          JOOQ_CREATE_SCHEMA);

  private static final String SYSTEM_PREFIX = "koe.";
  private static final String ENV_PREFIX = "KOE_";

  /** Where case logs are kept. */
  public enum StoreType {
    JOOQ,
    FILE
  }

  private final Map<String, String> values;

  private KoeConfig(Map<String, String> values) {
    this.values = Map.copyOf(values);
  }

  /**
   * @return configuration resolved once from the classpath, system properties and environment
   */
  public static KoeConfig defaults() {
    return Holder.INSTANCE;
  }

  /**
   * @param file properties, usually read from {@value #RESOURCE}
   * @param env variables, usually {@link System#getenv()}
   * @param system properties, usually {@link System#getProperties()}
   * @return resolved configuration
   */
  public static KoeConfig load(Properties file, Map<String, String> env, Properties system) {
    if (file == null || env == null || system == null) {
      throw new IllegalArgumentException("Configuration sources cannot be null");
    }

    final Map<String, String> values = new HashMap<>();
    for (String key : KEYS) {
      Optional.ofNullable(file.getProperty(key)).ifPresent(value -> values.put(key, value));
      Optional.ofNullable(system.getProperty(SYSTEM_PREFIX + key))
          .ifPresent(value -> values.put(key, value));
      Optional.ofNullable(env.get(envName(key))).ifPresent(value -> values.put(key, value));
    }

    return new KoeConfig(values);
  }

  static String envName(String key) {
    return ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  /**
   * @param key to look up
   * @return value when configured and not blank
   */
  public Optional<String> find(String key) {
    return Optional.ofNullable(values.get(key)).map(String::trim).filter(value -> !value.isEmpty());
  }

  /**
   * @param key to look up
   * @return configured value
   * @throws IllegalStateException when the key has no value
   */
  public String require(String key) {
    return find(key)
        .orElseThrow(
            () -> new IllegalStateException("Missing configuration key '%s'".formatted(key)));
  }

  public StoreType storeType() {
    final String value = find(STORE_TYPE).orElse(StoreType.FILE.name());
    try {
      return StoreType.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(
          "Unknown %s '%s', expected one of jooq, file".formatted(STORE_TYPE, value), e);
    }
  }

  public Path fileDirectory() {
    return Path.of(require(STORE_FILE_DIRECTORY));
  }

  public SQLDialect dialect() {
    final String value = find(JOOQ_DIALECT).orElse(SQLDialect.POSTGRES.name());
    try {
      return SQLDialect.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Unknown %s '%s'".formatted(JOOQ_DIALECT, value), e);
    }
  }

  public boolean createSchema() {
    return find(JOOQ_CREATE_SCHEMA).map(Boolean::parseBoolean).orElse(false);
  }

  /**
   * @return a context opening a connection per unit of work, with the schema created when {@value
   *     #JOOQ_CREATE_SCHEMA} is set
   */
  public DSLContext createDslContext() {
    final DSLContext dsl =
        DSL.using(
            new DriverManagerConnectionProvider(
                require(JDBC_URL), find(JDBC_USER).orElse(null), find(JDBC_PASSWORD).orElse(null)),
            dialect());

    if (createSchema()) {
      KoeTables.createIfNotExists(dsl);
    }

    return dsl;
  }

  /**
   * @param eventParser to read and write events with
   * @return store of the configured type
   */
  public EventStore createEventStore(EventParser eventParser) {
    return createEventStore(eventParser, storeType() == StoreType.JOOQ ? createDslContext() : null);
  }

  /**
   * @return service wired with the configured store, and a metadata cache in the same database when
   *     the store is {@link StoreType#JOOQ}
   */
  public SakService createSakService() {
    final EventParser eventParser = new EventParser();
    final DSLContext dsl = storeType() == StoreType.JOOQ ? createDslContext() : null;

    final SakMetadataCache metadataCache =
        dsl == null ? SakMetadataCache.empty() : new JooqSakMetadataCache(dsl);

    return new SakService(
        eventParser,
        createEventStore(eventParser, dsl),
        new StateProjector(),
        new BusinessRuleValidator(),
        metadataCache,
        SakNotificationSink.empty());
  }

  private EventStore createEventStore(EventParser eventParser, DSLContext dsl) {
    if (dsl == null) {
      final Path directory = fileDirectory();
      LOGGER.info("Keeping case logs as JSON documents in {}", directory.toAbsolutePath());
      return new JsonFileEventStore(directory, eventParser);
    }

    LOGGER.info("Keeping case logs in {} database", dsl.dialect());
    return new JooqEventStore(DslContextProvider.dslContextIdentity(dsl), eventParser);
  }

  private static Properties classpathProperties() {
    final Properties properties = new Properties();

    try (InputStream stream = KoeConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (stream == null) {
        LOGGER.warn("{} not found on the classpath, using built-in defaults", RESOURCE);
      } else {
        properties.load(stream);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }

    return properties;
  }

  private static final class Holder {
    private static final KoeConfig INSTANCE =
        load(classpathProperties(), System.getenv(), System.getProperties());
  }
}
