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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.koe.sak.event.EventParser;
import io.github.koe.sak.event.SakEvent;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one {@code {"version": n, "events": [...]}} document per case in a directory.
 *
 * <p>A document is never rewritten in place: the new content goes to a temporary file in the same
 * directory which then atomically replaces the old one, so a reader sees either the old or the new
 * log and a failed write leaves the old one intact.
 */
public final class JsonFileEventStore extends AbstractEventStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileEventStore.class);

  private static final String SUFFIX = ".json";
  private static final String VERSION = "version";
  private static final String EVENTS = "events";
  private static final HexFormat HEX = HexFormat.of();

  private final Path directory;
  private final EventParser eventParser;
  private final ObjectMapper objectMapper;

  /**
   * @param directory to keep documents in, created when missing
   * @param eventParser to read and write events with
   * @throws UncheckedIOException when the directory cannot be created
   */
  public JsonFileEventStore(Path directory, EventParser eventParser) {
    if (directory == null) {
      throw new IllegalArgumentException("Directory cannot be null");
    }

    if (eventParser == null) {
      throw new IllegalArgumentException("Event parser cannot be null");
    }

    try {
      this.directory = Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }

    this.eventParser = eventParser;
    this.objectMapper = eventParser.objectMapper();
  }

  /** {@inheritDoc} */
  @Override
  protected int compareAndWrite(String sakId, List<SakEvent> batch, int expectedVersion) {
    final Path document = documentOf(sakId);
    final EventLog current = readDocument(document, sakId).orElse(EventLog.empty());

    if (current.version() != expectedVersion) {
      throw new ConcurrencyException(expectedVersion, current.version());
    }

    final List<SakEvent> events = new ArrayList<>(current.events());
    events.addAll(batch);
    writeDocument(document, events);
    return events.size();
  }

  /** {@inheritDoc} */
  @Override
  public EventLog getEvents(String sakId) {
    if (sakId == null) {
      throw new IllegalArgumentException("Sak ID cannot be null");
    }

    final EventLog log = readDocument(documentOf(sakId), sakId).orElse(EventLog.empty());
    LOGGER.debug("Read {} event(s) of sak {}", log.version(), sakId);
    return log;
  }

  /** {@inheritDoc} */
  @Override
  public List<String> listSakIds() {
    try (Stream<Path> documents = Files.list(directory)) {
      return documents
          .map(JsonFileEventStore::sakIdOf)
          .flatMap(Optional::stream)
          .filter(this::hasEvents)
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private boolean hasEvents(String sakId) {
    return readDocument(documentOf(sakId), sakId).map(log -> !log.isEmpty()).orElse(false);
  }

  /** File names are the lower-case hex of the UTF-8 case id, one document per distinct id. */
  Path documentOf(String sakId) {
    return directory.resolve(HEX.formatHex(sakId.getBytes(StandardCharsets.UTF_8)) + SUFFIX);
  }

  static Optional<String> sakIdOf(Path document) {
    final String fileName = document.getFileName().toString();
    if (!fileName.endsWith(SUFFIX)) {
      return Optional.empty();
    }

    final String name = fileName.substring(0, fileName.length() - SUFFIX.length());
    try {
      return Optional.of(new String(HEX.parseHex(name), StandardCharsets.UTF_8));
    } catch (IllegalArgumentException e) {
      LOGGER.debug("Ignoring {}, not a case document", fileName);
      return Optional.empty();
    }
  }

  private Optional<EventLog> readDocument(Path document, String sakId) {
    if (!Files.exists(document)) {
      return Optional.empty();
    }

    final JsonNode root;
    try {
      root = objectMapper.readTree(document.toFile());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }

    final List<SakEvent> events = new ArrayList<>();
    for (JsonNode event : root.path(EVENTS)) {
      final SakEvent read = eventParser.read(event);
      if (!sakId.equals(read.sakId())) {
        throw new IllegalStateException(
            "Document %s belongs to sak %s, not %s"
                .formatted(document.getFileName(), read.sakId(), sakId));
      }

      events.add(read);
    }

    final int version = root.path(VERSION).asInt(-1);
    if (version != events.size()) {
      throw new IllegalStateException(
          "Document %s claims version %d but holds %d events"
              .formatted(document.getFileName(), version, events.size()));
    }

    return Optional.of(new EventLog(events, version));
  }

  private void writeDocument(Path document, List<SakEvent> events) {
    final ObjectNode root = objectMapper.createObjectNode();
    root.put(VERSION, events.size());
    final ArrayNode array = root.putArray(EVENTS);
    events.forEach(event -> array.add(eventParser.toTree(event)));

    Path temporary = null;
    try {
      temporary = Files.createTempFile(directory, document.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temporary.toFile(), root);
      Files.move(
          temporary,
          document,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      deleteQuietly(temporary, e);
      throw new UncheckedIOException(e);
    }
  }

  private static void deleteQuietly(Path temporary, IOException failure) {
    if (temporary == null) {
      return;
    }

    try {
      Files.deleteIfExists(temporary);
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }
}
