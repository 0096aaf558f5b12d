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

package io.github.koe.sak.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns JSON documents into {@link SakEvent}s and back.
 *
 * <p>There are two ways in:
 *
 * <ul>
 *   <li>{@link #read(JsonNode)} is the read path used by stores. It trusts the document and only
 *       dispatches on {@code event_type}.
 *   <li>{@link #parseCandidate(JsonNode)} is the write path used for client submissions. It
 *       rejects server-owned fields, assigns {@code event_id} and {@code tidsstempel} itself, and
 *       checks the payload constraints of the event type.
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class EventParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(EventParser.class);

  public static final String EVENT_ID = "event_id";
  public static final String TIDSSTEMPEL = "tidsstempel";
  public static final String EVENT_TYPE = "event_type";
  public static final String SAK_ID = "sak_id";
  public static final String AKTOR = "aktor";
  public static final String AKTOR_ROLLE = "aktor_rolle";
  public static final String DATA = "data";

  private static final List<String> SERVER_OWNED_FIELDS = List.of(EVENT_ID, TIDSSTEMPEL);

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Supplier<UUID> eventIdGenerator;

  public EventParser() {
    this(Clock.systemUTC(), UUID::randomUUID);
  }

  /**
   * @param clock assigning {@code tidsstempel} on the write path
   * @param eventIdGenerator assigning {@code event_id} on the write path
   */
  public EventParser(Clock clock, Supplier<UUID> eventIdGenerator) {
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    if (eventIdGenerator == null) {
      throw new IllegalArgumentException("Event ID generator cannot be null");
    }

    this.objectMapper = createObjectMapper();
    this.clock = clock;
    this.eventIdGenerator = eventIdGenerator;
  }

  /**
   * @return a new mapper using the wire conventions of the case log: snake_case keys, ISO-8601
   *     dates and no {@code null} values
   */
  public static ObjectMapper createObjectMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  /**
   * Read path: dispatches on {@code event_type} and maps the rest of the document as is.
   *
   * @param document of a stored event
   * @return parsed event
   * @throws EventParseException when the discriminant is unknown or the document does not fit it
   */
  public SakEvent read(JsonNode document) {
    final ObjectNode object = requireObject(document);
    final EventType eventType = eventTypeOf(object);

    try {
      return objectMapper.treeToValue(object, eventType.eventClass());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new EventParseException("Kunne ikke lese event av typen '%s'".formatted(eventType), e);
    }
  }

  /**
   * @param json of a stored event
   * @return parsed event
   * @throws EventParseException when the text is not JSON or does not describe a known event
   * @see #read(JsonNode)
   */
  public SakEvent read(String json) {
    return read(readTree(json));
  }

  /**
   * Write path: builds a new event out of a client submission.
   *
   * @param payload submitted by a client, without {@code event_id} and {@code tidsstempel}
   * @return a new event with server-assigned identity and timestamp
   * @throws EventParseException when the discriminant is missing or unknown
   * @throws EventValidationException when the payload is not acceptable for its event type
   */
  public SakEvent parseCandidate(JsonNode payload) {
    final ObjectNode candidate = requireObject(payload).deepCopy();

    for (String field : SERVER_OWNED_FIELDS) {
      if (candidate.has(field)) {
        throw new EventValidationException(
            "Feltet '%s' settes av serveren og kan ikke sendes inn".formatted(field), field);
      }
    }

    final EventType eventType = eventTypeOf(candidate);

    requireText(candidate, SAK_ID, "sak_id må oppgis");
    requireText(candidate, AKTOR, "Aktør må oppgis");
    if (!candidate.hasNonNull(AKTOR_ROLLE)) {
      throw new EventValidationException(
          "Aktørrolle må oppgis",
          AKTOR_ROLLE,
          Map.of(EventValidationException.GYLDIGE_VERDIER, optionsOf(AktorRolle.class)));
    }

    final JsonNode data = candidate.get(DATA);
    if (data == null || data.isNull()) {
      candidate.putObject(DATA);
    } else if (!data.isObject()) {
      throw new EventValidationException("Feltet 'data' må være et objekt", DATA);
    }

    candidate.put(EVENT_ID, eventIdGenerator.get().toString());
    candidate.put(TIDSSTEMPEL, clock.instant().toString());

    final SakEvent event;
    try {
      event = objectMapper.treeToValue(candidate, eventType.eventClass());
    } catch (InvalidFormatException e) {
      throw invalidValue(e);
    } catch (JsonProcessingException e) {
      throw new EventValidationException(
          "Ugyldig innhold for '%s'".formatted(eventType), pathOf(e), e);
    }

    PayloadValidator.validate(event);

    LOGGER.debug("Parsed candidate {} for sak {}", event.eventType(), event.sakId());
    return event;
  }

  /**
   * @param json submitted by a client
   * @return a new event with server-assigned identity and timestamp
   * @see #parseCandidate(JsonNode)
   */
  public SakEvent parseCandidate(String json) {
    return parseCandidate(readTree(json));
  }

  public ObjectNode toTree(SakEvent event) {
    return objectMapper.valueToTree(Objects.requireNonNull(event, "Event cannot be null"));
  }

  public String toJson(SakEvent event) {
    try {
      return objectMapper.writeValueAsString(Objects.requireNonNull(event, "Event cannot be null"));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  private JsonNode readTree(String json) {
    if (json == null) {
      throw new EventParseException("Event-dokument mangler");
    }

    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new EventParseException("Event-dokumentet er ikke gyldig JSON", e);
    }
  }

  private static ObjectNode requireObject(JsonNode document) {
    if (document == null || !document.isObject()) {
      throw new EventParseException("Event-dokumentet må være et JSON-objekt");
    }

    return (ObjectNode) document;
  }

  private static EventType eventTypeOf(ObjectNode document) {
    final JsonNode discriminant = document.get(EVENT_TYPE);
    if (discriminant == null || !discriminant.isTextual()) {
      throw new EventParseException("event_type mangler");
    }

    return EventType.find(discriminant.asText())
        .orElseThrow(
            () -> new EventParseException("Ukjent event_type: " + discriminant.asText()));
  }

  private static void requireText(ObjectNode document, String field, String message) {
    final JsonNode value = document.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new EventValidationException(message, field);
    }
  }

  private static EventValidationException invalidValue(InvalidFormatException cause) {
    final String field = pathOf(cause);
    final String message = "Ugyldig verdi '%s' for feltet '%s'".formatted(cause.getValue(), field);

    final Class<?> targetType = cause.getTargetType();
    if (targetType != null && targetType.isEnum()) {
      return new EventValidationException(
          message, field, Map.of(EventValidationException.GYLDIGE_VERDIER, optionsOf(targetType)));
    }

    return new EventValidationException(message, field, cause);
  }

  private static String pathOf(JsonProcessingException cause) {
    if (cause instanceof JsonMappingException mappingException) {
      return mappingException.getPath().stream()
          .map(JsonMappingException.Reference::getFieldName)
          .filter(Objects::nonNull)
          .collect(Collectors.joining("."));
    }

    return null;
  }

  private static String optionsOf(Class<?> enumType) {
    return Arrays.stream(enumType.getEnumConstants())
        .map(String::valueOf)
        .collect(Collectors.joining(", "));
  }
}
