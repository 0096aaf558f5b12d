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

package io.github.koe.sak.cqrs;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.koe.sak.async.SakMetadata;
import io.github.koe.sak.async.SakMetadataCache;
import io.github.koe.sak.async.SakNotification;
import io.github.koe.sak.async.SakNotificationSink;
import io.github.koe.sak.event.EventParser;
import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.rules.BusinessRuleValidator;
import io.github.koe.sak.rules.ValidationResult;
import io.github.koe.sak.state.SakState;
import io.github.koe.sak.state.StateProjector;
import io.github.koe.sak.store.ConcurrencyException;
import io.github.koe.sak.store.EventLog;
import io.github.koe.sak.store.EventStore;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the case core.
 *
 * <p>A submission is parsed, checked against the state projected from the log version the caller
 * has seen, appended with that version as the expectation, and projected again. Collaborators which
 * only mirror the log, the metadata cache and the notification sink, are informed after the append
 * and cannot make it fail.
 *
 * <p>The service holds no state of its own and may be shared between threads.
 */
public final class SakService extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(SakService.class);

  private final EventParser eventParser;
  private final EventStore eventStore;
  private final StateProjector stateProjector;
  private final BusinessRuleValidator businessRuleValidator;
  private final SakMetadataCache metadataCache;
  private final SakNotificationSink notificationSink;

  public SakService(
      final EventParser eventParser,
      final EventStore eventStore,
      final StateProjector stateProjector,
      final BusinessRuleValidator businessRuleValidator,
      final SakMetadataCache metadataCache,
      final SakNotificationSink notificationSink) {
    this.eventParser = throwIllegalArgumentIfNull(eventParser, "Event parser");
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.stateProjector = throwIllegalArgumentIfNull(stateProjector, "State projector");
    this.businessRuleValidator =
        throwIllegalArgumentIfNull(businessRuleValidator, "Business rule validator");
    this.metadataCache = throwIllegalArgumentIfNull(metadataCache, "Metadata cache");
    this.notificationSink = throwIllegalArgumentIfNull(notificationSink, "Notification sink");
  }

  /**
   * @param payload submitted by a client, without {@code event_id} and {@code tidsstempel}
   * @param expectedVersion of the log the client based the submission on
   * @return the new version and state
   * @throws io.github.koe.sak.event.EventParseException when the payload has an unknown type
   * @throws io.github.koe.sak.event.EventValidationException when the payload is not acceptable
   * @throws ConcurrencyException when the log is no longer at {@code expectedVersion}
   * @throws BusinessRuleViolationException when the event is not allowed in the current state
   */
  public SubmitResult submit(final JsonNode payload, final int expectedVersion) {
    throwIllegalArgumentIfNull(payload, "Payload");
    return submitCandidates(List.of(eventParser.parseCandidate(payload)), expectedVersion);
  }

  /**
   * @param json submitted by a client
   * @param expectedVersion of the log the client based the submission on
   * @return the new version and state
   * @see #submit(JsonNode, int)
   */
  public SubmitResult submit(final String json, final int expectedVersion) {
    throwIllegalArgumentIfNull(json, "Payload");
    return submitCandidates(List.of(eventParser.parseCandidate(json)), expectedVersion);
  }

  /**
   * Submits several events of one case at once. Each event is checked against the state including
   * the events before it in the batch, and the batch is appended as a whole or not at all.
   *
   * @param payloads submitted by a client, in order
   * @param expectedVersion of the log the client based the submission on
   * @return the new version and state
   * @see #submit(JsonNode, int)
   */
  public SubmitResult submitBatch(final List<JsonNode> payloads, final int expectedVersion) {
    throwIllegalArgumentIfNull(payloads, "Payloads");
    if (payloads.isEmpty()) {
      throw new IllegalArgumentException("Kan ikke legge til tom event-liste");
    }

    final List<SakEvent> candidates = new ArrayList<>(payloads.size());
    for (JsonNode payload : payloads) {
      candidates.add(eventParser.parseCandidate(throwIllegalArgumentIfNull(payload, "Payload")));
    }

    return submitCandidates(candidates, expectedVersion);
  }

  /**
   * @param sakId of the case
   * @return current version and state
   * @throws SakNotFoundException when the case has no events
   */
  public SakSnapshot getState(final String sakId) {
    final EventLog log = existingLog(sakId);
    return new SakSnapshot(log.version(), project(log.events()));
  }

  /**
   * @param sakId of the case
   * @return current version and one summary per event
   * @throws SakNotFoundException when the case has no events
   */
  public Tidslinje getTimeline(final String sakId) {
    final EventLog log = existingLog(sakId);
    return new Tidslinje(
        sakId, log.version(), log.events().stream().map(TidslinjeInnslag::of).toList());
  }

  /**
   * Recomputes every metadata entry from the case logs.
   *
   * @return number of cases refreshed
   */
  public int rebuildMetadata() {
    final List<String> sakIds = eventStore.listSakIds();
    for (String sakId : sakIds) {
      metadataCache.update(SakMetadata.of(project(eventStore.getEvents(sakId).events())));
    }

    LOGGER.info("Rebuilt metadata of {} sak(er)", sakIds.size());
    return sakIds.size();
  }

  private SubmitResult submitCandidates(
      final List<SakEvent> candidates, final int expectedVersion) {
    final String sakId = candidates.get(0).sakId();
    for (SakEvent candidate : candidates) {
      if (!sakId.equals(candidate.sakId())) {
        throw new IllegalArgumentException("Alle events må tilhøre samme sak_id");
      }
    }

    final EventLog log = eventStore.getEvents(sakId);
    if (log.version() != expectedVersion) {
      LOGGER.warn(
          "Stale submission to sak {}: expected version {}, log is at {}",
          sakId,
          expectedVersion,
          log.version());
      throw new ConcurrencyException(expectedVersion, log.version());
    }

    final SakState forrigeTilstand = project(log.events());

    final List<SakEvent> events = new ArrayList<>(log.events());
    SakState tilstand = forrigeTilstand;
    for (SakEvent candidate : candidates) {
      requireValid(candidate, tilstand);
      events.add(candidate);
      tilstand = project(events);
    }

    final int newVersion = eventStore.appendBatch(candidates, expectedVersion);
    informCollaborators(forrigeTilstand, tilstand, candidates.get(candidates.size() - 1));
    return new SubmitResult(newVersion, tilstand);
  }

  private void requireValid(final SakEvent candidate, final SakState state) {
    final ValidationResult result =
        throwIllegalStateIfNull(
            businessRuleValidator.validate(candidate, state), "Validation result");

    if (!result.valid()) {
      LOGGER.warn(
          "Rejected {} for sak {}: {} ({})",
          candidate.eventType(),
          candidate.sakId(),
          result.violatedRule(),
          result.message());
      throw new BusinessRuleViolationException(result);
    }
  }

  private void informCollaborators(
      final SakState forrigeTilstand, final SakState nyTilstand, final SakEvent utlosendeEvent) {
    final String sakId = utlosendeEvent.sakId();

    try {
      metadataCache.update(SakMetadata.of(nyTilstand));
    } catch (RuntimeException e) {
      LOGGER.warn("Could not update metadata of sak {}", sakId, e);
    }

    try {
      notificationSink.deliver(
          new SakNotification(sakId, forrigeTilstand, nyTilstand, utlosendeEvent));
    } catch (RuntimeException e) {
      LOGGER.warn("Could not notify about sak {}", sakId, e);
    }
  }

  private EventLog existingLog(final String sakId) {
    throwIllegalArgumentIfNull(sakId, "Sak ID");

    final EventLog log = throwIllegalStateIfNull(eventStore.getEvents(sakId), "Event log");
    if (log.isEmpty()) {
      throw SakNotFoundException.forSak(sakId);
    }

    return log;
  }

  private SakState project(final List<SakEvent> events) {
    return throwIllegalStateIfNull(stateProjector.project(events), "Projected state");
  }
}
