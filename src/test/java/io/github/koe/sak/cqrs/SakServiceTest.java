package io.github.koe.sak.cqrs;

import static io.github.koe.sak.test.Hendelser.PARSER;
import static io.github.koe.sak.test.Hendelser.SAK_ID;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.koe.sak.async.SakMetadata;
import io.github.koe.sak.async.SakMetadataCache;
import io.github.koe.sak.async.SakNotification;
import io.github.koe.sak.async.SakNotificationSink;
import io.github.koe.sak.event.EventType;
import io.github.koe.sak.event.EventValidationException;
import io.github.koe.sak.event.ResponsResultat;
import io.github.koe.sak.event.Spor;
import io.github.koe.sak.rules.BusinessRuleValidator;
import io.github.koe.sak.rules.Regel;
import io.github.koe.sak.state.OverordnetStatus;
import io.github.koe.sak.state.SporStatus;
import io.github.koe.sak.state.StateProjector;
import io.github.koe.sak.store.ConcurrencyException;
import io.github.koe.sak.store.EventStore;
import io.github.koe.sak.store.JsonFileEventStore;
import io.github.koe.sak.test.Hendelser;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SakServiceTest {
  private final List<SakNotification> notifications = new ArrayList<>();
  private final Map<String, SakMetadata> metadata = new ConcurrentHashMap<>();

  private EventStore store;
  private SakService service;

  private final SakNotificationSink recordingSink =
      new SakNotificationSink() {
        @Override
        public void deliver(SakNotification notification) {
          notifications.add(notification);
        }
      };

  private final SakMetadataCache recordingCache =
      new SakMetadataCache() {
        @Override
        public void update(SakMetadata entry) {
          metadata.put(entry.sakId(), entry);
        }

        @Override
        public Optional<SakMetadata> find(String sakId) {
          return Optional.ofNullable(metadata.get(sakId));
        }

        @Override
        public List<SakMetadata> list() {
          return List.copyOf(metadata.values());
        }
      };

  @BeforeEach
  void setUp(@TempDir Path directory) {
    store = new JsonFileEventStore(directory, PARSER);
    service = serviceWith(recordingCache, recordingSink);
  }

  SakService serviceWith(SakMetadataCache cache, SakNotificationSink sink) {
    return new SakService(
        PARSER, store, new StateProjector(), new BusinessRuleValidator(), cache, sink);
  }

  @Test
  void when_collaborators_are_null_it_throws_an_exception() {
    final var projector = new StateProjector();
    final var validator = new BusinessRuleValidator();
    final var cache = SakMetadataCache.empty();
    final var sink = SakNotificationSink.empty();

    assertThrows(
        IllegalArgumentException.class,
        () -> new SakService(null, store, projector, validator, cache, sink));
    assertThrows(
        IllegalArgumentException.class,
        () -> new SakService(PARSER, null, projector, validator, cache, sink));
    assertThrows(
        IllegalArgumentException.class,
        () -> new SakService(PARSER, store, projector, validator, cache, null));
  }

  @Nested
  class SubmitTest {
    @Test
    void when_valid_events_are_submitted_version_and_state_advance() {
      final var created = service.submit(Hendelser.sakOpprettet(SAK_ID), 0);
      final var sent = service.submit(Hendelser.grunnlagOpprettet(SAK_ID), created.version());

      assertAll(
          () -> assertEquals(1, created.version()),
          () -> assertEquals(2, sent.version()),
          () -> assertEquals(SporStatus.SENDT, sent.state().grunnlag().status()),
          () -> assertEquals(OverordnetStatus.VENTER_PAA_SVAR, sent.state().overordnetStatus()),
          () -> assertEquals(2, store.getEvents(SAK_ID).version()));
    }

    @Test
    void when_basis_is_approved_the_case_is_agreed_and_locked() {
      service.submit(Hendelser.sakOpprettet(SAK_ID), 0);
      final var sent = service.submit(Hendelser.grunnlagOpprettet(SAK_ID), 1);

      assertEquals(SporStatus.IKKE_RELEVANT, sent.state().vederlag().status());
      assertEquals(SporStatus.IKKE_RELEVANT, sent.state().frist().status());

      final var approved =
          service.submit(
              Hendelser.respons(SAK_ID, EventType.RESPONS_GRUNNLAG, ResponsResultat.GODKJENT), 2);

      assertAll(
          () -> assertEquals(3, approved.version()),
          () -> assertEquals(SporStatus.GODKJENT, approved.state().grunnlag().status()),
          () -> assertTrue(approved.state().grunnlag().laast()),
          () -> assertEquals(OverordnetStatus.OMFORENT, approved.state().overordnetStatus()));
    }

    @Test
    void when_event_is_appended_collaborators_learn_about_it() {
      service.submit(Hendelser.sakOpprettet(SAK_ID), 0);
      final var result = service.submit(Hendelser.grunnlagOpprettet(SAK_ID), 1);

      assertEquals(2, notifications.size());

      final var notification = notifications.get(1);
      assertEquals(SAK_ID, notification.sakId());
      assertEquals(SporStatus.UTKAST, notification.forrigeTilstand().grunnlag().status());
      assertEquals(result.state(), notification.nyTilstand());
      assertEquals(EventType.GRUNNLAG_OPPRETTET, notification.utlosendeEvent().eventType());

      final var entry = metadata.get(SAK_ID);
      assertEquals("Endret fundamentering", entry.sakstittel());
      assertEquals(OverordnetStatus.VENTER_PAA_SVAR, entry.status());
    }

    @Test
    void when_payload_is_text_it_is_parsed_the_same_way() {
      final var result = service.submit(Hendelser.sakOpprettet(SAK_ID).toString(), 0);

      assertEquals(1, result.version());
    }

    @Test
    void when_expected_version_is_stale_nothing_is_appended() {
      service.submit(Hendelser.sakOpprettet(SAK_ID), 0);
      service.submit(Hendelser.grunnlagOpprettet(SAK_ID), 1);

      final var exception =
          assertThrows(
              ConcurrencyException.class,
              () ->
                  service.submit(
                      Hendelser.vederlag(SAK_ID, EventType.VEDERLAG_KRAV_SENDT, 10_000), 1));

      assertEquals(409, exception.getStatusCode());
      assertEquals(2, exception.getActualVersion());
      assertEquals(2, store.getEvents(SAK_ID).version());
      assertEquals(2, notifications.size());
    }

    @Test
    void when_business_rule_is_broken_nothing_is_appended() {
      service.submit(Hendelser.sakOpprettet(SAK_ID), 0);

      final var exception =
          assertThrows(
              BusinessRuleViolationException.class,
              () ->
                  service.submit(
                      Hendelser.vederlag(SAK_ID, EventType.VEDERLAG_KRAV_SENDT, 10_000), 1));

      assertEquals(Regel.GRUNNLAG_REQUIRED, exception.getViolatedRule());
      assertEquals(400, exception.getStatusCode());
      assertEquals(1, store.getEvents(SAK_ID).version());
      assertEquals(1, notifications.size());
    }

    @Test
    void when_payload_is_invalid_nothing_is_appended() {
      final var payload = Hendelser.sakOpprettet(SAK_ID);
      Hendelser.data(payload).remove("sakstittel");

      assertThrows(EventValidationException.class, () -> service.submit(payload, 0));
      assertTrue(store.getEvents(SAK_ID).isEmpty());
    }

    @Test
    void when_collaborators_fail_the_append_still_stands() {
      final var failing =
          serviceWith(
              new SakMetadataCache() {
                @Override
                public void update(SakMetadata entry) {
                  throw new IllegalStateException("Metadata database is down");
                }

                @Override
                public Optional<SakMetadata> find(String sakId) {
                  return Optional.empty();
                }

                @Override
                public List<SakMetadata> list() {
                  return List.of();
                }
              },
              notification -> {
                throw new IllegalStateException("Broker is down");
              });

      final var result =
          assertDoesNotThrow(() -> failing.submit(Hendelser.sakOpprettet(SAK_ID), 0));

      assertEquals(1, result.version());
      assertEquals(1, store.getEvents(SAK_ID).version());
    }
  }

  @Nested
  class BatchTest {
    @Test
    void when_batch_is_valid_all_events_are_appended_and_one_notification_is_sent() {
      final var result =
          service.submitBatch(
              List.<JsonNode>of(
                  Hendelser.sakOpprettet(SAK_ID),
                  Hendelser.grunnlagOpprettet(SAK_ID),
                  Hendelser.vederlag(SAK_ID, EventType.VEDERLAG_KRAV_SENDT, 150_000)),
              0);

      assertEquals(3, result.version());
      assertEquals(SporStatus.SENDT, result.state().vederlag().status());
      assertEquals(1, notifications.size());
      assertEquals(
          EventType.VEDERLAG_KRAV_SENDT, notifications.get(0).utlosendeEvent().eventType());
      assertEquals(
          OverordnetStatus.INGEN_AKTIVE_SPOR,
          notifications.get(0).forrigeTilstand().overordnetStatus());
    }

    @Test
    void when_a_later_event_breaks_a_rule_no_event_of_the_batch_is_appended() {
      final var exception =
          assertThrows(
              BusinessRuleViolationException.class,
              () ->
                  service.submitBatch(
                      List.<JsonNode>of(
                          Hendelser.sakOpprettet(SAK_ID),
                          Hendelser.vederlag(SAK_ID, EventType.VEDERLAG_KRAV_SENDT, 150_000)),
                      0));

      assertEquals(Regel.GRUNNLAG_REQUIRED, exception.getViolatedRule());
      assertTrue(store.getEvents(SAK_ID).isEmpty());
      assertTrue(notifications.isEmpty());
    }

    @Test
    void when_batch_is_empty_or_spans_several_cases_it_is_rejected() {
      assertThrows(IllegalArgumentException.class, () -> service.submitBatch(List.of(), 0));
      assertThrows(
          IllegalArgumentException.class,
          () ->
              service.submitBatch(
                  List.<JsonNode>of(
                      Hendelser.sakOpprettet(SAK_ID), Hendelser.sakOpprettet("KOE-ANNEN")),
                  0));

      assertTrue(store.listSakIds().isEmpty());
    }
  }

  @Nested
  class QueryTest {
    @Test
    void when_case_is_unknown_it_is_not_found() {
      final var exception =
          assertThrows(SakNotFoundException.class, () -> service.getState("UKJENT"));

      assertEquals(404, exception.getStatusCode());
      assertTrue(exception.getMessage().contains("UKJENT"));
      assertThrows(SakNotFoundException.class, () -> service.getTimeline("UKJENT"));
    }

    @Test
    void when_case_exists_state_is_projected_from_its_log() {
      store.appendBatch(Hendelser.standardSak(SAK_ID), 0);

      final var snapshot = service.getState(SAK_ID);

      assertEquals(4, snapshot.version());
      assertEquals(SporStatus.SENDT, snapshot.state().frist().status());
    }

    @Test
    void when_timeline_is_requested_every_event_is_summarised_in_order() {
      store.appendBatch(Hendelser.standardSak(SAK_ID), 0);
      store.append(
          Hendelser.event(
              Hendelser.respons(SAK_ID, EventType.RESPONS_GRUNNLAG, ResponsResultat.GODKJENT)),
          4);

      final var timeline = service.getTimeline(SAK_ID);

      assertEquals(SAK_ID, timeline.sakId());
      assertEquals(5, timeline.version());
      assertEquals(
          List.of(
              "Sak opprettet: Endret fundamentering",
              "Grunnlag sendt: Uforutsette grunnforhold",
              "Vederlagskrav sendt: 150000 kr (ENHETSPRISER)",
              "Fristkrav sendt: 14 dager",
              "Svar på grunnlag: GODKJENT"),
          timeline.innslag().stream().map(TidslinjeInnslag::sammendrag).toList());
      assertEquals(Spor.SAK, timeline.innslag().get(0).spor());
      assertEquals(Spor.VEDERLAG, timeline.innslag().get(2).spor());
    }

    @Test
    void when_metadata_is_rebuilt_every_case_is_refreshed() {
      store.appendBatch(Hendelser.standardSak(SAK_ID), 0);
      store.append(Hendelser.event(Hendelser.eoSakOpprettet("EO-1")), 0);

      assertEquals(2, service.rebuildMetadata());

      assertNotNull(metadata.get("EO-1"));
      assertEquals(OverordnetStatus.VENTER_PAA_SVAR, metadata.get(SAK_ID).status());
    }
  }
}
