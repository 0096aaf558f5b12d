package io.github.koe.sak.store;

import static io.github.koe.sak.test.Hendelser.PARSER;
import static io.github.koe.sak.test.Hendelser.SAK_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileEventStoreTest extends AbstractEventStoreTest {
  private Path directory;
  private JsonFileEventStore store;

  @BeforeEach
  void setUp(@TempDir Path tempDir) {
    directory = tempDir.resolve("saker");
    store = new JsonFileEventStore(directory, PARSER);
  }

  @Override
  EventStore store() {
    return store;
  }

  @Nested
  class DocumentTest {
    @Test
    void when_collaborators_are_null_it_throws_an_exception() {
      assertThrows(IllegalArgumentException.class, () -> new JsonFileEventStore(null, PARSER));
      assertThrows(IllegalArgumentException.class, () -> new JsonFileEventStore(directory, null));
    }

    @Test
    void when_store_is_created_missing_directory_is_created() {
      assertTrue(Files.isDirectory(directory));
    }

    @Test
    void when_events_are_appended_document_holds_version_and_events() throws Exception {
      store.append(sakOpprettet(SAK_ID), 0);
      store.append(grunnlagOpprettet(SAK_ID), 1);

      final var document = PARSER.objectMapper().readTree(store.documentOf(SAK_ID).toFile());

      assertEquals(2, document.get("version").asInt());
      assertEquals(2, document.get("events").size());
      assertEquals(
          "grunnlag_opprettet", document.get("events").get(1).get("event_type").asText());
    }

    @Test
    void when_appends_succeed_no_temporary_files_are_left_behind() throws Exception {
      store.appendBatch(List.of(sakOpprettet(SAK_ID), grunnlagOpprettet(SAK_ID)), 0);
      store.append(grunnlagOppdatert(SAK_ID, 1), 2);

      try (Stream<Path> files = Files.list(directory)) {
        assertEquals(List.of(store.documentOf(SAK_ID)), files.toList());
      }
    }

    @Test
    void when_case_id_contains_path_separators_it_stays_inside_the_directory() {
      final var sakId = "PROSJEKT/A\\KOE-7";

      store.append(sakOpprettet(sakId), 0);

      assertEquals(directory, store.documentOf(sakId).getParent());
      assertEquals(1, store.getEvents(sakId).version());
      assertEquals(List.of(sakId), store.listSakIds());
    }

    @Test
    void when_case_ids_differ_only_in_separators_they_keep_separate_logs() {
      store.append(sakOpprettet("KOE/1"), 0);

      assertTrue(store.getEvents("KOE_1").isEmpty());

      store.append(sakOpprettet("KOE_1"), 0);
      store.append(grunnlagOpprettet("KOE_1"), 1);

      assertEquals(1, store.getEvents("KOE/1").version());
      assertEquals(2, store.getEvents("KOE_1").version());
      assertEquals("KOE/1", store.getEvents("KOE/1").events().get(0).sakId());
      assertEquals(List.of("KOE/1", "KOE_1"), store.listSakIds());
    }

    @Test
    void when_document_holds_another_case_reading_fails() throws Exception {
      store.append(sakOpprettet(SAK_ID), 0);
      Files.copy(store.documentOf(SAK_ID), store.documentOf("KOE-ANNEN"));

      assertThrows(IllegalStateException.class, () -> store.getEvents("KOE-ANNEN"));
      assertThrows(
          IllegalStateException.class, () -> store.append(sakOpprettet("KOE-ANNEN"), 1));
    }

    @Test
    void when_document_claims_a_wrong_version_reading_fails() throws Exception {
      store.append(sakOpprettet(SAK_ID), 0);

      final var document = store.documentOf(SAK_ID);
      Files.writeString(
          document, Files.readString(document).replaceFirst("\"version\" : 1", "\"version\" : 5"));

      assertThrows(IllegalStateException.class, () -> store.getEvents(SAK_ID));
    }

    @Test
    void when_other_files_are_in_the_directory_they_are_not_listed() throws Exception {
      store.append(sakOpprettet(SAK_ID), 0);
      Files.writeString(directory.resolve("LESMEG.txt"), "ikke en sak");
      Files.writeString(directory.resolve("notater.json"), "{}");

      assertEquals(List.of(SAK_ID), store.listSakIds());
    }
  }
}
