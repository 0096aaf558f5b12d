package io.github.koe.sak.async;

import static io.github.koe.sak.test.Hendelser.NOW;
import static io.github.koe.sak.test.Hendelser.SAK_ID;
import static org.junit.jupiter.api.Assertions.*;

import io.github.koe.sak.state.OverordnetStatus;
import org.junit.jupiter.api.Test;

class SakMetadataCacheTest {
  @Test
  void when_empty_cache_is_requested_it_must_not_be_null_and_it_must_forget_everything() {
    final var cache = SakMetadataCache.empty();

    assertNotNull(cache);
    assertDoesNotThrow(
        () -> cache.update(new SakMetadata(SAK_ID, "Tittel", OverordnetStatus.UTKAST, NOW)));
    assertTrue(cache.find(SAK_ID).isEmpty());
    assertTrue(cache.list().isEmpty());
  }
}
