package com.media.resolution.logging;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.ResolutionOptions;
import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.SyncDirection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static com.media.resolution.MediaFixtures.anime;
import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should tag the pass and clear on close")
    void testForPass() {
        ResolutionContext context = ResolutionContext.of(ResolutionOptions.builder()
                .direction(SyncDirection.REVERSE).mediaKind(MediaKind.MANGA).build());

        try (LogContext ignored = LogContext.forPass(context)) {
            assertEquals(context.getPassId(), MDC.get("passId"));
            assertEquals("reverse", MDC.get("direction"));
            assertEquals("manga", MDC.get("mediaKind"));
        }

        assertNull(MDC.get("passId"));
        assertNull(MDC.get("direction"));
    }

    @Test
    @DisplayName("Nested source context leaves the pass keys in place")
    void testNested() {
        ResolutionContext context = ResolutionContext.of(ResolutionOptions.defaults());

        try (LogContext pass = LogContext.forPass(context)) {
            try (LogContext source = LogContext.forSource(anime(1, 2, "Frieren", 28)).with("strategy", "IdStrategy")) {
                assertEquals("Frieren", MDC.get("source"));
                assertEquals("IdStrategy", MDC.get("strategy"));
            }
            assertNull(MDC.get("source"));
            assertNull(MDC.get("strategy"));
            assertNotNull(MDC.get("passId"));
        }
    }
}
