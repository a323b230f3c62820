package com.media.resolution.core;

import com.media.resolution.core.model.MediaKind;
import com.media.resolution.core.model.SyncDirection;
import com.media.resolution.report.SyncReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionContextTest {

    @Test
    @DisplayName("Options default to a forward anime pass that writes")
    void testDefaults() {
        ResolutionOptions options = ResolutionOptions.defaults();

        assertEquals(SyncDirection.FORWARD, options.getDirection());
        assertEquals(MediaKind.ANIME, options.getMediaKind());
        assertFalse(options.isForceSync());
        assertFalse(options.isDryRun());
        assertEquals("forward anime", options.describe());
    }

    @Test
    @DisplayName("Copying options keeps every flag")
    void testCopy() {
        ResolutionOptions options = ResolutionOptions.builder().dryRun(true).forceSync(true).build();
        ResolutionOptions reverse = ResolutionOptions.builder(options).direction(SyncDirection.REVERSE).build();

        assertTrue(reverse.isDryRun());
        assertTrue(reverse.isForceSync());
        assertEquals("reverse anime", reverse.describe());
    }

    @Test
    @DisplayName("Passes of one run share cancellation and the report sink")
    void testForPass() {
        SyncReport report = new SyncReport();
        ResolutionContext first = ResolutionContext.of(ResolutionOptions.defaults(), report);
        ResolutionContext second = first.forPass(ResolutionOptions.builder().mediaKind(MediaKind.MANGA).build());

        assertNotEquals(first.getPassId(), second.getPassId());
        assertSame(report, second.getReportSink());
        assertFalse(second.isCancelled());

        first.cancel();

        assertTrue(second.isCancelled());
        ResolutionCancelledException e = assertThrows(ResolutionCancelledException.class,
                () -> second.throwIfCancelled("update"));
        assertEquals("cancelled before update", e.getMessage());
    }

    @Test
    @DisplayName("An interrupted thread counts as cancelled")
    void testInterrupted() {
        ResolutionContext context = ResolutionContext.of(ResolutionOptions.defaults());
        Thread.currentThread().interrupt();
        try {
            assertTrue(context.isCancelled());
        } finally {
            Thread.interrupted();
        }
        assertFalse(context.isCancelled());
    }
}
