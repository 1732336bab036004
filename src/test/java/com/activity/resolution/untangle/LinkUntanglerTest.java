package com.activity.resolution.untangle;

import com.activity.resolution.core.model.MatchTier;
import com.activity.resolution.core.model.SecondaryAnnotation;
import com.activity.resolution.core.model.SourceLink;
import com.activity.resolution.core.model.SourceSystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinkUntangler Tests")
class LinkUntanglerTest {

    private final LinkUntangler untangler = new LinkUntangler();

    private static SecondaryAnnotation annotation(String nativeId) {
        return new SecondaryAnnotation(nativeId, null, null, null, null, true, 1L);
    }

    private static SourceLink link(SourceSystem source, String nativeId) {
        return new SourceLink(null, 1L, source, nativeId, Instant.EPOCH, null, null, null, null, null,
                MatchTier.NEW, Instant.EPOCH);
    }

    private UntangleRecommendation decide(List<SecondaryAnnotation> annotations, List<SourceLink> links) {
        return untangler.decide(1L, annotations, links).orElseThrow();
    }

    @Test
    @DisplayName("Single annotation needs no decision")
    void singleAnnotation() {
        assertTrue(untangler.decide(1L, List.of(annotation("st-1")), List.of()).isEmpty());
    }

    @Test
    @DisplayName("The one annotation naming a linked source is kept")
    void singleSourceMatch() {
        UntangleRecommendation rec = decide(
                List.of(annotation("activity-500"), annotation("st-3"), annotation("st-4")),
                List.of(link(SourceSystem.DESKTOP_LOG, "4")));

        assertEquals("st-4", rec.keepNativeId());
        assertEquals(List.of("activity-500", "st-3"), rec.unlinkNativeIds());
        assertEquals(UntangleReason.SINGLE_SOURCE_MATCH, rec.reason());
    }

    @Test
    @DisplayName("Prefixed GPS link ids still match")
    void prefixedLink() {
        UntangleRecommendation rec = decide(
                List.of(annotation("activity-500"), annotation("st-3")),
                List.of(link(SourceSystem.GPS_PLATFORM, "activity-500")));

        assertEquals("activity-500", rec.keepNativeId());
        assertEquals(UntangleReason.SINGLE_SOURCE_MATCH, rec.reason());
    }

    @Test
    @DisplayName("Several matches prefer the GPS kind with exactly one match")
    void preferredKind() {
        UntangleRecommendation rec = decide(
                List.of(annotation("st-3"), annotation("activity-500")),
                List.of(link(SourceSystem.GPS_PLATFORM, "500"), link(SourceSystem.DESKTOP_LOG, "3")));

        assertEquals("activity-500", rec.keepNativeId());
        assertEquals(List.of("st-3"), rec.unlinkNativeIds());
        assertEquals(UntangleReason.PREFERRED_KIND_MATCH, rec.reason());
    }

    @Test
    @DisplayName("Desktop wins when it is the only kind with a single match")
    void desktopSingle() {
        UntangleRecommendation rec = decide(
                List.of(annotation("activity-500"), annotation("activity-501"), annotation("st-3")),
                List.of(link(SourceSystem.GPS_PLATFORM, "500"), link(SourceSystem.GPS_PLATFORM, "501"),
                        link(SourceSystem.DESKTOP_LOG, "3")));

        assertEquals("st-3", rec.keepNativeId());
        assertEquals(UntangleReason.PREFERRED_KIND_MATCH, rec.reason());
    }

    @Test
    @DisplayName("Several matches of one kind keep the smallest native id")
    void lowestId() {
        UntangleRecommendation rec = decide(
                List.of(annotation("st-9"), annotation("st-10")),
                List.of(link(SourceSystem.DESKTOP_LOG, "9"), link(SourceSystem.DESKTOP_LOG, "10")));

        assertEquals("st-10", rec.keepNativeId());
        assertEquals(UntangleReason.PREFERRED_KIND_LOWEST_ID, rec.reason());
    }

    @Test
    @DisplayName("Without any match GPS annotations come before desktop and unknown")
    void noMatch() {
        UntangleRecommendation rec = decide(
                List.of(annotation("legacy-1"), annotation("st-1"), annotation("activity-9"), annotation("activity-10")),
                List.of());

        assertEquals("activity-10", rec.keepNativeId());
        assertEquals(List.of("activity-9", "legacy-1", "st-1"), rec.unlinkNativeIds());
        assertEquals(UntangleReason.NO_SOURCE_MATCH, rec.reason());
    }

    @Test
    @DisplayName("Decision does not depend on input order")
    void deterministic() {
        List<SourceLink> links = List.of(link(SourceSystem.DESKTOP_LOG, "3"));
        UntangleRecommendation forward = decide(
                List.of(annotation("activity-1"), annotation("st-3"), annotation("st-2")), links);
        UntangleRecommendation backward = decide(
                List.of(annotation("st-2"), annotation("st-3"), annotation("activity-1")), links);

        assertEquals(forward, backward);
    }
}
