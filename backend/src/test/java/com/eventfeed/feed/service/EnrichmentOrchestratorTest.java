package com.eventfeed.feed.service;

import com.eventfeed.config.FeedProperties;
import com.eventfeed.feed.extract.ContentFormat;
import com.eventfeed.feed.extract.ContentSerializer;
import com.eventfeed.feed.extract.MarkerExtractor;
import com.eventfeed.feed.extract.SectionLocator;
import com.eventfeed.feed.http.PageFetcher;
import com.eventfeed.feed.model.EnrichmentOptions;
import com.eventfeed.feed.model.EnrichmentStats;
import com.eventfeed.feed.model.EventRecord;
import com.eventfeed.feed.model.RawExtractStats;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EnrichmentOrchestratorTest {
    private static final String DETAILS_HTML = """
        <div class="events-detail-main">
            <h2>Abstract</h2>
            <p>This is the abstract content.</p>
            <h2>Bio</h2>
            <p>This is the bio content.</p>
        </div>
        """;

    private MockWebServer server;
    private EnrichmentOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        FeedProperties properties = new FeedProperties();
        properties.setRequestTimeoutSeconds(5);
        orchestrator = new EnrichmentOrchestrator(
            new PageFetcher(properties),
            new SectionLocator(),
            new ContentSerializer(),
            new MarkerExtractor()
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    private static MockResponse page(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", "text/html").setBody(body);
    }

    private static EnrichmentOptions titles(boolean overwrite) {
        return EnrichmentOptions.defaults().withTitles(true, overwrite);
    }

    private static EnrichmentOptions content(boolean overwrite, ContentFormat format) {
        return EnrichmentOptions.defaults().withContent(true, overwrite, format);
    }

    @Test
    void titlesAreIdempotentWithoutOverwriteAndReplacedWithIt() {
        server.enqueue(page("<html><body><div class=\"event-subtitle\">First Subtitle</div></body></html>"));
        server.enqueue(page("<html><body><div class=\"event-subtitle\">Second Subtitle</div></body></html>"));
        server.enqueue(page("<html><body><div class=\"event-subtitle\">Second Subtitle</div></body></html>"));
        List<EventRecord> records = List.of(EventRecord.of("guid", "g1", "urlRef", url("/event/1"), "title", ""));

        EnrichmentStats first = orchestrator.enrichTitles(records, titles(false));
        assertEquals(1, first.updated());
        assertEquals("First Subtitle", records.get(0).get("title"));

        EnrichmentStats second = orchestrator.enrichTitles(records, titles(false));
        assertEquals(0, second.updated());
        assertEquals("First Subtitle", records.get(0).get("title"));

        EnrichmentStats third = orchestrator.enrichTitles(records, titles(true));
        assertEquals(1, third.updated());
        assertEquals("Second Subtitle", records.get(0).get("title"));
    }

    @Test
    void sharedUrlIsFetchedOncePerCall() {
        server.enqueue(page("<div class=\"event-subtitle\">Shared</div>"));
        String shared = url("/event/shared");
        List<EventRecord> records = List.of(
            EventRecord.of("guid", "a", "urlRef", shared, "title", ""),
            EventRecord.of("guid", "b", "urlRef", shared, "title", "")
        );

        EnrichmentStats stats = orchestrator.enrichTitles(records, titles(false));

        assertEquals(2, stats.attempted());
        assertEquals(2, stats.updated());
        assertEquals(1, server.getRequestCount());
        assertThat(records).allSatisfy(record -> assertEquals("Shared", record.get("title")));
    }

    @Test
    void failedFetchIsCountedCachedAndLeavesFieldsAlone() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("gone"));
        String missing = url("/event/missing");
        List<EventRecord> records = List.of(
            EventRecord.of("guid", "a", "urlRef", missing, "content", "ICS description"),
            EventRecord.of("guid", "b", "urlRef", missing, "content", "")
        );

        EnrichmentStats stats = orchestrator.enrichContent(records, content(true, ContentFormat.TEXT));

        assertEquals(1, stats.errors());
        assertEquals(0, stats.updated());
        assertEquals(1, server.getRequestCount());
        assertEquals("ICS description", records.get(0).get("content"));
        assertEquals("", records.get(1).get("content"));
    }

    @Test
    void recordsWithoutUrlAreSkipped() {
        List<EventRecord> records = List.of(EventRecord.of("guid", "a", "urlRef", "  "), EventRecord.of("guid", "b"));

        EnrichmentStats stats = orchestrator.enrichContent(records, content(false, ContentFormat.TEXT));

        assertEquals(2, stats.skippedMissingUrl());
        assertEquals(0, stats.attempted());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void contentUpdatesOnlyEmptyFieldsWithoutOverwrite() {
        String html = "<html><body><div class=\"event-description\">This is the enriched body content.</div></body></html>";
        server.enqueue(page(html));
        server.enqueue(page(html));
        List<EventRecord> records = List.of(
            EventRecord.of("guid", "1", "urlRef", url("/event/1"), "content", ""),
            EventRecord.of("guid", "2", "urlRef", url("/event/2"), "content", "Existing")
        );

        EnrichmentStats stats = orchestrator.enrichContent(records, content(false, ContentFormat.TEXT));

        assertEquals(2, stats.attempted());
        assertEquals(1, stats.updated());
        assertEquals("This is the enriched body content.", records.get(0).get("content"));
        assertEquals("Existing", records.get(1).get("content"));
    }

    @Test
    void contentFromDetailsContainerAsHtml() {
        server.enqueue(page(
            "<html><body><div class=\"event-details-main\">"
                + "<h2 class=\"details\">Details</h2>"
                + "<div class=\"field__item\"><div class=\"tex2jax_process\"><h3>Abstract</h3><p>Line 1</p></div></div>"
                + "</div></body></html>"
        ));
        List<EventRecord> records = List.of(EventRecord.of("guid", "y", "urlRef", url("/e/2"), "content", ""));

        EnrichmentStats stats = orchestrator.enrichContent(records, content(true, ContentFormat.HTML));

        assertEquals(1, stats.updated());
        assertEquals("<h3>Abstract</h3><p>Line 1</p>", records.get(0).get("content"));
    }

    @Test
    void structuralMissNeverBlanksExistingContent() {
        server.enqueue(page("<html><body><div class='something-else'>No details here</div></body></html>"));
        List<EventRecord> records = List.of(EventRecord.of("guid", "a", "urlRef", url("/e/3"), "content", "ICS description"));

        EnrichmentStats stats = orchestrator.enrichContent(records, content(true, ContentFormat.MARKDOWN));

        assertEquals(0, stats.updated());
        assertEquals(0, stats.errors());
        assertEquals("ICS description", records.get(0).get("content"));
    }

    @Test
    void rawDetailsKeepInnerHtml() {
        String html = "<html><body><div class=\"events-detail-main\"><p>Hello <strong>World</strong></p></div></body></html>";
        server.enqueue(page(html));
        server.enqueue(page(html));
        List<EventRecord> records = List.of(
            EventRecord.of("guid", "1", "urlRef", url("/event/1")),
            EventRecord.of("guid", "2", "urlRef", url("/event/2"), "rawEventDetails", "pre")
        );

        EnrichmentStats stats = orchestrator.enrichRawDetails(records, EnrichmentOptions.defaults().withRawDetails(true, false));

        assertEquals(2, stats.attempted());
        assertEquals(1, stats.updated());
        assertThat(records.get(0).getString("rawEventDetails")).contains("<strong>World</strong>");
        assertEquals("pre", records.get(1).get("rawEventDetails"));
    }

    @Test
    void rawExtractsReadTheStoredInnerHtmlOfRawDetails() {
        server.enqueue(page("""
            <html><body><div class="events-detail-main"><h3>Abstract:</h3><p>We study X.</p><h3>Bio:</h3><p>Prof. Y.</p></div></body></html>
            """));
        server.enqueue(page("""
            <html><body><div class="events-detail-main"><ul><li>Abstract: Lists too.</li><li>Bio: Dr. Z.</li></ul></div></body></html>
            """));
        List<EventRecord> records = List.of(
            EventRecord.of("guid", "1", "urlRef", url("/event/1")),
            EventRecord.of("guid", "2", "urlRef", url("/event/2"))
        );

        orchestrator.enrichRawDetails(records, EnrichmentOptions.defaults().withRawDetails(true, false));
        RawExtractStats stats = orchestrator.enrichRawExtracts(records, EnrichmentOptions.defaults());

        assertThat(records.get(0).getString("rawEventDetails")).doesNotContain("events-detail-main");
        assertEquals(2, stats.updatedAbstract());
        assertEquals(2, stats.updatedBio());
        assertEquals("We study X.", records.get(0).get("rawExtractAbstract"));
        assertEquals("Prof. Y.", records.get(0).get("rawExtractBio"));
        assertEquals("Lists too.", records.get(1).get("rawExtractAbstract"));
        assertEquals("Dr. Z.", records.get(1).get("rawExtractBio"));
    }

    @Test
    void disabledPassesDoNothing() {
        List<EventRecord> records = List.of(EventRecord.of("guid", "1", "urlRef", url("/event/1"), "rawEventDetails", DETAILS_HTML));
        EnrichmentOptions off = EnrichmentOptions.defaults().withRawExtracts(false, false);

        assertEquals(0, orchestrator.enrichTitles(records, off).attempted());
        assertEquals(0, orchestrator.enrichContent(records, off).attempted());
        assertEquals(0, orchestrator.enrichRawDetails(records, off).attempted());
        assertEquals(0, orchestrator.enrichRawExtracts(records, off).attempted());
        assertEquals(0, server.getRequestCount());
        assertThat(records.get(0).has("rawExtractAbstract")).isFalse();
    }

    @Test
    void fetchExceptionsAreCountedAndCached() {
        PageFetcher throwing = Mockito.mock(PageFetcher.class);
        when(throwing.fetch(anyString())).thenThrow(new IllegalStateException("boom"));
        EnrichmentOrchestrator failing = new EnrichmentOrchestrator(
            throwing, new SectionLocator(), new ContentSerializer(), new MarkerExtractor()
        );
        List<EventRecord> records = List.of(
            EventRecord.of("guid", "a", "urlRef", "https://example.org/e/1", "title", "Kept"),
            EventRecord.of("guid", "b", "urlRef", "https://example.org/e/1", "title", "")
        );

        EnrichmentStats stats = failing.enrichTitles(records, titles(true));

        assertEquals(2, stats.attempted());
        assertEquals(1, stats.errors());
        assertEquals("Kept", records.get(0).get("title"));
        verify(throwing, times(1)).fetch("https://example.org/e/1");
    }

    @Test
    void rawExtractsFillAbstractAndBio() {
        List<EventRecord> records = List.of(EventRecord.of("guid", "1", "rawEventDetails", DETAILS_HTML));

        RawExtractStats stats = orchestrator.enrichRawExtracts(records, EnrichmentOptions.defaults());

        assertEquals(1, stats.attempted());
        assertEquals(1, stats.updatedAbstract());
        assertEquals(1, stats.updatedBio());
        assertEquals(0, stats.errors());
        assertEquals("This is the abstract content.", records.get(0).get("rawExtractAbstract"));
        assertEquals("This is the bio content.", records.get(0).get("rawExtractBio"));
    }

    @Test
    void rawExtractsRespectOverwritePerField() {
        List<EventRecord> keep = List.of(EventRecord.of(
            "guid", "1", "rawEventDetails", DETAILS_HTML, "rawExtractAbstract", "Existing abstract", "rawExtractBio", ""
        ));
        RawExtractStats kept = orchestrator.enrichRawExtracts(keep, EnrichmentOptions.defaults());
        assertEquals(0, kept.updatedAbstract());
        assertEquals(1, kept.updatedBio());
        assertEquals("Existing abstract", keep.get(0).get("rawExtractAbstract"));

        RawExtractStats replaced = orchestrator.enrichRawExtracts(keep, EnrichmentOptions.defaults().withRawExtracts(true, true));
        assertEquals(1, replaced.updatedAbstract());
        assertEquals("This is the abstract content.", keep.get(0).get("rawExtractAbstract"));
    }

    @Test
    void rawExtractsSkipMissingDetailsAndPartialMatches() {
        List<EventRecord> records = List.of(
            EventRecord.of("guid", "1", "rawEventDetails", "<div><h2>Abstract</h2><p>Abstract 1.</p></div>"),
            EventRecord.of("guid", "2", "rawEventDetails", "<div><p>No headers here.</p></div>"),
            EventRecord.of("guid", "3", "rawEventDetails", ""),
            EventRecord.of("guid", "4")
        );

        RawExtractStats stats = orchestrator.enrichRawExtracts(records, EnrichmentOptions.defaults());

        assertEquals(2, stats.attempted());
        assertEquals(2, stats.skippedMissingDetails());
        assertEquals(1, stats.updatedAbstract());
        assertEquals(0, stats.updatedBio());
        assertThat(records.get(0).has("rawExtractBio")).isFalse();
        assertThat(records.get(1).has("rawExtractAbstract")).isFalse();
    }

    @Test
    void abstractFailureDoesNotStopBio() {
        MarkerExtractor markerExtractor = Mockito.mock(MarkerExtractor.class);
        when(markerExtractor.extract(anyString(), eq(MarkerExtractor.ABSTRACT)))
            .thenThrow(new IllegalArgumentException("Simulated extraction error"));
        when(markerExtractor.extract(anyString(), eq(MarkerExtractor.BIO))).thenReturn("Valid bio.");
        EnrichmentOrchestrator withFailingAbstract = new EnrichmentOrchestrator(
            Mockito.mock(PageFetcher.class), new SectionLocator(), new ContentSerializer(), markerExtractor
        );
        List<EventRecord> records = List.of(EventRecord.of("guid", "1", "rawEventDetails", DETAILS_HTML));

        RawExtractStats stats = withFailingAbstract.enrichRawExtracts(records, EnrichmentOptions.defaults());

        assertEquals(1, stats.attempted());
        assertEquals(1, stats.errors());
        assertEquals(0, stats.updatedAbstract());
        assertEquals(1, stats.updatedBio());
        assertEquals("Valid bio.", records.get(0).get("rawExtractBio"));
    }
}
