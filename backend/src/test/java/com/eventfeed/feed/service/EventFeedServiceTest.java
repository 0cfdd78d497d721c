package com.eventfeed.feed.service;

import com.eventfeed.config.FeedConfig;
import com.eventfeed.config.FeedProperties;
import com.eventfeed.feed.calendar.CalendarLoadException;
import com.eventfeed.feed.calendar.CalendarRecordMapper;
import com.eventfeed.feed.calendar.CalendarSourceLoader;
import com.eventfeed.feed.calendar.IcsCalendarReader;
import com.eventfeed.feed.calendar.TransformConfigLoader;
import com.eventfeed.feed.extract.ContentFormat;
import com.eventfeed.feed.extract.ContentSerializer;
import com.eventfeed.feed.extract.MarkerExtractor;
import com.eventfeed.feed.extract.SectionLocator;
import com.eventfeed.feed.http.PageFetcher;
import com.eventfeed.feed.model.EnrichmentOptions;
import com.eventfeed.feed.model.EventRecord;
import com.eventfeed.feed.model.FeedRunRequest;
import com.eventfeed.feed.model.FeedRunSummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class EventFeedServiceTest {
    private static final String ICS_TEMPLATE = """
        BEGIN:VCALENDAR
        VERSION:2.0
        PRODID:-//Example//Seminars//EN
        BEGIN:VEVENT
        UID:late@example.org
        DTSTAMP:20240101T000000Z
        DTSTART:20240401T150000Z
        DTEND:20240401T160000Z
        SUMMARY:Bob Jones
        URL:%s
        LOCATION:202 - Friend Center
        END:VEVENT
        BEGIN:VEVENT
        UID:early@example.org
        DTSTAMP:20240101T000000Z
        DTSTART:20240301T150000Z
        DTEND:20240301T160000Z
        SUMMARY:Alice Smith
        DESCRIPTION:From the calendar
        LOCATION:101 - Sherrerd
        CATEGORIES:CatB,CatA
        END:VEVENT
        END:VCALENDAR
        """;

    private final ObjectMapper objectMapper = new FeedConfig().objectMapper();
    private MockWebServer server;
    private EventFeedService service;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        FeedProperties properties = new FeedProperties();
        properties.setRequestTimeoutSeconds(5);
        PageFetcher fetcher = new PageFetcher(properties);
        service = new EventFeedService(
            new CalendarSourceLoader(fetcher, properties),
            new IcsCalendarReader(),
            new TransformConfigLoader(objectMapper),
            new CalendarRecordMapper(),
            new EnrichmentOrchestrator(fetcher, new SectionLocator(), new ContentSerializer(), new MarkerExtractor()),
            new FallbackTitleFiller(),
            new EventsJsonWriter(objectMapper)
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    private Path writeCalendar() throws Exception {
        Path ics = tempDir.resolve("feed.ics");
        Files.writeString(ics, ICS_TEMPLATE.formatted(server.url("/events/bob").toString()));
        return ics;
    }

    @Test
    void generatesSortedJsonWithEnrichmentAndFallbackTitles() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(
            "<html><body><div class=\"event-subtitle\">Graph Theory Today</div>"
                + "<div class=\"events-detail-main\"><h2>Abstract</h2><p>We study graphs.</p>"
                + "<h2>Bio</h2><p>Bob is a professor.</p></div></body></html>"
        ));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(
            "<html><body><div class=\"events-detail-main\"><h2>Abstract</h2><p>We study graphs.</p>"
                + "<h2>Bio</h2><p>Bob is a professor.</p></div></body></html>"
        ));
        Path output = tempDir.resolve("out/events.json");
        EnrichmentOptions options = EnrichmentOptions.defaults()
            .withTitles(true, false)
            .withRawDetails(true, false);

        FeedRunSummary summary = service.generate(
            new FeedRunRequest(writeCalendar().toString(), output.toString(), null, false, null, options)
        );

        assertEquals(2, summary.calendarEntries());
        assertEquals(2, summary.recordsWritten());
        assertEquals(1, summary.titlesFilled());
        assertEquals(1, summary.rawExtractStats().updatedAbstract());
        assertEquals(2, server.getRequestCount());

        JsonNode events = objectMapper.readTree(output.toFile());
        assertEquals(2, events.size());
        JsonNode alice = events.get(0);
        assertEquals("early@example.org", alice.get("guid").asText());
        assertEquals("2024-03-01T10:00:00", alice.get("startTime").asText());
        assertEquals("CatA,CatB", alice.get("series").asText());
        assertEquals("Alice Smith", alice.get("title").asText());
        assertEquals("advertisement", alice.get("itemType").asText());
        assertEquals("Sherrerd", alice.get("location").get("name").asText());
        assertEquals("101", alice.get("location").get("detail").asText());

        JsonNode bob = events.get(1);
        assertEquals("Graph Theory Today", bob.get("title").asText());
        assertEquals("We study graphs.", bob.get("rawExtractAbstract").asText());
        assertEquals("Bob is a professor.", bob.get("rawExtractBio").asText());
    }

    @Test
    void limitTruncatesAfterSorting() throws Exception {
        Path output = tempDir.resolve("limited.json");

        FeedRunSummary summary = service.generate(
            new FeedRunRequest(writeCalendar().toString(), output.toString(), null, false, 1, EnrichmentOptions.defaults())
        );

        assertEquals(1, summary.recordsWritten());
        JsonNode events = objectMapper.readTree(output.toFile());
        assertEquals("early@example.org", events.get(0).get("guid").asText());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void transformConfigIsAppliedFromFile() throws Exception {
        Path config = tempDir.resolve("transform.json");
        Files.writeString(config, "{\"target_timezone\": \"UTC\", \"copies\": {\"eventId\": \"guid\"}}");
        Path output = tempDir.resolve("configured.json");

        service.generate(new FeedRunRequest(
            writeCalendar().toString(), output.toString(), config.toString(), false, null, EnrichmentOptions.defaults()
        ));

        JsonNode first = objectMapper.readTree(output.toFile()).get(0);
        assertEquals("2024-03-01T15:00:00", first.get("startTime").asText());
        assertEquals("early@example.org", first.get("eventId").asText());
    }

    @Test
    void enrichRunsFallbackWhenOnlyFallbackIsEnabled() {
        List<EventRecord> records = new ArrayList<>(List.of(EventRecord.of("speaker", "Alice", "title", "tbd")));
        EnrichmentOptions options = EnrichmentOptions.defaults()
            .withTitleFallback(true, false)
            .withTitlePrefixTemplate("Talk by");

        EventFeedService.EnrichmentRun run = service.enrich(records, options);

        assertEquals(1, run.titlesFilled());
        assertThat(run.stats()).isEmpty();
        assertEquals("Talk by Alice", records.get(0).get("title"));
    }

    @Test
    void calendarFailuresStopTheRun() {
        Path missing = tempDir.resolve("missing.ics");

        assertThatThrownBy(() -> service.generate(new FeedRunRequest(
            missing.toUri().toString(), tempDir.resolve("x.json").toString(), null, false, null, null
        ))).isInstanceOf(CalendarLoadException.class);
    }

    @Test
    void optionsComeFromProperties() {
        FeedProperties.Enrichment enrichment = new FeedProperties.Enrichment();
        enrichment.getContent().setEnabled(true);
        enrichment.getContent().setFormat("markdown");
        enrichment.getTitleFallback().setPrefixTemplate("{series}");

        EnrichmentOptions options = EventFeedService.enrichmentOptions(enrichment);

        assertThat(options.content().enabled()).isTrue();
        assertEquals(ContentFormat.MARKDOWN, options.contentFormat());
        assertThat(options.rawExtracts().enabled()).isTrue();
        assertThat(options.titles().enabled()).isFalse();
        assertEquals("{series}", options.titlePrefixTemplate());
    }
}
