package com.eventfeed.feed.service;

import com.eventfeed.config.FeedProperties;
import com.eventfeed.feed.calendar.CalendarRecordMapper;
import com.eventfeed.feed.calendar.CalendarSourceLoader;
import com.eventfeed.feed.calendar.IcsCalendarReader;
import com.eventfeed.feed.calendar.TransformConfigLoader;
import com.eventfeed.feed.extract.ContentFormat;
import com.eventfeed.feed.model.EnrichmentOptions;
import com.eventfeed.feed.model.EnrichmentStats;
import com.eventfeed.feed.model.EventRecord;
import com.eventfeed.feed.model.FeedRunRequest;
import com.eventfeed.feed.model.FeedRunSummary;
import com.eventfeed.feed.model.RawCalendarEntry;
import com.eventfeed.feed.model.RawExtractStats;
import com.eventfeed.feed.model.TransformConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Generate pipeline: load the calendar, map it, enrich the records, apply the limit and write JSON.
 */
@Service
public class EventFeedService {
    private static final Logger log = LoggerFactory.getLogger(EventFeedService.class);

    private final CalendarSourceLoader sourceLoader;
    private final IcsCalendarReader calendarReader;
    private final TransformConfigLoader configLoader;
    private final CalendarRecordMapper recordMapper;
    private final EnrichmentOrchestrator enrichmentOrchestrator;
    private final FallbackTitleFiller titleFiller;
    private final EventsJsonWriter jsonWriter;

    public EventFeedService(
        CalendarSourceLoader sourceLoader,
        IcsCalendarReader calendarReader,
        TransformConfigLoader configLoader,
        CalendarRecordMapper recordMapper,
        EnrichmentOrchestrator enrichmentOrchestrator,
        FallbackTitleFiller titleFiller,
        EventsJsonWriter jsonWriter
    ) {
        this.sourceLoader = sourceLoader;
        this.calendarReader = calendarReader;
        this.configLoader = configLoader;
        this.recordMapper = recordMapper;
        this.enrichmentOrchestrator = enrichmentOrchestrator;
        this.titleFiller = titleFiller;
        this.jsonWriter = jsonWriter;
    }

    public static EnrichmentOptions enrichmentOptions(FeedProperties.Enrichment enrichment) {
        if (enrichment == null) {
            return EnrichmentOptions.defaults();
        }
        return EnrichmentOptions.defaults()
            .withTitles(enrichment.getTitles().isEnabled(), enrichment.getTitles().isOverwrite())
            .withContent(
                enrichment.getContent().isEnabled(),
                enrichment.getContent().isOverwrite(),
                ContentFormat.parse(enrichment.getContent().getFormat())
            )
            .withRawDetails(enrichment.getRawDetails().isEnabled(), enrichment.getRawDetails().isOverwrite())
            .withRawExtracts(enrichment.getRawExtracts().isEnabled(), enrichment.getRawExtracts().isOverwrite())
            .withTitleFallback(enrichment.getTitleFallback().isEnabled(), enrichment.getTitleFallback().isOverwrite())
            .withTitlePrefixTemplate(enrichment.getTitleFallback().getPrefixTemplate());
    }

    public FeedRunSummary generate(FeedRunRequest request) {
        // Config first so a broken config file fails before anything is fetched.
        TransformConfig config = configLoader.load(configLoader.resolve(request.configPath()));
        String icsText = sourceLoader.load(request.icsSource());
        List<RawCalendarEntry> entries = calendarReader.read(icsText);
        List<EventRecord> records = recordMapper.mapCalendar(entries, config);
        log.info("Mapped {} calendar entries from {}", entries.size(), request.icsSource());

        EnrichmentRun run = enrich(records, request.enrichment());

        List<EventRecord> output = records;
        if (request.limit() != null && request.limit() < records.size()) {
            output = new ArrayList<>(records.subList(0, request.limit()));
            log.info("Limited output to {} of {} records", output.size(), records.size());
        }

        Path written = null;
        if (request.printOnly()) {
            System.out.println(jsonWriter.toJson(output));
        } else {
            written = jsonWriter.write(output, Path.of(request.outputPath()));
            log.info("Wrote {} events to {}", output.size(), written);
        }
        return new FeedRunSummary(entries.size(), output.size(), written, run.stats(), run.rawExtracts(), run.titlesFilled());
    }

    /**
     * Runs the enabled enrichment passes in pipeline order: titles, title fallback, content,
     * raw details, raw extracts.
     */
    public EnrichmentRun enrich(List<EventRecord> records, EnrichmentOptions options) {
        List<EnrichmentStats> stats = new ArrayList<>();
        if (options.titles().enabled()) {
            stats.add(logStats(enrichmentOrchestrator.enrichTitles(records, options)));
        }
        int titlesFilled = 0;
        if (options.titles().enabled() || options.titleFallback().enabled()) {
            titlesFilled = titleFiller.fill(records, options.titleFallback().overwrite(), options.titlePrefixTemplate());
            log.info("Title fallback filled {} titles", titlesFilled);
        }
        if (options.content().enabled()) {
            stats.add(logStats(enrichmentOrchestrator.enrichContent(records, options)));
        }
        if (options.rawDetails().enabled()) {
            stats.add(logStats(enrichmentOrchestrator.enrichRawDetails(records, options)));
        }
        RawExtractStats rawExtracts = enrichmentOrchestrator.enrichRawExtracts(records, options);
        if (options.rawExtracts().enabled()) {
            log.info("Raw extracts enrichment: {}", rawExtracts);
        }
        return new EnrichmentRun(stats, rawExtracts, titlesFilled);
    }

    private static EnrichmentStats logStats(EnrichmentStats stats) {
        log.info("{} enrichment: {}", stats.kind().field(), stats);
        return stats;
    }

    public record EnrichmentRun(List<EnrichmentStats> stats, RawExtractStats rawExtracts, int titlesFilled) {
    }
}
