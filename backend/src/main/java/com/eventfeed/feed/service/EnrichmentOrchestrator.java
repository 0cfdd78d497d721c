package com.eventfeed.feed.service;

import com.eventfeed.feed.extract.ContentFormat;
import com.eventfeed.feed.extract.ContentSerializer;
import com.eventfeed.feed.extract.MarkerExtractor;
import com.eventfeed.feed.extract.SectionKind;
import com.eventfeed.feed.extract.SectionLocator;
import com.eventfeed.feed.http.PageFetcher;
import com.eventfeed.feed.model.EnrichmentKind;
import com.eventfeed.feed.model.EnrichmentOptions;
import com.eventfeed.feed.model.EnrichmentStats;
import com.eventfeed.feed.model.EventRecord;
import com.eventfeed.feed.model.HttpFetchResult;
import com.eventfeed.feed.model.RawExtractStats;
import com.eventfeed.feed.util.TextNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Fills record fields from each event's detail page. Every pass walks the records in order,
 * fetches each distinct URL at most once (misses and failures included) and only writes a
 * field when new, non-empty data was obtained.
 */
@Service
public class EnrichmentOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentOrchestrator.class);

    private final PageFetcher pageFetcher;
    private final SectionLocator sectionLocator;
    private final ContentSerializer contentSerializer;
    private final MarkerExtractor markerExtractor;

    public EnrichmentOrchestrator(
        PageFetcher pageFetcher,
        SectionLocator sectionLocator,
        ContentSerializer contentSerializer,
        MarkerExtractor markerExtractor
    ) {
        this.pageFetcher = pageFetcher;
        this.sectionLocator = sectionLocator;
        this.contentSerializer = contentSerializer;
        this.markerExtractor = markerExtractor;
    }

    public EnrichmentStats enrichTitles(List<EventRecord> records, EnrichmentOptions options) {
        EnrichmentOptions.FieldToggle toggle = options.titles();
        if (!toggle.enabled()) {
            return new EnrichmentStats(EnrichmentKind.TITLE);
        }
        return enrichFromPages(records, EnrichmentKind.TITLE, toggle.overwrite(), (html, url) -> extractSubtitle(html, url));
    }

    public EnrichmentStats enrichContent(List<EventRecord> records, EnrichmentOptions options) {
        EnrichmentOptions.FieldToggle toggle = options.content();
        if (!toggle.enabled()) {
            return new EnrichmentStats(EnrichmentKind.CONTENT);
        }
        ContentFormat format = options.contentFormat();
        return enrichFromPages(
            records,
            EnrichmentKind.CONTENT,
            toggle.overwrite(),
            (html, url) -> extractSection(html, url, SectionKind.CONTENT_BODY, format)
        );
    }

    public EnrichmentStats enrichRawDetails(List<EventRecord> records, EnrichmentOptions options) {
        EnrichmentOptions.FieldToggle toggle = options.rawDetails();
        if (!toggle.enabled()) {
            return new EnrichmentStats(EnrichmentKind.RAW_DETAILS);
        }
        return enrichFromPages(
            records,
            EnrichmentKind.RAW_DETAILS,
            toggle.overwrite(),
            (html, url) -> extractSection(html, url, SectionKind.RAW_DETAILS, ContentFormat.HTML)
        );
    }

    /**
     * Splits {@code rawEventDetails} into {@code rawExtractAbstract} and {@code rawExtractBio}. No network.
     * Abstract and bio are handled independently; a failure in one does not stop the other.
     */
    public RawExtractStats enrichRawExtracts(List<EventRecord> records, EnrichmentOptions options) {
        RawExtractStats stats = new RawExtractStats();
        EnrichmentOptions.FieldToggle toggle = options.rawExtracts();
        if (!toggle.enabled()) {
            return stats;
        }
        for (int idx = 0; idx < records.size(); idx++) {
            EventRecord record = records.get(idx);
            String details = record.getString(EventRecord.RAW_EVENT_DETAILS);
            if (TextNormalizer.isBlank(details)) {
                stats.recordSkippedMissingDetails();
                log.debug("Raw extracts skip(no-details) event_index={}", idx);
                continue;
            }
            stats.recordAttempt();
            if (applyExtract(record, details, MarkerExtractor.ABSTRACT, EventRecord.RAW_EXTRACT_ABSTRACT, toggle.overwrite(), stats)) {
                stats.recordAbstractUpdate();
            }
            if (applyExtract(record, details, MarkerExtractor.BIO, EventRecord.RAW_EXTRACT_BIO, toggle.overwrite(), stats)) {
                stats.recordBioUpdate();
            }
        }
        return stats;
    }

    private boolean applyExtract(
        EventRecord record,
        String details,
        String marker,
        String field,
        boolean overwrite,
        RawExtractStats stats
    ) {
        String extracted;
        try {
            extracted = markerExtractor.extract(details, marker);
        } catch (RuntimeException e) {
            stats.recordError();
            log.debug("Raw extracts error marker={} guid={}", marker, record.getString(EventRecord.GUID), e);
            return false;
        }
        if (extracted == null || extracted.isBlank()) {
            return false;
        }
        if (!overwrite && !TextNormalizer.isBlank(record.get(field))) {
            log.debug("Raw extracts skip(has-value) field={} guid={}", field, record.getString(EventRecord.GUID));
            return false;
        }
        record.put(field, extracted);
        return true;
    }

    private EnrichmentStats enrichFromPages(
        List<EventRecord> records,
        EnrichmentKind kind,
        boolean overwrite,
        BiFunction<String, String, String> extraction
    ) {
        EnrichmentStats stats = new EnrichmentStats(kind);
        Map<String, String> cache = new HashMap<>();
        String field = kind.field();
        for (int idx = 0; idx < records.size(); idx++) {
            EventRecord record = records.get(idx);
            String url = record.getString(EventRecord.URL_REF);
            if (url == null || url.isBlank()) {
                stats.recordSkippedMissingUrl();
                log.debug("Enrich {} skip(no-url) event_index={}", kind, idx);
                continue;
            }
            url = url.trim();
            stats.recordAttempt();

            String value;
            Duration elapsed = null;
            if (cache.containsKey(url)) {
                value = cache.get(url);
                log.debug("Enrich {} cache-hit url={} len={}", kind, url, value.length());
            } else {
                try {
                    HttpFetchResult result = pageFetcher.fetch(url);
                    if (!result.isSuccessful() || result.body() == null) {
                        stats.recordError();
                        cache.put(url, "");
                        log.debug("Enrich {} fetch-failed url={} reason={}", kind, url, result.describeFailure());
                        continue;
                    }
                    elapsed = result.duration();
                    value = extraction.apply(result.body(), result.finalUrlOrRequested());
                } catch (RuntimeException e) {
                    stats.recordError();
                    cache.put(url, "");
                    log.debug("Enrich {} error url={}", kind, url, e);
                    continue;
                }
                value = value == null ? "" : value;
                cache.put(url, value);
                log.debug("Enrich {} fetched url={} len={} took={}ms", kind, url, value.length(),
                    elapsed == null ? -1 : elapsed.toMillis());
            }

            if (value.isBlank()) {
                log.debug("Enrich {} skip(no-data) url={}", kind, url);
                continue;
            }
            Object existing = record.get(field);
            if (overwrite || TextNormalizer.isBlank(existing)) {
                record.put(field, value);
                stats.recordUpdate();
                log.debug("Enrich {} {} url={}", kind, TextNormalizer.isBlank(existing) ? "updated" : "overwrote", url);
            } else {
                log.debug("Enrich {} skip(has-value) url={} overwrite={}", kind, url, overwrite);
            }
        }
        return stats;
    }

    private String extractSubtitle(String html, String baseUrl) {
        Document document = Jsoup.parse(html, baseUrl);
        return sectionLocator.locate(document, SectionKind.SUBTITLE)
            .map(element -> TextNormalizer.collapseWhitespace(element.text()))
            .orElse("");
    }

    private String extractSection(String html, String baseUrl, SectionKind kind, ContentFormat format) {
        Document document = Jsoup.parse(html, baseUrl);
        return sectionLocator.locate(document, kind)
            .map(element -> contentSerializer.serialize(element, format))
            .orElse("");
    }
}
