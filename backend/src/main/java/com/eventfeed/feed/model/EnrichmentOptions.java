package com.eventfeed.feed.model;

import com.eventfeed.feed.extract.ContentFormat;

/**
 * Per-run enrichment switches, passed explicitly into every enrichment call.
 */
public record EnrichmentOptions(
    FieldToggle titles,
    FieldToggle content,
    FieldToggle rawDetails,
    FieldToggle rawExtracts,
    FieldToggle titleFallback,
    ContentFormat contentFormat,
    String titlePrefixTemplate
) {
    public EnrichmentOptions {
        titles = titles == null ? FieldToggle.DISABLED : titles;
        content = content == null ? FieldToggle.DISABLED : content;
        rawDetails = rawDetails == null ? FieldToggle.DISABLED : rawDetails;
        rawExtracts = rawExtracts == null ? FieldToggle.ENABLED : rawExtracts;
        titleFallback = titleFallback == null ? FieldToggle.DISABLED : titleFallback;
        contentFormat = contentFormat == null ? ContentFormat.TEXT : contentFormat;
        titlePrefixTemplate = titlePrefixTemplate == null ? "" : titlePrefixTemplate;
    }

    public static EnrichmentOptions defaults() {
        return new EnrichmentOptions(null, null, null, null, null, null, null);
    }

    public EnrichmentOptions withTitles(boolean enabled, boolean overwrite) {
        return new EnrichmentOptions(new FieldToggle(enabled, overwrite), content, rawDetails, rawExtracts, titleFallback,
            contentFormat, titlePrefixTemplate);
    }

    public EnrichmentOptions withContent(boolean enabled, boolean overwrite, ContentFormat format) {
        return new EnrichmentOptions(titles, new FieldToggle(enabled, overwrite), rawDetails, rawExtracts, titleFallback,
            format, titlePrefixTemplate);
    }

    public EnrichmentOptions withRawDetails(boolean enabled, boolean overwrite) {
        return new EnrichmentOptions(titles, content, new FieldToggle(enabled, overwrite), rawExtracts, titleFallback,
            contentFormat, titlePrefixTemplate);
    }

    public EnrichmentOptions withRawExtracts(boolean enabled, boolean overwrite) {
        return new EnrichmentOptions(titles, content, rawDetails, new FieldToggle(enabled, overwrite), titleFallback,
            contentFormat, titlePrefixTemplate);
    }

    /**
     * Title fallback always follows title enrichment; enabling it here runs it without title enrichment too.
     */
    public EnrichmentOptions withTitleFallback(boolean enabled, boolean overwrite) {
        return new EnrichmentOptions(titles, content, rawDetails, rawExtracts, new FieldToggle(enabled, overwrite),
            contentFormat, titlePrefixTemplate);
    }

    public EnrichmentOptions withTitlePrefixTemplate(String template) {
        return new EnrichmentOptions(titles, content, rawDetails, rawExtracts, titleFallback, contentFormat, template);
    }

    public record FieldToggle(boolean enabled, boolean overwrite) {
        public static final FieldToggle DISABLED = new FieldToggle(false, false);
        public static final FieldToggle ENABLED = new FieldToggle(true, false);
    }
}
