package com.eventfeed.feed.service;

import com.eventfeed.feed.model.EventRecord;
import com.eventfeed.feed.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Network-free last pass: a record whose title is still missing gets its speaker as title,
 * optionally behind a prefix rendered from the record's own fields.
 */
@Component
public class FallbackTitleFiller {
    private static final Logger log = LoggerFactory.getLogger(FallbackTitleFiller.class);

    static final int MAX_PREFIX_LENGTH = 80;
    private static final Pattern FIELD_REFERENCE = Pattern.compile("\\{([^{}]*)}");

    public int fill(List<EventRecord> records, boolean overwrite) {
        return fill(records, overwrite, null);
    }

    public int fill(List<EventRecord> records, boolean overwrite, String prefixTemplate) {
        if (records == null) {
            return 0;
        }
        int filled = 0;
        for (EventRecord record : records) {
            if (record == null) {
                continue;
            }
            Object speakerValue = record.get(EventRecord.SPEAKER);
            if (TextNormalizer.isBlank(speakerValue)) {
                continue;
            }
            if (!overwrite && !TextNormalizer.isMissing(record.get(EventRecord.TITLE))) {
                continue;
            }
            String speaker = speakerValue.toString().trim();
            String prefix = renderPrefix(prefixTemplate, record);
            String title = prefix.isEmpty() ? speaker : prefix + " " + speaker;
            record.put(EventRecord.TITLE, title);
            filled++;
            log.debug("Title fallback guid={} title={}", record.getString(EventRecord.GUID), title);
        }
        return filled;
    }

    /**
     * Renders {@code {field}} references from the record. Unknown or non-string fields render empty.
     * Templates with unbalanced braces are used as written.
     */
    String renderPrefix(String template, EventRecord record) {
        if (template == null || template.isBlank()) {
            return "";
        }
        String rendered;
        if (!balancedBraces(template)) {
            rendered = template;
        } else {
            Matcher matcher = FIELD_REFERENCE.matcher(template);
            StringBuilder out = new StringBuilder();
            while (matcher.find()) {
                Object value = record.get(matcher.group(1).trim());
                String replacement = value instanceof String ? (String) value : "";
                matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
            }
            matcher.appendTail(out);
            rendered = out.toString();
        }
        rendered = TextNormalizer.collapseWhitespace(rendered);
        if (rendered.length() > MAX_PREFIX_LENGTH) {
            log.debug("Title prefix dropped, {} chars exceeds {}", rendered.length(), MAX_PREFIX_LENGTH);
            return "";
        }
        return rendered;
    }

    private static boolean balancedBraces(String template) {
        boolean open = false;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '{') {
                if (open) {
                    return false;
                }
                open = true;
            } else if (c == '}') {
                if (!open) {
                    return false;
                }
                open = false;
            }
        }
        return !open;
    }
}
