package com.eventfeed.feed.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Finds the fragment of an event detail page that holds a given section. Each kind owns an
 * ordered list of lookups; the first lookup that finds something wins, so the specific
 * details-container lookup always runs before the generic containers that might wrap it.
 */
@Component
public class SectionLocator {
    static final String SUBTITLE_SELECTOR = "div.event-subtitle";
    static final List<String> DETAILS_CONTAINERS = List.of(
        ".events-detail-main",
        ".event-details-main"
    );
    static final List<String> CONTENT_WRAPPERS = List.of(
        ".tex2jax_process",
        ".field__item",
        ".field--name-field-ps-body",
        ".text-formatted"
    );
    static final List<String> GENERIC_CONTAINERS = List.of(
        ".event-description",
        ".event-body",
        ".event-content",
        "#event-description",
        "#event-body",
        "article"
    );
    private static final Set<String> BLOCK_TAGS = Set.of(
        "div", "section", "article", "p", "ul", "ol", "table", "blockquote", "pre"
    );
    private static final Set<String> HEADING_TAGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");
    private static final String DETAILS_HEADER_TEXT = "details";

    private final Map<SectionKind, List<Function<Document, Optional<Element>>>> lookups;

    public SectionLocator() {
        Map<SectionKind, List<Function<Document, Optional<Element>>>> byKind = new EnumMap<>(SectionKind.class);
        byKind.put(SectionKind.SUBTITLE, List.of(document -> first(document, SUBTITLE_SELECTOR)));

        List<Function<Document, Optional<Element>>> rawDetails = new ArrayList<>();
        for (String selector : DETAILS_CONTAINERS) {
            rawDetails.add(document -> first(document, selector));
        }
        byKind.put(SectionKind.RAW_DETAILS, List.copyOf(rawDetails));

        List<Function<Document, Optional<Element>>> content = new ArrayList<>();
        content.add(this::detailsBody);
        for (String selector : GENERIC_CONTAINERS) {
            content.add(document -> first(document, selector));
        }
        byKind.put(SectionKind.CONTENT_BODY, List.copyOf(content));
        this.lookups = byKind;
    }

    public Optional<Element> locate(Document document, SectionKind kind) {
        if (document == null || kind == null) {
            return Optional.empty();
        }
        for (Function<Document, Optional<Element>> lookup : lookups.getOrDefault(kind, List.of())) {
            Optional<Element> found = lookup.apply(document);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    Optional<Element> detailsContainer(Document document) {
        for (String selector : DETAILS_CONTAINERS) {
            Optional<Element> container = first(document, selector);
            if (container.isPresent()) {
                return container;
            }
        }
        return Optional.empty();
    }

    private Optional<Element> detailsBody(Document document) {
        Optional<Element> container = detailsContainer(document);
        if (container.isEmpty()) {
            return Optional.empty();
        }
        Element header = detailsHeader(container.get());
        if (header == null) {
            return container;
        }

        List<Element> following = new ArrayList<>();
        for (Element sibling = header.nextElementSibling(); sibling != null; sibling = sibling.nextElementSibling()) {
            following.add(sibling);
        }
        for (String wrapper : CONTENT_WRAPPERS) {
            for (Element sibling : following) {
                if (sibling.is(wrapper)) {
                    return Optional.of(sibling);
                }
                Element nested = sibling.selectFirst(wrapper);
                if (nested != null) {
                    return Optional.of(nested);
                }
            }
        }
        for (Element sibling : following) {
            if (BLOCK_TAGS.contains(sibling.normalName())) {
                return Optional.of(sibling);
            }
        }
        return Optional.empty();
    }

    private Element detailsHeader(Element container) {
        Element classed = container.selectFirst("h2.details");
        if (classed != null) {
            return classed;
        }
        for (Element candidate : container.select(".details, h1, h2, h3, h4, h5, h6")) {
            if (candidate.hasClass(DETAILS_HEADER_TEXT)) {
                return candidate;
            }
            if (HEADING_TAGS.contains(candidate.normalName())
                && DETAILS_HEADER_TEXT.equalsIgnoreCase(candidate.text().trim())) {
                return candidate;
            }
        }
        return null;
    }

    private static Optional<Element> first(Document document, String selector) {
        return Optional.ofNullable(document.selectFirst(selector));
    }
}
