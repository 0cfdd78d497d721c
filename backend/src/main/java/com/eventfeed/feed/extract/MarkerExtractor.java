package com.eventfeed.feed.extract;

import com.eventfeed.feed.util.TextNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a labeled section ("Abstract", "Bio", ...) out of event detail HTML.
 * <p>
 * The marker is searched in this order, first hit wins:
 * <ol>
 *   <li>a text node containing {@code Word:} (case-sensitive);</li>
 *   <li>a text node containing the word in any case whose nearest block ancestor reads {@code word:},
 *       which covers {@code <b>Bio</b>: ...};</li>
 *   <li>a heading {@code h1}-{@code h6} whose text is the word, any case.</li>
 * </ol>
 * A colon marker is scoped to its nearest block ({@code p}, {@code div}, {@code li}, a heading, a table
 * cell, ...) and yields the rest of that block. When that block is a heading, or nothing follows the
 * colon, the following siblings are collected as well. Heading markers yield the text of the following
 * siblings up to the next heading or bare label such as {@code Bio:}. Later occurrences of the same
 * marker are ignored.
 */
@Component
public class MarkerExtractor {
    public static final String ABSTRACT = "Abstract";
    public static final String BIO = "Bio";

    private static final Set<String> HEADING_TAGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");
    private static final Set<String> BLOCK_ANCESTORS = Set.of(
        "p", "div", "section", "article", "li", "td", "th", "dd", "dt", "blockquote",
        "h1", "h2", "h3", "h4", "h5", "h6"
    );
    // A block holding nothing but a label, e.g. "Bio:", starts the next section.
    private static final Pattern BARE_LABEL = Pattern.compile("^[\\p{L}][\\p{L} ]{0,40}:$");

    public String extractAbstract(String rawHtml) {
        return extract(rawHtml, ABSTRACT);
    }

    public String extractBio(String rawHtml) {
        return extract(rawHtml, BIO);
    }

    public String extract(String rawHtml, String markerWord) {
        if (rawHtml == null || rawHtml.isBlank() || markerWord == null || markerWord.isBlank()) {
            return "";
        }
        Document document = Jsoup.parseBodyFragment(rawHtml);
        String word = markerWord.trim();
        return findMarker(document, word)
            .map(Marker::collect)
            .map(TextNormalizer::collapseWhitespace)
            .orElse("");
    }

    private Optional<Marker> findMarker(Document document, String word) {
        List<TextNode> textNodes = textNodes(document.body());
        String literal = word + ":";
        for (TextNode node : textNodes) {
            if (node.text().contains(literal)) {
                Pattern exact = Pattern.compile(Pattern.quote(literal));
                return Optional.of(Marker.colon(blockAncestorOrParent(node), exact));
            }
        }

        String lowerWord = word.toLowerCase(Locale.ROOT);
        Pattern relaxed = Pattern.compile(Pattern.quote(literal), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        for (TextNode node : textNodes) {
            if (!node.text().toLowerCase(Locale.ROOT).contains(lowerWord)) {
                continue;
            }
            Element block = blockAncestor(node);
            if (block != null && relaxed.matcher(block.text()).find()) {
                return Optional.of(Marker.colon(block, relaxed));
            }
        }

        for (Element heading : document.body().select("h1, h2, h3, h4, h5, h6")) {
            if (heading.text().trim().equalsIgnoreCase(word)) {
                return Optional.of(Marker.heading(heading));
            }
        }
        return Optional.empty();
    }

    private static List<TextNode> textNodes(Element root) {
        List<TextNode> nodes = new ArrayList<>();
        if (root == null) {
            return nodes;
        }
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    nodes.add((TextNode) node);
                }
            }

            @Override
            public void tail(Node node, int depth) {
            }
        }, root);
        return nodes;
    }

    private static Element blockAncestor(TextNode node) {
        Node current = node.parent();
        while (current instanceof Element) {
            Element element = (Element) current;
            if (BLOCK_ANCESTORS.contains(element.normalName())) {
                return element;
            }
            current = element.parent();
        }
        return null;
    }

    private static Element blockAncestorOrParent(TextNode node) {
        Element block = blockAncestor(node);
        if (block != null) {
            return block;
        }
        return node.parent() instanceof Element ? (Element) node.parent() : null;
    }

    private record Marker(Element element, Pattern colonPattern) {
        static Marker colon(Element block, Pattern pattern) {
            return new Marker(block, pattern);
        }

        static Marker heading(Element heading) {
            return new Marker(heading, null);
        }

        String collect() {
            if (element == null) {
                return "";
            }
            if (colonPattern == null) {
                return followingText(element);
            }
            String text = element.text();
            Matcher matcher = colonPattern.matcher(text);
            String rest = matcher.find() ? text.substring(matcher.end()).trim() : "";
            if (!isHeading(element) && !rest.isEmpty()) {
                return rest;
            }
            List<String> parts = new ArrayList<>();
            addIfPresent(parts, rest);
            addIfPresent(parts, followingText(element));
            return String.join(" ", parts);
        }

        private static String followingText(Element start) {
            List<String> parts = new ArrayList<>();
            for (Node sibling = start.nextSibling(); sibling != null; sibling = sibling.nextSibling()) {
                if (sibling instanceof Element) {
                    Element next = (Element) sibling;
                    if (isHeading(next) || BARE_LABEL.matcher(next.text().trim()).matches()) {
                        break;
                    }
                    addIfPresent(parts, next.text());
                } else if (sibling instanceof TextNode) {
                    addIfPresent(parts, ((TextNode) sibling).text());
                }
            }
            return String.join(" ", parts);
        }

        private static boolean isHeading(Element element) {
            return HEADING_TAGS.contains(element.normalName());
        }

        private static void addIfPresent(List<String> parts, String value) {
            if (value != null && !value.isBlank()) {
                parts.add(value.trim());
            }
        }
    }
}
