package com.eventfeed.feed.extract;

import com.eventfeed.feed.util.TextNormalizer;
import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Renders a located fragment as plain text, Markdown or inner HTML. Script and style elements
 * are removed from the fragment first, whatever the format.
 */
@Component
public class ContentSerializer {
    private static final Logger log = LoggerFactory.getLogger(ContentSerializer.class);

    // Elements rendered with a blank line around them; other block elements only break the line.
    private static final Set<String> PARAGRAPH_TAGS = Set.of(
        "p", "h1", "h2", "h3", "h4", "h5", "h6", "blockquote", "pre", "ul", "ol", "table"
    );

    private final FlexmarkHtmlConverter markdownConverter;

    public ContentSerializer() {
        MutableDataSet options = new MutableDataSet();
        options.set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false);
        this.markdownConverter = FlexmarkHtmlConverter.builder(options).build();
    }

    public String serialize(Element fragment, ContentFormat format) {
        if (fragment == null) {
            return "";
        }
        fragment.select("script, style").remove();
        ContentFormat effective = format == null ? ContentFormat.TEXT : format;
        switch (effective) {
            case HTML:
                return toHtml(fragment);
            case MARKDOWN:
                return toMarkdown(fragment);
            default:
                return toText(fragment);
        }
    }

    String toText(Element fragment) {
        StringBuilder raw = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    raw.append(((TextNode) node).text());
                } else if (node instanceof Element) {
                    Element element = (Element) node;
                    if ("br".equals(element.normalName())) {
                        raw.append('\n');
                    } else {
                        appendBreak(raw, element);
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element) {
                    appendBreak(raw, (Element) node);
                }
            }
        }, fragment);

        List<String> lines = new ArrayList<>();
        boolean previousBlank = true;
        for (String line : raw.toString().split("\n")) {
            String collapsed = TextNormalizer.collapseWhitespace(line);
            if (collapsed.isEmpty()) {
                if (!previousBlank) {
                    lines.add("");
                }
                previousBlank = true;
            } else {
                lines.add(collapsed);
                previousBlank = false;
            }
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
    }

    String toMarkdown(Element fragment) {
        try {
            String markdown = markdownConverter.convert(fragment.html());
            return TextNormalizer.collapseBlankLines(markdown).strip();
        } catch (RuntimeException e) {
            log.debug("Markdown conversion failed; falling back to text", e);
            return toText(fragment);
        }
    }

    String toHtml(Element fragment) {
        try {
            Document owner = fragment.ownerDocument();
            if (owner != null) {
                owner.outputSettings().prettyPrint(false);
            }
            return fragment.html().trim();
        } catch (RuntimeException e) {
            log.debug("Inner HTML serialization failed; using outer HTML", e);
            return fragment.outerHtml();
        }
    }

    private static void appendBreak(StringBuilder raw, Element element) {
        if (PARAGRAPH_TAGS.contains(element.normalName())) {
            raw.append("\n\n");
        } else if (element.isBlock()) {
            raw.append('\n');
        }
    }
}
