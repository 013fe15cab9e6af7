/**
 * CategoryDetector finds an article's topical category inside its content container.
 * - First it looks for a "Category:" label paragraph (p.small-font with a bold label) and takes its tag link text.
 * - Failing that, it scans the container's direct children for plain "Category: value" text.
 * - When neither is present the article simply has no category.
 */

package com.example.affairsdigest.service.extract;

import org.jsoup.nodes.Element;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CategoryDetector {
    static final Pattern CATEGORY_PATTERN = Pattern.compile("Category: (.+)");

    public Optional<String> detect(Element root) {
        Optional<String> labelled = fromLabel(root);
        if (labelled.isPresent()) {
            return labelled;
        }
        return fromText(root);
    }

    public boolean isCategoryMarker(String text) {
        return CATEGORY_PATTERN.matcher(text).find();
    }

    private Optional<String> fromLabel(Element root) {
        for (Element paragraph : root.select("p.small-font")) {
            boolean hasLabel = paragraph.select("b").stream()
                    .anyMatch(label -> label.text().trim().equals("Category:"));
            if (!hasLabel) {
                continue;
            }
            Element link = paragraph.selectFirst("a[rel~=tag]");
            if (link != null && !link.text().isBlank()) {
                return Optional.of(link.text().trim());
            }
        }
        return Optional.empty();
    }

    private Optional<String> fromText(Element root) {
        for (Element child : root.children()) {
            String text = child.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            Matcher matcher = CATEGORY_PATTERN.matcher(text);
            if (matcher.find()) {
                String value = matcher.group(1).trim();
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }
}
