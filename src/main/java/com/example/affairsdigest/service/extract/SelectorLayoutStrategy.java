/**
 * A layout described entirely by CSS selectors.
 */

package com.example.affairsdigest.service.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Optional;

public abstract class SelectorLayoutStrategy implements LayoutStrategy {
    private final String name;
    private final String rootSelector;
    private final String headingSelector;
    private final String imageSelector;

    protected SelectorLayoutStrategy(String name, String rootSelector, String headingSelector, String imageSelector) {
        this.name = name;
        this.rootSelector = rootSelector;
        this.headingSelector = headingSelector;
        this.imageSelector = imageSelector;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Element> matchRoot(Document document) {
        return Optional.ofNullable(document.selectFirst(rootSelector));
    }

    @Override
    public Optional<Element> findHeading(Document document, Element root) {
        return Optional.ofNullable(root.selectFirst(headingSelector))
                .filter(heading -> !heading.text().isBlank());
    }

    @Override
    public Optional<String> findImageUrl(Document document, Element root) {
        Element image = document.selectFirst(imageSelector);
        if (image == null) {
            return Optional.empty();
        }
        String url = image.hasAttr("content") ? image.absUrl("content") : image.absUrl("src");
        if (url.isEmpty()) {
            url = image.hasAttr("content") ? image.attr("content") : image.attr("src");
        }
        return url.isBlank() ? Optional.empty() : Optional.of(url);
    }
}
