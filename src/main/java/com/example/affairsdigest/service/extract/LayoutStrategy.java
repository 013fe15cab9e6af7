/**
 * LayoutStrategy knows how one version of the site's article markup is laid out.
 * - matchRoot(): the article's content container, or empty when this layout does not apply.
 * - findHeading(): the article heading; once a root matched, a missing heading is a structural mismatch.
 * - findImageUrl(): the featured image, optional in every layout.
 * Strategies are tried in a fixed order and the first one whose root matches is used for the whole page.
 */

package com.example.affairsdigest.service.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Optional;

public interface LayoutStrategy {
    String name();
    Optional<Element> matchRoot(Document document);
    Optional<Element> findHeading(Document document, Element root);
    Optional<String> findImageUrl(Document document, Element root);
}
