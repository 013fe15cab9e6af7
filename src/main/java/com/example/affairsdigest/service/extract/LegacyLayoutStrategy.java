/**
 * Older article template. The featured image may only be advertised through Open Graph metadata.
 */

package com.example.affairsdigest.service.extract;

public class LegacyLayoutStrategy extends SelectorLayoutStrategy {
    public LegacyLayoutStrategy() {
        super("legacy",
                "div.post-content",
                "h1",
                "img.wp-post-image[src], meta[property=og:image][content]");
    }
}
