/**
 * Current article template: a single column post container with the heading inside it.
 */

package com.example.affairsdigest.service.extract;

public class CurrentLayoutStrategy extends SelectorLayoutStrategy {
    public CurrentLayoutStrategy() {
        super("current",
                "div.inside_post.column.content_width",
                "h1#list",
                "div.featured_image img[src]");
    }
}
