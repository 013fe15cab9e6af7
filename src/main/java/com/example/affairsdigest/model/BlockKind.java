/**
 * Structural role of a content block inside an article.
 */

package com.example.affairsdigest.model;

public enum BlockKind {
    HEADING,
    PARAGRAPH,
    SUB_HEADING,
    SUB_SUB_HEADING,
    BULLET_ITEM,
    NUMBERED_ITEM;

    public boolean isListItem() {
        return this == BULLET_ITEM || this == NUMBERED_ITEM;
    }
}
