/**
 * One untranslated piece of article text as it was found in the page, in document order.
 */

package com.example.affairsdigest.service.extract;

import com.example.affairsdigest.model.BlockKind;

public final class RawBlock {
    private final BlockKind kind;
    private final String text;

    public RawBlock(BlockKind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public BlockKind getKind() {
        return kind;
    }
    public String getText() {
        return text;
    }
}
