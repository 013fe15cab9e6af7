/**
 * Position in a remote document's text where the next insertion goes.
 * Index 0 belongs to the document's own leading structural element, so a fresh document starts at 1.
 * The cursor only moves forward, by the exact length of text that was inserted.
 */

package com.example.affairsdigest.service.docs;

public final class RenderCursor {
    public static final RenderCursor START = new RenderCursor(1);

    private final int position;

    private RenderCursor(int position) {
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Range the given text will occupy once inserted at this cursor. Lengths are counted in UTF-16
     * code units, the same unit the document API uses for indices.
     */
    public IndexRange rangeOf(String insertedText) {
        return new IndexRange(position, position + insertedText.length());
    }

    public RenderCursor advance(String insertedText) {
        if (insertedText.isEmpty()) {
            throw new IllegalArgumentException("Nothing was inserted");
        }
        return new RenderCursor(position + insertedText.length());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RenderCursor && ((RenderCursor) o).position == position;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(position);
    }

    @Override
    public String toString() {
        return "RenderCursor@" + position;
    }
}
