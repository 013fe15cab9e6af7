/**
 * Half-open range [start, end) of document indices.
 */

package com.example.affairsdigest.service.docs;

import org.json.JSONObject;

import java.util.Objects;

public final class IndexRange {
    private final int start;
    private final int end;

    public IndexRange(int start, int end) {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }
    public int getEnd() {
        return end;
    }

    JSONObject toJson() {
        return new JSONObject()
                .put("startIndex", start)
                .put("endIndex", end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexRange that = (IndexRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
