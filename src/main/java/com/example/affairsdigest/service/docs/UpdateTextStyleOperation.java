package com.example.affairsdigest.service.docs;

import org.json.JSONObject;

public final class UpdateTextStyleOperation extends DocumentOperation {
    private final IndexRange range;
    private final TextStyle style;

    public UpdateTextStyleOperation(IndexRange range, TextStyle style) {
        this.range = range;
        this.style = style;
    }

    public IndexRange getRange() {
        return range;
    }
    public TextStyle getStyle() {
        return style;
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject().put("updateTextStyle", new JSONObject()
                .put("range", range.toJson())
                .put("textStyle", style.toJson())
                .put("fields", "*"));
    }

    @Override
    public String toString() {
        return "updateTextStyle" + range;
    }
}
