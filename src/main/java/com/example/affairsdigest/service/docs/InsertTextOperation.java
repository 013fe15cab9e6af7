package com.example.affairsdigest.service.docs;

import org.json.JSONObject;

public final class InsertTextOperation extends DocumentOperation {
    private final int index;
    private final String text;

    public InsertTextOperation(int index, String text) {
        this.index = index;
        this.text = text;
    }

    public int getIndex() {
        return index;
    }
    public String getText() {
        return text;
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject().put("insertText", new JSONObject()
                .put("location", new JSONObject().put("index", index))
                .put("text", text));
    }

    @Override
    public String toString() {
        return "insertText@" + index + " (" + text.length() + " chars)";
    }
}
