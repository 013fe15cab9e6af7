package com.example.affairsdigest.service.docs;

import org.json.JSONObject;

public final class CreateParagraphBulletsOperation extends DocumentOperation {
    private final IndexRange range;
    private final BulletPreset preset;

    public CreateParagraphBulletsOperation(IndexRange range, BulletPreset preset) {
        this.range = range;
        this.preset = preset;
    }

    public IndexRange getRange() {
        return range;
    }
    public BulletPreset getPreset() {
        return preset;
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject().put("createParagraphBullets", new JSONObject()
                .put("range", range.toJson())
                .put("bulletPreset", preset.name()));
    }

    @Override
    public String toString() {
        return "createParagraphBullets" + range + " " + preset;
    }
}
