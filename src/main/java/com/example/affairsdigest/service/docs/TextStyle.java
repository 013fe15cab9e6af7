/**
 * Character style applied to a range: weight, slant, colour (0..1 RGB) and size in points.
 */

package com.example.affairsdigest.service.docs;

import org.json.JSONObject;

public final class TextStyle {
    private final boolean bold;
    private final boolean italic;
    private final double red;
    private final double green;
    private final double blue;
    private final int fontSize;

    public TextStyle(boolean bold, boolean italic, double red, double green, double blue, int fontSize) {
        this.bold = bold;
        this.italic = italic;
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.fontSize = fontSize;
    }

    JSONObject toJson() {
        JSONObject style = new JSONObject();
        if (bold) {
            style.put("bold", true);
        }
        if (italic) {
            style.put("italic", true);
        }
        JSONObject rgb = new JSONObject()
                .put("red", red)
                .put("green", green)
                .put("blue", blue);
        style.put("foregroundColor", new JSONObject().put("color", new JSONObject().put("rgbColor", rgb)));
        style.put("fontSize", new JSONObject().put("magnitude", fontSize).put("unit", "PT"));
        return style;
    }
}
