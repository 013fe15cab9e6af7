/**
 * One request of a document batch update.
 */

package com.example.affairsdigest.service.docs;

import org.json.JSONObject;

public abstract class DocumentOperation {
    public abstract JSONObject toJson();
}
