/**
 * Immutable state of a document build: the operations planned so far and the cursor after them.
 */

package com.example.affairsdigest.service.docs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class DocumentPlan {
    private final RenderCursor cursor;
    private final List<DocumentOperation> operations;

    private DocumentPlan(RenderCursor cursor, List<DocumentOperation> operations) {
        this.cursor = cursor;
        this.operations = operations;
    }

    public static DocumentPlan empty() {
        return new DocumentPlan(RenderCursor.START, Collections.emptyList());
    }

    public RenderCursor getCursor() {
        return cursor;
    }
    public List<DocumentOperation> getOperations() {
        return operations;
    }

    /**
     * Appends one insertion plus the operations that style what it inserted. The insertion must sit
     * exactly at the current cursor; the new cursor is derived from the text of that insertion.
     */
    public DocumentPlan append(InsertTextOperation insert, List<? extends DocumentOperation> styling) {
        if (insert.getIndex() != cursor.getPosition()) {
            throw new IllegalStateException("Insertion at " + insert.getIndex() + " but cursor is at " + cursor.getPosition());
        }
        List<DocumentOperation> next = new ArrayList<>(operations.size() + 1 + styling.size());
        next.addAll(operations);
        next.add(insert);
        next.addAll(styling);
        return new DocumentPlan(cursor.advance(insert.getText()), Collections.unmodifiableList(next));
    }
}
