/**
 * DocumentPlanner computes the batch of requests that writes one category document.
 * - The document API shifts every later index when text is inserted, so each style range is computed
 *   from the exact text of the insertion it belongs to, before the next insertion is planned.
 * - Layout: styled page title, plain separator line, one insertion per block, trailing separator.
 * - step() is a pure function of (plan, block); plan() folds it over a whole category.
 */

package com.example.affairsdigest.service.docs;

import com.example.affairsdigest.model.ContentBlock;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class DocumentPlanner {
    public static final String SEPARATOR = "-".repeat(50);

    public static final TextStyle TITLE_STYLE = new TextStyle(true, false, 0, 0.4, 0.8, 18);
    public static final TextStyle HEADING_STYLE = new TextStyle(true, false, 0.2, 0.2, 0.2, 14);
    public static final TextStyle PARAGRAPH_STYLE = new TextStyle(false, false, 0.13, 0.13, 0.13, 11);
    public static final TextStyle SUB_HEADING_STYLE = new TextStyle(true, true, 0, 0.6, 0.3, 12);
    public static final TextStyle SUB_SUB_HEADING_STYLE = new TextStyle(true, false, 0.4, 0.4, 0.4, 11);
    public static final TextStyle LIST_STYLE = new TextStyle(false, false, 0.26, 0.26, 0.26, 11);

    private static final DateTimeFormatter PAGE_TITLE_DATE = DateTimeFormatter.ofPattern("dd MMMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter DOCUMENT_TITLE_DATE = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private DocumentPlanner() {
    }

    public static String documentTitle(String category, LocalDate date) {
        return DOCUMENT_TITLE_DATE.format(date) + " - " + category;
    }

    public static String pageTitle(LocalDate date) {
        return "Current Affairs - " + PAGE_TITLE_DATE.format(date);
    }

    public static DocumentPlan plan(String pageTitle, List<ContentBlock> blocks) {
        DocumentPlan plan = begin(pageTitle);
        for (ContentBlock block : blocks) {
            plan = step(plan, block);
        }
        return finish(plan);
    }

    public static DocumentPlan begin(String pageTitle) {
        DocumentPlan plan = DocumentPlan.empty();
        InsertTextOperation title = insertAt(plan, pageTitle + "\n");
        IndexRange titleRange = plan.getCursor().rangeOf(title.getText());
        plan = plan.append(title, List.of(new UpdateTextStyleOperation(titleRange, TITLE_STYLE)));
        return plan.append(insertAt(plan, SEPARATOR + "\n"), List.of());
    }

    public static DocumentPlan step(DocumentPlan plan, ContentBlock block) {
        InsertTextOperation insert = insertAt(plan, textFor(block));
        IndexRange range = plan.getCursor().rangeOf(insert.getText());
        List<DocumentOperation> styling = new ArrayList<>(2);
        switch (block.getKind()) {
            case HEADING:
                styling.add(new UpdateTextStyleOperation(range, HEADING_STYLE));
                break;
            case PARAGRAPH:
                styling.add(new UpdateTextStyleOperation(range, PARAGRAPH_STYLE));
                break;
            case SUB_HEADING:
                styling.add(new UpdateTextStyleOperation(range, SUB_HEADING_STYLE));
                break;
            case SUB_SUB_HEADING:
                styling.add(new UpdateTextStyleOperation(range, SUB_SUB_HEADING_STYLE));
                break;
            case BULLET_ITEM:
                styling.add(new CreateParagraphBulletsOperation(range, BulletPreset.BULLET_DISC_CIRCLE_SQUARE));
                styling.add(new UpdateTextStyleOperation(range, LIST_STYLE));
                break;
            case NUMBERED_ITEM:
                styling.add(new CreateParagraphBulletsOperation(range, BulletPreset.NUMBERED_DECIMAL_ALPHA_ROMAN));
                styling.add(new UpdateTextStyleOperation(range, LIST_STYLE));
                break;
            default:
                throw new IllegalArgumentException("Unknown block kind " + block.getKind());
        }
        return plan.append(insert, styling);
    }

    public static DocumentPlan finish(DocumentPlan plan) {
        return plan.append(insertAt(plan, "\n" + SEPARATOR + "\n\n"), List.of());
    }

    /**
     * The exact text inserted for a block, terminators and list prefixes included.
     */
    public static String textFor(ContentBlock block) {
        switch (block.getKind()) {
            case PARAGRAPH:
                return block.getText() + "\n\n";
            case BULLET_ITEM:
                return "• " + block.getText() + "\n";
            case NUMBERED_ITEM:
                return block.getOrdinal().getAsInt() + ". " + block.getText() + "\n";
            default:
                return block.getText() + "\n";
        }
    }

    private static InsertTextOperation insertAt(DocumentPlan plan, String text) {
        return new InsertTextOperation(plan.getCursor().getPosition(), text);
    }
}
