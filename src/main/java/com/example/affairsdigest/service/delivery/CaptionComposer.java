package com.example.affairsdigest.service.delivery;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

public class CaptionComposer {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd MMMM yyyy", Locale.ENGLISH);

    private final String footer;

    public CaptionComposer(String footer) {
        this.footer = footer;
    }

    public String compose(LocalDate date, List<String> titles) {
        StringBuilder caption = new StringBuilder();
        caption.append("🎗️ ").append(DATE.format(date)).append(" Current Affairs 🎗️\n\n");
        for (String title : titles) {
            caption.append("👉 ").append(title).append('\n');
        }
        caption.append('\n').append(footer);
        return caption.toString();
    }
}
