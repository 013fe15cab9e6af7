/**
 * ContentBlock is the atomic unit of a normalized article.
 * - kind, text and language are always present; text is trimmed and never empty.
 * - imageRef may only be carried by a translated HEADING block.
 * - ordinal is present only on NUMBERED_ITEM blocks and starts at 1 for every article.
 * Instances are immutable; the constructor rejects combinations that break these rules.
 */

package com.example.affairsdigest.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

public final class ContentBlock {
    private final BlockKind kind;
    private final String text;
    private final Language language;
    private final String imageRef;
    private final Integer ordinal;

    public ContentBlock(BlockKind kind, String text, Language language, String imageRef, Integer ordinal) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.language = Objects.requireNonNull(language, "language");
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Block text must not be empty");
        }
        this.text = text.trim();
        if (imageRef != null && (kind != BlockKind.HEADING || language != Language.TRANSLATED)) {
            throw new IllegalArgumentException("imageRef is only allowed on a translated heading");
        }
        if ((ordinal != null) != (kind == BlockKind.NUMBERED_ITEM)) {
            throw new IllegalArgumentException("ordinal must be present exactly on numbered items");
        }
        if (ordinal != null && ordinal < 1) {
            throw new IllegalArgumentException("ordinal is 1-based: " + ordinal);
        }
        this.imageRef = imageRef;
        this.ordinal = ordinal;
    }

    public static ContentBlock of(BlockKind kind, String text, Language language) {
        return new ContentBlock(kind, text, language, null, null);
    }

    public static ContentBlock numbered(String text, Language language, int ordinal) {
        return new ContentBlock(BlockKind.NUMBERED_ITEM, text, language, null, ordinal);
    }

    public BlockKind getKind() {
        return kind;
    }
    public String getText() {
        return text;
    }
    public Language getLanguage() {
        return language;
    }
    public Optional<String> getImageRef() {
        return Optional.ofNullable(imageRef);
    }
    public OptionalInt getOrdinal() {
        return ordinal == null ? OptionalInt.empty() : OptionalInt.of(ordinal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentBlock that = (ContentBlock) o;
        return kind == that.kind
                && language == that.language
                && text.equals(that.text)
                && Objects.equals(imageRef, that.imageRef)
                && Objects.equals(ordinal, that.ordinal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, language, imageRef, ordinal);
    }

    @Override
    public String toString() {
        return kind + "/" + language + (ordinal != null ? "#" + ordinal : "") + ": " + text;
    }
}
