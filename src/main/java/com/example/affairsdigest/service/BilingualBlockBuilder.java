/**
 * Turns the raw text of one article into its bilingual block sequence.
 * Every block is emitted twice, translated copy first, and numbered items share one ordinal per pair.
 */

package com.example.affairsdigest.service;

import com.example.affairsdigest.exception.TranslationException;
import com.example.affairsdigest.model.BlockKind;
import com.example.affairsdigest.model.ContentBlock;
import com.example.affairsdigest.model.Language;
import com.example.affairsdigest.service.extract.RawBlock;
import com.example.affairsdigest.service.translate.Translator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public class BilingualBlockBuilder {
    private final Translator translator;
    private final String targetLanguage;
    private final Logger logger;

    public BilingualBlockBuilder(Translator translator, String targetLanguage, Logger logger) {
        this.translator = translator;
        this.targetLanguage = targetLanguage;
        this.logger = logger;
    }

    /**
     * Builds the blocks of one article. Ordinals restart at 1 on every call.
     *
     * @param heading  original heading text
     * @param imageRef featured image URL, or null
     * @param rawBlocks body text in document order
     * @return the bilingual sequence, starting with the two heading blocks
     */
    public List<ContentBlock> build(String heading, String imageRef, List<RawBlock> rawBlocks) {
        List<ContentBlock> blocks = new ArrayList<>();
        String headingText = heading.trim();
        blocks.add(new ContentBlock(BlockKind.HEADING, translate(headingText), Language.TRANSLATED, imageRef, null));
        blocks.add(ContentBlock.of(BlockKind.HEADING, headingText, Language.ORIGINAL));

        int nextOrdinal = 1;
        for (RawBlock raw : rawBlocks) {
            String original = raw.getText().trim();
            if (original.isEmpty()) {
                continue;
            }
            String translated = translate(original);
            if (raw.getKind() == BlockKind.NUMBERED_ITEM) {
                blocks.add(ContentBlock.numbered(translated, Language.TRANSLATED, nextOrdinal));
                blocks.add(ContentBlock.numbered(original, Language.ORIGINAL, nextOrdinal));
                nextOrdinal++;
            } else {
                blocks.add(ContentBlock.of(raw.getKind(), translated, Language.TRANSLATED));
                blocks.add(ContentBlock.of(raw.getKind(), original, Language.ORIGINAL));
            }
        }
        return blocks;
    }

    private String translate(String text) {
        try {
            String translated = translator.translate(text, targetLanguage);
            if (translated == null || translated.isBlank()) {
                logger.warning("Empty translation, keeping original text");
                return text;
            }
            return translated.trim();
        } catch (TranslationException e) {
            logger.warning("Translation error: " + e.getMessage());
            return text;
        } catch (RuntimeException e) {
            logger.warning("Unexpected translation failure: " + e);
            return text;
        }
    }
}
