/**
 * DeliveryAdapter publishes the rendered digest to the messaging channel.
 * - Captions longer than CAPTION_LIMIT are cut to fit with a trailing "..." and the full text follows as a message.
 * - Every channel call is retried through the RetryPolicy; exhausted retries or permanent errors are thrown.
 */

package com.example.affairsdigest.service.delivery;

import com.example.affairsdigest.exception.DeliveryException;

import java.nio.file.Path;
import java.util.logging.Logger;

public class DeliveryAdapter {
    public static final int CAPTION_LIMIT = 1024;
    private static final String ELLIPSIS = "...";

    private final DeliveryChannel channel;
    private final RetryPolicy retryPolicy;
    private final Logger logger;

    public DeliveryAdapter(DeliveryChannel channel, RetryPolicy retryPolicy, Logger logger) {
        this.channel = channel;
        this.retryPolicy = retryPolicy;
        this.logger = logger;
    }

    public void deliver(Path file, String filename, String caption) throws DeliveryException {
        if (caption.length() > CAPTION_LIMIT) {
            String shortCaption = truncate(caption);
            retryPolicy.execute("send document", () -> channel.sendDocument(file, filename, shortCaption), logger);
            retryPolicy.execute("send full caption", () -> channel.sendMessage(caption), logger);
        } else {
            retryPolicy.execute("send document", () -> channel.sendDocument(file, filename, caption), logger);
        }
        logger.info("Document sent successfully");
    }

    static String truncate(String caption) {
        if (caption.length() <= CAPTION_LIMIT) {
            return caption;
        }
        int cut = CAPTION_LIMIT - ELLIPSIS.length();
        // keep surrogate pairs (emoji) whole
        if (Character.isHighSurrogate(caption.charAt(cut - 1))) {
            cut--;
        }
        return caption.substring(0, cut) + ELLIPSIS;
    }
}
