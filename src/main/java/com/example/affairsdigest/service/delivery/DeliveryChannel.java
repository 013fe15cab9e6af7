/**
 * DeliveryChannel is the messaging channel the digest is published to.
 * - sendDocument(): uploads a file with a caption.
 * - sendMessage(): posts plain text.
 * Implementations signal timeouts as transient DeliveryExceptions and everything else as permanent.
 */

package com.example.affairsdigest.service.delivery;

import com.example.affairsdigest.exception.DeliveryException;

import java.nio.file.Path;

public interface DeliveryChannel {
    void sendDocument(Path file, String filename, String caption) throws DeliveryException;
    void sendMessage(String text) throws DeliveryException;
}
