/**
 * ImageNormalizer prepares a downloaded featured image for embedding.
 * - Payloads under MIN_BYTES are rejected as placeholders or broken images.
 * - The image is decoded, flattened to RGB (alpha and palette modes included),
 *   scaled to a fixed 300x225 footprint and re-encoded as PNG.
 */

package com.example.affairsdigest.service.render;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.logging.Logger;

public class ImageNormalizer {
    public static final int MIN_BYTES = 100;
    public static final int WIDTH = 300;
    public static final int HEIGHT = 225;

    private final Logger logger;

    public ImageNormalizer(Logger logger) {
        this.logger = logger;
    }

    public Optional<byte[]> normalize(byte[] content, String source) {
        if (content == null || content.length < MIN_BYTES) {
            logger.warning("Image at " + source + " is too small, likely invalid");
            return Optional.empty();
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
            if (image == null) {
                logger.warning("Image at " + source + " is in an unsupported format");
                return Optional.empty();
            }
            BufferedImage scaled = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
            Graphics2D graphics = scaled.createGraphics();
            try {
                graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
                graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
                graphics.drawImage(image, 0, 0, WIDTH, HEIGHT, Color.WHITE, null);
            } finally {
                graphics.dispose();
            }
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            if (!ImageIO.write(scaled, "png", output)) {
                logger.warning("No PNG writer available for image at " + source);
                return Optional.empty();
            }
            return Optional.of(output.toByteArray());
        } catch (IOException e) {
            logger.warning("Failed to process image from " + source + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
