package io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import image.PixelBuffer;

public final class ImageLoader {

    private static final Logger logger = LoggerFactory.getLogger(ImageLoader.class);

    private ImageLoader() {
    }

    /**
     * Decode any format ImageIO can read (PNG, JPEG, BMP, GIF, ...).
     *
     * @throws IOException if the file cannot be read or no decoder accepts it
     */
    public static PixelBuffer load(Path input) throws IOException {
        BufferedImage img;
        try (InputStream in = Files.newInputStream(input)) {
            img = ImageIO.read(in);
        }
        if (img == null)
            throw new IOException("Unsupported image format: " + input);
        PixelBuffer buf = BufferedImages.toPixelBuffer(img);
        logger.debug("Loaded {} as {}", input, buf);
        return buf;
    }
}
