package io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import image.PixelBuffer;
import ops.Rgba;
import stages.BasicFilters;

public final class ImageSaver {

    private static final Logger logger = LoggerFactory.getLogger(ImageSaver.class);

    private ImageSaver() {
    }

    /**
     * Encode by file extension: {@code .jpg}/{@code .jpeg} (alpha flattened
     * onto white, 8-bit), {@code .bmp} (8-bit RGB), anything else PNG.
     * Missing parent directories are created.
     *
     * @return the absolute path written
     */
    public static Path save(PixelBuffer buf, Path target) throws IOException {
        Path p = target.toAbsolutePath();
        if (p.getParent() != null)
            Files.createDirectories(p.getParent());
        String format = formatOf(p);
        PixelBuffer out = buf;
        if (!format.equals("png")) {
            out = BufferedImages.to8Bit(out);
            if (out.hasAlpha())
                out = BasicFilters.flatten(out, Rgba.rgb(255, 255, 255));
        }
        if (!ImageIO.write(BufferedImages.toBufferedImage(out), format, p.toFile()))
            throw new IOException("No ImageIO writer for format " + format);
        logger.debug("Wrote {} ({})", p, format);
        return p;
    }

    static String formatOf(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".jpg") || name.endsWith(".jpeg"))
            return "jpg";
        if (name.endsWith(".bmp"))
            return "bmp";
        return "png";
    }
}
