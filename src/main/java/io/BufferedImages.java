package io;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;

import image.PixelBuffer;

/**
 * Conversion between AWT images and {@link PixelBuffer}.
 * <p>
 * 16-bit component rasters (gray, gray+alpha, RGB, RGBA) keep their depth;
 * everything else goes through {@code getRGB} as 8-bit RGB, or RGBA when
 * the color model has alpha.
 */
public final class BufferedImages {

    private BufferedImages() {
    }

    public static PixelBuffer toPixelBuffer(BufferedImage img) {
        Raster raster = img.getRaster();
        if (raster.getTransferType() == DataBuffer.TYPE_USHORT && img.getColorModel() instanceof ComponentColorModel)
            return fromUShortRaster(raster);

        int w = img.getWidth(), h = img.getHeight();
        boolean alpha = img.getColorModel().hasAlpha();
        int c = alpha ? 4 : 3;
        int[] argb = img.getRGB(0, 0, w, h, null, 0, w);
        int[] s = new int[w * h * c];
        for (int p = 0, o = 0; p < argb.length; p++, o += c) {
            int v = argb[p];
            s[o] = (v >> 16) & 0xFF;
            s[o + 1] = (v >> 8) & 0xFF;
            s[o + 2] = v & 0xFF;
            if (alpha)
                s[o + 3] = (v >>> 24) & 0xFF;
        }
        return PixelBuffer.wrap(w, h, c, 8, s);
    }

    private static PixelBuffer fromUShortRaster(Raster raster) {
        int w = raster.getWidth(), h = raster.getHeight(), bands = raster.getNumBands();
        int[] in = raster.getPixels(0, 0, w, h, (int[]) null);
        if (bands == 3 || bands == 4)
            return PixelBuffer.wrap(w, h, bands, 16, in);
        // gray (+ alpha): replicate into RGB
        boolean alpha = bands == 2;
        int c = alpha ? 4 : 3;
        int[] s = new int[w * h * c];
        for (int p = 0; p < w * h; p++) {
            int g = in[p * bands];
            int o = p * c;
            s[o] = g;
            s[o + 1] = g;
            s[o + 2] = g;
            if (alpha)
                s[o + 3] = in[p * bands + 1];
        }
        return PixelBuffer.wrap(w, h, c, 16, s);
    }

    /** 8-bit buffers become INT_RGB / INT_ARGB, 16-bit ones a USHORT component image. */
    public static BufferedImage toBufferedImage(PixelBuffer buf) {
        if (buf.bitDepth() == 16)
            return toUShortImage(buf);
        int w = buf.width(), h = buf.height(), c = buf.channels();
        boolean alpha = buf.hasAlpha();
        BufferedImage out = new BufferedImage(w, h, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        int[] argb = new int[w * h];
        for (int p = 0, i = 0; p < argb.length; p++, i += c) {
            int a = alpha ? buf.sample(i + 3) : 0xFF;
            argb[p] = (a << 24) | (buf.sample(i) << 16) | (buf.sample(i + 1) << 8) | buf.sample(i + 2);
        }
        out.setRGB(0, 0, w, h, argb, 0, w);
        return out;
    }

    private static BufferedImage toUShortImage(PixelBuffer buf) {
        boolean alpha = buf.hasAlpha();
        ComponentColorModel cm = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_sRGB), alpha, false,
                alpha ? Transparency.TRANSLUCENT : Transparency.OPAQUE, DataBuffer.TYPE_USHORT);
        WritableRaster raster = cm.createCompatibleWritableRaster(buf.width(), buf.height());
        raster.setPixels(0, 0, buf.width(), buf.height(), buf.samples());
        return new BufferedImage(cm, raster, false, null);
    }

    /** Same image at 8 bits per sample ({@code v >> 8}); 8-bit buffers are returned as is. */
    public static PixelBuffer to8Bit(PixelBuffer buf) {
        if (buf.bitDepth() == 8)
            return buf;
        int[] s = buf.samples();
        for (int i = 0; i < s.length; i++)
            s[i] >>= 8;
        return PixelBuffer.wrap(buf.width(), buf.height(), buf.channels(), 8, s);
    }
}
