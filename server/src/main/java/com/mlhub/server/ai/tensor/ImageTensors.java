package com.mlhub.server.ai.tensor;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Pixel-level conversions between {@link BufferedImage} and float tensors.
 * Gray images are read from their raster samples: Java2D color conversion
 * of a gray source (getRGB, drawImage into an RGB target) applies a gamma
 * curve and would shift every level.
 */
public class ImageTensors {

    /**
     * @return the decoded image, or null when no registered reader understands
     *         the bytes
     */
    public static BufferedImage decode(byte[] bytes) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(bytes));
    }

    public static byte[] encodePng(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw new IllegalStateException("No PNG writer available");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public static boolean isGray(BufferedImage image) {
        return image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY;
    }

    /**
     * Single-band 8-bit copy. Gray sources keep their levels (16-bit samples
     * are rescaled); color sources use ITU-R 601 luma.
     */
    public static BufferedImage toGray(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            return src;
        }
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster out = dst.getRaster();
        boolean gray = isGray(src);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out.setSample(x, y, 0, gray ? graySample(src, x, y) : luma(src.getRGB(x, y)));
            }
        }
        return dst;
    }

    /**
     * RGB copy of a gray image with the level replicated into each channel.
     * Color images are returned as they are.
     */
    public static BufferedImage toRgb(BufferedImage src) {
        if (!isGray(src)) {
            return src;
        }
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int v = graySample(src, x, y);
                dst.setRGB(x, y, (v << 16) | (v << 8) | v);
            }
        }
        return dst;
    }

    /**
     * Bilinear resize of a color image into an RGB image.
     */
    public static BufferedImage resize(BufferedImage src, int width, int height) {
        if (src.getWidth() == width && src.getHeight() == height) {
            return src;
        }
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = dst.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(src, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    /**
     * Bilinear resize on raw samples of an 8-bit gray image, pixel centers
     * aligned.
     */
    public static BufferedImage resizeGray(BufferedImage src, int width, int height) {
        BufferedImage gray = toGray(src);
        int sw = gray.getWidth();
        int sh = gray.getHeight();
        if (sw == width && sh == height) {
            return gray;
        }
        Raster in = gray.getRaster();
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster out = dst.getRaster();
        float scaleX = (float) sw / width;
        float scaleY = (float) sh / height;
        for (int y = 0; y < height; y++) {
            float fy = Math.min(Math.max((y + 0.5f) * scaleY - 0.5f, 0f), sh - 1);
            int y0 = (int) fy;
            int y1 = Math.min(y0 + 1, sh - 1);
            float dy = fy - y0;
            for (int x = 0; x < width; x++) {
                float fx = Math.min(Math.max((x + 0.5f) * scaleX - 0.5f, 0f), sw - 1);
                int x0 = (int) fx;
                int x1 = Math.min(x0 + 1, sw - 1);
                float dx = fx - x0;
                float top = in.getSample(x0, y0, 0) * (1 - dx) + in.getSample(x1, y0, 0) * dx;
                float bottom = in.getSample(x0, y1, 0) * (1 - dx) + in.getSample(x1, y1, 0) * dx;
                out.setSample(x, y, 0, Math.round(top * (1 - dy) + bottom * dy));
            }
        }
        return dst;
    }

    /**
     * Reads the image as height x width x channels floats in [0, 1]. One
     * channel is the gray level (luma for color images); three channels are
     * R, G, B, with gray levels replicated.
     */
    public static float[] toHwcFloats(BufferedImage image, int channels) {
        int w = image.getWidth();
        int h = image.getHeight();
        boolean gray = isGray(image);
        float[] out = new float[h * w * channels];
        int i = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (gray) {
                    float v = graySample(image, x, y) / 255.0f;
                    for (int c = 0; c < channels; c++) {
                        out[i++] = c < 3 ? v : 1.0f;
                    }
                    continue;
                }
                int argb = image.getRGB(x, y);
                if (channels == 1) {
                    out[i++] = luma(argb) / 255.0f;
                } else {
                    out[i++] = ((argb >> 16) & 0xFF) / 255.0f;
                    out[i++] = ((argb >> 8) & 0xFF) / 255.0f;
                    out[i++] = (argb & 0xFF) / 255.0f;
                    for (int extra = 3; extra < channels; extra++) {
                        out[i++] = ((argb >>> 24) & 0xFF) / 255.0f;
                    }
                }
            }
        }
        return out;
    }

    /**
     * Builds an image from height x width x channels values already in pixel
     * range. Values are rounded and clamped to [0, 255]. Channels: 1 gray, 3
     * RGB, 4 RGBA.
     */
    public static BufferedImage fromHwcPixels(float[] pixels, int height, int width, int channels) {
        int type;
        switch (channels) {
            case 1:
                type = BufferedImage.TYPE_BYTE_GRAY;
                break;
            case 3:
                type = BufferedImage.TYPE_INT_RGB;
                break;
            case 4:
                type = BufferedImage.TYPE_INT_ARGB;
                break;
            default:
                throw new IllegalArgumentException("Unsupported channel count " + channels);
        }
        BufferedImage image = new BufferedImage(width, height, type);
        if (channels == 1) {
            int[] gray = new int[width * height];
            for (int i = 0; i < gray.length; i++) {
                gray[i] = clamp(pixels[i]);
            }
            image.getRaster().setPixels(0, 0, width, height, gray);
            return image;
        }
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int base = (y * width + x) * channels;
                int r = clamp(pixels[base]);
                int g = clamp(pixels[base + 1]);
                int b = clamp(pixels[base + 2]);
                int a = channels == 4 ? clamp(pixels[base + 3]) : 255;
                image.setRGB(x, y, (a << 24) | (r << 16) | (g << 8) | b);
            }
        }
        return image;
    }

    /**
     * Converts a [0, 1] image tensor (rank 3 or 4, batch 1) back to an image.
     */
    public static BufferedImage fromUnitTensor(CanonicalTensor tensor, TensorLayout layout) {
        CanonicalTensor t = tensor;
        if (t.rank() == 4) {
            if (t.dim(0) != 1) {
                throw new IllegalArgumentException("Expected a single image, got batch of " + t.dim(0));
            }
            long[] s = t.getShape();
            t = t.reshape(s[1], s[2], s[3]);
        }
        if (t.rank() != 3) {
            throw new IllegalArgumentException("Expected an image tensor, got " + tensor.describe());
        }
        if (layout == TensorLayout.CHANNELS_FIRST) {
            t = t.chwToHwc();
        }
        float[] values = t.getFloats();
        float[] pixels = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            pixels[i] = values[i] * 255.0f;
        }
        return fromHwcPixels(pixels, (int) t.dim(0), (int) t.dim(1), (int) t.dim(2));
    }

    /**
     * First band of a gray image scaled to 0..255.
     */
    private static int graySample(BufferedImage image, int x, int y) {
        int bits = image.getColorModel().getComponentSize(0);
        int sample = image.getRaster().getSample(x, y, 0);
        if (bits == 8) {
            return sample;
        }
        int max = (1 << bits) - 1;
        return Math.round(sample * 255.0f / max);
    }

    private static int luma(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        return (r * 299 + g * 587 + b * 114) / 1000;
    }

    private static int clamp(float v) {
        int p = Math.round(v);
        return p < 0 ? 0 : (p > 255 ? 255 : p);
    }
}
