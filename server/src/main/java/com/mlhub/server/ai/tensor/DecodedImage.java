package com.mlhub.server.ai.tensor;

import java.awt.image.BufferedImage;

/**
 * A decoded image handed as-is to backends that preprocess internally.
 */
public class DecodedImage implements ModelInput {

    private final BufferedImage image;

    public DecodedImage(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("image must not be null");
        }
        this.image = image;
    }

    public BufferedImage getImage() {
        return image;
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    @Override
    public String describe() {
        return "image " + image.getWidth() + "x" + image.getHeight();
    }
}
