package com.mlhub.server.ai.output;

import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.ImageTensors;
import com.mlhub.server.api.PredictResponse;
import com.mlhub.server.exception.InferenceFailureException;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Base64;

/**
 * Renders an image-shaped output as PNG. Values up to 1.0 are treated as
 * normalized and scaled by 255; larger values are taken as pixel levels.
 */
public class ImageOutputFormatter implements OutputFormatter {

    @Override
    public OutputKind getKind() {
        return OutputKind.IMAGE;
    }

    @Override
    public void format(CanonicalTensor output, PredictResponse response) {
        if (output.isString() || output.size() == 0) {
            throw new InferenceFailureException("Cannot render " + output.describe() + " as an image");
        }
        BufferedImage image = toImage(output);
        String encoded = Base64.getEncoder().encodeToString(ImageTensors.encodePng(image));
        response.prediction = encoded;
        response.imageBase64 = encoded;
        response.imageSize = new PredictResponse.ImageSize(image.getWidth(), image.getHeight());
    }

    BufferedImage toImage(CanonicalTensor output) {
        float scale = output.max() <= 1.0f ? 255.0f : 1.0f;
        CanonicalTensor t = output;

        // leading batch axis: keep the first image
        if (t.rank() == 4) {
            long[] s = t.getShape();
            int perImage = (int) (s[1] * s[2] * s[3]);
            t = CanonicalTensor.ofFloats(Arrays.copyOf(t.getFloats(), perImage), s[1], s[2], s[3]);
        }
        if (t.rank() == 3 && !isChannelCount(t.dim(2)) && isChannelCount(t.dim(0))) {
            t = t.chwToHwc();
        }
        int height;
        int width;
        int channels;
        if (t.rank() == 3) {
            height = (int) t.dim(0);
            width = (int) t.dim(1);
            channels = (int) t.dim(2);
        } else if (t.rank() == 2) {
            height = (int) t.dim(0);
            width = (int) t.dim(1);
            channels = 1;
        } else {
            throw new InferenceFailureException("Cannot render " + output.describe() + " as an image");
        }
        if (!isChannelCount(channels)) {
            throw new InferenceFailureException("Unsupported channel count " + channels + " in "
                    + output.describe());
        }

        float[] values = t.getFloats();
        float[] pixels = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            pixels[i] = values[i] * scale;
        }
        return ImageTensors.fromHwcPixels(pixels, height, width, channels);
    }

    private static boolean isChannelCount(long c) {
        return c == 1 || c == 3 || c == 4;
    }
}
