package com.mlhub.server.ai.input;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.DecodedImage;
import com.mlhub.server.ai.tensor.ImageTensors;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.ai.tensor.TensorLayout;
import com.mlhub.server.ai.tensor.TensorShape;
import com.mlhub.server.api.PredictRequest;
import com.mlhub.server.config.InferenceConfig;
import com.mlhub.server.exception.InferenceFailureException;
import com.mlhub.server.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Base64;

/**
 * Decodes {@code image_base64} and builds a [0, 1] float tensor sized and
 * laid out for the target backend. Backends that preprocess images
 * themselves get the decoded image untouched.
 */
public class ImageInputNormalizer implements InputNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ImageInputNormalizer.class);

    private final int defaultHeight;
    private final int defaultWidth;
    private final int defaultChannels;

    public ImageInputNormalizer(InferenceConfig.ImageConfig config) {
        this.defaultHeight = config.defaultHeight != null ? config.defaultHeight : 224;
        this.defaultWidth = config.defaultWidth != null ? config.defaultWidth : 224;
        this.defaultChannels = config.defaultChannels != null ? config.defaultChannels : 3;
    }

    /**
     * Height, width and channel count the backend expects, and whether its
     * tensor carries an explicit channel axis.
     */
    static class Target {
        final int height;
        final int width;
        final int channels;
        final boolean channelAxis;

        Target(int height, int width, int channels, boolean channelAxis) {
            this.height = height;
            this.width = width;
            this.channels = channels;
            this.channelAxis = channelAxis;
        }
    }

    @Override
    public InputKind getKind() {
        return InputKind.IMAGE;
    }

    @Override
    public void validate(PredictRequest request) {
        decodeBase64(request.imageBase64);
    }

    @Override
    public ModelInput normalize(PredictRequest request, BackendHandle handle) {
        byte[] bytes = decodeBase64(request.imageBase64);
        BufferedImage image;
        try {
            image = ImageTensors.decode(bytes);
        } catch (IOException e) {
            throw new InferenceFailureException("Could not decode image payload", e);
        }
        if (image == null) {
            throw new InferenceFailureException("Unsupported or corrupt image payload");
        }

        if (handle.acceptsDecodedImages()) {
            return new DecodedImage(image);
        }

        TensorLayout layout = handle.layout();
        Target target = resolveTarget(handle.shape().orElse(null), layout);
        // convert the color mode first, then resize
        BufferedImage resized = target.channels == 1
                ? ImageTensors.resizeGray(image, target.width, target.height)
                : ImageTensors.resize(ImageTensors.toRgb(image), target.width, target.height);
        float[] hwc = ImageTensors.toHwcFloats(resized, target.channels);

        CanonicalTensor tensor;
        if (target.channelAxis) {
            tensor = CanonicalTensor.ofFloats(hwc, 1, target.height, target.width, target.channels);
            if (layout == TensorLayout.CHANNELS_FIRST) {
                tensor = tensor.toChannelsFirst();
            }
        } else {
            tensor = CanonicalTensor.ofFloats(hwc, 1, target.height, target.width);
        }
        logger.debug("Image {}x{} preprocessed to {}", image.getWidth(), image.getHeight(), tensor.describe());
        return tensor;
    }

    Target resolveTarget(TensorShape shape, TensorLayout layout) {
        if (shape == null) {
            return new Target(defaultHeight, defaultWidth, defaultChannels, true);
        }
        if (shape.rank() == 4) {
            int hAxis = layout == TensorLayout.CHANNELS_FIRST ? 2 : 1;
            int wAxis = hAxis + 1;
            int cAxis = layout == TensorLayout.CHANNELS_FIRST ? 1 : 3;
            return new Target(
                    known(shape, hAxis, defaultHeight),
                    known(shape, wAxis, defaultWidth),
                    known(shape, cAxis, defaultChannels),
                    true);
        }
        if (shape.rank() == 3) {
            // batch, height, width: single channel without a channel axis
            return new Target(known(shape, 1, defaultHeight), known(shape, 2, defaultWidth), 1, false);
        }
        return new Target(defaultHeight, defaultWidth, defaultChannels, true);
    }

    private static int known(TensorShape shape, int axis, int fallback) {
        return shape.isKnown(axis) ? (int) shape.dim(axis) : fallback;
    }

    static byte[] decodeBase64(String payload) {
        if (payload == null || payload.trim().isEmpty()) {
            throw new ValidationException("image_base64 is required");
        }
        String data = payload.trim();
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("image_base64 is not valid base64", e);
        }
        if (bytes.length == 0) {
            throw new ValidationException("image_base64 decodes to an empty payload");
        }
        return bytes;
    }
}
