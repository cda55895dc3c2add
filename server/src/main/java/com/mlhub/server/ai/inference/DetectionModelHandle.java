package com.mlhub.server.ai.inference;

import ai.djl.inference.Predictor;
import ai.djl.modality.cv.Image;
import ai.djl.modality.cv.ImageFactory;
import ai.djl.modality.cv.output.DetectedObjects;
import ai.djl.modality.cv.output.Rectangle;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.translate.TranslateException;
import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.DecodedImage;
import com.mlhub.server.ai.tensor.ImageTensors;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.ai.tensor.TensorLayout;
import com.mlhub.server.ai.tensor.TensorShape;
import com.mlhub.server.exception.InferenceFailureException;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * YOLO detector exported as TorchScript. Takes decoded images directly; its
 * translator letterboxes and rescales internally.
 */
public class DetectionModelHandle implements BackendHandle {

    private final ZooModel<Image, DetectedObjects> model;
    private final List<String> classNames;
    private final TensorShape shape;

    public DetectionModelHandle(ZooModel<Image, DetectedObjects> model, List<String> classNames, int imageSize) {
        this.model = model;
        this.classNames = List.copyOf(classNames);
        this.shape = new TensorShape(new long[] { TensorShape.UNKNOWN, 3, imageSize, imageSize },
                TensorLayout.CHANNELS_FIRST);
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.DETECTION_MODEL;
    }

    @Override
    public Optional<TensorShape> shape() {
        return Optional.of(shape);
    }

    @Override
    public TensorLayout layout() {
        return TensorLayout.CHANNELS_FIRST;
    }

    @Override
    public boolean acceptsDecodedImages() {
        return true;
    }

    public List<String> getClassNames() {
        return classNames;
    }

    @Override
    public InferenceResult infer(ModelInput input, InferenceMode mode) {
        BufferedImage buffered;
        if (input instanceof DecodedImage) {
            buffered = ((DecodedImage) input).getImage();
        } else if (input instanceof CanonicalTensor && !((CanonicalTensor) input).isString()) {
            buffered = ImageTensors.fromUnitTensor((CanonicalTensor) input, layout());
        } else {
            throw new InferenceFailureException("Detection backend needs an image, got " + input.describe());
        }

        Image image = ImageFactory.getInstance().fromImage(buffered);
        DetectedObjects found;
        try (Predictor<Image, DetectedObjects> predictor = model.newPredictor()) {
            found = predictor.predict(image);
        } catch (TranslateException e) {
            throw new InferenceFailureException("Detection failed on " + input.describe(), e);
        }

        List<Detection> detections = toDetections(found, classNames, image.getWidth(), image.getHeight());
        if (mode != InferenceMode.ANNOTATED_IMAGE) {
            return new DetectionInferenceResult(detections, image.getWidth(), image.getHeight());
        }

        Image annotated = image.duplicate();
        annotated.drawBoundingBoxes(found);
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        try {
            annotated.save(png, "png");
        } catch (IOException e) {
            throw new InferenceFailureException("Could not encode annotated image", e);
        }
        return new DetectionInferenceResult(detections, png.toByteArray(), annotated.getWidth(),
                annotated.getHeight());
    }

    /**
     * Converts ratio-scaled boxes to pixel corners and attaches class ids from
     * the exported name table (-1 when the name is not in the table).
     */
    static List<Detection> toDetections(DetectedObjects found, List<String> classNames, int width, int height) {
        List<Detection> out = new ArrayList<>(found.getNumberOfObjects());
        for (int i = 0; i < found.getNumberOfObjects(); i++) {
            DetectedObjects.DetectedObject obj = found.item(i);
            Rectangle r = obj.getBoundingBox().getBounds();
            float[] box = {
                    (float) (r.getX() * width),
                    (float) (r.getY() * height),
                    (float) ((r.getX() + r.getWidth()) * width),
                    (float) ((r.getY() + r.getHeight()) * height)
            };
            String name = obj.getClassName();
            int classId = classNames.indexOf(name);
            if (classId < 0) {
                classId = parseIdOrUnknown(name);
            }
            String label = classId >= 0 && classId < classNames.size() ? classNames.get(classId) : null;
            out.add(new Detection(box, obj.getProbability(), classId, label));
        }
        return out;
    }

    private static int parseIdOrUnknown(String name) {
        if (name == null) {
            return -1;
        }
        try {
            return Integer.parseInt(name.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
