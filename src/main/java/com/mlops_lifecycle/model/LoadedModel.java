package com.mlops_lifecycle.model;

import com.mlops_lifecycle.exception.ModelLoadException;
import com.mlops_lifecycle.exception.PredictionException;
import com.mlops_lifecycle.exception.PredictionInputException;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.Classifier;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SerializationHelper;
import weka.core.Utils;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A deserialized Weka classifier together with the training header it was built on.
 * The artifact format is the one produced by {@link SerializationHelper#writeAll}: the classifier
 * and an {@link Instances} header, in any order.
 *
 * <p>Instances are shared read-only between request threads once loaded. Weka classifiers may
 * keep scratch state while scoring, so scoring is serialized per model.
 */
@Slf4j
public class LoadedModel {

    private final Classifier classifier;
    private final Instances header;
    private final List<String> featureNames;
    private final List<String> classLabels;

    private LoadedModel(Classifier classifier, Instances header) {
        this.classifier = classifier;
        this.header = header;

        List<String> features = new ArrayList<>();
        for (int i = 0; i < header.numAttributes(); i++) {
            if (i != header.classIndex()) {
                features.add(header.attribute(i).name());
            }
        }
        this.featureNames = Collections.unmodifiableList(features);

        Attribute classAttr = header.classAttribute();
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < classAttr.numValues(); i++) {
            labels.add(classAttr.value(i));
        }
        this.classLabels = Collections.unmodifiableList(labels);
    }

    public static LoadedModel read(Path artifact) {
        if (artifact == null || !Files.isRegularFile(artifact)) {
            throw new ModelLoadException("Model artifact not found: " + artifact);
        }
        Object[] objects;
        try (InputStream in = Files.newInputStream(artifact)) {
            objects = SerializationHelper.readAll(in);
        } catch (Exception e) {
            throw new ModelLoadException("Failed to deserialize model artifact " + artifact + ": " + e.getMessage(), e);
        }
        return fromObjects(objects);
    }

    public static LoadedModel fromObjects(Object[] objects) {
        Classifier classifier = null;
        Instances header = null;
        for (Object o : objects) {
            if (o instanceof Classifier c && classifier == null) {
                classifier = c;
            } else if (o instanceof Instances i && header == null) {
                header = i;
            }
        }
        if (classifier == null) {
            throw new ModelLoadException("Artifact does not contain a Weka classifier");
        }
        if (header == null) {
            throw new ModelLoadException("Artifact does not contain the training header (save it with SerializationHelper.writeAll)");
        }

        Instances emptyHeader = new Instances(header, 0);
        if (emptyHeader.classIndex() < 0) {
            emptyHeader.setClassIndex(emptyHeader.numAttributes() - 1);
        }
        if (!emptyHeader.classAttribute().isNominal()) {
            throw new ModelLoadException("Class attribute '" + emptyHeader.classAttribute().name()
                    + "' is not nominal; only classifiers can be served");
        }
        return new LoadedModel(classifier, emptyHeader);
    }

    public int numFeatures() {
        return featureNames.size();
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public List<String> getClassLabels() {
        return classLabels;
    }

    public String getAlgorithm() {
        return classifier.getClass().getName();
    }

    /**
     * @param features raw values as bound from the request; anything but a finite number is rejected
     */
    public Prediction predict(List<?> features) {
        if (features == null || features.size() != numFeatures()) {
            throw new PredictionInputException("Expected " + numFeatures() + " features but got "
                    + (features == null ? 0 : features.size()));
        }

        double[] values = new double[header.numAttributes()];
        int next = 0;
        for (int i = 0; i < values.length; i++) {
            if (i == header.classIndex()) {
                values[i] = Utils.missingValue();
            } else {
                values[i] = toFeatureValue(next, features.get(next));
                next++;
            }
        }
        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);

        double[] distribution;
        try {
            synchronized (classifier) {
                distribution = classifier.distributionForInstance(instance);
            }
        } catch (Exception e) {
            throw new PredictionException(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }

        if (distribution == null || distribution.length != classLabels.size() || Utils.sum(distribution) <= 0) {
            throw new PredictionException("Model returned no usable class distribution");
        }

        int predicted = Utils.maxIndex(distribution);
        List<Double> probability = Arrays.stream(distribution).boxed().toList();
        log.debug("Predicted class {} ({}) with distribution {}", predicted, classLabels.get(predicted), probability);
        return new Prediction(predicted, classLabels.get(predicted), probability);
    }

    private static double toFeatureValue(int position, Object raw) {
        if (!(raw instanceof Number number)) {
            throw new PredictionInputException("Feature " + position + " is not a number: " + raw);
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new PredictionInputException("Feature " + position + " must be a finite number");
        }
        return value;
    }
}
