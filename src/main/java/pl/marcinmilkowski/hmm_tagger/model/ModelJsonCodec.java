package pl.marcinmilkowski.hmm_tagger.model;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.hmm_tagger.hmm.EmptyCorpusException;
import pl.marcinmilkowski.hmm_tagger.hmm.HmmModel;
import pl.marcinmilkowski.hmm_tagger.hmm.LogProb;
import pl.marcinmilkowski.hmm_tagger.hmm.TransitionBoundaries;
import pl.marcinmilkowski.hmm_tagger.hmm.Vocabulary;
import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Stores trained models as JSON.
 *
 * Layout:
 * {
 *   "format": "hmm-tagger-model",
 *   "version": 1,
 *   "smoothing": "laplace",
 *   "transition_boundaries": "flattened",
 *   "tags": ["ADJ", "NOUN", ...],
 *   "tokens": ["Sehr", "gute", ...],
 *   "initial": {"ADV": -1.58, ...},
 *   "transition": {"ADV": {"ADJ": -0.42, ...}, ...},
 *   "emission": {"ADJ": {"gute": -2.0, ...}, ...},
 *   "residual": {"ADJ": -9.3, ...}
 * }
 *
 * Only finite log-probabilities are written. A missing initial or transition entry
 * reads back as negative infinity; a missing emission entry reads back as the tag's
 * residual for smoothed models and as negative infinity otherwise.
 */
public final class ModelJsonCodec {

    private static final Logger logger = LoggerFactory.getLogger(ModelJsonCodec.class);

    static final String FORMAT = "hmm-tagger-model";
    static final int VERSION = 1;

    private ModelJsonCodec() {
    }

    public static JSONObject toJson(HmmModel model) {
        Vocabulary vocabulary = model.vocabulary();
        int n = vocabulary.tagCount();

        JSONObject root = new JSONObject();
        root.put("format", FORMAT);
        root.put("version", VERSION);
        root.put("smoothing", model.smoothing().configName());
        root.put("transition_boundaries", model.transitionBoundaries().configName());
        root.put("tags", new JSONArray(vocabulary.tags()));
        root.put("tokens", new JSONArray(vocabulary.tokens()));

        JSONObject initial = new JSONObject();
        for (int tag = 0; tag < n; tag++) {
            putFinite(initial, vocabulary.tag(tag), model.initialLogProb(tag));
        }
        root.put("initial", initial);

        JSONObject transition = new JSONObject();
        for (int from = 0; from < n; from++) {
            JSONObject row = new JSONObject();
            for (int to = 0; to < n; to++) {
                putFinite(row, vocabulary.tag(to), model.transitionLogProb(from, to));
            }
            transition.put(vocabulary.tag(from), row);
        }
        root.put("transition", transition);

        JSONObject emission = new JSONObject();
        JSONObject residual = model.hasResidual() ? new JSONObject() : null;
        for (int tag = 0; tag < n; tag++) {
            double fill = LogProb.ZERO;
            if (residual != null) {
                fill = model.residualLogProb(tag);
                residual.put(vocabulary.tag(tag), fill);
            }
            JSONObject row = new JSONObject();
            for (int token = 0; token < vocabulary.size(); token++) {
                double value = model.emissionLogProb(tag, token);
                if (value != fill) {
                    putFinite(row, vocabulary.token(token), value);
                }
            }
            emission.put(vocabulary.tag(tag), row);
        }
        root.put("emission", emission);
        if (residual != null) {
            root.put("residual", residual);
        }
        return root;
    }

    /**
     * @throws IllegalArgumentException if the JSON is not a stored model
     */
    public static HmmModel fromJson(JSONObject root) {
        if (!FORMAT.equals(root.getString("format"))) {
            throw new IllegalArgumentException("Not an HMM tagger model: format=" + root.getString("format"));
        }
        int version = root.getIntValue("version");
        if (version != VERSION) {
            throw new IllegalArgumentException("Unsupported model version: " + version);
        }

        Smoothing smoothing = Smoothing.fromName(requireString(root, "smoothing"));
        TransitionBoundaries boundaries = TransitionBoundaries.fromName(requireString(root, "transition_boundaries"));

        List<String> tags = requireStrings(root, "tags");
        List<String> tokens = requireStrings(root, "tokens");
        Vocabulary vocabulary = Vocabulary.of(tags, tokens);
        int n = vocabulary.tagCount();
        int v = vocabulary.size();

        double[] initial = new double[n];
        Arrays.fill(initial, LogProb.ZERO);
        readRow(root.getJSONObject("initial"), initial, vocabulary, true);

        double[][] transition = new double[n][n];
        JSONObject transitionJson = requireObject(root, "transition");
        for (int from = 0; from < n; from++) {
            Arrays.fill(transition[from], LogProb.ZERO);
            readRow(transitionJson.getJSONObject(vocabulary.tag(from)), transition[from], vocabulary, true);
        }

        double[] residual = null;
        if (smoothing == Smoothing.LAPLACE) {
            JSONObject residualJson = requireObject(root, "residual");
            residual = new double[n];
            for (int tag = 0; tag < n; tag++) {
                String name = vocabulary.tag(tag);
                if (!residualJson.containsKey(name)) {
                    throw new IllegalArgumentException("Missing residual for tag " + name);
                }
                residual[tag] = residualJson.getDoubleValue(name);
            }
        }

        double[][] emission = new double[n][v];
        JSONObject emissionJson = requireObject(root, "emission");
        for (int tag = 0; tag < n; tag++) {
            Arrays.fill(emission[tag], residual != null ? residual[tag] : LogProb.ZERO);
            readRow(emissionJson.getJSONObject(vocabulary.tag(tag)), emission[tag], vocabulary, false);
        }

        return HmmModel.fromTables(vocabulary, initial, transition, emission, residual, smoothing, boundaries);
    }

    public static void write(HmmModel model, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, JSON.toJSONString(toJson(model)), StandardCharsets.UTF_8);
        logger.info("Wrote model {} to {}", model, path);
    }

    /**
     * @throws IOException if the file cannot be read or does not hold a valid model
     */
    public static HmmModel read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Model file not found: " + path);
        }
        try {
            JSONObject root = JSON.parseObject(Files.readString(path, StandardCharsets.UTF_8));
            if (root == null) {
                throw new IOException("Model file is empty: " + path);
            }
            HmmModel model = fromJson(root);
            logger.info("Read model {} from {}", model, path);
            return model;
        } catch (JSONException | IllegalArgumentException | EmptyCorpusException e) {
            throw new IOException("Invalid model file " + path + ": " + e.getMessage(), e);
        }
    }

    private static void putFinite(JSONObject target, String key, double value) {
        if (value != LogProb.ZERO) {
            target.put(key, value);
        }
    }

    private static void readRow(JSONObject row, double[] target, Vocabulary vocabulary, boolean keyedByTag) {
        if (row == null) {
            return;
        }
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            int index = keyedByTag
                ? vocabulary.tagIndex(entry.getKey())
                : vocabulary.tokenIndex(entry.getKey());
            if (index < 0) {
                throw new IllegalArgumentException("Unknown " + (keyedByTag ? "tag" : "token")
                    + " in model: " + entry.getKey());
            }
            target[index] = row.getDoubleValue(entry.getKey());
        }
    }

    private static String requireString(JSONObject root, String key) {
        String value = root.getString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing '" + key + "' field in model");
        }
        return value;
    }

    private static JSONObject requireObject(JSONObject root, String key) {
        JSONObject value = root.getJSONObject(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing '" + key + "' object in model");
        }
        return value;
    }

    private static List<String> requireStrings(JSONObject root, String key) {
        JSONArray array = root.getJSONArray(key);
        if (array == null) {
            throw new IllegalArgumentException("Missing '" + key + "' array in model");
        }
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }
}
