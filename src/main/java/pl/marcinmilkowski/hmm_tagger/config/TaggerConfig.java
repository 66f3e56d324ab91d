package pl.marcinmilkowski.hmm_tagger.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.hmm_tagger.hmm.HmmModel;
import pl.marcinmilkowski.hmm_tagger.hmm.TrainerOptions;
import pl.marcinmilkowski.hmm_tagger.hmm.TransitionBoundaries;
import pl.marcinmilkowski.hmm_tagger.hmm.UnknownTokenPolicy;
import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tagger settings loaded from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "smoothing": "laplace",                 // none | laplace
 *   "transition_boundaries": "flattened",   // flattened | sentence
 *   "unknown_token_policy": "residual",     // zero | residual | uniform (optional)
 *   "decode_threads": 4                     // optional, defaults to available processors
 * }
 *
 * When "unknown_token_policy" is absent the policy follows the smoothing: residual
 * mass for laplace, zero probability for none.
 */
public class TaggerConfig {
    private static final Logger logger = LoggerFactory.getLogger(TaggerConfig.class);

    public static final String DEFAULTS_RESOURCE = "/tagger-defaults.json";

    private final String version;
    private final Smoothing smoothing;
    private final TransitionBoundaries transitionBoundaries;
    private final UnknownTokenPolicy unknownTokenPolicy;
    private final int decodeThreads;

    public TaggerConfig(String version, Smoothing smoothing, TransitionBoundaries transitionBoundaries,
                        UnknownTokenPolicy unknownTokenPolicy, int decodeThreads) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in tagger config");
        }
        if (smoothing == null || transitionBoundaries == null) {
            throw new IllegalArgumentException("Tagger config needs smoothing and transition boundaries");
        }
        if (decodeThreads < 1) {
            throw new IllegalArgumentException("'decode_threads' must be positive, got " + decodeThreads);
        }
        if (unknownTokenPolicy == UnknownTokenPolicy.RESIDUAL && smoothing != Smoothing.LAPLACE) {
            throw new IllegalArgumentException("'unknown_token_policy' residual requires laplace smoothing");
        }
        this.version = version;
        this.smoothing = smoothing;
        this.transitionBoundaries = transitionBoundaries;
        this.unknownTokenPolicy = unknownTokenPolicy;
        this.decodeThreads = decodeThreads;
    }

    /**
     * Load configuration from a JSON file.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static TaggerConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Tagger config file not found: " + configPath);
        }
        TaggerConfig config = parse(Files.readString(configPath));
        logger.info("Loaded tagger config version {} from {}: {}", config.version, configPath, config.toJson());
        return config;
    }

    /**
     * The configuration bundled with the library.
     */
    public static TaggerConfig defaults() {
        try (InputStream in = TaggerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default tagger config: " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Parse configuration from JSON text.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a value is invalid
     */
    public static TaggerConfig parse(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Tagger config is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Tagger config is empty");
        }

        String smoothingName = root.getString("smoothing");
        if (smoothingName == null || smoothingName.isBlank()) {
            throw new IllegalArgumentException("Missing 'smoothing' field in tagger config");
        }
        Smoothing smoothing = Smoothing.fromName(smoothingName);

        String boundariesName = root.getString("transition_boundaries");
        TransitionBoundaries boundaries = boundariesName != null
            ? TransitionBoundaries.fromName(boundariesName)
            : TransitionBoundaries.FLATTENED;

        String policyName = root.getString("unknown_token_policy");
        UnknownTokenPolicy policy = policyName != null ? UnknownTokenPolicy.fromName(policyName) : null;

        int threads = readThreads(root.get("decode_threads"));

        return new TaggerConfig(root.getString("version"), smoothing, boundaries, policy, threads);
    }

    // Absent or null means one thread per available processor.
    private static int readThreads(Object value) {
        if (value == null) {
            return Runtime.getRuntime().availableProcessors();
        }
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("'decode_threads' must be an integer, got " + value);
        }
        double threads = ((Number) value).doubleValue();
        if (threads != Math.rint(threads) || threads > Integer.MAX_VALUE || threads < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("'decode_threads' must be an integer, got " + value);
        }
        return (int) threads;
    }

    public String getVersion() {
        return version;
    }

    public Smoothing getSmoothing() {
        return smoothing;
    }

    public TransitionBoundaries getTransitionBoundaries() {
        return transitionBoundaries;
    }

    /**
     * The configured policy, or the smoothing's default when none was configured.
     */
    public UnknownTokenPolicy getUnknownTokenPolicy() {
        return unknownTokenPolicy != null ? unknownTokenPolicy : UnknownTokenPolicy.defaultFor(smoothing);
    }

    /**
     * Policy to decode a given model with. An explicitly configured policy wins;
     * otherwise the model's own smoothing decides.
     */
    public UnknownTokenPolicy unknownTokenPolicyFor(HmmModel model) {
        return unknownTokenPolicy != null ? unknownTokenPolicy : UnknownTokenPolicy.defaultFor(model.smoothing());
    }

    public int getDecodeThreads() {
        return decodeThreads;
    }

    public TrainerOptions trainerOptions() {
        return new TrainerOptions(smoothing, transitionBoundaries);
    }

    /**
     * Export the effective config as a JSONObject.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        root.put("smoothing", smoothing.configName());
        root.put("transition_boundaries", transitionBoundaries.configName());
        root.put("unknown_token_policy", getUnknownTokenPolicy().configName());
        root.put("decode_threads", decodeThreads);
        return root;
    }
}
