package pl.marcinmilkowski.hmm_tagger.hmm;

import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;
import pl.marcinmilkowski.hmm_tagger.tagging.PosTagger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Part-of-speech tagger backed by a trained HMM and Viterbi decoding.
 *
 * Usage:
 * <pre>
 *   HmmModel model = HmmTrainer.train(corpus, TrainerOptions.of(Smoothing.LAPLACE));
 *   HmmTagger tagger = new HmmTagger(model);
 *   List&lt;String&gt; tags = tagger.decode(List.of("Sehr", "gute", "Beratung"));
 * </pre>
 */
public class HmmTagger implements PosTagger {

    private final HmmModel model;
    private final ViterbiDecoder decoder;

    public HmmTagger(HmmModel model, UnknownTokenPolicy unknownTokenPolicy) {
        this.model = model;
        this.decoder = new ViterbiDecoder(model, unknownTokenPolicy);
    }

    /**
     * Tagger with the model's default unknown-token policy: residual mass for smoothed
     * models, zero probability otherwise.
     */
    public HmmTagger(HmmModel model) {
        this(model, UnknownTokenPolicy.defaultFor(model.smoothing()));
    }

    /**
     * Train a model and wrap it in a tagger.
     */
    public static HmmTagger train(TrainingCorpus corpus, Smoothing smoothing) {
        return new HmmTagger(HmmTrainer.train(corpus, TrainerOptions.of(smoothing)));
    }

    /**
     * Most likely tag for each observation, in order.
     *
     * @throws EmptyInputException if there are no observations
     */
    public List<String> decode(List<String> observations) {
        return decoder.decodeTags(observations);
    }

    /**
     * Decode and keep the path score and degenerate-step diagnostics.
     */
    public DecodeResult decodeWithDiagnostics(List<String> observations) {
        return decoder.decode(observations);
    }

    /**
     * Tokens of the decode vocabulary that the model never saw in training.
     */
    public Set<String> unknownTokens(Collection<String> decodeVocabulary) {
        return model.unknownTokens(decodeVocabulary);
    }

    @Override
    public List<TaggedToken> tagSentence(List<String> tokens) {
        List<String> tags = decode(tokens);
        List<TaggedToken> tagged = new ArrayList<>(tags.size());
        for (int i = 0; i < tags.size(); i++) {
            tagged.add(new TaggedToken(tokens.get(i), tags.get(i), i));
        }
        return tagged;
    }

    @Override
    public List<List<TaggedToken>> tagSentences(List<List<String>> sentences) {
        List<List<TaggedToken>> results = new ArrayList<>(sentences.size());
        for (List<String> sentence : sentences) {
            results.add(tagSentence(sentence));
        }
        return results;
    }

    @Override
    public String getName() {
        return "HMM Tagger (Viterbi, smoothing=" + model.smoothing().configName() + ")";
    }

    @Override
    public Collection<String> getTagset() {
        return model.vocabulary().tags();
    }

    public HmmModel getModel() {
        return model;
    }

    public UnknownTokenPolicy getUnknownTokenPolicy() {
        return decoder.getUnknownTokenPolicy();
    }
}
