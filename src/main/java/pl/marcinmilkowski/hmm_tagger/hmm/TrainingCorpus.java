package pl.marcinmilkowski.hmm_tagger.hmm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Annotated training data for the tagger.
 *
 * A corpus is either grouped into sentences (as read from a tagged corpus file) or a
 * flat pair sequence accompanied by an explicit list of sentence-initial tags. Only a
 * grouped corpus supports sentence-aware transition counting.
 */
public final class TrainingCorpus {

    private final List<List<TrainingPair>> sentences;
    private final List<TrainingPair> pairs;
    private final List<String> sentenceInitialTags;

    private TrainingCorpus(List<List<TrainingPair>> sentences, List<TrainingPair> pairs,
                           List<String> sentenceInitialTags) {
        this.sentences = sentences;
        this.pairs = pairs;
        this.sentenceInitialTags = sentenceInitialTags;
    }

    /**
     * Create a corpus from sentences. The first pair of every sentence supplies one
     * sentence-initial tag.
     *
     * @throws IllegalArgumentException if any sentence is empty
     */
    public static TrainingCorpus ofSentences(List<List<TrainingPair>> sentences) {
        List<List<TrainingPair>> copied = new ArrayList<>(sentences.size());
        List<TrainingPair> flat = new ArrayList<>();
        List<String> initial = new ArrayList<>(sentences.size());
        for (int i = 0; i < sentences.size(); i++) {
            List<TrainingPair> sentence = sentences.get(i);
            if (sentence == null || sentence.isEmpty()) {
                throw new IllegalArgumentException("Sentence " + i + " of the training corpus is empty");
            }
            copied.add(List.copyOf(sentence));
            flat.addAll(sentence);
            initial.add(sentence.get(0).tag());
        }
        return new TrainingCorpus(Collections.unmodifiableList(copied), List.copyOf(flat), List.copyOf(initial));
    }

    /**
     * Create an ungrouped corpus from a flat pair sequence and the tags that started
     * each sentence of the source corpus (one entry per sentence, not per token).
     */
    public static TrainingCorpus ofPairs(List<TrainingPair> pairs, List<String> sentenceInitialTags) {
        return new TrainingCorpus(null, List.copyOf(pairs), List.copyOf(sentenceInitialTags));
    }

    public List<TrainingPair> pairs() {
        return pairs;
    }

    /**
     * The tags of all pairs in corpus order, ignoring sentence boundaries.
     */
    public List<String> tagSequence() {
        List<String> tags = new ArrayList<>(pairs.size());
        for (TrainingPair pair : pairs) {
            tags.add(pair.tag());
        }
        return tags;
    }

    public List<String> sentenceInitialTags() {
        return sentenceInitialTags;
    }

    public boolean hasSentenceBoundaries() {
        return sentences != null;
    }

    /**
     * @throws IllegalStateException if the corpus was built from a flat pair sequence
     */
    public List<List<TrainingPair>> sentences() {
        if (sentences == null) {
            throw new IllegalStateException("Corpus was built from flat pairs and has no sentence grouping");
        }
        return sentences;
    }

    public int sentenceCount() {
        return sentenceInitialTags.size();
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }
}
