package pl.marcinmilkowski.hmm_tagger.tagging;

import java.util.Collection;
import java.util.List;

/**
 * Interface for POS taggers that assign one tag to each token of a pre-tokenized sentence.
 */
public interface PosTagger {

    /**
     * Tag a single sentence.
     *
     * @param tokens The sentence's tokens, in order
     * @return One tagged token per input token
     */
    List<TaggedToken> tagSentence(List<String> tokens);

    /**
     * Tag multiple sentences.
     *
     * @param sentences List of tokenized sentences
     * @return List of token lists for each sentence
     */
    List<List<TaggedToken>> tagSentences(List<List<String>> sentences);

    /**
     * Get the name of this tagger.
     */
    String getName();

    /**
     * Get the tags this tagger can assign.
     */
    Collection<String> getTagset();

    /**
     * A single token with its assigned tag.
     */
    record TaggedToken(String word, String tag, int position) {

        @Override
        public String toString() {
            return word + "\t" + tag;
        }
    }
}
