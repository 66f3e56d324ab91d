package pl.marcinmilkowski.hmm_tagger.hmm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The closed tag set (HMM states) and the training token vocabulary, with dense
 * integer indexes for both.
 *
 * Tags are indexed in natural string order, so enumeration and the decoder's
 * tie-breaking are reproducible across runs. Tokens are indexed in the order they were
 * first seen in the training data. Instances are immutable.
 */
public final class Vocabulary {

    private final List<String> tags;
    private final Map<String, Integer> tagIndex;
    private final List<String> tokens;
    private final Map<String, Integer> tokenIndex;

    private Vocabulary(List<String> tags, List<String> tokens) {
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));

        Map<String, Integer> tagIds = new HashMap<>();
        for (int i = 0; i < tags.size(); i++) {
            if (tagIds.putIfAbsent(tags.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate tag: " + tags.get(i));
            }
        }
        Map<String, Integer> tokenIds = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokenIds.putIfAbsent(tokens.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate token: " + tokens.get(i));
            }
        }
        this.tagIndex = tagIds;
        this.tokenIndex = tokenIds;
    }

    /**
     * Collect tags and tokens from training pairs.
     *
     * @throws EmptyCorpusException if there are no pairs
     */
    public static Vocabulary fromPairs(List<TrainingPair> pairs) {
        if (pairs == null || pairs.isEmpty()) {
            throw new EmptyCorpusException("Cannot build a tag set from an empty training corpus");
        }
        Set<String> tagSet = new TreeSet<>();
        Map<String, Integer> firstSeen = new LinkedHashMap<>();
        for (TrainingPair pair : pairs) {
            tagSet.add(pair.tag());
            firstSeen.computeIfAbsent(pair.token(), ignored -> firstSeen.size());
        }
        return new Vocabulary(new ArrayList<>(tagSet), new ArrayList<>(firstSeen.keySet()));
    }

    /**
     * Rebuild a vocabulary from stored lists. Tags are re-sorted into natural order;
     * token order is kept as given.
     */
    public static Vocabulary of(Collection<String> tags, List<String> tokens) {
        if (tags.isEmpty()) {
            throw new EmptyCorpusException("A vocabulary needs at least one tag");
        }
        return new Vocabulary(new ArrayList<>(new TreeSet<>(tags)), tokens);
    }

    public int tagCount() {
        return tags.size();
    }

    /**
     * Number of distinct training tokens (V in the Laplace formula).
     */
    public int size() {
        return tokens.size();
    }

    public String tag(int index) {
        return tags.get(index);
    }

    public String token(int index) {
        return tokens.get(index);
    }

    /**
     * @return the tag's index, or -1 if the tag is not in the tag set
     */
    public int tagIndex(String tag) {
        Integer id = tagIndex.get(tag);
        return id != null ? id : -1;
    }

    /**
     * @return the token's index, or -1 if the token never occurred in training
     */
    public int tokenIndex(String token) {
        Integer id = tokenIndex.get(token);
        return id != null ? id : -1;
    }

    public boolean containsTag(String tag) {
        return tagIndex.containsKey(tag);
    }

    public boolean containsToken(String token) {
        return tokenIndex.containsKey(token);
    }

    public List<String> tags() {
        return tags;
    }

    public List<String> tokens() {
        return tokens;
    }

    /**
     * Tokens of the given decode-time vocabulary that never occurred in training,
     * in iteration order of the argument.
     */
    public Set<String> unknownTokens(Collection<String> decodeVocabulary) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String token : decodeVocabulary) {
            if (!tokenIndex.containsKey(token)) {
                unknown.add(token);
            }
        }
        return unknown;
    }
}
