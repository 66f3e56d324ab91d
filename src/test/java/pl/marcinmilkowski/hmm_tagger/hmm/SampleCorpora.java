package pl.marcinmilkowski.hmm_tagger.hmm;

import java.util.ArrayList;
import java.util.List;

/**
 * Small hand-checked corpora shared by the HMM tests.
 */
final class SampleCorpora {

    private SampleCorpora() {
    }

    /**
     * Five sentences, tags ADJ DET NOUN VERB, nine token types.
     * <pre>
     *   the/DET dog/NOUN runs/VERB
     *   the/DET cat/NOUN sleeps/VERB
     *   a/DET dog/NOUN sleeps/VERB
     *   dogs/NOUN run/VERB
     *   the/DET big/ADJ dog/NOUN runs/VERB
     * </pre>
     */
    static TrainingCorpus animals() {
        return TrainingCorpus.ofSentences(List.of(
            sentence("the/DET", "dog/NOUN", "runs/VERB"),
            sentence("the/DET", "cat/NOUN", "sleeps/VERB"),
            sentence("a/DET", "dog/NOUN", "sleeps/VERB"),
            sentence("dogs/NOUN", "run/VERB"),
            sentence("the/DET", "big/ADJ", "dog/NOUN", "runs/VERB")
        ));
    }

    static List<TrainingPair> sentence(String... wordSlashTag) {
        List<TrainingPair> pairs = new ArrayList<>();
        for (String item : wordSlashTag) {
            int slash = item.lastIndexOf('/');
            pairs.add(new TrainingPair(item.substring(0, slash), item.substring(slash + 1)));
        }
        return pairs;
    }

    static List<TrainingPair> pairsWithTags(String... tags) {
        List<TrainingPair> pairs = new ArrayList<>();
        for (int i = 0; i < tags.length; i++) {
            pairs.add(new TrainingPair("w" + i, tags[i]));
        }
        return pairs;
    }
}
