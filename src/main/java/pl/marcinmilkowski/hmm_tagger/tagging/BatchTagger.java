package pl.marcinmilkowski.hmm_tagger.tagging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.hmm_tagger.config.TaggerConfig;
import pl.marcinmilkowski.hmm_tagger.hmm.HmmModel;
import pl.marcinmilkowski.hmm_tagger.hmm.HmmTagger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tags many sentences against one shared, read-only model on a fixed thread pool.
 *
 * Every sentence is decoded independently. A sentence that fails (for example an
 * empty one) yields a failed {@link SentenceResult}; the remaining sentences are
 * still tagged. Results are returned in input order.
 */
public class BatchTagger {

    private static final Logger logger = LoggerFactory.getLogger(BatchTagger.class);

    private final HmmTagger tagger;
    private int threads = Runtime.getRuntime().availableProcessors();

    public BatchTagger(HmmTagger tagger) {
        this.tagger = tagger;
    }

    public BatchTagger(HmmTagger tagger, int threads) {
        this(tagger);
        setThreads(threads);
    }

    /**
     * Batch tagger using the configured unknown-token policy and decode thread count.
     */
    public static BatchTagger fromConfig(HmmModel model, TaggerConfig config) {
        HmmTagger tagger = new HmmTagger(model, config.unknownTokenPolicyFor(model));
        return new BatchTagger(tagger, config.getDecodeThreads());
    }

    public HmmTagger getTagger() {
        return tagger;
    }

    public void setThreads(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Thread count must be positive, got " + n);
        }
        this.threads = n;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Tag all sentences.
     *
     * @throws InterruptedException if interrupted while waiting for results
     */
    public List<SentenceResult> tagAll(List<List<String>> sentences) throws InterruptedException {
        long startTime = System.currentTimeMillis();
        int poolSize = poolSize(sentences.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        AtomicInteger failures = new AtomicInteger(0);
        List<Future<List<String>>> futures = new ArrayList<>(sentences.size());
        try {
            for (List<String> sentence : sentences) {
                futures.add(executor.submit(() -> tagger.decode(sentence)));
            }

            List<SentenceResult> results = new ArrayList<>(sentences.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(SentenceResult.success(i, futures.get(i).get()));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    logger.warn("Sentence {} could not be tagged: {}", i, cause.getMessage());
                    failures.incrementAndGet();
                    results.add(SentenceResult.failure(i, cause));
                }
            }

            logger.info("Tagged {} sentences ({} failed) on {} threads in {} ms",
                sentences.size(), failures.get(), poolSize, System.currentTimeMillis() - startTime);
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    // No more threads than sentences, but at least one.
    int poolSize(int sentenceCount) {
        return Math.min(threads, Math.max(1, sentenceCount));
    }

    /**
     * Outcome for one sentence of a batch: either its tags or the failure.
     */
    public record SentenceResult(int index, List<String> tags, Throwable failure) {

        public static SentenceResult success(int index, List<String> tags) {
            return new SentenceResult(index, List.copyOf(tags), null);
        }

        public static SentenceResult failure(int index, Throwable failure) {
            return new SentenceResult(index, List.of(), failure);
        }

        public boolean isSuccess() {
            return failure == null;
        }
    }
}
