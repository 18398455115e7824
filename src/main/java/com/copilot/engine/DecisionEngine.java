package com.copilot.engine;

import com.copilot.config.AggregationConfig;
import com.copilot.config.CopilotConfig;
import com.copilot.config.ExecutionConfig;
import com.copilot.exception.CopilotException;
import com.copilot.exception.EvaluationException;
import com.copilot.feature.FeatureStore;
import com.copilot.feature.FeatureVector;
import com.copilot.graph.KnowledgeGraph;
import com.copilot.rule.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the rule set over many subjects.
 * <p>
 * Subjects are evaluated concurrently on a fixed worker pool against the frozen graph and the
 * immutable rule set. The calling thread is the only one that touches the sink: it waits for
 * each subject in submission order and delivers its record, so records arrive in subject order
 * and a record is either delivered whole or not at all.
 * <p>
 * A subject not finished within {@code subjectTimeoutMs} of the writer starting to wait for it
 * is cancelled and its record discarded. {@link #cancel()} or interrupting the calling thread
 * stops delivery and discards every subject not yet delivered.
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final KnowledgeGraph graph;
    private final RuleSet ruleSet;
    private final RuleEvaluator evaluator;
    private final DecisionAggregator aggregator;
    private final ExecutionConfig execution;
    private final ExecutorService workers;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DecisionEngine(KnowledgeGraph graph, RuleSet ruleSet,
                          AggregationConfig aggregation, ExecutionConfig execution) {
        this.graph = Objects.requireNonNull(graph, "Knowledge graph cannot be null");
        this.ruleSet = Objects.requireNonNull(ruleSet, "Rule set cannot be null");
        this.execution = Objects.requireNonNull(execution, "Execution config cannot be null");
        graph.freeze();
        this.evaluator = new RuleEvaluator(ruleSet, graph);
        this.aggregator = new DecisionAggregator(aggregation);

        AtomicInteger threadIndex = new AtomicInteger(0);
        this.workers = Executors.newFixedThreadPool(execution.parallelism(), r -> {
            Thread t = new Thread(r);
            t.setName(execution.threadNamePrefix() + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("DecisionEngine initialized: {} rules, {} nodes, parallelism {}",
                ruleSet.size(), graph.nodeCount(), execution.parallelism());
    }

    /**
     * Build the graph and rule set declared by a configuration and start an engine on them.
     */
    public static DecisionEngine fromConfig(CopilotConfig config) {
        KnowledgeGraph graph = config.buildGraph();
        RuleSet ruleSet = config.buildRuleSet(graph);
        return new DecisionEngine(graph, ruleSet, config.aggregation(), config.execution());
    }

    /**
     * Evaluate one subject synchronously on the calling thread.
     */
    public DecisionRecord decide(String subjectId, FeatureVector features) {
        Objects.requireNonNull(subjectId, "Subject id cannot be null");
        List<CandidateDecision> candidates = evaluator.evaluate(subjectId,
                features != null ? features : FeatureVector.empty());
        return aggregator.aggregate(subjectId, candidates);
    }

    /**
     * Evaluate one subject synchronously, reading its features from the store.
     */
    public DecisionRecord evaluate(String subjectId, FeatureStore store) {
        return decide(subjectId, store.features(subjectId).orElse(FeatureVector.empty()));
    }

    /**
     * Evaluate every subject of the store, delivering records in the store's subject order.
     */
    public RunSummary run(FeatureStore store, ActionSink sink) {
        return run(store.subjectIds(), store, sink);
    }

    /**
     * Evaluate the given subjects, delivering records in iteration order.
     * A subject the store does not know is evaluated with an empty feature vector.
     * An exception thrown by the sink discards the remaining subjects and is rethrown as is.
     *
     * @throws EvaluationException if a subject fails unexpectedly; remaining subjects are discarded
     */
    public RunSummary run(Collection<String> subjectIds, FeatureStore store, ActionSink sink) {
        Objects.requireNonNull(store, "Feature store cannot be null");
        Objects.requireNonNull(sink, "Action sink cannot be null");
        if (shutdown.get()) {
            throw new CopilotException("DecisionEngine is shutdown");
        }
        cancelRequested.set(false);
        long start = System.nanoTime();
        log.info("Starting run over {} subjects", subjectIds.size());

        List<String> subjects = new ArrayList<>(subjectIds);
        List<Future<DecisionRecord>> futures = new ArrayList<>(subjects.size());
        for (String subjectId : subjects) {
            futures.add(workers.submit(() -> evaluateSafely(subjectId, store)));
        }

        int delivered = 0;
        int timedOut = 0;
        int cancelled = 0;
        for (int i = 0; i < futures.size(); i++) {
            if (cancelRequested.get() || Thread.currentThread().isInterrupted()) {
                cancelled = discardFrom(futures, i);
                log.warn("Run cancelled: {} subjects discarded", cancelled);
                break;
            }
            Future<DecisionRecord> future = futures.get(i);
            DecisionRecord record;
            try {
                record = execution.hasTimeout()
                        ? future.get(execution.subjectTimeoutMs(), TimeUnit.MILLISECONDS)
                        : future.get();
            } catch (TimeoutException e) {
                future.cancel(true);
                timedOut++;
                log.warn("Subject {} exceeded {} ms and was discarded", subjects.get(i),
                        execution.subjectTimeoutMs());
                continue;
            } catch (CancellationException e) {
                cancelled = discardFrom(futures, i);
                log.warn("Run cancelled: {} subjects discarded", cancelled);
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelled = discardFrom(futures, i);
                log.warn("Run interrupted: {} subjects discarded", cancelled);
                break;
            } catch (ExecutionException e) {
                discardFrom(futures, i + 1);
                throw unwrap(subjects.get(i), e.getCause());
            }

            try {
                sink.accept(record);
            } catch (RuntimeException e) {
                int discarded = discardFrom(futures, i + 1);
                log.error("Action sink failed on subject {}: {} subjects discarded", subjects.get(i), discarded);
                throw e;
            }
            delivered++;
        }

        RunSummary summary = new RunSummary(subjects.size(), delivered, timedOut, cancelled,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        log.info("Run finished: {}", summary);
        return summary;
    }

    /**
     * Evaluate every subject of the store and collect the records.
     */
    public List<DecisionRecord> runAll(FeatureStore store) {
        CollectingActionSink sink = new CollectingActionSink();
        run(store, sink);
        return sink.getRecords();
    }

    /**
     * Stop delivering records of the current run. Subjects not yet delivered are discarded.
     */
    public void cancel() {
        log.info("Cancellation requested");
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("Shutting down DecisionEngine");
            workers.shutdownNow();
        }
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return workers.awaitTermination(timeout, unit);
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public KnowledgeGraph getGraph() {
        return graph;
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    private DecisionRecord evaluateSafely(String subjectId, FeatureStore store) {
        try {
            return evaluate(subjectId, store);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException(subjectId, e.getMessage(), e);
        }
    }

    private static int discardFrom(List<Future<DecisionRecord>> futures, int from) {
        for (int i = from; i < futures.size(); i++) {
            futures.get(i).cancel(true);
        }
        return futures.size() - from;
    }

    private static RuntimeException unwrap(String subjectId, Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new EvaluationException(subjectId, String.valueOf(cause), cause);
    }
}
