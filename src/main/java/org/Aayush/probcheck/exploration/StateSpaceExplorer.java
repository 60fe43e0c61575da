package org.Aayush.probcheck.exploration;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.probcheck.core.id.StateStorage;
import org.Aayush.probcheck.graph.LabeledTransitionMarkovDecisionProcess;
import org.Aayush.probcheck.graph.LtmdpStepGraph;
import org.Aayush.probcheck.graph.ModelCapacity;
import org.Aayush.probcheck.model.AnalysisModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Breadth-first discovery of the reachable state space into an LTMDP.
 * <p>
 * The initial step is explored first on the calling thread. Every newly stored successor is
 * queued exactly once; workers poll the queue and expand disjoint states, each with its own
 * {@link LtmdpChoiceResolver} and {@link LtmdpStepGraph}. A finished step graph is appended
 * to the shared LTMDP as one contiguous cid block. Exploration ends when the queue is empty
 * and no state is in flight.
 * </p>
 * <p>
 * The first worker failure stops all workers and is rethrown unchanged by {@link #explore()}.
 * </p>
 *
 * @param <S> serialized state type; must be immutable and implement value equality.
 */
@Slf4j
public final class StateSpaceExplorer<S> {

    private final AnalysisModel<S> model;
    private final int workerCount;
    private final boolean useForwardOptimization;

    @Getter
    @Accessors(fluent = true)
    private final StateStorage<S> stateStorage;
    @Getter
    @Accessors(fluent = true)
    private final LabeledTransitionMarkovDecisionProcess ltmdp;

    private final ConcurrentLinkedQueue<Integer> queue = new ConcurrentLinkedQueue<>();
    // queued or in-flight states
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private boolean explored;

    public StateSpaceExplorer(AnalysisModel<S> model, int workerCount, boolean useForwardOptimization, ModelCapacity capacity) {
        this.model = Objects.requireNonNull(model, "model");
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        Objects.requireNonNull(capacity, "capacity");
        this.workerCount = workerCount;
        this.useForwardOptimization = useForwardOptimization;
        this.stateStorage = new StateStorage<>(capacity.getMaxStates());
        this.ltmdp = new LabeledTransitionMarkovDecisionProcess(model.stateFormulaLabels(), capacity);
    }

    /**
     * Explores the full reachable state space. May only be called once.
     *
     * @return exploration statistics.
     */
    public synchronized ExplorationStats explore() {
        if (explored) {
            throw new IllegalStateException("state space has already been explored");
        }
        explored = true;
        long started = System.nanoTime();
        log.info("Exploring state space with {} worker(s)", workerCount);

        Worker initialWorker = new Worker();
        initialWorker.exploreInitialStep();

        if (workerCount == 1) {
            initialWorker.run();
        } else {
            runParallel();
        }
        RuntimeException error = failure.get();
        if (error != null) {
            throw error;
        }

        ExplorationStats stats = ExplorationStats.builder()
                .stateCount(stateStorage.size())
                .transitionTargetCount(ltmdp.transitionTargetCount())
                .continuationGraphSize(ltmdp.continuationGraphSize())
                .workerCount(workerCount)
                .elapsedNanos(System.nanoTime() - started)
                .build();
        log.info("Explored {} states, {} transition targets, continuation graph size {} in {} ms",
                stats.getStateCount(), stats.getTransitionTargetCount(), stats.getContinuationGraphSize(),
                stats.getElapsedNanos() / 1_000_000L);
        return stats;
    }

    private void runParallel() {
        ExecutorService executor = Executors.newFixedThreadPool(workerCount);
        try {
            List<Worker> workers = new ArrayList<>(workerCount);
            for (int i = 0; i < workerCount; i++) {
                workers.add(new Worker());
            }
            for (Worker worker : workers) {
                executor.execute(worker);
            }
            executor.shutdown();
            while (!executor.awaitTermination(100, TimeUnit.MILLISECONDS)) {
                log.debug("Exploration in progress: {} states stored, {} pending", stateStorage.size(), pending.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure.compareAndSet(null, new IllegalStateException("exploration was interrupted", e));
        } finally {
            executor.shutdownNow();
        }
    }

    private void enqueue(int storageId) {
        pending.incrementAndGet();
        queue.offer(storageId);
    }

    private final class Worker implements Runnable {
        private final LtmdpStepGraph stepGraph = new LtmdpStepGraph();
        private final LtmdpChoiceResolver resolver = new LtmdpChoiceResolver(stepGraph, useForwardOptimization);

        void exploreInitialStep() {
            resolver.prepareNextState();
            while (resolver.prepareNextPath()) {
                recordTarget(model.model().initialStep(resolver));
            }
            ltmdp.addInitialStepGraph(stepGraph);
        }

        @Override
        public void run() {
            try {
                while (failure.get() == null) {
                    Integer storageId = queue.poll();
                    if (storageId == null) {
                        if (pending.get() == 0) {
                            return;
                        }
                        Thread.onSpinWait();
                        continue;
                    }
                    try {
                        exploreState(storageId);
                    } finally {
                        pending.decrementAndGet();
                    }
                }
            } catch (RuntimeException e) {
                failure.compareAndSet(null, e);
            }
        }

        private void exploreState(int storageId) {
            S state = stateStorage.get(storageId);
            resolver.prepareNextState();
            while (resolver.prepareNextPath()) {
                recordTarget(model.model().step(state, resolver));
            }
            ltmdp.addStateStepGraph(storageId, stepGraph);
        }

        private void recordTarget(S successor) {
            int added = stateStorage.addState(successor);
            int storageId = StateStorage.storageId(added);
            if (StateStorage.isNewlyAdded(added)) {
                enqueue(storageId);
            }
            int targetId = ltmdp.addTransitionTarget(model.label(successor), storageId);
            stepGraph.setLeafTarget(resolver.currentContinuationId(), targetId);
        }
    }
}
