package com.reqflow.core.engine;

import com.reqflow.core.capability.KnowledgeGraphService;
import com.reqflow.core.capability.RequirementEvaluator;
import com.reqflow.core.capability.RequirementMiner;
import com.reqflow.core.capability.RequirementRewriter;
import com.reqflow.core.clarification.AnswerResult;
import com.reqflow.core.clarification.ClarificationGate;
import com.reqflow.core.clarification.QuestionFactory;
import com.reqflow.core.config.ReqflowProperties;
import com.reqflow.core.config.WorkflowConfig;
import com.reqflow.core.delegator.ClarificationHandler;
import com.reqflow.core.delegator.ClarificationResolution;
import com.reqflow.core.delegator.ClarificationTask;
import com.reqflow.core.delegator.Delegator;
import com.reqflow.core.delegator.GraphYield;
import com.reqflow.core.delegator.HandlerResult;
import com.reqflow.core.delegator.KgBatch;
import com.reqflow.core.delegator.KgBuildHandler;
import com.reqflow.core.delegator.MiningHandler;
import com.reqflow.core.delegator.MiningYield;
import com.reqflow.core.delegator.QaReport;
import com.reqflow.core.delegator.QaReviewHandler;
import com.reqflow.core.delegator.RewriteHandler;
import com.reqflow.core.delegator.RewriteYield;
import com.reqflow.core.delegator.ValidationHandler;
import com.reqflow.core.delegator.ValidationVerdict;
import com.reqflow.core.events.EventBroadcaster;
import com.reqflow.core.events.EventKind;
import com.reqflow.core.logging.MdcContext;
import com.reqflow.core.metrics.ReqflowMetrics;
import com.reqflow.core.model.ClarificationQuestion;
import com.reqflow.core.model.FailureReason;
import com.reqflow.core.model.PhaseOutcome;
import com.reqflow.core.model.PhaseResult;
import com.reqflow.core.model.PhaseStats;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SourceDocument;
import com.reqflow.core.model.Verdict;
import com.reqflow.core.model.WorkflowPhase;
import com.reqflow.core.model.WorkflowSnapshot;
import com.reqflow.core.pool.PhaseHandler;
import com.reqflow.core.pool.PoolSettings;
import com.reqflow.core.pool.WorkerPool;
import com.reqflow.core.pool.WorkflowCancelledException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Drives workflow runs through their phases.
 * <p>
 * Each accepted submission gets a driver thread that runs one {@link Delegator} per phase and
 * asks {@link PhaseTransitions} for the next phase once the phase result is final. Progress,
 * transitions, questions and the terminal result are published on the run's event channel.
 * Every failure mode ends in a terminal phase plus a {@code workflow_result} event.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final WorkflowConfig defaults;
    private final WorkerPool pool;
    private final EventBroadcaster broadcaster;
    private final ClarificationGate gate;
    private final WorkflowSessionRegistry registry;
    private final RequirementMiner miner;
    private final RequirementEvaluator evaluator;
    private final RequirementRewriter rewriter;
    private final KnowledgeGraphService knowledgeGraph;
    private final ReqflowMetrics metrics;
    private final Clock clock;

    private final AtomicInteger driverCounter = new AtomicInteger();
    private final ExecutorService drivers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "workflow-driver-" + driverCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public WorkflowOrchestrator(ReqflowProperties properties, WorkerPool pool, EventBroadcaster broadcaster,
                                ClarificationGate gate, WorkflowSessionRegistry registry,
                                RequirementMiner miner, RequirementEvaluator evaluator,
                                RequirementRewriter rewriter, KnowledgeGraphService knowledgeGraph,
                                ReqflowMetrics metrics) {
        this(properties.toWorkflowConfig(), pool, broadcaster, gate, registry,
                miner, evaluator, rewriter, knowledgeGraph, metrics, Clock.systemUTC());
    }

    public WorkflowOrchestrator(WorkflowConfig defaults, WorkerPool pool, EventBroadcaster broadcaster,
                                ClarificationGate gate, WorkflowSessionRegistry registry,
                                RequirementMiner miner, RequirementEvaluator evaluator,
                                RequirementRewriter rewriter, KnowledgeGraphService knowledgeGraph,
                                ReqflowMetrics metrics, Clock clock) {
        this.defaults = defaults;
        this.pool = pool;
        this.broadcaster = broadcaster;
        this.gate = gate;
        this.registry = registry;
        this.miner = miner;
        this.evaluator = evaluator;
        this.rewriter = rewriter;
        this.knowledgeGraph = knowledgeGraph;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PreDestroy
    public void shutdown() {
        drivers.shutdownNow();
    }

    public WorkflowConfig defaults() {
        return defaults;
    }

    /**
     * Accepts a batch and starts driving it asynchronously.
     *
     * @return accepted with a future of the final snapshot, or rejected when the correlation
     *         id already has an active run
     * @throws IllegalArgumentException if the overrides or pre-extracted items are invalid
     */
    public SubmitResult submit(WorkflowSubmission submission) {
        String correlationId = submission.correlationId() != null && !submission.correlationId().isBlank()
                ? submission.correlationId()
                : generateCorrelationId();
        WorkflowConfig config = defaults.withOverrides(submission.overrides());
        var run = new WorkflowRun(correlationId, config, clock.instant());
        for (RequirementItem item : submission.items()) {
            if (!run.addItem(item)) {
                throw new IllegalArgumentException("Duplicate requirement id " + item.id());
            }
        }

        try {
            registry.register(run);
        } catch (DuplicateRunException e) {
            log.warn("Rejected submission for {}: {}", correlationId, e.getMessage());
            return SubmitResult.rejected(correlationId);
        }

        gate.forget(correlationId);
        broadcaster.open(correlationId);
        run.announce((previous, next) -> publishStatus(run, previous, next));
        log.info("Accepted workflow {} with {} item(s) and {} document(s)",
                correlationId, submission.items().size(), submission.documents().size());

        var documents = submission.documents();
        CompletableFuture<WorkflowSnapshot> completion =
                CompletableFuture.supplyAsync(() -> drive(run, documents), drivers);
        return SubmitResult.accepted(correlationId, completion);
    }

    /**
     * Cancels an active run. The {@code failed} status event is published before this returns;
     * no phase transition follows it.
     */
    public CancelResult cancel(String correlationId) {
        Optional<WorkflowRun> active = registry.active(correlationId);
        if (active.isEmpty()) {
            return CancelResult.NOT_FOUND;
        }
        WorkflowRun run = active.get();
        String reason = "Cancelled by request";
        if (run.fail(FailureReason.CANCELLED, reason, clock.instant(),
                (previous, next) -> publishStatus(run, previous, next))) {
            log.info("Workflow {} cancelled", correlationId);
        }
        run.token().cancel(reason);
        gate.cancelAll(correlationId, reason);
        return CancelResult.OK;
    }

    /**
     * Offers an answer to a clarification question of the run. The first answer wins.
     */
    public AnswerResult answerClarification(String correlationId, String questionId, String answer) {
        if (!registry.isKnown(correlationId)) {
            return AnswerResult.NOT_FOUND;
        }
        return gate.answer(correlationId, questionId, answer);
    }

    public Optional<WorkflowSnapshot> status(String correlationId) {
        return registry.snapshot(correlationId);
    }

    public List<WorkflowSnapshot> list() {
        return registry.snapshots();
    }

    public List<ClarificationQuestion> pendingQuestions(String correlationId) {
        return gate.pending(correlationId);
    }

    WorkflowSnapshot drive(WorkflowRun run, List<SourceDocument> documents) {
        String correlationId = run.correlationId();
        MdcContext.setRun(correlationId);
        try {
            WorkflowPhase phase = WorkflowPhase.MINING;
            while (enter(run, phase) && !phase.isTerminal()) {
                MdcContext.setPhase(correlationId, phase.configKey());
                PhaseStats stats = runPhase(run, phase, documents);
                run.recordStats(phase, stats);
                run.token().throwIfCancelled();

                PhaseTransition transition = PhaseTransitions.next(phase, stats, run.itemCount());
                if (transition.reason() == FailureReason.PHASE_EXHAUSTED) {
                    throw new PhaseExhaustedException(phase, stats, transition.detail());
                }
                if (transition.isFailure()) {
                    failRun(run, transition.reason(), transition.detail());
                    break;
                }
                phase = transition.next();
            }
        } catch (WorkflowCancelledException e) {
            failRun(run, FailureReason.CANCELLED, e.getMessage());
        } catch (PhaseExhaustedException e) {
            log.warn("Workflow {} failed: {}", correlationId, e.getMessage());
            failRun(run, FailureReason.PHASE_EXHAUSTED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Workflow {} failed unexpectedly", correlationId, e);
            failRun(run, FailureReason.INTERNAL_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            MdcContext.clear();
        }
        return finish(run);
    }

    private boolean enter(WorkflowRun run, WorkflowPhase phase) {
        return run.enter(phase, clock.instant(), (previous, next) -> publishStatus(run, previous, next));
    }

    private void failRun(WorkflowRun run, FailureReason reason, String detail) {
        run.fail(reason, detail, clock.instant(), (previous, next) -> publishStatus(run, previous, next));
    }

    private WorkflowSnapshot finish(WorkflowRun run) {
        String correlationId = run.correlationId();
        gate.cancelAll(correlationId, "workflow finished");
        WorkflowSnapshot snapshot = run.snapshot();
        broadcaster.publish(correlationId, EventKind.WORKFLOW_RESULT, resultPayload(snapshot));
        broadcaster.markTerminal(correlationId);
        try {
            knowledgeGraph.release(correlationId);
        } catch (RuntimeException e) {
            log.warn("Failed to release knowledge graph for {}: {}", correlationId, e.getMessage());
        }
        registry.archive(run, snapshot).ifPresent(gate::forget);
        if (metrics != null) {
            metrics.recordWorkflowResult(snapshot.phase().configKey());
        }
        log.info("Workflow {} finished: {}{}", correlationId, snapshot.phase(),
                snapshot.failureReason() != null ? " (" + snapshot.failureReason() + ")" : "");
        return snapshot;
    }

    private PhaseStats runPhase(WorkflowRun run, WorkflowPhase phase, List<SourceDocument> documents) {
        return switch (phase) {
            case MINING -> mine(run, documents);
            case KG_BUILD -> buildGraph(run);
            case VALIDATING -> validate(run);
            case REWRITING -> rewrite(run);
            case QA_REVIEW -> review(run);
            case CLARIFICATION -> clarify(run);
            default -> throw new IllegalStateException("Phase " + phase + " has no delegator");
        };
    }

    private PhaseStats mine(WorkflowRun run, List<SourceDocument> documents) {
        var delegator = delegator(WorkflowPhase.MINING, new MiningHandler(miner), SourceDocument::id);
        PhaseResult<MiningYield> result = delegator.runPhase(run.correlationId(), documents,
                settings(run, WorkflowPhase.MINING), run.token());
        // Items join the run in document order, whichever document finished first.
        result.payloads().forEach((documentId, mined) -> {
            PhaseOutcome outcome = result.outcomes().get(documentId);
            for (RequirementItem item : mined.items()) {
                if (!run.addItem(item.withOutcome(outcome))) {
                    log.warn("Skipping mined requirement {}: id already in use", item.id());
                }
            }
        });
        return result.stats();
    }

    private PhaseStats buildGraph(WorkflowRun run) {
        var batches = KgBatch.partition(run.items(), run.config().kgBatchSize());
        var batchesById = new HashMap<String, KgBatch>();
        batches.forEach(b -> batchesById.put(b.id(), b));
        var delegator = delegator(WorkflowPhase.KG_BUILD,
                new KgBuildHandler(knowledgeGraph, run.correlationId()), KgBatch::id);
        PhaseResult<GraphYield> result = delegator.runPhase(run.correlationId(), batches,
                settings(run, WorkflowPhase.KG_BUILD), run.token(), (batchId, outcome, yield) -> {
                    for (RequirementItem item : batchesById.get(batchId).items()) {
                        run.slot(item.id()).record(WorkflowPhase.KG_BUILD, it -> it.withOutcome(outcome));
                    }
                });
        return result.stats();
    }

    private PhaseStats validate(WorkflowRun run) {
        var delegator = delegator(WorkflowPhase.VALIDATING,
                new ValidationHandler(evaluator, run.config().passThreshold()), RequirementItem::id);
        PhaseResult<ValidationVerdict> result = delegator.runPhase(run.correlationId(), run.items(),
                settings(run, WorkflowPhase.VALIDATING), run.token(), (itemId, outcome, verdict) -> {
                    if (verdict != null) {
                        run.recordEvaluation(itemId, verdict.evaluation());
                    }
                    run.slot(itemId).record(WorkflowPhase.VALIDATING, it -> verdict != null
                            ? it.withScore(verdict.score()).withOutcome(outcome)
                            : it.withOutcome(outcome));
                });
        return result.stats();
    }

    private PhaseStats rewrite(WorkflowRun run) {
        var failed = run.items().stream().filter(i -> i.verdict() == Verdict.FAIL).toList();
        var config = run.config();
        var delegator = delegator(WorkflowPhase.REWRITING,
                new RewriteHandler(rewriter, evaluator, config.passThreshold(), config.rewriteMaxRounds(), metrics),
                RequirementItem::id);
        PhaseResult<RewriteYield> result = delegator.runPhase(run.correlationId(), failed,
                settings(run, WorkflowPhase.REWRITING), run.token(), (itemId, outcome, yield) -> {
                    if (yield != null && yield.evaluation() != null) {
                        run.recordEvaluation(itemId, yield.evaluation());
                    }
                    run.slot(itemId).record(WorkflowPhase.REWRITING, it -> yield != null
                            ? it.withText(yield.text()).withScore(yield.bestScore()).withOutcome(outcome)
                            : it.withOutcome(outcome));
                });
        return result.stats();
    }

    private PhaseStats review(WorkflowRun run) {
        var items = run.items();
        var config = run.config();
        var handler = new QaReviewHandler(knowledgeGraph, run.correlationId(), config.passThreshold(),
                config.duplicateThreshold(), config.searchTopK(), run.evaluations(),
                items.stream().map(RequirementItem::id).toList());
        var delegator = delegator(WorkflowPhase.QA_REVIEW, handler, RequirementItem::id);
        PhaseResult<QaReport> result = delegator.runPhase(run.correlationId(), items,
                settings(run, WorkflowPhase.QA_REVIEW), run.token(), (itemId, outcome, report) ->
                        run.slot(itemId).record(WorkflowPhase.QA_REVIEW, it -> it.withOutcome(outcome)));

        var pendingReview = new LinkedHashMap<String, QaReport>();
        result.payloads().forEach((itemId, report) -> {
            if (report.verdict() == Verdict.FAIL) {
                pendingReview.put(itemId, report);
            }
        });
        run.setPendingReview(pendingReview);
        return result.stats();
    }

    private PhaseStats clarify(WorkflowRun run) {
        var tasks = new ArrayList<ClarificationTask>();
        run.pendingReview().forEach((itemId, report) -> {
            RequirementItem item = run.slot(itemId).current();
            tasks.add(new ClarificationTask(item,
                    QuestionFactory.questionsFor(run.correlationId(), item, report.issues())));
        });
        var config = run.config();
        var delegator = delegator(WorkflowPhase.CLARIFICATION,
                new ClarificationHandler(gate, config.clarificationTimeout()), ClarificationTask::itemId);
        var settings = new PoolSettings(WorkflowPhase.CLARIFICATION.configKey(),
                config.maxConcurrent(WorkflowPhase.CLARIFICATION),
                config.clarificationTimeout().plus(config.perItemTimeout()), 1, Duration.ZERO);
        PhaseResult<ClarificationResolution> result = delegator.runPhase(run.correlationId(), tasks,
                settings, run.token(), (itemId, outcome, resolution) ->
                        run.slot(itemId).record(WorkflowPhase.CLARIFICATION, it ->
                                resolution != null && resolution.revisedText() != null
                                        ? it.withText(resolution.revisedText()).withOutcome(outcome)
                                        : it.withOutcome(outcome)));
        return result.stats();
    }

    private <T, R extends HandlerResult> Delegator<T, R> delegator(WorkflowPhase phase, PhaseHandler<T, R> handler,
                                                                 Function<T, String> idOf) {
        return new Delegator<>(phase, handler, idOf, pool, broadcaster, metrics);
    }

    private static PoolSettings settings(WorkflowRun run, WorkflowPhase phase) {
        var config = run.config();
        return new PoolSettings(phase.configKey(), config.maxConcurrent(phase), config.perItemTimeout(),
                config.maxAttempts(), config.retryBackoff());
    }

    private void publishStatus(WorkflowRun run, WorkflowPhase previous, WorkflowPhase next) {
        var payload = new HashMap<String, Object>();
        payload.put("phase", next.configKey());
        if (previous != null) {
            payload.put("previous", previous.configKey());
        }
        if (next == WorkflowPhase.FAILED) {
            var snapshot = run.snapshot();
            payload.put("reason", snapshot.failureReason().name());
            if (snapshot.failureDetail() != null) {
                payload.put("detail", snapshot.failureDetail());
            }
        }
        payload.put("items", run.itemCount());
        broadcaster.publish(run.correlationId(), EventKind.WORKFLOW_STATUS, payload);
        log.info("Workflow {} -> {}", run.correlationId(), next);
    }

    static Map<String, Object> resultPayload(WorkflowSnapshot snapshot) {
        var payload = new HashMap<String, Object>();
        payload.put("phase", snapshot.phase().configKey());
        if (snapshot.failureReason() != null) {
            payload.put("reason", snapshot.failureReason().name());
        }
        if (snapshot.failureDetail() != null) {
            payload.put("detail", snapshot.failureDetail());
        }
        var items = new ArrayList<Map<String, Object>>();
        for (RequirementItem item : snapshot.items()) {
            var entry = new HashMap<String, Object>();
            entry.put("id", item.id());
            entry.put("text", item.text());
            if (item.verdict() != null) {
                entry.put("verdict", item.verdict().wireName());
            }
            if (item.currentScore() != null) {
                entry.put("score", item.currentScore());
            }
            items.add(entry);
        }
        payload.put("items", items);
        payload.put("passed", snapshot.count(Verdict.PASS));
        payload.put("failed", snapshot.count(Verdict.FAIL));
        payload.put("errored", snapshot.count(Verdict.ERROR));
        return payload;
    }

    /**
     * Generates an id in the format RF-YYYY-NNNN.
     */
    public String generateCorrelationId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("RF-%d-%04d", year, count);
    }
}
