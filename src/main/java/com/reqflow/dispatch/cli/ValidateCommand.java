package com.reqflow.dispatch.cli;

import com.reqflow.core.clarification.AnswerResult;
import com.reqflow.core.config.WorkflowConfig;
import com.reqflow.core.engine.SubmitResult;
import com.reqflow.core.engine.WorkflowOrchestrator;
import com.reqflow.core.engine.WorkflowSubmission;
import com.reqflow.core.events.EventBroadcaster;
import com.reqflow.core.events.EventKind;
import com.reqflow.core.events.EventStream;
import com.reqflow.core.events.WorkflowEvent;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SourceDocument;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: reqflow validate &lt;file&gt;
 * <p>
 * Runs a workflow in-process and prints its event stream until the result arrives. By default
 * every non-blank line of the file is one requirement ({@code #} starts a comment line); with
 * {@code --document} the whole file is mined as a single document. Questions are answered with
 * {@code --answer} when given, otherwise they fall back to manual review on timeout.
 * <p>
 * Exit code 0 when the run completes, 1 when it fails, 2 when it could not start.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Validate the requirements in a file")
@Component
public class ValidateCommand implements Callable<Integer> {

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    @Parameters(index = "0", description = "Requirements file (one per line) or document")
    Path file;

    @Option(names = {"--document", "-d"}, description = "Mine the file as one raw document")
    boolean document;

    @Option(names = {"--answer", "-a"}, description = "Answer every clarification question with this value")
    String answer;

    @Option(names = "--id", description = "Correlation id (generated when omitted)")
    String correlationId;

    @Option(names = "--pass-threshold", description = "Score needed to pass validation (0..1)")
    Double passThreshold;

    @Option(names = "--clarification-timeout", description = "Seconds to wait for an answer")
    Long clarificationTimeoutSeconds;

    private final WorkflowOrchestrator orchestrator;
    private final EventBroadcaster broadcaster;

    public ValidateCommand(WorkflowOrchestrator orchestrator, EventBroadcaster broadcaster) {
        this.orchestrator = orchestrator;
        this.broadcaster = broadcaster;
    }

    @Override
    public Integer call() throws InterruptedException {
        ConsoleOutput.printBanner();

        String id = correlationId != null && !correlationId.isBlank()
                ? correlationId
                : orchestrator.generateCorrelationId();
        WorkflowSubmission submission;
        try {
            submission = readSubmission(id);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }
        if (submission.items().isEmpty() && submission.documents().isEmpty()) {
            ConsoleOutput.error("No requirements found in " + file);
            return 2;
        }

        // Subscribe before submitting so the stream starts at the first event.
        try (EventStream stream = broadcaster.stream(id)) {
            SubmitResult result;
            try {
                result = orchestrator.submit(submission);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid submission: " + e.getMessage());
                return 2;
            }
            if (!result.isAccepted()) {
                ConsoleOutput.error("Workflow " + id + " is already running");
                return 2;
            }
            ConsoleOutput.info("Workflow " + id + " started");
            return follow(stream, result);
        }
    }

    private int follow(EventStream stream, SubmitResult result) throws InterruptedException {
        while (true) {
            Optional<WorkflowEvent> next = stream.next(POLL_INTERVAL);
            if (next.isEmpty()) {
                // The result event is queued before the completion future finishes.
                if (result.completion().isDone()) {
                    ConsoleOutput.error("Event stream closed before the result arrived");
                    return 1;
                }
                continue;
            }
            WorkflowEvent event = next.get();
            ConsoleOutput.event(event);
            if (event.kind() == EventKind.QUESTION && answer != null) {
                answerQuestion(event);
            }
            if (event.kind() == EventKind.WORKFLOW_RESULT) {
                ConsoleOutput.summary(event.payload());
                boolean completed = "completed".equals(event.payload().get("phase"));
                if (completed) {
                    ConsoleOutput.success("Workflow complete.");
                } else {
                    ConsoleOutput.error("Workflow failed: " + event.payload().get("reason"));
                }
                return completed ? 0 : 1;
            }
        }
    }

    private void answerQuestion(WorkflowEvent question) {
        String questionId = String.valueOf(question.payload().get("questionId"));
        AnswerResult answered = orchestrator.answerClarification(question.correlationId(), questionId, answer);
        if (answered == AnswerResult.OK) {
            ConsoleOutput.success("Answered " + questionId + ": " + answer);
        } else {
            ConsoleOutput.error("Could not answer " + questionId + ": " + answered);
        }
    }

    WorkflowSubmission readSubmission(String id) throws IOException {
        var overrides = new WorkflowConfig.Overrides(null, null, null,
                clarificationTimeoutSeconds != null ? Duration.ofSeconds(clarificationTimeoutSeconds) : null,
                passThreshold);
        if (document) {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return new WorkflowSubmission(id, List.of(), List.of(), overrides);
            }
            return new WorkflowSubmission(id, List.of(),
                    List.of(new SourceDocument("DOC-1", content, file.getFileName().toString())), overrides);
        }
        var items = new ArrayList<RequirementItem>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNumber++;
            String text = line.strip();
            if (text.isEmpty() || text.startsWith("#")) {
                continue;
            }
            items.add(RequirementItem.of(String.format("REQ-%03d", items.size() + 1), text,
                    file.getFileName() + ":" + lineNumber));
        }
        return new WorkflowSubmission(id, items, List.of(), overrides);
    }
}
