package com.projectdesk.pipeline;

import com.projectdesk.AppLogger;
import com.projectdesk.ProjectDeskException;
import com.projectdesk.ProjectRegistry;
import com.projectdesk.agent.FallbackAgent;
import com.projectdesk.events.EventChannel;
import com.projectdesk.events.EventSink;
import com.projectdesk.models.AskResult;
import com.projectdesk.models.MentionResolution;
import com.projectdesk.models.Project;
import com.projectdesk.models.ResolvedMention;
import com.projectdesk.models.RoutingDecision;
import com.projectdesk.models.RunResult;
import com.projectdesk.models.StagedFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Entry point for one natural-language request: resolve mentions, route,
 * run the structured pipeline or the fallback agent, report what was staged.
 */
public class AskService {

    private final ProjectRegistry registry;
    private final MentionResolver resolver;
    private final PromptRouter router;
    private final StructuredPipeline pipeline;
    private final FallbackAgent agent;
    private final ExecutorService workers;
    private final AppLogger logger = AppLogger.get();

    public AskService(ProjectRegistry registry, MentionResolver resolver, PromptRouter router,
                      StructuredPipeline pipeline, FallbackAgent agent) {
        this.registry = registry;
        this.resolver = resolver;
        this.router = router;
        this.pipeline = pipeline;
        this.agent = agent;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ask-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs the request on the calling thread.
     */
    public AskResult ask(String projectId, String prompt) throws IOException, InterruptedException {
        return execute(projectId, prompt, EventSink.NONE);
    }

    /**
     * Starts the request on the worker pool and returns its event channel.
     * Cancelling the channel interrupts the run; files staged before that stay staged.
     */
    public EventChannel stream(String projectId, String prompt) {
        EventChannel channel = new EventChannel();
        channel.status("open", Map.of("projectId", projectId == null ? "" : projectId));
        Future<?> task = workers.submit(() -> runStreamed(projectId, prompt, channel));
        channel.onCancel(() -> task.cancel(true));
        return channel;
    }

    private void runStreamed(String projectId, String prompt, EventChannel channel) {
        try {
            AskResult result = execute(projectId, prompt, channel);
            channel.done(result.getMeta());
        } catch (ProjectDeskException e) {
            logger.warn("Streamed request for " + projectId + " failed: " + e.getMessage());
            channel.error(e.getMessage(), e.getKind());
        } catch (InterruptedException e) {
            if (channel.isCancelled()) {
                logger.info("Streamed request for " + projectId + " cancelled by client");
            } else {
                channel.error("Request interrupted", null);
            }
        } catch (Exception e) {
            logger.error("Streamed request for " + projectId + " failed", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            channel.error(message, null);
        }
    }

    AskResult execute(String projectId, String prompt, EventSink sink) throws IOException, InterruptedException {
        long started = System.currentTimeMillis();
        if (prompt == null || prompt.isBlank()) {
            throw ProjectDeskException.invalidRequest("prompt is required");
        }
        Project project = registry.get(projectId);

        MentionResolution resolution = resolver.resolve(prompt, project);
        sink.status("resolved", Map.of("mentions", resolution.mentions().stream()
            .map(ResolvedMention::token)
            .collect(Collectors.toList())));

        RoutingDecision decision = router.decide(prompt, resolution.mentions());
        String route = decision.route().name().toLowerCase(Locale.ROOT);
        sink.status("routed", Map.of("route", route));
        logger.info("Request for " + project.getId() + " routed " + route
            + " (" + resolution.mentions().size() + " mention(s))");

        RunResult run;
        if (decision.isStructured()) {
            run = pipeline.run(project, decision.inputs(), decision.guidelines(), decision.outputs(),
                resolution.expandedPrompt(), sink);
        } else {
            run = agent.run(project, resolution.expandedPrompt(), sink);
        }

        List<String> staged = run.staged().stream()
            .map(StagedFile::mention)
            .distinct()
            .collect(Collectors.toList());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("route", route);
        meta.put("requireApproval", !staged.isEmpty());
        meta.put("staged", staged);
        meta.put("writeDir", project.getWriteDir());
        meta.put("stagingDir", project.getStagingDir());
        meta.put("durationMs", System.currentTimeMillis() - started);
        return new AskResult(withAcknowledgements(run.text(), staged), meta);
    }

    /**
     * Appends an {@code @output/<path>} line for every staged file the text does not already mention.
     */
    static String withAcknowledgements(String text, List<String> staged) {
        String body = text == null ? "" : text;
        List<String> missing = staged.stream()
            .filter(mention -> !body.contains(mention))
            .collect(Collectors.toList());
        if (missing.isEmpty()) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.stripTrailing());
        if (sb.length() > 0) {
            sb.append("\n\n");
        }
        sb.append("Staged for approval:");
        for (String mention : missing) {
            sb.append("\n- ").append(mention);
        }
        return sb.toString();
    }

    public void shutdown() {
        workers.shutdownNow();
    }
}
