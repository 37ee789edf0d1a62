package io.jerry.core.agent;

import io.jerry.core.context.AssembledContext;
import io.jerry.core.context.ContextAssembler;
import io.jerry.core.context.SystemPromptBuilder;
import io.jerry.core.decision.Decision;
import io.jerry.core.decision.DecisionEngine;
import io.jerry.core.decision.ModelUnavailableException;
import io.jerry.core.decision.ToolInvocation;
import io.jerry.core.model.ToolCall;
import io.jerry.core.peer.PeerCaller;
import io.jerry.core.peer.PeerUnavailableException;
import io.jerry.core.session.Conversation;
import io.jerry.core.session.ConversationHandle;
import io.jerry.core.session.ConversationLockTimeoutException;
import io.jerry.core.session.ConversationSessionManager;
import io.jerry.core.session.ConversationStatus;
import io.jerry.core.session.Turn;
import io.jerry.core.tool.CorrelationIdGenerator;
import io.jerry.core.tool.ToolCallRequest;
import io.jerry.core.tool.ToolCallResult;
import io.jerry.core.tool.ToolContext;
import io.jerry.core.tool.ToolRegistry;
import io.jerry.core.tool.ToolRoute;
import io.jerry.core.tool.UnknownToolException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OrchestrationLoop {
    private static final Logger LOG = LoggerFactory.getLogger(OrchestrationLoop.class);
    private static final Duration DISPATCH_GRACE = Duration.ofMillis(250);
    private static final int SUMMARY_RESULT_CHARS = 400;

    static final String APOLOGY_REPLY = ":warning: Looks like I had some trouble processing. Please try again.";
    static final String BUSY_REPLY = "I'm still working on your previous message in this conversation. "
        + "Please try again in a moment.";
    static final String MODEL_UNAVAILABLE_REPLY = "I'm having trouble reaching my language model right now, "
        + "so I couldn't finish your request. Please try again in a few minutes.";

    private final ConversationSessionManager sessions;
    private final ContextAssembler assembler;
    private final SystemPromptBuilder promptBuilder;
    private final DecisionEngine decisionEngine;
    private final ToolRegistry toolRegistry;
    private final PeerCaller peerCaller;
    private final CorrelationIdGenerator correlationIds;
    private final AgentSettings settings;
    private final UnaryOperator<String> inboundFilter;
    private final Clock clock;

    public OrchestrationLoop(
        ConversationSessionManager sessions,
        ContextAssembler assembler,
        SystemPromptBuilder promptBuilder,
        DecisionEngine decisionEngine,
        ToolRegistry toolRegistry,
        PeerCaller peerCaller,
        CorrelationIdGenerator correlationIds,
        AgentSettings settings,
        UnaryOperator<String> inboundFilter,
        Clock clock
    ) {
        this.sessions = sessions;
        this.assembler = assembler;
        this.promptBuilder = promptBuilder;
        this.decisionEngine = decisionEngine;
        this.toolRegistry = toolRegistry;
        this.peerCaller = peerCaller == null ? PeerCaller.unavailable() : peerCaller;
        this.correlationIds = correlationIds;
        this.settings = settings;
        this.inboundFilter = inboundFilter == null ? UnaryOperator.identity() : inboundFilter;
        this.clock = clock;
    }

    public CycleResult handleInboundMessage(InboundEvent event, ReplySink sink) {
        ConversationHandle handle;
        try {
            handle = sessions.acquire(event.conversationKey(), settings.lockTimeout());
        } catch (ConversationLockTimeoutException e) {
            CycleResult busy = new CycleResult(CycleOutcome.BUSY, BUSY_REPLY, 0, 0, false);
            deliver(sink, event, busy);
            return busy;
        }

        try {
            CycleResult result;
            try {
                result = runCycle(handle.conversation(), event, sink);
            } catch (RuntimeException e) {
                if (handle.conversation().isClosed()) {
                    LOG.debug("Cycle for closed conversation {} aborted: {}", event.conversationKey(), e.getMessage());
                    result = new CycleResult(CycleOutcome.SUPERSEDED, "", 0, 0, false);
                } else {
                    LOG.error("Cycle for conversation {} failed", event.conversationKey(), e);
                    result = new CycleResult(CycleOutcome.FAILED, APOLOGY_REPLY, 0, 0, false);
                }
            }
            if (result.replied()) {
                deliver(sink, event, result);
            } else {
                LOG.info("Conversation {} was closed mid-cycle; discarding reply", event.conversationKey());
            }
            return result;
        } finally {
            handle.release();
            log(event, CycleState.TERMINATED);
        }
    }

    private CycleResult runCycle(Conversation conversation, InboundEvent event, ReplySink sink) {
        log(event, CycleState.START);
        if (conversation.size() == 0) {
            restoreHistory(conversation, event, sink);
        }
        markWorking(sink, event);
        conversation.append(Turn.user(inboundFilter.apply(event.text()), clock.instant()));
        Instant cycleDeadline = clock.instant().plus(settings.cycleTimeout());
        ToolContext toolContext = new ToolContext(event.conversationKey(), event.senderId());

        int decisions = 0;
        int dispatched = 0;
        int rounds = 0;
        boolean parseDegraded = false;
        while (true) {
            if (rounds > 0 && !clock.instant().isBefore(cycleDeadline)) {
                LOG.warn("Conversation {} ran out of cycle time after {} tool rounds", event.conversationKey(), rounds);
                return finish(conversation, event, CycleOutcome.ITERATION_CAP, progressSummary(conversation, rounds),
                    decisions, dispatched, parseDegraded);
            }
            log(event, CycleState.ASSEMBLING);
            String systemPrompt = promptBuilder.build(toolDescriptions());
            AssembledContext context = assembler.assemble(conversation.turns(), systemPrompt);

            log(event, CycleState.DECIDING);
            Decision decision;
            try {
                decision = decideWithRetry(context, cycleDeadline);
            } catch (ModelUnavailableException e) {
                LOG.warn("Model unavailable for conversation {} after {} attempts: {}",
                    event.conversationKey(), settings.decisionAttempts(), e.getMessage());
                return finish(conversation, event, CycleOutcome.DEGRADED, MODEL_UNAVAILABLE_REPLY,
                    decisions, dispatched, parseDegraded);
            }
            decisions++;
            parseDegraded |= decision.parseDegraded();
            if (decision.parseDegraded()) {
                LOG.warn("Degraded model output parsed for conversation {}", event.conversationKey());
            }

            if (decision.isFinalAnswer()) {
                return finish(conversation, event, CycleOutcome.ANSWERED, decision.text(),
                    decisions, dispatched, parseDegraded);
            }
            if (rounds >= settings.maxIterations() || !clock.instant().isBefore(cycleDeadline)) {
                LOG.warn("Conversation {} stopped after {} tool rounds", event.conversationKey(), rounds);
                return finish(conversation, event, CycleOutcome.ITERATION_CAP, progressSummary(conversation, rounds),
                    decisions, dispatched, parseDegraded);
            }

            log(event, CycleState.DISPATCHING);
            rounds++;
            List<Dispatched> results = dispatch(conversation, event, decision.invocations(), toolContext, cycleDeadline);
            dispatched += results.size();
            if (conversation.isClosed()) {
                return new CycleResult(CycleOutcome.SUPERSEDED, "", decisions, dispatched, parseDegraded);
            }

            log(event, CycleState.FOLDING);
            for (Dispatched item : results) {
                ToolCallResult result = item.result();
                Instant now = clock.instant();
                conversation.append(item.peer()
                    ? Turn.peerResult(result.render(), result.correlationId(), now)
                    : Turn.toolResult(result.render(), result.correlationId(), now));
            }
            conversation.transition(ConversationStatus.RUNNING);
        }
    }

    // Attempts and backoff both stop at the cycle deadline.
    private Decision decideWithRetry(AssembledContext context, Instant cycleDeadline) {
        long backoff = settings.decisionBackoff().toMillis();
        ModelUnavailableException last = null;
        for (int attempt = 1; attempt <= settings.decisionAttempts(); attempt++) {
            Duration remaining = Duration.between(clock.instant(), cycleDeadline);
            if (remaining.isNegative() || remaining.isZero()) {
                break;
            }
            try {
                return decisionEngine.decide(context.messages(), toolRegistry.definitions(), remaining);
            } catch (ModelUnavailableException e) {
                last = e;
                LOG.debug("Decision attempt {} failed: {}", attempt, e.getMessage());
                if (attempt < settings.decisionAttempts()) {
                    if (backoff >= Duration.between(clock.instant(), cycleDeadline).toMillis()) {
                        LOG.debug("No cycle time left for another decision attempt");
                        break;
                    }
                    sleep(backoff);
                    backoff = backoff * 2;
                }
            }
        }
        throw last != null ? last : new ModelUnavailableException("cycle deadline passed before the model was asked");
    }

    private List<Dispatched> dispatch(
        Conversation conversation,
        InboundEvent event,
        List<ToolInvocation> invocations,
        ToolContext toolContext,
        Instant cycleDeadline
    ) {
        Instant now = clock.instant();
        Instant callDeadline = now.plus(settings.toolTimeout());
        if (callDeadline.isAfter(cycleDeadline)) {
            callDeadline = cycleDeadline;
        }

        List<ToolCallRequest> requests = new ArrayList<>(invocations.size());
        List<ToolCall> calls = new ArrayList<>(invocations.size());
        for (ToolInvocation invocation : invocations) {
            String correlationId = correlationIds.next();
            requests.add(new ToolCallRequest(correlationId, invocation.toolName(), invocation.arguments(),
                event.conversationKey(), callDeadline));
            calls.add(new ToolCall(correlationId, invocation.toolName(), invocation.arguments()));
        }
        conversation.append(Turn.agentInvocations("", calls, now));

        boolean anyPeer = false;
        boolean[] peer = new boolean[requests.size()];
        List<CompletableFuture<ToolCallResult>> futures = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ToolCallRequest request = requests.get(i);
            peer[i] = peerRoute(request.toolName());
            anyPeer |= peer[i];
            futures.add(start(request, toolContext));
        }
        conversation.transition(anyPeer ? ConversationStatus.AWAITING_PEER : ConversationStatus.AWAITING_TOOL);

        long waitMillis = Math.max(0, Duration.between(clock.instant(), callDeadline).plus(DISPATCH_GRACE).toMillis());
        List<CompletableFuture<ToolCallResult>> bounded = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            ToolCallRequest request = requests.get(i);
            bounded.add(futures.get(i).completeOnTimeout(
                ToolCallResult.timeout(request.correlationId(), request.toolName()),
                waitMillis,
                TimeUnit.MILLISECONDS
            ));
        }
        CompletableFuture.allOf(bounded.toArray(new CompletableFuture[0])).join();

        List<Dispatched> results = new ArrayList<>(bounded.size());
        for (int i = 0; i < bounded.size(); i++) {
            results.add(new Dispatched(bounded.get(i).join(), peer[i]));
        }
        return results;
    }

    private CompletableFuture<ToolCallResult> start(ToolCallRequest request, ToolContext toolContext) {
        String correlationId = request.correlationId();
        try {
            ToolRoute route = toolRegistry.lookup(request.toolName());
            CompletableFuture<ToolCallResult> future = route.kind() == ToolRoute.Kind.LOCAL
                ? toolRegistry.invoke(route.tool(), request, toolContext)
                : peerCaller.call(route.peer(), request);
            return future.exceptionally(ex -> ToolCallResult.failure(correlationId, request.toolName(),
                ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()));
        } catch (UnknownToolException | PeerUnavailableException e) {
            LOG.warn("Cannot dispatch {}: {}", request.toolName(), e.getMessage());
            return CompletableFuture.completedFuture(
                ToolCallResult.failure(correlationId, request.toolName(), e.getMessage()));
        } catch (RuntimeException e) {
            LOG.warn("Dispatch of {} failed", request.toolName(), e);
            return CompletableFuture.completedFuture(ToolCallResult.failure(correlationId, request.toolName(),
                e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }
    }

    private CycleResult finish(
        Conversation conversation,
        InboundEvent event,
        CycleOutcome outcome,
        String reply,
        int decisions,
        int dispatched,
        boolean parseDegraded
    ) {
        if (conversation.isClosed()) {
            return new CycleResult(CycleOutcome.SUPERSEDED, "", decisions, dispatched, parseDegraded);
        }
        conversation.append(Turn.agent(reply, clock.instant()));
        log(event, CycleState.DONE);
        return new CycleResult(outcome, reply, decisions, dispatched, parseDegraded);
    }

    private String progressSummary(Conversation conversation, int rounds) {
        StringBuilder summary = new StringBuilder("I ran ")
            .append(rounds)
            .append(rounds == 1 ? " round" : " rounds")
            .append(" of tool calls without reaching a final answer, so I'm stopping here.");
        List<Turn> turns = conversation.turns();
        List<String> findings = new ArrayList<>();
        for (int i = turns.size() - 1; i >= 0 && findings.size() < 3; i--) {
            Turn turn = turns.get(i);
            if (turn.isResult() && !turn.content().isBlank()) {
                findings.add(0, abbreviate(turn.content()));
            }
        }
        if (!findings.isEmpty()) {
            summary.append("\n\nWhat I found so far:");
            for (String finding : findings) {
                summary.append("\n- ").append(finding);
            }
        }
        return summary.toString();
    }

    private Map<String, String> toolDescriptions() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (ToolRoute route : toolRegistry.routes()) {
            descriptions.put(route.name(), route.description());
        }
        return descriptions;
    }

    private boolean peerRoute(String toolName) {
        try {
            return toolRegistry.lookup(toolName).kind() == ToolRoute.Kind.PEER;
        } catch (UnknownToolException e) {
            return false;
        }
    }

    private void restoreHistory(Conversation conversation, InboundEvent event, ReplySink sink) {
        List<Turn> prior;
        try {
            prior = sink.priorTurns(event);
        } catch (RuntimeException e) {
            LOG.warn("Could not restore history for conversation {}", event.conversationKey(), e);
            return;
        }
        for (Turn turn : prior) {
            conversation.append(turn);
        }
        if (!prior.isEmpty()) {
            LOG.info("Restored {} earlier turns for conversation {}", prior.size(), event.conversationKey());
        }
    }

    private static void markWorking(ReplySink sink, InboundEvent event) {
        try {
            sink.working(event);
        } catch (RuntimeException e) {
            LOG.debug("Could not show working status for {}: {}", event.conversationKey(), e.getMessage());
        }
    }

    private void deliver(ReplySink sink, InboundEvent event, CycleResult result) {
        try {
            sink.deliver(event, result.reply());
        } catch (RuntimeException e) {
            LOG.warn("Could not deliver reply for conversation {}", event.conversationKey(), e);
        }
    }

    private static void log(InboundEvent event, CycleState state) {
        LOG.debug("[{}] {}", event.conversationKey(), state);
    }

    private static String abbreviate(String value) {
        String flat = value.replace('\n', ' ').trim();
        return flat.length() <= SUMMARY_RESULT_CHARS ? flat : flat.substring(0, SUMMARY_RESULT_CHARS) + "...";
    }

    private record Dispatched(ToolCallResult result, boolean peer) {
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException("Interrupted during decision backoff", e);
        }
    }
}
