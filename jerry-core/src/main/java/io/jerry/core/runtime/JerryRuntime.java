package io.jerry.core.runtime;

import io.jerry.core.agent.AgentSettings;
import io.jerry.core.agent.InboundDispatcher;
import io.jerry.core.agent.OrchestrationLoop;
import io.jerry.core.agent.PeerInboundBridge;
import io.jerry.core.config.model.AgentDefaults;
import io.jerry.core.config.model.CoralConfig;
import io.jerry.core.config.model.JerryConfig;
import io.jerry.core.config.model.ProviderConfig;
import io.jerry.core.config.model.ProvidersConfig;
import io.jerry.core.config.model.RuntimeConfig;
import io.jerry.core.config.model.SlackConfig;
import io.jerry.core.context.ContextAssembler;
import io.jerry.core.context.ContextBudget;
import io.jerry.core.context.SystemPromptBuilder;
import io.jerry.core.decision.DecisionSettings;
import io.jerry.core.decision.ModelDecisionEngine;
import io.jerry.core.middleware.PiiRedactor;
import io.jerry.core.peer.PeerCaller;
import io.jerry.core.peer.PeerSessionClient;
import io.jerry.core.peer.PeerSessionFatalException;
import io.jerry.core.peer.PeerSessionSettings;
import io.jerry.core.peer.PeerUnavailableException;
import io.jerry.core.peer.ReconnectPolicy;
import io.jerry.core.provider.DisabledProvider;
import io.jerry.core.provider.FallbackLlmProvider;
import io.jerry.core.provider.LlmProvider;
import io.jerry.core.provider.OpenAiCompatProvider;
import io.jerry.core.provider.ProviderRegistry;
import io.jerry.core.provider.ProviderRouter;
import io.jerry.core.session.ConversationSessionManager;
import io.jerry.core.slack.EventDeduplicator;
import io.jerry.core.slack.SlackClient;
import io.jerry.core.slack.SlackEventsServer;
import io.jerry.core.slack.SlackMessageRouter;
import io.jerry.core.slack.SlackReplySink;
import io.jerry.core.slack.SlackSignatureVerifier;
import io.jerry.core.tool.CorrelationIdGenerator;
import io.jerry.core.tool.PeerToolDescriptor;
import io.jerry.core.tool.ToolCallRequest;
import io.jerry.core.tool.ToolCallResult;
import io.jerry.core.tool.ToolRegistry;
import io.jerry.core.tool.impl.GitHubTool;
import io.jerry.core.tool.impl.GoogleTool;
import io.jerry.core.tool.impl.SearchTool;
import io.jerry.core.tool.impl.WebTool;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JerryRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JerryRuntime.class);
    private static final List<String> PROVIDER_ORDER = List.of("mistral", "openai", "openrouter");

    private final JerryConfig config;
    private final Clock clock;
    private final Consumer<PeerSessionFatalException> fatalHandler;
    private final ToolRegistry toolRegistry;
    private final ConversationSessionManager sessions;
    private final ModelDecisionEngine decisionEngine;
    private final OrchestrationLoop loop;
    private final InboundDispatcher dispatcher;
    private volatile PeerSessionClient peerSession;
    private SlackEventsServer slackServer;

    public JerryRuntime(JerryConfig config) {
        this(config, Clock.systemUTC(), error -> LOG.error("Peer session failed permanently", error));
    }

    public JerryRuntime(JerryConfig config, Clock clock, Consumer<PeerSessionFatalException> fatalHandler) {
        this.config = config;
        this.clock = clock;
        this.fatalHandler = fatalHandler;
        AgentDefaults agent = config.agent();
        RuntimeConfig runtime = config.runtime();

        this.toolRegistry = new ToolRegistry(clock, runtime.toolWorkers());
        registerTools(toolRegistry, config);

        this.sessions = new ConversationSessionManager(
            clock,
            Duration.ofMillis(runtime.lockTimeoutMs()),
            Duration.ofMillis(runtime.idleEvictionMs())
        );

        LlmProvider provider = new ProviderRouter(buildProviders(config.providers())).resolve(agent.provider(), agent.model());
        this.decisionEngine = new ModelDecisionEngine(provider, new DecisionSettings(
            provider.name(),
            agent.model(),
            agent.temperature(),
            agent.maxTokens(),
            Duration.ofMillis(agent.modelTimeoutMs())
        ));

        AgentSettings settings = new AgentSettings(
            agent.maxIterations(),
            agent.decisionAttempts(),
            Duration.ofMillis(agent.decisionBackoffMs()),
            Duration.ofMillis(agent.toolTimeoutMs()),
            Duration.ofMillis(agent.cycleTimeoutMs()),
            Duration.ofMillis(runtime.lockTimeoutMs())
        );
        this.loop = new OrchestrationLoop(
            sessions,
            new ContextAssembler(new ContextBudget(agent.contextMaxTurns(), agent.contextMaxTokens())),
            new SystemPromptBuilder(clock),
            decisionEngine,
            toolRegistry,
            this::callPeer,
            new CorrelationIdGenerator(),
            settings,
            inboundFilter(config),
            clock
        );
        this.dispatcher = new InboundDispatcher(loop, runtime.inboundWorkers(), runtime.inboundQueue());
    }

    public static ProviderRegistry buildProviders(ProvidersConfig providers) {
        Map<String, LlmProvider> direct = new LinkedHashMap<>();
        for (String name : PROVIDER_ORDER) {
            String defaultBase = ProvidersConfig.defaults().byName(name).apiBase();
            direct.put(name, buildOpenAiCompatProvider(name, providers.byName(name), defaultBase));
        }
        ProviderRegistry registry = new ProviderRegistry();
        for (String name : PROVIDER_ORDER) {
            List<LlmProvider> chain = new ArrayList<>();
            chain.add(direct.get(name));
            PROVIDER_ORDER.stream().filter(other -> !other.equals(name)).map(direct::get).forEach(chain::add);
            registry.register(new FallbackLlmProvider(name, chain));
        }
        return registry;
    }

    private static LlmProvider buildOpenAiCompatProvider(String name, ProviderConfig providerConfig, String defaultBase) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
                ? defaultBase
                : providerConfig.apiBase();
            return new OpenAiCompatProvider(name, providerConfig.apiKey(), apiBase, providerConfig.extraHeaders());
        }
        return DisabledProvider.missingKey(name);
    }

    private static void registerTools(ToolRegistry registry, JerryConfig config) {
        registry.register(new SearchTool(config.tools().search()));
        registry.register(new WebTool(config.tools().web()));
        registry.register(new GitHubTool(config.tools().github()));
        registry.register(new GoogleTool(config.tools().google()));
    }

    private static UnaryOperator<String> inboundFilter(JerryConfig config) {
        if (!config.privacy().redactionEnabled()) {
            return UnaryOperator.identity();
        }
        PiiRedactor redactor = new PiiRedactor(config.privacy().customPattern());
        return redactor::redact;
    }

    public synchronized void startServices() {
        sessions.startEviction(Duration.ofMillis(config.runtime().evictionIntervalMs()));
        CoralConfig coral = config.coral();
        if (coral.enabled()) {
            startPeerSession(coral);
        } else {
            LOG.info("Coordination network not configured; peer tools are unavailable");
        }
        SlackConfig slack = config.slack();
        if (slack.enabled()) {
            startSlack(slack);
        } else {
            LOG.info("Slack not configured; events endpoint not started");
        }
    }

    private void startPeerSession(CoralConfig coral) {
        PeerSessionSettings settings = new PeerSessionSettings(
            coral.connectionUrl(),
            coral.agentId(),
            Duration.ofMillis(coral.heartbeatMs()),
            Duration.ofMillis(coral.handshakeTimeoutMs()),
            new ReconnectPolicy(
                coral.reconnectAttempts(),
                Duration.ofMillis(coral.reconnectInitialDelayMs()),
                Duration.ofMillis(coral.reconnectMaxDelayMs()),
                coral.reconnectJitter()
            )
        );
        PeerInboundBridge bridge = new PeerInboundBridge(
            dispatcher,
            toolRegistry,
            () -> this::respondToPeer,
            fatalHandler
        );
        PeerSessionClient client = new PeerSessionClient(settings, toolRegistry::localDefinitions, bridge, clock);
        peerSession = client;
        client.start();
        LOG.info("Connecting to coordination network as {} (orchestration runtime: {})", coral.agentId(), coral.orchestrationRuntime());
    }

    private void startSlack(SlackConfig slack) {
        SlackReplySink replies = new SlackReplySink(new SlackClient(slack.botToken(), slack.apiBase()));
        SlackMessageRouter router = new SlackMessageRouter(
            new EventDeduplicator(), dispatcher::submit, replies, replies::greet);
        slackServer = new SlackEventsServer(
            slack.host(),
            slack.port(),
            new SlackSignatureVerifier(slack.signingSecret(), clock),
            router
        );
        slackServer.start();
    }

    private CompletableFuture<ToolCallResult> callPeer(PeerToolDescriptor tool, ToolCallRequest request) {
        PeerSessionClient client = peerSession;
        if (client == null) {
            return PeerCaller.unavailable().call(tool, request);
        }
        return client.call(tool, request);
    }

    private void respondToPeer(String correlationId, String text) {
        PeerSessionClient client = peerSession;
        if (client == null) {
            throw new PeerUnavailableException("peer session is not running");
        }
        client.respond(correlationId, text);
    }

    public OrchestrationLoop loop() {
        return loop;
    }

    public InboundDispatcher dispatcher() {
        return dispatcher;
    }

    public ToolRegistry toolRegistry() {
        return toolRegistry;
    }

    public ConversationSessionManager sessions() {
        return sessions;
    }

    public synchronized int slackPort() {
        return slackServer == null ? -1 : slackServer.port();
    }

    @Override
    public synchronized void close() {
        if (slackServer != null) {
            slackServer.close();
        }
        PeerSessionClient client = peerSession;
        if (client != null) {
            client.close();
        }
        dispatcher.close();
        sessions.close();
        toolRegistry.close();
        decisionEngine.close();
    }
}
