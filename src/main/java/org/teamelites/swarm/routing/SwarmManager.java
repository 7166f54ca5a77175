package org.teamelites.swarm.routing;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.teamelites.swarm.api.InboundMessage;
import org.teamelites.swarm.api.NicheDescriptor;
import org.teamelites.swarm.api.RouteResult;
import org.teamelites.swarm.api.SwarmAgentEntry;
import org.teamelites.swarm.niche.NicheMatcher;
import org.teamelites.swarm.reasoning.IReasoningContextProvider;
import org.teamelites.swarm.reasoning.IReasoningContextProvider.ReasoningEntry;
import org.teamelites.swarm.reasoning.ReasoningContext;
import org.teamelites.swarm.spi.IChannelAdapter;
import org.teamelites.swarm.spi.IMessageProcessor;
import org.teamelites.swarm.store.SwarmStore;
import org.teamelites.swarm.telemetry.SwarmEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Routes inbound messages to niche agents and processes them through per-agent queues.
 * <p>
 * <b>Routing:</b> in {@code single} mode every message goes to the registry's singleton agent.
 * In {@code swarm} mode the message is classified into a niche and routed to the agent bound to
 * exactly that niche key; a miss is counted as an unserved niche and yields {@code null}.
 * <p>
 * <b>Processing:</b> each agent owns a FIFO queue. One {@link #processQueues()} pass takes at
 * most one message from every non-empty queue, runs all of them concurrently on worker threads
 * and returns once every one has finished. A slow agent therefore never delays a fast agent
 * within the same pass, while messages of one agent are never processed concurrently.
 * <p>
 * <b>Reasoning:</b> when a {@link IReasoningContextProvider} is set, context is gathered before
 * processing (bounded by the context timeout) and the exchange is logged afterwards on a
 * separate executor without being awaited.
 * <p>
 * <strong>Thread Safety:</strong> routing and enqueueing are thread-safe. {@link #processQueues()}
 * must not be called concurrently with itself.
 */
public class SwarmManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SwarmManager.class);

    private final SwarmStore store;
    private final Function<InboundMessage, NicheDescriptor> nicheMatcher;
    private final SwarmEventLog events;
    private final Duration contextTimeout;
    private final Map<String, ArrayDeque<QueuedMessage>> queues = new LinkedHashMap<>();
    private final ExecutorService workers;
    private final ExecutorService reasoningExecutor;

    private volatile IMessageProcessor processor;
    private volatile IReasoningContextProvider reasoningProvider;

    /**
     * Creates a manager from configuration.
     * <p>
     * Options: {@code context-timeout} (duration bounding reasoning context gathering).
     *
     * @param store   the registry.
     * @param events  swarm event sink.
     * @param options the routing configuration.
     */
    public SwarmManager(SwarmStore store, SwarmEventLog events, Config options) {
        this(store, NicheMatcher::matchNiche, events, options.getDuration("context-timeout"));
    }

    SwarmManager(SwarmStore store, Function<InboundMessage, NicheDescriptor> nicheMatcher,
                 SwarmEventLog events, Duration contextTimeout) {
        if (contextTimeout.isNegative() || contextTimeout.isZero()) {
            throw new IllegalArgumentException("context-timeout must be positive, got: " + contextTimeout);
        }
        this.store = store;
        this.nicheMatcher = nicheMatcher;
        this.events = events != null ? events : SwarmEventLog.loggingOnly();
        this.contextTimeout = contextTimeout;
        this.workers = Executors.newCachedThreadPool(daemonThreads("swarm-agent-"));
        this.reasoningExecutor = Executors.newCachedThreadPool(daemonThreads("swarm-reasoning-"));
    }

    public void setProcessor(IMessageProcessor processor) {
        this.processor = processor;
    }

    public void setReasoningContextProvider(IReasoningContextProvider provider) {
        this.reasoningProvider = provider;
    }

    /**
     * Finds the agent that should handle a message.
     *
     * @param message the inbound message.
     * @return the agent and, in swarm mode, the matched niche; null if no agent serves it.
     */
    public RouteResult routeMessage(InboundMessage message) {
        return switch (store.getMode()) {
            case SINGLE -> {
                String agentId = store.getAgentId();
                yield agentId == null ? null : new RouteResult(agentId, null);
            }
            case SWARM -> routeToNiche(message);
        };
    }

    private RouteResult routeToNiche(InboundMessage message) {
        NicheDescriptor niche = nicheMatcher.apply(message);
        SwarmAgentEntry agent = store.getAgentForNiche(niche);
        if (agent == null) {
            store.incrementRouteFallback(niche.key());
            store.incrementUnservedNiche(niche.key());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("nicheKey", niche.key());
            data.put("channel", niche.channel());
            data.put("domain", niche.domain().id());
            data.put("unservedCount", store.getUnservedNicheCount(niche.key()));
            events.record("route_unserved", data);
            return null;
        }
        store.incrementRouteSuccess(niche.key());
        log.debug("Routed message from {} to agent {} ({})", message.chatId(), agent.agentId(), niche.key());
        return new RouteResult(agent.agentId(), niche);
    }

    /**
     * Appends a message to an agent's queue.
     *
     * @param agentId the agent.
     * @param message the message.
     * @param adapter adapter to reply through, may be null.
     */
    public void enqueueMessage(String agentId, InboundMessage message, IChannelAdapter adapter) {
        synchronized (queues) {
            queues.computeIfAbsent(agentId, id -> new ArrayDeque<>())
                    .addLast(new QueuedMessage(message, adapter));
        }
    }

    public void enqueueMessage(String agentId, InboundMessage message) {
        enqueueMessage(agentId, message, null);
    }

    /**
     * Runs one processing pass: at most one message per agent, all agents concurrently.
     * Drained queues are removed afterwards. Does nothing while no processor is set.
     *
     * @return the number of messages processed in this pass.
     */
    public int processQueues() {
        IMessageProcessor current = processor;
        if (current == null) {
            log.debug("No message processor set, skipping queue pass");
            return 0;
        }

        Map<String, QueuedMessage> batch = new LinkedHashMap<>();
        synchronized (queues) {
            for (Map.Entry<String, ArrayDeque<QueuedMessage>> entry : queues.entrySet()) {
                QueuedMessage next = entry.getValue().pollFirst();
                if (next != null) {
                    batch.put(entry.getKey(), next);
                }
            }
        }
        if (batch.isEmpty()) {
            removeDrainedQueues();
            return 0;
        }

        List<CompletableFuture<Void>> running = new ArrayList<>(batch.size());
        for (Map.Entry<String, QueuedMessage> entry : batch.entrySet()) {
            running.add(CompletableFuture.runAsync(
                    () -> processOne(current, entry.getKey(), entry.getValue()), workers));
        }
        CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();

        removeDrainedQueues();
        return batch.size();
    }

    private void removeDrainedQueues() {
        synchronized (queues) {
            Iterator<ArrayDeque<QueuedMessage>> it = queues.values().iterator();
            while (it.hasNext()) {
                if (it.next().isEmpty()) {
                    it.remove();
                }
            }
        }
    }

    private void processOne(IMessageProcessor current, String agentId, QueuedMessage queued) {
        InboundMessage message = queued.message();
        IReasoningContextProvider provider = reasoningProvider;
        String nicheKey = provider != null ? nicheKeyOf(agentId) : null;
        try {
            ReasoningContext context = provider != null
                    ? gatherContext(provider, agentId, nicheKey)
                    : ReasoningContext.EMPTY;
            String reply = current.process(agentId, message, queued.adapter(), context);
            if (provider != null) {
                logReasoningDetached(provider, agentId, nicheKey,
                        new ReasoningEntry(message.text(), reply == null ? "" : reply, message.channel()));
            }
        } catch (Exception e) {
            log.warn("Message processing failed for agent {}: {}", agentId, e.getMessage());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("agentId", agentId);
            data.put("channel", message.channel());
            data.put("chatId", message.chatId());
            data.put("error", String.valueOf(e.getMessage()));
            events.record("message_processing_failed", data);
        }
    }

    private ReasoningContext gatherContext(IReasoningContextProvider provider, String agentId, String nicheKey) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> provider.gatherContext(agentId, nicheKey), reasoningExecutor)
                    .completeOnTimeout(ReasoningContext.EMPTY, contextTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.debug("Reasoning context failed for {}", agentId, e);
                        return ReasoningContext.EMPTY;
                    })
                    .join();
        } catch (RejectedExecutionException e) {
            log.debug("Reasoning executor closed, processing {} without context", agentId);
            return ReasoningContext.EMPTY;
        }
    }

    private void logReasoningDetached(IReasoningContextProvider provider, String agentId, String nicheKey,
                                      ReasoningEntry entry) {
        try {
            reasoningExecutor.execute(() -> provider.logReasoning(agentId, nicheKey, entry));
        } catch (RejectedExecutionException e) {
            log.debug("Reasoning executor closed, dropping reasoning log for {}", agentId);
        }
    }

    private String nicheKeyOf(String agentId) {
        for (SwarmAgentEntry agent : store.getAgents()) {
            if (agent.agentId().equals(agentId)) {
                return agent.nicheKey();
            }
        }
        return null;
    }

    /**
     * @return pending messages per agent, for agents with a queue.
     */
    public Map<String, Integer> getQueueSizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        synchronized (queues) {
            queues.forEach((agentId, queue) -> sizes.put(agentId, queue.size()));
        }
        return sizes;
    }

    public long getUnservedNicheCount(String nicheKey) {
        return store.getUnservedNicheCount(nicheKey);
    }

    /**
     * Registers a live agent for a niche.
     *
     * @param agentId     the agent.
     * @param blueprintId blueprint it runs.
     * @param niche       the niche it serves.
     */
    public void createAgentForNiche(String agentId, String blueprintId, NicheDescriptor niche) {
        store.addAgent(new SwarmAgentEntry(agentId, blueprintId, niche.key(), null, Instant.now().toString()));
        log.info("Registered agent {} for niche {}", agentId, niche.key());
    }

    /**
     * Stops the worker and reasoning executors. Messages still queued stay unprocessed.
     */
    @Override
    public void close() {
        workers.shutdown();
        reasoningExecutor.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
            if (!reasoningExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                reasoningExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            reasoningExecutor.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record QueuedMessage(InboundMessage message, IChannelAdapter adapter) {
    }
}
