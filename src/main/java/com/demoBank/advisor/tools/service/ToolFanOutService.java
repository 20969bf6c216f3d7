package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.config.ToolGatewaySettings;
import com.demoBank.advisor.tools.exception.ToolInvocationException;
import com.demoBank.advisor.tools.model.FanOutResult;
import com.demoBank.advisor.tools.model.ToolError;
import com.demoBank.advisor.tools.model.ToolName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs the tools of one bundle in parallel.
 *
 * Responsibilities:
 * - Bound the pool to min(maxWorkers, bundle size) and the whole fan-out to one timeout
 * - Let each worker return its own outcome and merge all outcomes in a single join
 * - Isolate failures: a failed or late tool becomes an error entry, the others still contribute output
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolFanOutService {

    private final ToolGatewaySettings settings;
    private final ToolGatewayClient gatewayClient;
    private final ToolNameResolver nameResolver;
    private final LocalToolMocks localToolMocks;

    private record ToolOutcome(ToolName tool, JsonNode output, ToolError error) {}

    /**
     * Calls every tool in the argument map.
     *
     * @param arguments per-tool arguments; iteration order is the bundle order
     * @param authToken caller token forwarded to the gateway
     * @param traceId   trace id for logging
     * @return merged outputs and errors; every requested tool appears in exactly one of them
     */
    public FanOutResult execute(Map<ToolName, ObjectNode> arguments, String authToken, String traceId) {
        if (arguments == null || arguments.isEmpty()) {
            return FanOutResult.empty();
        }

        List<ToolName> tools = new ArrayList<>(arguments.keySet());
        List<Callable<ToolOutcome>> tasks = new ArrayList<>();
        for (ToolName tool : tools) {
            ObjectNode args = arguments.get(tool);
            tasks.add(() -> invoke(tool, args, authToken, traceId));
        }

        int poolSize = Math.min(settings.maxWorkers(), tools.size());
        log.info("Tool fan-out started - traceId: {}, tools: {}, poolSize: {}", traceId, tools, poolSize);
        long startedAt = System.currentTimeMillis();

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        List<Future<ToolOutcome>> futures;
        try {
            futures = executor.invokeAll(tasks, settings.fanOutTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures = List.of();
        } finally {
            executor.shutdownNow();
        }

        // Join: one outcome per tool, in bundle order
        Map<ToolName, JsonNode> outputs = new EnumMap<>(ToolName.class);
        Map<ToolName, ToolError> errors = new EnumMap<>(ToolName.class);
        for (int i = 0; i < tools.size(); i++) {
            ToolName tool = tools.get(i);
            ToolOutcome outcome = i < futures.size() ? await(tool, futures.get(i)) : timedOut(tool);
            if (outcome.error() != null) {
                errors.put(tool, outcome.error());
            } else {
                outputs.put(tool, outcome.output());
            }
        }

        log.info("Tool fan-out completed - traceId: {}, outputs: {}, errors: {}, elapsedMs: {}",
                traceId, outputs.keySet(), errors.keySet(), System.currentTimeMillis() - startedAt);
        return new FanOutResult(outputs, errors);
    }

    /**
     * Calls a single tool on the caller thread. Used for the suitability guard, which runs alone.
     */
    public FanOutResult executeSingle(ToolName tool, ObjectNode arguments, String authToken, String traceId) {
        ToolOutcome outcome = invoke(tool, arguments, authToken, traceId);
        if (outcome.error() != null) {
            return new FanOutResult(Map.of(), Map.of(tool, outcome.error()));
        }
        return new FanOutResult(Map.of(tool, outcome.output()), Map.of());
    }

    private ToolOutcome invoke(ToolName tool, ObjectNode arguments, String authToken, String traceId) {
        try {
            JsonNode output;
            if (settings.localMocksActive()) {
                output = localToolMocks.output(tool.code(), arguments);
            } else {
                String resolvedName = nameResolver.resolve(tool.code(), authToken, traceId);
                output = gatewayClient.callTool(resolvedName, arguments, authToken, traceId);
            }
            log.debug("Tool call succeeded - traceId: {}, tool: {}", traceId, tool);
            return new ToolOutcome(tool, output, null);
        } catch (ToolInvocationException e) {
            log.warn("Tool call failed - traceId: {}, tool: {}, kind: {}, error: {}",
                    traceId, tool, e.getErrorKind(), e.getMessage());
            return new ToolOutcome(tool, null, new ToolError(e.getErrorKind(), e.getMessage()));
        }
    }

    private ToolOutcome await(ToolName tool, Future<ToolOutcome> future) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return timedOut(tool);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return timedOut(tool);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Unexpected tool worker failure - tool: {}", tool, cause);
            return new ToolOutcome(tool, null,
                    new ToolError("internal_error", cause.getClass().getSimpleName() + ": " + cause.getMessage()));
        }
    }

    private ToolOutcome timedOut(ToolName tool) {
        log.warn("Tool call timed out - tool: {}, fanOutTimeout: {}", tool, settings.fanOutTimeout());
        return new ToolOutcome(tool, null,
                new ToolError(ToolError.TIMEOUT, "Not finished within " + settings.fanOutTimeout().toMillis() + "ms"));
    }
}
