package com.comparo.core.config;

import com.comparo.core.approval.ToolCallFormatter;
import com.comparo.core.pipeline.ApprovalGatedToolCallback;
import com.comparo.core.pipeline.ChatClientInvocationPipeline;
import com.comparo.core.pipeline.InvocationPipeline;
import com.comparo.core.selection.TargetCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the shared invocation pipeline and the executors comparisons run on.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public InvocationPipeline invocationPipeline(ChatClient.Builder chatClientBuilder,
                                                 TargetCatalog catalog,
                                                 ObjectProvider<ToolCallbackProvider> toolProviders,
                                                 ToolCallFormatter formatter) {
        List<ApprovalGatedToolCallback> tools = toolProviders.orderedStream()
                .flatMap(provider -> Arrays.stream(provider.getToolCallbacks()))
                .map(tool -> new ApprovalGatedToolCallback(tool, formatter))
                .toList();
        log.info("Invocation pipeline configured with {} gated tool(s)", tools.size());
        return new ChatClientInvocationPipeline(chatClientBuilder.build(), catalog, tools);
    }

    @Bean(name = "targetExecutor", destroyMethod = "shutdownNow")
    public ExecutorService targetExecutor(ComparoProperties properties) {
        int maxParallel = Math.max(1, properties.getDispatch().getMaxParallel());
        log.info("Target executor sized for {} parallel invocation(s)", maxParallel);
        return Executors.newFixedThreadPool(maxParallel, namedDaemonThreads("comparo-target-"));
    }

    @Bean(name = "comparisonTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService comparisonTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("comparo-timeout-"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
