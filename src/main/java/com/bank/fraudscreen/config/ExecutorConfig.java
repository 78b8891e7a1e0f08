package com.bank.fraudscreen.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService sinkExecutor(WorkflowConfig workflowConfig) {
        return Executors.newFixedThreadPool(workflowConfig.getSinkPoolSize(), namedThreads("workflow-sink-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService remoteCallExecutor(WorkflowConfig workflowConfig) {
        return Executors.newFixedThreadPool(workflowConfig.getRemoteCallPoolSize(), namedThreads("remote-call-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
