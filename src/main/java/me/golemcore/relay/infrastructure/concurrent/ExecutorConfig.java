package me.golemcore.relay.infrastructure.concurrent;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools shared by the turn pipeline.
 *
 * <ul>
 * <li>{@code turnExecutor} - runs one orchestrator per active turn</li>
 * <li>{@code toolExecutor} - MCP handshakes started from tool calls</li>
 * <li>{@code turnTimeoutScheduler} - wall-clock turn deadlines</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final RelayProperties properties;

    @Bean(name = "turnExecutor", destroyMethod = "shutdownNow")
    public ExecutorService turnExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, properties.getTurn().getWorkerThreads()),
                daemonThreads("relay-turn"));
    }

    @Bean(name = "toolExecutor", destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, properties.getTurn().getToolThreads()),
                daemonThreads("relay-tool"));
    }

    @Bean(name = "turnTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService turnTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("relay-turn-timeout"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
