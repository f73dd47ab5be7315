package com.chatflow.realtime.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Enables Spring's @Async support for presence fan-out.
 *
 * A user going online or offline is announced to every chat the user belongs to.
 * That can be hundreds of rooms, so the announcement runs on this executor and the
 * STOMP inbound thread that handled the connect/disconnect is released immediately.
 *
 * The pool has exactly one thread: announcements for the same user must leave in the
 * order the transitions happened, otherwise a quick reconnect could be observed as
 * online → offline.
 */
@EnableAsync
@Configuration
public class AsyncConfig {

    @Bean(name = "presenceExecutor")
    public Executor presenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("presence-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
