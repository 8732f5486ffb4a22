package com.tryonai.backend.config;

import com.tryonai.backend.config.properties.SessionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncConfig {

	public static final String SESSION_DISPATCH_EXECUTOR = "sessionDispatchExecutor";

	/**
	 * Bounded pool for session processing. When both the pool and its queue are full,
	 * submissions are rejected instead of piling up unbounded work.
	 */
	@Bean(name = SESSION_DISPATCH_EXECUTOR)
	public ThreadPoolTaskExecutor sessionDispatchExecutor(SessionProperties sessionProperties) {
		SessionProperties.Dispatcher dispatcher = sessionProperties.getDispatcher();
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(dispatcher.getCorePoolSize());
		executor.setMaxPoolSize(Math.max(dispatcher.getCorePoolSize(), dispatcher.getMaxPoolSize()));
		executor.setQueueCapacity(dispatcher.getQueueCapacity());
		executor.setThreadNamePrefix("session-dispatch-");
		executor.setWaitForTasksToCompleteOnShutdown(true);
		executor.setAwaitTerminationSeconds(30);
		executor.initialize();
		return executor;
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
