package com.daquv.agentstream.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 워크플로우 실행/노드 실행 스레드 풀 설정
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({WorkflowProperties.class, StreamProperties.class})
public class ExecutorConfig {

    /**
     * 실행 1회(브리지 생산자)를 돌리는 풀
     */
    @Bean
    public ThreadPoolTaskExecutor workflowTaskExecutor(StreamProperties streamProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(streamProperties.getRunPoolSize());
        executor.setMaxPoolSize(streamProperties.getRunPoolSize());
        executor.setQueueCapacity(streamProperties.getRunQueueCapacity());
        executor.setThreadNamePrefix("workflow-run-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /**
     * 노드 본문을 실행하는 풀. 타임아웃/취소 시 인터럽트된다.
     */
    @Bean
    public ThreadPoolTaskExecutor nodeTaskExecutor(WorkflowProperties workflowProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workflowProperties.getNodePoolSize());
        executor.setMaxPoolSize(workflowProperties.getNodePoolSize());
        executor.setQueueCapacity(workflowProperties.getNodeQueueCapacity());
        executor.setThreadNamePrefix("workflow-node-");
        return executor;
    }

    /**
     * SSE 응답 본문(StreamingResponseBody)을 쓰는 풀
     */
    @Bean
    public ThreadPoolTaskExecutor streamWriterTaskExecutor(StreamProperties streamProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(streamProperties.getRunPoolSize());
        executor.setMaxPoolSize(streamProperties.getRunPoolSize());
        executor.setQueueCapacity(streamProperties.getRunQueueCapacity());
        executor.setThreadNamePrefix("stream-writer-");
        return executor;
    }

    /**
     * RunRegistry 만료 점검용 스케줄러
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("run-sweeper-");
        return scheduler;
    }
}
