package com.daquv.agentstream.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final ThreadPoolTaskExecutor streamWriterTaskExecutor;
    private final StreamProperties streamProperties;

    public WebMvcConfig(@Qualifier("streamWriterTaskExecutor") ThreadPoolTaskExecutor streamWriterTaskExecutor,
                        StreamProperties streamProperties) {
        this.streamWriterTaskExecutor = streamWriterTaskExecutor;
        this.streamProperties = streamProperties;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(streamWriterTaskExecutor);
        configurer.setDefaultTimeout(streamProperties.getAsyncTimeout().toMillis());
    }
}
