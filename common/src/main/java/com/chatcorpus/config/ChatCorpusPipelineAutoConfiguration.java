package com.chatcorpus.config;

import com.chatcorpus.checkpoint.CheckpointManager;
import com.chatcorpus.incremental.DeltaDetector;
import com.chatcorpus.incremental.IncrementalStateStore;
import com.chatcorpus.pipeline.PipelineOrchestrator;
import com.chatcorpus.reconcile.ContentReconciler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires the pipeline beans.
 *
 * <p>Discovered via component-scanning from an application that scans
 * {@code com.chatcorpus.*}.  The stateless building blocks are singletons; the
 * enrichment orchestrator is created per run by {@link PipelineOrchestrator} because it
 * owns the enrichers and the rate limiter for that run.</p>
 */
@Configuration
@EnableConfigurationProperties(PipelineConfig.class)
public class ChatCorpusPipelineAutoConfiguration {

    @Bean
    public ContentReconciler contentReconciler() {
        return new ContentReconciler();
    }

    @Bean
    public DeltaDetector deltaDetector() {
        return new DeltaDetector();
    }

    @Bean
    public CheckpointManager checkpointManager() {
        return new CheckpointManager();
    }

    @Bean
    public IncrementalStateStore incrementalStateStore() {
        return new IncrementalStateStore();
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineConfig config) {
        return new PipelineOrchestrator(config);
    }
}
