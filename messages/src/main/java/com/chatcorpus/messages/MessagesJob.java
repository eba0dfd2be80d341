package com.chatcorpus.messages;

import com.chatcorpus.ChatCorpusJobBase;
import com.chatcorpus.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for the message export pipeline.
 *
 * <p>Usage:
 * <pre>
 *   java -jar chatcorpus-messages.jar [config-path]
 * </pre>
 *
 * <p>If no config path is supplied, the default classpath resource
 * {@code pipeline-config.yaml} is used.</p>
 */
@Slf4j
public class MessagesJob extends ChatCorpusJobBase {

    private static final String DEFAULT_CONFIG = "pipeline-config.yaml";

    @Override
    protected String getDefaultConfigResource() {
        return DEFAULT_CONFIG;
    }

    @Override
    protected String getJobName(PipelineConfig config) {
        return "Messages Pipeline [" + config.getMode() + "]";
    }

    public static void main(String[] args) {
        System.exit(new MessagesJob().run(args));
    }
}
