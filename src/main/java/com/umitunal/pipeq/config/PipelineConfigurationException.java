package com.umitunal.pipeq.config;

/**
 * Structural configuration problem: a required binding is missing or a setting is invalid.
 * Aborts a stage invocation before any job is touched.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
