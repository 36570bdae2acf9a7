package com.umitunal.pipeq.transform;

import com.umitunal.pipeq.model.Subject;

import java.util.Optional;

/**
 * Produces the enriched text for a subject, typically by calling a text-generation service.
 * An empty result means the subject could not be enriched this time; the caller retries it.
 */
@FunctionalInterface
public interface EnrichmentTransform {

    Optional<String> enrich(String subjectUrl, Subject context) throws Exception;
}
