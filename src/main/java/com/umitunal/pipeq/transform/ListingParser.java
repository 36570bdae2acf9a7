package com.umitunal.pipeq.transform;

import com.umitunal.pipeq.model.Subject;

import java.util.List;

/**
 * Extracts subjects from a listing document.
 *
 * Must be pure and tolerant: malformed or partial input yields fewer subjects or null
 * fields, never an exception.
 */
@FunctionalInterface
public interface ListingParser {

    List<Subject> parse(String rawListing, String baseUrl);
}
