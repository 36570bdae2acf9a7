package com.umitunal.pipeq.transform;

import java.io.IOException;

/**
 * Fetches the raw listing document that discovery parses.
 */
@FunctionalInterface
public interface ListingSource {

    String fetch(String url) throws IOException, InterruptedException;
}
