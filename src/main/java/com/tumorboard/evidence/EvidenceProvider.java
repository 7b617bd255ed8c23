package com.tumorboard.evidence;

import com.tumorboard.models.Evidence;
import java.io.IOException;

/**
 * Source of variant-level clinical evidence.
 */
public interface EvidenceProvider extends AutoCloseable {

    /**
     * Fetch and normalize all evidence known for a gene/variant pair.
     * An empty bundle is a valid answer, not an error.
     *
     * @throws IOException if the service is unreachable or answers with a non-2xx status
     */
    Evidence fetchEvidence(String gene, String variant) throws IOException, InterruptedException;

    /**
     * Release network resources. Implementations without any keep the default.
     */
    @Override
    default void close() {
    }
}
