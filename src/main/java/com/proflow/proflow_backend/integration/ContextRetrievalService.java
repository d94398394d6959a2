package com.proflow.proflow_backend.integration;

public interface ContextRetrievalService {

    /** Never fails; an unavailable retrieval backend yields {@link RetrievedContext#empty()}. */
    RetrievedContext contextFor(String query, String userId);
}
