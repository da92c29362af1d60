package com.delta.jobharvester.harvest.scrape;

import com.delta.jobharvester.harvest.model.ProviderStatus;
import com.delta.jobharvester.harvest.model.SearchParams;
import com.delta.jobharvester.harvest.model.TaskKind;

public interface ScrapingProviderClient {

    /**
     * Starts an asynchronous scrape and returns the provider's request id. Never retried.
     */
    String submit(TaskKind kind, SearchParams params, String webhookUrl);

    ProviderStatus fetchStatus(String requestId);
}
