package com.delta.jobharvester.harvest.classify;

import com.delta.jobharvester.harvest.model.ClassificationItem;
import com.delta.jobharvester.harvest.model.ClassificationResult;

public interface ClassificationClient {
    /**
     * One external call for one item.
     *
     * @throws com.delta.jobharvester.harvest.http.ExternalServiceException classified by failure class
     */
    ClassificationResult classify(ClassificationItem item);
}
