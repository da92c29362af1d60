package com.delta.jobharvester.harvest.model;

public sealed interface PollOutcome permits PollOutcome.NotReady, PollOutcome.Ready, PollOutcome.Failed {

    static PollOutcome notReady() {
        return new NotReady();
    }

    record NotReady() implements PollOutcome {
    }

    record Ready(ResultBundle bundle) implements PollOutcome {
    }

    record Failed(String errorMessage) implements PollOutcome {
    }
}
