package com.delta.jobharvester.harvest.dedup;

import java.util.Optional;

public interface MarketResolver {
    Optional<String> resolve(String locationText);
}
