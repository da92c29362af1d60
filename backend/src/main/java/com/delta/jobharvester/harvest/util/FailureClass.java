package com.delta.jobharvester.harvest.util;

public enum FailureClass {
  TRANSIENT_NETWORK,
  RATE_LIMITED,
  CLIENT_ERROR,
  PARSE_ERROR;

  public boolean isRetriable() {
    return this == TRANSIENT_NETWORK || this == RATE_LIMITED;
  }
}
