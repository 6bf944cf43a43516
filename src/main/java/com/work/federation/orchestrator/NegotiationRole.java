package com.work.federation.orchestrator;

public enum NegotiationRole {
    CONSUMER,
    PROVIDER
}
