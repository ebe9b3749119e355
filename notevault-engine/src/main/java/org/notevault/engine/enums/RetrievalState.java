package org.notevault.engine.enums;

public enum RetrievalState {
    REQUESTED,
    RESOLVED, // catalog entry resolved to a fingerprint
    FETCHED, // original bytes read and verified
    RENDERED,
    LOGGED, // ledger entry durable
    DELIVERED,
    FAILED
}
