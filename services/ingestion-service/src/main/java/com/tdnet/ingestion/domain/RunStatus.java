package com.tdnet.ingestion.domain;

public enum RunStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    PARTIAL_SUCCESS,
    FAILED
}
