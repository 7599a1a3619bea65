package com.reqflow.core.engine;

public enum CancelResult {
    OK,
    NOT_FOUND
}
