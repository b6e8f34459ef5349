package com.alertrelay.pipeline.store;

public enum ServerValue {
    // Epoch millis of the store clock at write time.
    TIMESTAMP
}
