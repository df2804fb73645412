package com.tomopipe.runtime;

public enum StorageBackend {
    LOCAL,
    PIPE_STORAGE
}
