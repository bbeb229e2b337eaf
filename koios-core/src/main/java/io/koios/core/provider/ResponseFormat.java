package io.koios.core.provider;

public enum ResponseFormat {
    TEXT,
    JSON
}
