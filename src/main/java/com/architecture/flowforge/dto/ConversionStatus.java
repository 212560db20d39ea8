package com.architecture.flowforge.dto;

public enum ConversionStatus {
    SUCCESS,
    FAILED
}
