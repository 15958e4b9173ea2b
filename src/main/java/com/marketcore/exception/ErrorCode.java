package com.marketcore.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    TYPE_MISMATCH("TYPE_MISMATCH"),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION");

    private final String code;
}
