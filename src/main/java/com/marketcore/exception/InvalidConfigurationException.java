package com.marketcore.exception;

import java.util.Map;

public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_CONFIGURATION, message, details);
    }

    public InvalidConfigurationException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.INVALID_CONFIGURATION, message, details, cause);
    }
}
