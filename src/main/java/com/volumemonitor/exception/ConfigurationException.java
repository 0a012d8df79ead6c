package com.volumemonitor.exception;

import java.util.List;
import java.util.Map;

public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, List<String> violations) {
        super(ErrorCode.CONFIGURATION_ERROR, message, Map.of("violations", violations));
    }
}
