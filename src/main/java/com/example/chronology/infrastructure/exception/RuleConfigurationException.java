package com.example.chronology.infrastructure.exception;

/**
 * Raised at startup when the rule file is missing, malformed or refers to unknown event labels.
 * There is no recovery: the application refuses to start.
 */
public class RuleConfigurationException extends InfrastructureException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
