package org.adseller.server.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Thrown at startup when seller configuration cannot be used to build the evaluation engines.
 */
@Getter
public class InvalidConfigurationException extends RuntimeException {

    private final List<String> messages;

    public InvalidConfigurationException(String message) {
        super(message);
        this.messages = Collections.singletonList(message);
    }

    public InvalidConfigurationException(List<String> messages) {
        super(String.join("\n", messages));
        this.messages = messages;
    }
}
