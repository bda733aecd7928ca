package com.tourbooking.common.exception;

import lombok.Getter;

/**
 * A downstream dependency could not be reached. The caller may retry the
 * same operation later. Mapped to HTTP 503.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {

    private final String dependency;

    public ServiceUnavailableException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public ServiceUnavailableException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }
}
