package org.retrier.spring.config.model;

public enum BackoffType {

    FIXED, EXPONENTIAL
}
