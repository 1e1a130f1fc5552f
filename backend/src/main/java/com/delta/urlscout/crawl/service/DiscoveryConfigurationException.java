package com.delta.urlscout.crawl.service;

/**
 * Unrecoverable misconfiguration of a discovery run, such as an invalid base URL. Aborts the run.
 */
public class DiscoveryConfigurationException extends RuntimeException {
    public DiscoveryConfigurationException(String message) {
        super(message);
    }
}
