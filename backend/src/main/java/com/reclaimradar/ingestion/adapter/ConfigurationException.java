package com.reclaimradar.ingestion.adapter;

/**
 * Provider credentials missing or invalid. Fatal for a sync run; never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
