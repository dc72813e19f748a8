package com.m2m.cloud.auth.defaults;

/**
 * Process environment as seen by default credential discovery.
 */
public interface Environment {

    String getenv(String name);

    String getProperty(String name);
}
