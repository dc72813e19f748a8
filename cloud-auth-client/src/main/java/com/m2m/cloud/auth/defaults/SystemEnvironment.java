package com.m2m.cloud.auth.defaults;

public final class SystemEnvironment implements Environment {

    @Override
    public String getenv(String name) {
        return System.getenv(name);
    }

    @Override
    public String getProperty(String name) {
        return System.getProperty(name);
    }
}
