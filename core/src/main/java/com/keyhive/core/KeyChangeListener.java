package com.keyhive.core;

@FunctionalInterface
public interface KeyChangeListener {
    void onKeyChange(KeyChange change) throws Exception;
}
