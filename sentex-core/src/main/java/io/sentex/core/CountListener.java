package io.sentex.core;

@FunctionalInterface
public interface CountListener {

    void onEvent(int count);
}
