package com.chatcorpus.enrichment;

/**
 * Blocking pause used for rate limiting; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
