package com.localmedia.playback;

/**
 * Keeps the host's background playback session (service, notification) alive. Called whenever playback
 * starts; must be idempotent. Failures are logged by the caller and otherwise ignored: controls keep
 * working without the external surface.
 */
@FunctionalInterface
public interface SessionLifecycleHook {

    SessionLifecycleHook NONE = () -> { };

    void ensureActive() throws Exception;
}
