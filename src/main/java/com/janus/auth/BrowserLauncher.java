package com.janus.auth;

/**
 * Opens the authorization page for the operator.
 */
@FunctionalInterface
public interface BrowserLauncher {

    void open(String url);
}
