package com.janus.auth;

import lombok.extern.slf4j.Slf4j;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

/**
 * Uses the desktop browser when one is available, otherwise asks the operator to open the URL.
 */
@Slf4j
public class DesktopBrowserLauncher implements BrowserLauncher {

    @Override
    public void open(String url) {
        log.info("Opening browser: {}", url);

        if (GraphicsEnvironment.isHeadless()
                || !Desktop.isDesktopSupported()
                || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            log.info("No desktop browser available, open the URL above manually");
            return;
        }

        try {
            Desktop.getDesktop().browse(URI.create(url));
        } catch (IOException e) {
            log.warn("Could not launch browser ({}), open the URL above manually", e.getMessage());
        }
    }
}
