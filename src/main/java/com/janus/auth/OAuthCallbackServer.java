package com.janus.auth;

import com.janus.exception.AuthenticationException;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.List;
import java.util.Map;

/**
 * Short-lived loopback listener receiving exactly one OAuth redirect.
 */
@Slf4j
public class OAuthCallbackServer {

    private static final String SUCCESS_PAGE =
            "<h1>Authentication Successful!</h1><p>You can close this window now.</p>";

    private final String provider;
    private final Sinks.One<Callback> callback = Sinks.one();
    private DisposableServer server;

    /**
     * Parameters delivered on the redirect URI.
     */
    public record Callback(String code, String state, String error) {
    }

    private OAuthCallbackServer(String provider) {
        this.provider = provider;
    }

    /**
     * Bind the listener on {@code localhost:port}; the returned Mono fails if the port is taken.
     */
    public static Mono<OAuthCallbackServer> start(String provider, int port, String path) {
        return Mono.fromCallable(() -> {
            OAuthCallbackServer callbackServer = new OAuthCallbackServer(provider);
            callbackServer.bind(port, path);
            return callbackServer;
        });
    }

    private void bind(int port, String path) {
        try {
            server = HttpServer.create()
                    .host("localhost")
                    .port(port)
                    .route(routes -> routes.get(path, this::handle))
                    .bindNow();
        } catch (RuntimeException e) {
            throw new AuthenticationException(provider, AuthenticationException.Reason.AUTHORIZATION_FAILED,
                    "Port " + port + " is already in use. Please kill the hanging process or wait a moment.", e);
        }
        log.debug("Local OAuth server started on http://localhost:{}{}", port, path);
    }

    private Publisher<Void> handle(HttpServerRequest request, HttpServerResponse response) {
        Map<String, List<String>> params = new QueryStringDecoder(request.uri()).parameters();
        Callback received = new Callback(first(params, "code"), first(params, "state"), first(params, "error"));

        if (callback.tryEmitValue(received).isFailure()) {
            return page(response, HttpResponseStatus.CONFLICT,
                    "<h1>Authentication Already Completed</h1><p>This login attempt has already been handled.</p>");
        }
        if (received.error() != null) {
            return page(response, HttpResponseStatus.BAD_REQUEST,
                    "<h1>Authentication Failed</h1><p>Error: " + HtmlUtils.htmlEscape(received.error()) + "</p>");
        }
        if (received.code() == null) {
            return page(response, HttpResponseStatus.BAD_REQUEST,
                    "<h1>Authentication Failed</h1><p>No authorization code received.</p>");
        }
        return page(response, HttpResponseStatus.OK, SUCCESS_PAGE);
    }

    private static Publisher<Void> page(HttpServerResponse response,
                                           HttpResponseStatus status, String html) {
        return response.status(status)
                .header("Content-Type", "text/html; charset=utf-8")
                .sendString(Mono.just(html));
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    /**
     * Completes with the first callback; no timeout since an operator drives the browser.
     */
    public Mono<Callback> awaitCallback() {
        // leave the listener's event loop before the token exchange and file I/O
        return callback.asMono().publishOn(Schedulers.boundedElastic());
    }

    public Mono<Void> stop() {
        return Mono.defer(() -> {
            if (server == null || server.isDisposed()) {
                return Mono.empty();
            }
            server.dispose();
            return server.onDispose().doOnSuccess(v -> log.debug("Local OAuth server stopped"));
        });
    }
}
