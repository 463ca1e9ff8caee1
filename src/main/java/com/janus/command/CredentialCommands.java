package com.janus.command;

import com.janus.auth.CredentialStatus;
import com.janus.auth.OAuthCredentialManager;
import com.janus.exception.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator commands managing stored provider credentials: {@code auth}, {@code status}, {@code logout}.
 */
@Slf4j
@Component
public class CredentialCommands {

    public static final int OK = 0;
    public static final int FAILED = 1;
    public static final int USAGE = 2;

    private static final Duration STATUS_TIMEOUT = Duration.ofSeconds(10);

    private final Map<String, OAuthCredentialManager> managers = new LinkedHashMap<>();

    public CredentialCommands(List<OAuthCredentialManager> managers) {
        for (OAuthCredentialManager manager : managers) {
            this.managers.put(manager.getProvider(), manager);
        }
    }

    /**
     * @param args command name followed by its arguments
     * @param out  where command results are printed
     * @return process exit code
     */
    public int execute(String[] args, PrintStream out) {
        if (args.length == 0) {
            return usage(out);
        }
        try {
            return switch (args[0]) {
                case "auth" -> args.length == 2 ? auth(args[1], out) : usage(out);
                case "logout" -> args.length == 2 ? logout(args[1], out) : usage(out);
                case "status" -> status(out);
                default -> usage(out);
            };
        } catch (GatewayException e) {
            log.error("{} failed: {}", args[0], e.getMessage());
            return FAILED;
        }
    }

    private int auth(String provider, PrintStream out) {
        OAuthCredentialManager manager = managers.get(provider);
        if (manager == null) {
            return unknownProvider(provider, out);
        }
        // waits for the operator to finish in the browser
        manager.login().block();
        out.println("Authenticated with " + provider);
        return OK;
    }

    private int logout(String provider, PrintStream out) {
        OAuthCredentialManager manager = managers.get(provider);
        if (manager == null) {
            return unknownProvider(provider, out);
        }
        manager.logout().block();
        out.println("Removed stored credential for " + provider);
        return OK;
    }

    private int status(PrintStream out) {
        for (OAuthCredentialManager manager : managers.values()) {
            CredentialStatus status = manager.status().block(STATUS_TIMEOUT);
            if (status == null || !status.isAuthenticated()) {
                out.printf("%-12s not authenticated%n", manager.getProvider());
            } else if (status.expiresAt() == null) {
                out.printf("%-12s %s%n", manager.getProvider(), status.state());
            } else {
                out.printf("%-12s %s (expires %s)%n", manager.getProvider(), status.state(), status.expiresAt());
            }
        }
        return OK;
    }

    private int unknownProvider(String provider, PrintStream out) {
        out.println("Unknown provider '" + provider + "'. Available: " + String.join(", ", managers.keySet()));
        return USAGE;
    }

    private int usage(PrintStream out) {
        out.println("Usage: janus [start | auth <provider> | status | logout <provider>]");
        out.println("Providers: " + String.join(", ", managers.keySet()));
        return USAGE;
    }
}
