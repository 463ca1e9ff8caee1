package com.janus;

import com.janus.command.CredentialCommands;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Main application class for Janus - local gateway serving the Anthropic Messages API from
 * OAuth-authenticated providers.
 */
@SpringBootApplication
public class JanusApplication {

    public static void main(String[] args) {
        if (args.length > 0 && !args[0].startsWith("--") && !"start".equals(args[0])) {
            System.exit(runCommand(args));
        }

        // "start" is the default and may be omitted
        String[] serverArgs = args.length > 0 && "start".equals(args[0])
                ? Arrays.copyOfRange(args, 1, args.length)
                : args;
        SpringApplication.run(JanusApplication.class, serverArgs);
    }

    private static int runCommand(String[] args) {
        SpringApplication application = new SpringApplication(JanusApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        try (ConfigurableApplicationContext context = application.run()) {
            return context.getBean(CredentialCommands.class).execute(args, System.out);
        }
    }
}
