package com.dockyard.dispatch.cli;

import com.dockyard.core.security.JwtTokenService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: dockyard token
 * <p>
 * Prints an admin bearer token for the queue API. Only the token is written
 * to stdout so it can be captured by scripts.
 */
@Command(name = "token", mixinStandardHelpOptions = true, description = "Mint an admin API token")
@Component
public class TokenCommand implements Runnable {

    @Option(names = {"--subject"}, description = "Token subject", defaultValue = "admin")
    private String subject;

    @Option(names = {"--ttl"}, description = "Lifetime in seconds (default: configured expiry)")
    private Integer ttlSeconds;

    private final JwtTokenService tokenService;

    public TokenCommand(JwtTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public void run() {
        String token = ttlSeconds != null
                ? tokenService.generateAdminToken(subject, ttlSeconds)
                : tokenService.generateAdminToken(subject);
        System.out.println(token);
    }
}
