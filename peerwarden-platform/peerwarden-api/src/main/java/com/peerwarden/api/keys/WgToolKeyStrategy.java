package com.peerwarden.api.keys;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;

/**
 * Key generation through the native {@code wg} tool.
 * 
 * The public key is always obtained by piping the private key into
 * {@code wg pubkey}; generating it independently would not match.
 */
public class WgToolKeyStrategy implements KeyGenerationStrategy {

    private final WgToolLocator locator;
    private final Duration invocationTimeout;

    public WgToolKeyStrategy(WgToolLocator locator, Duration invocationTimeout) {
        this.locator = locator;
        this.invocationTimeout = invocationTimeout;
    }

    @Override
    public String name() {
        return "wg-tool";
    }

    @Override
    public boolean isAvailable() {
        return locator.locate().isPresent();
    }

    @Override
    public GeneratedKeys generate(boolean includePresharedKey) {
        String wg = executable();
        String privateKey = invoke(wg, "genkey", null);
        String publicKey = invoke(wg, "pubkey", privateKey + "\n");
        String presharedKey = includePresharedKey ? invoke(wg, "genpsk", null) : null;
        return new GeneratedKeys(privateKey, publicKey, presharedKey);
    }

    @Override
    public String generatePresharedKey() {
        return invoke(executable(), "genpsk", null);
    }

    private String executable() {
        return locator.locate()
                .orElseThrow(() -> new IllegalStateException("WireGuard tools not available"));
    }

    private String invoke(String wg, String subcommand, String stdin) {
        try {
            ToolProcess.Result result = ToolProcess.run(List.of(wg, subcommand), stdin, invocationTimeout);
            if (!result.succeeded()) {
                throw new IllegalStateException(
                        "wg " + subcommand + " exited with " + result.exitCode() + ": " + result.stderr());
            }
            return result.stdout();
        } catch (IOException e) {
            throw new UncheckedIOException("wg " + subcommand + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running wg " + subcommand, e);
        }
    }
}
