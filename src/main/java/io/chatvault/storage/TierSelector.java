package io.chatvault.storage;

import io.chatvault.config.EnvironmentOverrides;
import io.chatvault.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;

/**
 * Chooses the tier of a database that does not exist yet. Consulted only on first run.
 */
@FunctionalInterface
public interface TierSelector {

    Tier select();

    static TierSelector fixed(Tier tier) {
        return () -> tier;
    }

    /**
     * Explicit choice first, then {@code CHATVAULT_DB_MODE}, then the fallback selector.
     */
    static TierSelector resolve(Optional<Tier> explicit, EnvironmentOverrides env, TierSelector fallback) {
        return () -> explicit.or(env::tier).orElseGet(fallback::select);
    }

    /** Numbered menu on a terminal; empty input, EOF or anything unrecognised means open. */
    static TierSelector interactive(BufferedReader in, PrintStream out) {
        Logger log = LoggerFactory.getLogger(TierSelector.class);
        return () -> {
            out.println("Select database mode for the new database:");
            out.println("  1) open    plain SQLite file");
            out.println("  2) secure  encrypted file");
            out.println("  3) strict  encrypted file and encrypted message content");
            out.print("Choice [1]: ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new RuntimeException("Failed to read database mode choice", e);
            }
            Tier chosen = parseChoice(line);
            log.info("Selected database mode {}", chosen);
            return chosen;
        };
    }

    static Tier parseChoice(String line) {
        if (line == null) {
            return Tier.OPEN;
        }
        String trimmed = line.trim();
        switch (trimmed) {
            case "2":
                return Tier.SECURE;
            case "3":
                return Tier.STRICT;
            default:
                return Tier.parse(trimmed).orElse(Tier.OPEN);
        }
    }
}
