package io.chatvault;

import io.chatvault.cli.ChatVaultCommand;
import io.chatvault.config.ChatVaultConfig;
import io.chatvault.config.EnvironmentOverrides;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        // Must be set before the first logger is created.
        if (System.getProperty("chatvault.log.dir") == null) {
            String root = ChatVaultCommand.rootArgument(args)
                    .orElseGet(() -> System.getenv(EnvironmentOverrides.DATA_DIR));
            ChatVaultConfig config = ChatVaultConfig.fromRoot(root);
            System.setProperty("chatvault.log.dir", config.logsDir().toString());
        }
        int code = ChatVaultCommand.commandLine(new ChatVaultCommand()).execute(args);
        System.exit(code);
    }
}
