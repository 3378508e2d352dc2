package com.ciro.gatemux.bridge;

import java.time.Duration;
import java.util.List;

public record BridgeSettings(Duration keepAlive,
                             int maxPending,
                             Duration createTimeout,
                             TerminalPolicy terminalPolicy,
                             List<String> defaultCommand) {

    public BridgeSettings {
        if (keepAlive == null || keepAlive.isZero() || keepAlive.isNegative()) {
            throw new IllegalArgumentException("keepAlive must be > 0");
        }
        if (maxPending < 1) throw new IllegalArgumentException("maxPending must be >= 1");
        if (terminalPolicy == null) terminalPolicy = TerminalPolicy.KEEP;
        defaultCommand = (defaultCommand == null || defaultCommand.isEmpty())
                ? List.of("/bin/zsh")
                : List.copyOf(defaultCommand);
    }

    public static BridgeSettings defaults() {
        return new BridgeSettings(Duration.ofSeconds(15), 256, Duration.ofSeconds(30),
                TerminalPolicy.KEEP, List.of("/bin/zsh"));
    }

    public BridgeSettings withKeepAlive(Duration v) {
        return new BridgeSettings(v, maxPending, createTimeout, terminalPolicy, defaultCommand);
    }

    public BridgeSettings withMaxPending(int v) {
        return new BridgeSettings(keepAlive, v, createTimeout, terminalPolicy, defaultCommand);
    }

    public BridgeSettings withCreateTimeout(Duration v) {
        return new BridgeSettings(keepAlive, maxPending, v, terminalPolicy, defaultCommand);
    }

    public BridgeSettings withTerminalPolicy(TerminalPolicy v) {
        return new BridgeSettings(keepAlive, maxPending, createTimeout, v, defaultCommand);
    }

    public BridgeSettings withDefaultCommand(List<String> v) {
        return new BridgeSettings(keepAlive, maxPending, createTimeout, terminalPolicy, v);
    }
}
