package io.stagerelay;

import io.stagerelay.cli.StageRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new StageRelayCommand()).execute(args);
        System.exit(code);
    }
}
