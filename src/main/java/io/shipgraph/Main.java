package io.shipgraph;

import io.shipgraph.cli.ShipGraphCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ShipGraphCommand()).execute(args);
        System.exit(code);
    }
}
