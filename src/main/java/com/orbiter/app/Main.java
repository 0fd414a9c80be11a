package com.orbiter.app;

import com.orbiter.app.cli.Cli;

public final class Main {

    private Main() {}

    public static void main(String[] args) {
        Cli.run(args);
    }
}
