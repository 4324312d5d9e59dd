package dev.treebleshooter;

import dev.treebleshooter.cli.TreebleshooterCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = TreebleshooterCli.commandLine().execute(args);
        System.exit(exitCode);
    }
}
