package com.mergeql.cli;

import com.mergeql.cli.command.IntrospectCommand;
import com.mergeql.cli.command.MergeCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "mergeql",
        description = "Merge duplicate entity rows of a relational store into one survivor",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                IntrospectCommand.class,
                MergeCommand.class
        }
)
public class MergeCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * Command line whose failures print a one line error and exit with 1.
     */
    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new MergeCli());
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            cmd.getErr().println("Error: " + e.getMessage());
            return 1;
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
