package im.arun.docoutline.cli;

import im.arun.docoutline.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Command-line entry point. {@code outline} writes one outline per PDF, {@code collection}
 * ranks sections of a document collection against a persona and task.
 */
@Command(
    name = "docoutline",
    description = "Infer heading outlines from PDF documents and select relevant sections",
    mixinStandardHelpOptions = true,
    version = "DocOutline 1.0",
    subcommands = {OutlineCommand.class, CollectionCommand.class}
)
public class DocOutlineCLI implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.err);
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLine(new DocOutlineCLI()).execute(args);
        } finally {
            ExecutorProvider.shutdown();
        }
        System.exit(exitCode);
    }
}
