package com.agentdeck.dispatch.cli;

import com.agentdeck.core.permission.AllowListStore;
import com.agentdeck.core.permission.InvalidPermissionPatternException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: agentdeck allow "&lt;pattern&gt;" | --list
 * <p>
 * Adds a pattern to the project's durable allow-list, or prints the list.
 */
@Command(name = "allow", mixinStandardHelpOptions = true, description = "Manage the project's allow-list")
@Component
public class AllowCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Pattern to add, e.g. 'Bash(npm test:*)'")
    private String pattern;

    @Option(names = {"--list", "-l"}, description = "Print the allow-list")
    private boolean list;

    @Option(names = {"--dir", "-d"}, description = "Project directory (default: current directory)")
    private Path directory;

    private final AllowListStore store;

    public AllowCommand(AllowListStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        Path project = (directory != null ? directory : Path.of("")).toAbsolutePath().normalize();
        if (list || pattern == null) {
            var rules = store.rules(project);
            ConsoleOutput.info("Allow-list " + store.settingsFile(project));
            if (rules.allowText().isEmpty()) {
                System.out.println("  (empty)");
            }
            rules.allowText().forEach(text -> System.out.println("  " + text));
            return 0;
        }
        try {
            if (store.addAllow(project, pattern)) {
                ConsoleOutput.success("Added " + pattern);
            } else {
                ConsoleOutput.info(pattern + " is already allowed");
            }
            return 0;
        } catch (InvalidPermissionPatternException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
