package de.levingamer8.greaterlauncher.launch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Everything needed to start the game once. Not persisted. */
public record LaunchCommand(Path executable, Path workingDirectory, List<String> arguments, ProcessPriority priority) {

    public static final String WINDOW_TITLE = "Victoria II";

    public LaunchCommand {
        arguments = List.copyOf(arguments);
    }

    public List<String> command() {
        List<String> cmd = new ArrayList<>(arguments.size() + 1);
        cmd.add(executable.toString());
        cmd.addAll(arguments);
        return cmd;
    }

    // the game runs best pinned to one core
    public List<String> windowsStartArgs() {
        return List.of(priority.startSwitch(), "/affinity", "1", "/node", "0");
    }

    public List<String> windowsStartCommand() {
        List<String> cmd = new ArrayList<>(List.of("cmd", "/c", "start", WINDOW_TITLE));
        cmd.addAll(windowsStartArgs());
        cmd.addAll(command());
        return cmd;
    }

    public ProcessBuilder toProcessBuilder(boolean windows) {
        ProcessBuilder pb = new ProcessBuilder(windows ? windowsStartCommand() : command());
        pb.directory(workingDirectory.toFile());
        pb.redirectErrorStream(true);
        return pb;
    }
}
