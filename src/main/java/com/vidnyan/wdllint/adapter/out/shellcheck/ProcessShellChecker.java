package com.vidnyan.wdllint.adapter.out.shellcheck;

import com.vidnyan.wdllint.application.port.out.ShellChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runs the {@code shellcheck} binary as a subprocess.
 * <p>
 * Whether the binary is on PATH is looked up once per executable name and cached for the
 * life of the process.
 */
@Slf4j
@RequiredArgsConstructor
public class ProcessShellChecker implements ShellChecker {

    private static final Map<String, Boolean> AVAILABILITY = new ConcurrentHashMap<>();

    private final String executable;
    private final String shell;

    @Override
    public boolean isAvailable() {
        return AVAILABILITY.computeIfAbsent(executable, name -> {
            boolean found = isOnPath(name, System.getenv("PATH"));
            log.debug("ShellCheck executable {} {}", name, found ? "found" : "not found");
            return found;
        });
    }

    @Override
    public ShellCheckOutput check(Path script, Set<Integer> suppressedCodes) throws IOException, InterruptedException {
        List<String> command = command(script, suppressedCodes);
        log.debug("Running: {}", String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        boolean finished = false;
        try {
            String stdout;
            try (InputStream in = process.getInputStream()) {
                stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            finished = true;
            return new ShellCheckOutput(exitCode, stdout);
        } finally {
            if (!finished) {
                process.destroy();
            }
        }
    }

    List<String> command(Path script, Set<Integer> suppressedCodes) {
        String exclusions = suppressedCodes.stream()
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
        return List.of(executable, "-s", shell, "-f", "json", "-e", exclusions, script.toString());
    }

    /**
     * Whether {@code name} is an executable regular file, either as given (when it contains a path
     * separator) or in one of the {@code searchPath} directories.
     */
    static boolean isOnPath(String name, String searchPath) {
        if (name.contains(File.separator)) {
            return isExecutableFile(Path.of(name));
        }
        if (searchPath == null || searchPath.isEmpty()) {
            return false;
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            try {
                if (!dir.isEmpty() && isExecutableFile(Path.of(dir, name))) {
                    return true;
                }
            } catch (InvalidPathException e) {
                log.debug("Skipping PATH entry {}: {}", dir, e.getMessage());
            }
        }
        return false;
    }

    private static boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
