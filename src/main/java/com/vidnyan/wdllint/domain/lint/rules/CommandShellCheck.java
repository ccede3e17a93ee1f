package com.vidnyan.wdllint.domain.lint.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.vidnyan.wdllint.application.port.out.ShellChecker;
import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.tree.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Runs ShellCheck on each task command and reports its findings at their position in the WDL
 * source. Placeholders are replaced with dummy values of similar length first.
 * <p>
 * Does nothing when no checker is available.
 */
@Slf4j
public class CommandShellCheck extends Linter {

    /**
     * Codes excluded from the report. 1009 and 1072 are non-informative commentary; the rest
     * (literal braces, constant loops and comparisons, always-true {@code -n}) are triggered by
     * the dummy values.
     */
    static final Set<Integer> SUPPRESSIONS = Set.of(1009, 1072, 1083, 2043, 2050, 2157, 2193);

    static final String CHECKER_FAILED = "shellcheck failed on the task command; "
            + "update shellcheck version or disable CommandShellCheck to suppress this warning";
    static final String UNPARSEABLE_OUTPUT = "error parsing shellcheck output JSON; "
            + "update shellcheck version or disable CommandShellCheck to suppress this warning";

    private Path scratchDir;

    public CommandShellCheck(LintContext context) {
        super(context);
    }

    @Override
    public void task(Task obj) {
        ShellChecker checker = getContext().shellChecker();
        if (!checker.isAvailable()) {
            return;
        }

        String script = CommandScripts.render(obj.getCommand(),
                placeholder -> CommandScripts.dummyValue(placeholder.getExpr().getType(), placeholder.getPos()));
        CommandScripts.DedentedScript dedented = CommandScripts.stripLeadingWhitespace(script);

        ShellChecker.ShellCheckOutput output;
        try {
            Path scriptFile = scratchDir().resolve(obj.getName());
            Files.writeString(scriptFile, dedented.text(), StandardCharsets.UTF_8);
            output = checker.check(scriptFile, SUPPRESSIONS);
        } catch (IOException e) {
            log.warn("Could not run ShellCheck on task {}: {}", obj.getName(), e.getMessage());
            add(obj, CHECKER_FAILED, obj.getCommand().getPos());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while running ShellCheck on task {}", obj.getName());
            add(obj, CHECKER_FAILED, obj.getCommand().getPos());
            return;
        }

        if (!output.completed()) {
            log.warn("ShellCheck exited with status {} on task {}", output.exitCode(), obj.getName());
            add(obj, CHECKER_FAILED, obj.getCommand().getPos());
            return;
        }
        if (output.stdout() == null || output.stdout().isBlank()) {
            return;
        }

        List<ShellCheckComment> comments;
        try {
            comments = getContext().objectMapper().readValue(output.stdout(), new TypeReference<List<ShellCheckComment>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("Unparseable ShellCheck output for task {}: {}", obj.getName(), e.getOriginalMessage());
            add(obj, UNPARSEABLE_OUTPUT, obj.getCommand().getPos());
            return;
        }
        if (comments == null || comments.stream().anyMatch(c -> c == null || !c.isComplete())) {
            log.warn("Incomplete ShellCheck comment in output for task {}", obj.getName());
            add(obj, UNPARSEABLE_OUTPUT, obj.getCommand().getPos());
            return;
        }

        SourcePosition commandPos = obj.getCommand().getPos();
        for (ShellCheckComment comment : comments) {
            int line = commandPos.line() + comment.line() - 1;
            int column = dedented.offset() + comment.column() - 1;
            add(obj, "SC" + comment.code() + " " + comment.message(),
                    new SourcePosition(commandPos.filename(), line, column, line, column));
        }
    }

    private Path scratchDir() throws IOException {
        if (scratchDir == null) {
            scratchDir = Files.createTempDirectory("wdllint_shellcheck_");
        }
        return scratchDir;
    }

    @Override
    public void close() {
        if (scratchDir == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(scratchDir);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", scratchDir, e.getMessage());
        }
        scratchDir = null;
    }

    /**
     * One entry of ShellCheck's {@code -f json} report.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ShellCheckComment(
        Integer line,
        Integer column,
        Integer code,
        String message
    ) {

        boolean isComplete() {
            return line != null && column != null && code != null && message != null;
        }
    }
}
