package com.vidnyan.wdllint.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the lint engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "wdllint")
public class LintProperties {

    /**
     * Whether imported documents are linted when a request does not say.
     */
    private boolean descendImports = true;

    /**
     * Rule names to leave out, e.g. CommandShellCheck.
     */
    private List<String> disabledRules = new ArrayList<>();

    private ShellCheck shellcheck = new ShellCheck();

    @Data
    public static class ShellCheck {

        /**
         * When false, CommandShellCheck never runs ShellCheck.
         */
        private boolean enabled = true;

        /**
         * Executable name looked up on PATH, or a path to it.
         */
        private String executable = "shellcheck";

        /**
         * Shell dialect passed to ShellCheck.
         */
        private String shell = "bash";
    }
}
