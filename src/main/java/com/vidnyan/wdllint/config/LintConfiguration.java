package com.vidnyan.wdllint.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.wdllint.adapter.out.shellcheck.ProcessShellChecker;
import com.vidnyan.wdllint.application.port.out.ShellChecker;
import com.vidnyan.wdllint.domain.lint.LintEngine;
import com.vidnyan.wdllint.domain.lint.LinterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the lint engine.
 * Wires the rule registry and the ShellCheck adapter from {@link LintProperties}.
 */
@Slf4j
@Configuration
public class LintConfiguration {

    /**
     * ObjectMapper for JSON reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public ShellChecker shellChecker(LintProperties properties) {
        LintProperties.ShellCheck shellcheck = properties.getShellcheck();
        if (!shellcheck.isEnabled()) {
            log.info("ShellCheck disabled");
            return ShellChecker.unavailable();
        }
        return new ProcessShellChecker(shellcheck.getExecutable(), shellcheck.getShell());
    }

    /**
     * Built-in rules minus the disabled ones. Logs the active rules on startup.
     */
    @Bean
    public LinterRegistry linterRegistry(LintProperties properties) {
        LinterRegistry registry = LinterRegistry.defaults().without(properties.getDisabledRules());
        log.info("Registered {} lint rules:", registry.size());
        registry.names().forEach(name -> log.info("  - {}", name));
        return registry;
    }

    @Bean
    public LintEngine lintEngine(LinterRegistry linterRegistry, ShellChecker shellChecker, ObjectMapper objectMapper) {
        return new LintEngine(linterRegistry, shellChecker, objectMapper);
    }
}
