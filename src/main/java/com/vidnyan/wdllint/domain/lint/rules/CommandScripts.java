package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.expr.Placeholder;
import com.vidnyan.wdllint.domain.model.expr.StringExpr;
import com.vidnyan.wdllint.domain.model.type.ArrayType;
import com.vidnyan.wdllint.domain.model.type.BooleanType;
import com.vidnyan.wdllint.domain.model.type.FloatType;
import com.vidnyan.wdllint.domain.model.type.IntType;
import com.vidnyan.wdllint.domain.model.type.WdlType;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Text manipulation of task commands for the command rules.
 */
final class CommandScripts {

    private CommandScripts() {
    }

    /**
     * Command text after dedenting, and how many columns were removed from each line.
     */
    record DedentedScript(int offset, String text) {
    }

    /**
     * Concatenate the command's parts, rendering each placeholder with {@code placeholder}.
     */
    static String render(StringExpr command, Function<Placeholder, String> placeholder) {
        StringBuilder script = new StringBuilder();
        for (StringExpr.Part part : command.getParts()) {
            if (part instanceof StringExpr.Text text) {
                script.append(text.text());
            } else {
                script.append(placeholder.apply((Placeholder) part));
            }
        }
        return script.toString();
    }

    /**
     * A stand-in for an interpolated value that a shell linter will not complain about.
     * Its length approximates the {@code ~{...}} it replaces so columns stay aligned.
     */
    static String dummyValue(WdlType type, SourcePosition pos) {
        if (type instanceof ArrayType array) {
            return dummyValue(array.getItemType(), pos);
        }
        if (type instanceof BooleanType) {
            return "false";
        }
        // + 3 for the "~{" and "}" delimiters
        int length = Math.max(1, pos.endColumn() - pos.column()) + 3;
        if (type instanceof IntType || type instanceof FloatType) {
            return "4".repeat(length);
        }
        return "x".repeat(length);
    }

    /**
     * Remove the indentation common to all non-blank lines. Blank lines are kept as-is.
     */
    static DedentedScript stripLeadingWhitespace(String text) {
        String[] lines = text.split("\n", -1);
        int common = -1;
        for (String line : lines) {
            int indent = leadingWhitespace(line);
            if (indent < line.length() && (common < 0 || indent < common)) {
                common = indent;
            }
        }
        if (common <= 0) {
            return new DedentedScript(0, text);
        }
        final int strip = common;
        String[] dedented = Arrays.stream(lines)
                .map(line -> leadingWhitespace(line) < line.length() ? line.substring(strip) : line)
                .toArray(String[]::new);
        return new DedentedScript(strip, String.join("\n", dedented));
    }

    static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }
}
