package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import com.vidnyan.wdllint.domain.model.tree.Task;

/**
 * Task command line whose indentation mixes tabs and spaces. Reported once per task, at the
 * first such line.
 */
public class MixedIndentation extends Linter {

    public MixedIndentation(LintContext context) {
        super(context);
    }

    @Override
    public void task(Task obj) {
        String[] lines = CommandScripts.render(obj.getCommand(), placeholder -> "$").split("\n", -1);
        SourcePosition commandPos = obj.getCommand().getPos();
        for (int offset = 0; offset < lines.length; offset++) {
            String line = lines[offset];
            String indentation = line.substring(0, CommandScripts.leadingWhitespace(line));
            if (indentation.contains(" ") && indentation.contains("\t")) {
                int lineNumber = commandPos.line() + offset;
                add(obj, "command indented with both spaces & tabs",
                        new SourcePosition(commandPos.filename(), lineNumber, 1, lineNumber, line.length()));
                break;
            }
        }
    }
}
