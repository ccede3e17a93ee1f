package com.vidnyan.wdllint.domain.lint.rules;

import org.junit.jupiter.api.Test;

import static com.vidnyan.wdllint.WdlTrees.*;
import static com.vidnyan.wdllint.domain.model.type.Types.*;
import static org.junit.jupiter.api.Assertions.*;

class CommandScriptsTest {

    @Test
    void dummyValue_ShouldMatchPlaceholderWidthByType() {
        // "~{n}" occupies 4 columns
        assertEquals("4444", CommandScripts.dummyValue(integer(), span(1, 10, 11)));
        assertEquals("xxxxxxx", CommandScripts.dummyValue(file(), span(1, 10, 14)));
        assertEquals("false", CommandScripts.dummyValue(bool(), span(1, 10, 30)));
        assertEquals("xxxxxx", CommandScripts.dummyValue(array(optional(string())), span(1, 10, 13)));
    }

    @Test
    void stripLeadingWhitespace_ShouldRemoveCommonIndentIgnoringBlankLines() {
        // Act
        CommandScripts.DedentedScript dedented = CommandScripts.stripLeadingWhitespace("\n    a\n  \n      b\n");

        // Assert
        assertEquals(4, dedented.offset());
        assertEquals("\na\n  \n  b\n", dedented.text());
    }

    @Test
    void stripLeadingWhitespace_WithUnindentedLine_ShouldLeaveTextAlone() {
        // Act
        CommandScripts.DedentedScript dedented = CommandScripts.stripLeadingWhitespace("  a\nb");

        // Assert
        assertEquals(0, dedented.offset());
        assertEquals("  a\nb", dedented.text());
    }
}
