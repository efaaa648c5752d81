package com.openforge.memkeep.tool;

public record ToolExecution(ToolDirective directive, String result) {

    /** "[TOOL RESULT] NAME" followed by the result on the next line. */
    public String render() {
        return "[TOOL RESULT] " + directive.tool() + "\n" + result;
    }
}
