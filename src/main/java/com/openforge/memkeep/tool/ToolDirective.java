package com.openforge.memkeep.tool;

/**
 * One recognised tool directive in a model reply.
 *
 * @param tool  registered tool name, upper-case
 * @param args  argument text after the colon, trimmed; "" for bare directives
 * @param shape whether the line carried a colon
 */
public record ToolDirective(String tool, String args, Shape shape) {

    public enum Shape {
        /** {@code NAME: args} */
        WITH_ARGS,
        /** the line is exactly {@code NAME} */
        BARE
    }
}
