package com.openforge.memkeep.tool;

/**
 * A named request → result-string operation the model can invoke by directive.
 * Implementations may have side effects; failures are thrown as unchecked
 * exceptions and turned into error results by the {@link ToolRegistry}.
 */
public interface AgentTool {

    /** Upper-case directive name, e.g. {@code SEARCH}. */
    String name();

    /** One-line usage shown to the model, e.g. {@code SEARCH: <query> — search the web}. */
    String usage();

    String execute(String args);
}
