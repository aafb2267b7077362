package io.b2mash.ismsp.tool;

/** A decoded, typed tool invocation. One record per {@link ToolOperation}. */
public interface ToolRequest {

  ToolOperation operation();
}
