package io.b2mash.ismsp.tool;

/**
 * Executes one {@link ToolOperation}. Implementations are Spring beans collected by the {@link
 * ToolDispatcher}; each operation must have exactly one.
 */
public interface ToolHandler<R extends ToolRequest> {

  ToolOperation operation();

  Class<R> requestType();

  /** Returns the JSON-serializable payload, or throws an {@code IsmsException}. */
  Object handle(R request);
}
