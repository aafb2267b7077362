package io.b2mash.ismsp.tool;

import java.util.List;

public record ToolDescriptor(
    String name, String description, List<String> required, List<String> optional) {

  static ToolDescriptor of(ToolOperation operation) {
    return new ToolDescriptor(
        operation.toolName(),
        operation.description(),
        operation.requiredArguments(),
        operation.optionalArguments());
  }
}
