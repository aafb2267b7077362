package io.b2mash.ismsp.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.ismsp.exception.NotFoundException;
import io.b2mash.ismsp.exception.ValidationException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns an operation name and its loosely typed argument bag into a {@link ToolRequest}. This is
 * the only place that looks at raw arguments; everything downstream receives typed records.
 */
@Component
public class ToolRequestDecoder {

  private final ObjectMapper objectMapper;

  public ToolRequestDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ToolRequest decode(String toolName, Map<String, ?> arguments) {
    var operation =
        ToolOperation.fromToolName(toolName)
            .orElseThrow(
                () ->
                    NotFoundException.withDetail(
                        "Unknown tool", "No tool named '" + toolName + "'"));
    Map<String, ?> bag = arguments == null ? Map.of() : arguments;

    for (String required : operation.requiredArguments()) {
      var value = bag.get(required);
      if (value == null || (value instanceof String text && text.isBlank())) {
        throw ValidationException.missing(required);
      }
    }

    try {
      return objectMapper.convertValue(bag, operation.requestType());
    } catch (IllegalArgumentException e) {
      var cause = e.getCause() instanceof JsonProcessingException json ? json : null;
      throw new ValidationException(
          "Arguments of "
              + toolName
              + " could not be read: "
              + (cause != null ? cause.getOriginalMessage() : e.getMessage()));
    }
  }
}
