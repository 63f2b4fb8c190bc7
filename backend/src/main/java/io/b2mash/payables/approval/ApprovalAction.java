package io.b2mash.payables.approval;

import io.b2mash.payables.exception.InvalidInputException;
import java.util.Arrays;

public enum ApprovalAction {
  APPROVE("approve"),
  REJECT("reject"),
  ARCHIVE("archive");

  private final String value;

  ApprovalAction(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ApprovalAction fromValue(String value) {
    return Arrays.stream(values())
        .filter(action -> action.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidInputException(
                    "Invalid action",
                    "Unknown action '" + value + "'; use approve, reject or archive"));
  }
}
