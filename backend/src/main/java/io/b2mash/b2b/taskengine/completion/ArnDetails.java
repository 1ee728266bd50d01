package io.b2mash.b2b.taskengine.completion;

import io.b2mash.b2b.taskengine.exception.InvalidStateException;
import java.util.regex.Pattern;

/** Acknowledgement reference number recorded when a filing task is marked complete. */
public record ArnDetails(String arnNumber, String arnName) {

  private static final Pattern ARN_FORMAT = Pattern.compile("\\d{15}");

  /**
   * Checks that an ARN is present, exactly 15 digits, and carries the filer's name.
   *
   * @throws InvalidStateException if any part is missing or malformed
   */
  public static ArnDetails requireValid(ArnDetails arn) {
    if (arn == null || arn.arnNumber() == null || arn.arnNumber().isBlank()) {
      throw new InvalidStateException(
          "ARN required", "This task requires an ARN number when marked complete");
    }
    if (!ARN_FORMAT.matcher(arn.arnNumber()).matches()) {
      throw new InvalidStateException("Invalid ARN", "ARN must be exactly 15 digits");
    }
    if (arn.arnName() == null || arn.arnName().isBlank()) {
      throw new InvalidStateException("Invalid ARN", "Name is required with the ARN number");
    }
    return new ArnDetails(arn.arnNumber(), arn.arnName().trim());
  }
}
