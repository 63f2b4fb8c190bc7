package io.b2mash.payables.report;

import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/** Reads and writes the JSON stored in {@link ReportPeriod#getSnapshotData()}. */
@Component
public class ReportSnapshotCodec {

  private final ObjectMapper objectMapper;

  public ReportSnapshotCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String write(ReportSnapshot snapshot) {
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JacksonException e) {
      throw new IllegalStateException("Failed to serialize report snapshot", e);
    }
  }

  public ReportSnapshot read(String json) {
    try {
      var snapshot = objectMapper.readValue(json, ReportSnapshot.class);
      if (snapshot.version() != ReportSnapshot.CURRENT_VERSION) {
        throw new IllegalStateException(
            "Unsupported report snapshot version " + snapshot.version());
      }
      return snapshot;
    } catch (JacksonException e) {
      throw new IllegalStateException("Stored report snapshot is not readable", e);
    }
  }
}
