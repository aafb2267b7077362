package io.b2mash.ismsp.report;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.time.LocalDateTime;

/** One evidence row of the report window, joined with the title of its requirement. */
public record ReportedEvidence(
    long id,
    String itemCode,
    String title,
    String evidenceType,
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime createdAt) {}
