package io.b2mash.ismsp.evidence;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.time.LocalDateTime;

public record Evidence(
    long id,
    String itemCode,
    String evidenceType,
    String content,
    String filePath,
    EvidenceStatus status,
    String createdBy,
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime createdAt,
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime updatedAt) {}
