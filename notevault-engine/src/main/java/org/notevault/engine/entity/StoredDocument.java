package org.notevault.engine.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredDocument {

    private String fingerprint; // SHA-256 of the raw bytes

    private Long size; // in bytes

    private Integer pageCount;

    private String contentType;

    private String originalFilename;

    private String uploadedBy;

    private OffsetDateTime uploadedAt;
}
