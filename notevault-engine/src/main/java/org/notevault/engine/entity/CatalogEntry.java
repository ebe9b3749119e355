package org.notevault.engine.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEntry {

    private UUID id;

    private String courseCode;

    private String title;

    private String uploadedBy;

    private OffsetDateTime createdAt;

    private String fingerprint;

    private boolean active;
}
