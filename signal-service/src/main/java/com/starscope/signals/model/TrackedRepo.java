package com.starscope.signals.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A tracked GitHub repository. Owned by the repository CRUD layer; the
 * detection pipeline only reads ids.
 */
@Data
@NoArgsConstructor
@Table("repos")
public class TrackedRepo {

    @Id
    private Long id;

    private String fullName;

    private LocalDateTime addedAt;
}
