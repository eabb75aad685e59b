package com.starscope.signals.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * External mention of a repository (Hacker News story, Reddit post, ...)
 * stored by the context fetcher. Read-only here.
 */
@Data
@NoArgsConstructor
@Table("context_signals")
public class ContextSignal {

    public static final String HACKER_NEWS = "hacker_news";

    @Id
    private Long id;

    private Long repoId;

    private String signalType;

    private String externalId;

    private String title;

    private String url;

    private long score;

    private Integer commentCount;

    private LocalDateTime publishedAt;

    private LocalDateTime fetchedAt;
}
