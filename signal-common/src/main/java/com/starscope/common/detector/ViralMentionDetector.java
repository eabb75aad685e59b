package com.starscope.common.detector;

import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.MentionRecord;
import com.starscope.common.model.Severity;
import com.starscope.common.model.StarSnapshot;

import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags a repository that was mentioned somewhere popular recently. Only
 * mentions fetched within the lookback window count; the highest-scoring one
 * is reported.
 *
 * <pre>
 * fires:  score &ge; 100 within the last 48 hours
 * HIGH:   score &ge; 500
 * MEDIUM: score &ge; 200
 * </pre>
 */
public final class ViralMentionDetector implements AnomalyDetector {

    private static final int TITLE_PREVIEW_LENGTH = 50;

    private final DetectionThresholds.ViralMention thresholds;

    public ViralMentionDetector() {
        this(DetectionThresholds.DEFAULTS.viralMention());
    }

    public ViralMentionDetector(DetectionThresholds.ViralMention thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public EarlySignalKind kind() {
        return EarlySignalKind.VIRAL_MENTION;
    }

    @Override
    public Optional<EarlySignalFinding> detect(long repoId, DetectionContext context) {
        Instant now = context.now();
        Instant cutoff = now.minus(thresholds.lookback());

        Optional<MentionRecord> top = context.mentions(repoId).stream()
            .filter(m -> m.fetchedAt() != null && !m.fetchedAt().isBefore(cutoff))
            .filter(m -> m.score() >= thresholds.minScore())
            .max(Comparator.comparingLong(MentionRecord::score));
        if (top.isEmpty()) {
            return Optional.empty();
        }

        MentionRecord mention = top.get();
        Severity severity;
        if (mention.score() >= thresholds.highScore()) {
            severity = Severity.HIGH;
        } else if (mention.score() >= thresholds.mediumScore()) {
            severity = Severity.MEDIUM;
        } else {
            severity = Severity.LOW;
        }

        Long stars = context.latestSnapshot(repoId).map(StarSnapshot::stars).orElse(null);

        return Optional.of(new EarlySignalFinding(
            repoId,
            kind(),
            severity,
            String.format(Locale.ROOT, "Viral on HN: \"%s...\" (%d points)",
                preview(mention.title()), mention.score()),
            null,
            stars,
            null,
            now,
            now.plus(thresholds.ttl())));
    }

    private static String preview(String title) {
        if (title == null) {
            return "";
        }
        if (title.codePointCount(0, title.length()) <= TITLE_PREVIEW_LENGTH) {
            return title;
        }
        return title.substring(0, title.offsetByCodePoints(0, TITLE_PREVIEW_LENGTH));
    }
}
