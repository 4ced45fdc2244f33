package com.legacyport.driver;

import java.time.Instant;
import java.util.List;

/**
 * 一次目录翻译的汇总，outcomes 按相对路径排序。
 */
public record BatchReport(
    String root,
    List<FileOutcome> outcomes,
    long elapsedMs,
    Instant finishedAt
) {
    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(FileOutcome.Status status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    public List<FileOutcome> failures() {
        return outcomes.stream().filter(FileOutcome::isFailure).toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(FileOutcome::isFailure);
    }
}
