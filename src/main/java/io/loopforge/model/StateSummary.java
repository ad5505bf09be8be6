package io.loopforge.model;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public record StateSummary(
        int total,
        int pending,
        int promptInProgress,
        int awaitingVerification,
        int verifyInProgress,
        int fixupInProgress,
        int completed,
        int failed
) {
    public static StateSummary of(Collection<FileState> files) {
        Map<FileStatus, Integer> counts = new EnumMap<>(FileStatus.class);
        for (FileState file : files) {
            counts.merge(file.status(), 1, Integer::sum);
        }
        return new StateSummary(
                files.size(),
                counts.getOrDefault(FileStatus.PENDING, 0),
                counts.getOrDefault(FileStatus.PROMPT_IN_PROGRESS, 0),
                counts.getOrDefault(FileStatus.AWAITING_VERIFICATION, 0),
                counts.getOrDefault(FileStatus.VERIFY_IN_PROGRESS, 0),
                counts.getOrDefault(FileStatus.FIXUP_IN_PROGRESS, 0),
                counts.getOrDefault(FileStatus.COMPLETED, 0),
                counts.getOrDefault(FileStatus.FAILED, 0)
        );
    }

    public int remaining() {
        return total - completed - failed;
    }
}
