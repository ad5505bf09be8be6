package io.loopforge.changes;

import io.loopforge.pattern.PatternResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Change tracking backed by {@code git status --porcelain -z}.
 *
 * <p>Git only knows what is dirty now, not which step made it dirty, so {@link #diffSince}
 * reports every dirty path. Commits are serialized because git holds one index lock per worktree.
 */
public final class GitChangeTracker implements ChangeTracker {
    private static final Logger log = LoggerFactory.getLogger(GitChangeTracker.class);
    private static final long GIT_TIMEOUT_MS = 60_000L;
    private static final DateTimeFormatter BRANCH_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path workingDir;
    private final Set<String> baseline;
    private final Object commitLock = new Object();

    public GitChangeTracker(Path workingDir) {
        this(workingDir, Set.of());
    }

    public GitChangeTracker(Path workingDir, Set<String> baseline) {
        this.workingDir = workingDir;
        this.baseline = baseline == null ? Set.of() : Set.copyOf(baseline);
    }

    public static boolean isRepository(Path workingDir) {
        try {
            return new GitChangeTracker(workingDir).git(List.of("rev-parse", "--git-dir"), false).exitCode() == 0;
        } catch (ChangeTrackingException e) {
            return false;
        }
    }

    @Override
    public GitChangeTracker withBaseline(Set<String> value) {
        return new GitChangeTracker(workingDir, value);
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public Set<String> captureBaseline() {
        return dirtyFiles();
    }

    @Override
    public ChangeCheckpoint checkpoint() {
        return new ChangeCheckpoint(System.currentTimeMillis());
    }

    @Override
    public Set<String> diffSince(ChangeCheckpoint checkpoint) {
        return dirtyFiles();
    }

    @Override
    public Optional<String> commit(String filePath, String message) {
        synchronized (commitLock) {
            String stem = PatternResolver.fileStem(filePath);
            List<String> related = new ArrayList<>();
            for (String path : dirtyFiles()) {
                if (baseline.contains(path)) {
                    continue;
                }
                if (path.equals(filePath) || (!stem.isEmpty() && path.contains(stem))) {
                    related.add(path);
                }
            }
            if (related.isEmpty()) {
                log.debug("No changes to commit for {}", filePath);
                return Optional.empty();
            }
            List<String> add = new ArrayList<>(List.of("add", "--"));
            add.addAll(related);
            GitOutput staged = git(add, true);
            if (staged.exitCode() != 0) {
                throw new ChangeTrackingException("git add failed: " + staged.output().strip());
            }
            GitOutput committed = git(List.of("commit", "-m", message), true);
            if (committed.exitCode() != 0) {
                if (committed.output().contains("nothing to commit")) {
                    return Optional.empty();
                }
                throw new ChangeTrackingException("git commit failed: " + committed.output().strip());
            }
            GitOutput head = git(List.of("rev-parse", "--short", "HEAD"), false);
            String hash = head.output().strip();
            return hash.isEmpty() ? Optional.empty() : Optional.of(hash);
        }
    }

    @Override
    public Optional<String> currentBranch() {
        GitOutput out = git(List.of("rev-parse", "--abbrev-ref", "HEAD"), false);
        if (out.exitCode() != 0) {
            return Optional.empty();
        }
        String branch = out.output().strip();
        return branch.isEmpty() ? Optional.empty() : Optional.of(branch);
    }

    @Override
    public String createTaskBranch(String taskId) {
        String branch = "loopforge/" + taskId + "-" + ZonedDateTime.now(ZoneOffset.UTC).format(BRANCH_STAMP);
        GitOutput out = git(List.of("checkout", "-b", branch), true);
        if (out.exitCode() != 0) {
            throw new ChangeTrackingException("Failed to create branch '" + branch + "': " + out.output().strip());
        }
        return branch;
    }

    Set<String> dirtyFiles() {
        GitOutput out = git(List.of("-c", "core.quotePath=false", "status", "--porcelain", "-z",
                "--untracked-files=all"), false);
        if (out.exitCode() != 0) {
            throw new ChangeTrackingException("git status failed with exit " + out.exitCode());
        }
        return parsePorcelain(out.output());
    }

    /**
     * Paths from NUL-terminated {@code git status --porcelain -z} output. A rename or copy entry is
     * followed by its source path, which is skipped.
     */
    static Set<String> parsePorcelain(String output) {
        Set<String> files = new TreeSet<>();
        if (output == null || output.isEmpty()) {
            return files;
        }
        String[] entries = output.split("\0");
        for (int i = 0; i < entries.length; i++) {
            String entry = entries[i];
            if (entry.length() < 4) {
                continue;
            }
            String code = entry.substring(0, 2);
            files.add(entry.substring(3));
            if (code.indexOf('R') >= 0 || code.indexOf('C') >= 0) {
                i++;
            }
        }
        return files;
    }

    private GitOutput git(List<String> args, boolean mergeStderr) {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add("git");
        command.addAll(args);
        String name = args.get(0).equals("-c") ? args.get(2) : args.get(0);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDir.toFile());
        if (mergeStderr) {
            pb.redirectErrorStream(true);
        } else {
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }
        try {
            Process process = pb.start();
            process.getOutputStream().close();
            byte[] stdout = process.getInputStream().readAllBytes();
            if (!process.waitFor(GIT_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ChangeTrackingException("git " + name + " timed out");
            }
            return new GitOutput(process.exitValue(), new String(stdout, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ChangeTrackingException("Failed to run git " + name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChangeTrackingException("Interrupted while running git " + name, e);
        }
    }

    private record GitOutput(int exitCode, String output) {
    }
}
