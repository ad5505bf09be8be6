package io.loopforge.changes;

import io.loopforge.guard.ChangeAuthorizationGuard;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

final class GitChangeTrackerTest {

    @Test
    void porcelainOutputIsParsedIntoPaths() {
        String output = " M src/a.ts\0"
                + "?? src/a.test.ts\0"
                + "R  new/name.ts\0old/name.ts\0"
                + "A  with space.ts\0"
                + "x\0";
        Set<String> files = GitChangeTracker.parsePorcelain(output);
        Assertions.assertEquals(Set.of("src/a.ts", "src/a.test.ts", "new/name.ts", "with space.ts"), files);
    }

    @Test
    void emptyOutputMeansClean() {
        Assertions.assertTrue(GitChangeTracker.parsePorcelain("").isEmpty());
        Assertions.assertTrue(GitChangeTracker.parsePorcelain(null).isEmpty());
    }

    @Test
    void noopTrackerReportsNothing() {
        ChangeTracker tracker = NoopChangeTracker.INSTANCE;
        Assertions.assertFalse(tracker.enabled());
        Assertions.assertTrue(tracker.diffSince(tracker.checkpoint()).isEmpty());
        Assertions.assertTrue(tracker.commit("a.ts", "msg").isEmpty());
        Assertions.assertThrows(ChangeTrackingException.class, () -> tracker.createTaskBranch("task_0"));
    }

    @Test
    void nonAsciiPathsAreReportedVerbatim() throws Exception {
        Path repo = Files.createTempDirectory("loopforge-test-git-");
        try {
            initRepository(repo);
            // created through the shell so the test does not depend on the JVM's file name encoding
            run(repo, "sh", "-c", "printf 'export {}' > \"$(printf 'caf\\303\\251.ts')\"");

            GitChangeTracker tracker = new GitChangeTracker(repo);
            Set<String> dirty = tracker.dirtyFiles();

            Assertions.assertEquals(Set.of("café.ts"), dirty);
            Assertions.assertTrue(ChangeAuthorizationGuard.forFileOnly().check("café*", dirty, Set.of()).authorized());
        } finally {
            run(repo, "sh", "-c", "rm -f caf*.ts");
            deleteRecursively(repo);
        }
    }

    @Test
    void baselineIsExemptAndCommitTakesOnlyRelatedFiles() throws Exception {
        Path repo = Files.createTempDirectory("loopforge-test-git-");
        try {
            initRepository(repo);
            Files.writeString(repo.resolve("notes.md"), "draft");
            Files.writeString(repo.resolve("parser-notes.md"), "draft");

            GitChangeTracker base = new GitChangeTracker(repo);
            Assertions.assertTrue(GitChangeTracker.isRepository(repo));
            Set<String> baseline = base.captureBaseline();
            Assertions.assertEquals(Set.of("notes.md", "parser-notes.md"), baseline);

            GitChangeTracker tracker = base.withBaseline(baseline);
            ChangeCheckpoint checkpoint = tracker.checkpoint();
            Files.createDirectories(repo.resolve("src"));
            Files.writeString(repo.resolve("src/parser.ts"), "export const parse = 1;");
            Files.writeString(repo.resolve("src/parser.test.ts"), "test('parse', () => {});");
            Files.writeString(repo.resolve("src/lexer.ts"), "export const lex = 1;");
            Assertions.assertEquals(
                    Set.of("notes.md", "parser-notes.md", "src/parser.ts", "src/parser.test.ts", "src/lexer.ts"),
                    tracker.diffSince(checkpoint));

            Optional<String> hash = tracker.commit("src/parser.ts", "loopforge: src/parser.ts");

            Assertions.assertTrue(hash.isPresent());
            Assertions.assertEquals(Set.of("notes.md", "parser-notes.md", "src/lexer.ts"), tracker.dirtyFiles());
            Assertions.assertEquals("loopforge: src/parser.ts", run(repo, "git", "log", "-1", "--format=%s").strip());
            List<String> committed = List.of(run(repo, "git", "show", "--name-only", "--format=", "HEAD").strip().split("\n"));
            Assertions.assertEquals(List.of("src/parser.test.ts", "src/parser.ts"), committed);
            Assertions.assertTrue(tracker.commit("src/parser.ts", "again").isEmpty());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void taskBranchIsCreatedFromCurrentBranch() throws Exception {
        Path repo = Files.createTempDirectory("loopforge-test-git-");
        try {
            initRepository(repo);
            GitChangeTracker tracker = new GitChangeTracker(repo);
            Assertions.assertEquals(Optional.of("main"), tracker.currentBranch());

            String branch = tracker.createTaskBranch("task_3");

            Assertions.assertTrue(branch.startsWith("loopforge/task_3-"), branch);
            Assertions.assertEquals(Optional.of(branch), tracker.currentBranch());
            Assertions.assertEquals(branch, run(repo, "git", "rev-parse", "--abbrev-ref", "HEAD").strip());
        } finally {
            deleteRecursively(repo);
        }
    }

    private static void initRepository(Path repo) throws Exception {
        run(repo, "git", "init", "-q");
        run(repo, "git", "symbolic-ref", "HEAD", "refs/heads/main");
        run(repo, "git", "config", "user.email", "loopforge@example.com");
        run(repo, "git", "config", "user.name", "LoopForge Test");
        run(repo, "git", "config", "commit.gpgsign", "false");
        Files.writeString(repo.resolve("README.md"), "fixture");
        run(repo, "git", "add", "README.md");
        run(repo, "git", "commit", "-q", "-m", "init");
    }

    private static String run(Path dir, String... command) throws Exception {
        List<String> args = new ArrayList<>(List.of(command));
        Process process = new ProcessBuilder(args).directory(dir.toFile()).redirectErrorStream(true).start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        int exit = process.waitFor();
        Assertions.assertEquals(0, exit, String.join(" ", command) + ": " + output);
        return output;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
