package io.loopforge.pattern;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Resolves per-file placeholders in prompts, verify commands, allowlists and commit messages.
 *
 * <p>Supported: {@code {file}}, {@code {file_stem}}, {@code {file_dir}}, and, where the template
 * asks for them, {@code {all_files}}, {@code {test_files}} and {@code {created_files}}, which list
 * files on disk matching the allowlist.
 */
public final class PatternResolver {
    private static final List<String> TEST_MARKERS = List.of(
            ".test.", ".spec.", "_test.", "_spec.", "/test/", "/tests/", "/__tests__/"
    );

    private final Path workingDir;

    public PatternResolver(Path workingDir) {
        this.workingDir = workingDir.toAbsolutePath().normalize();
    }

    public Path workingDir() {
        return workingDir;
    }

    /**
     * File name without extension and without a trailing {@code .test} or {@code .spec},
     * so {@code parser.test.ts} and {@code parser.ts} share the stem {@code parser}.
     */
    public static String fileStem(String filePath) {
        String name = fileName(filePath);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        if (stem.endsWith(".test")) {
            return stem.substring(0, stem.length() - ".test".length());
        }
        if (stem.endsWith(".spec")) {
            return stem.substring(0, stem.length() - ".spec".length());
        }
        return stem;
    }

    public static String fileDir(String filePath) {
        String normalized = filePath.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? "" : normalized.substring(0, slash);
    }

    /**
     * Substitutes only the path-derived placeholders; never touches the filesystem.
     */
    public static String expandBasic(String template, String filePath) {
        if (template == null) {
            return null;
        }
        return template
                .replace("{file}", filePath)
                .replace("{file_stem}", fileStem(filePath))
                .replace("{file_dir}", fileDir(filePath));
    }

    public static String expandWith(String template, Map<String, String> values) {
        if (template == null) {
            return null;
        }
        String out = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            out = out.replace("{" + entry.getKey() + "}", entry.getValue() == null ? "" : entry.getValue());
        }
        return out;
    }

    public String resolve(String template, String filePath, String allowlistPattern) {
        if (template == null) {
            return null;
        }
        String out = template;
        if (out.contains("{all_files}")) {
            out = out.replace("{all_files}", String.join(" ", allFiles(filePath, allowlistPattern)));
        }
        if (out.contains("{test_files}")) {
            out = out.replace("{test_files}", String.join(" ", testFiles(filePath, allowlistPattern)));
        }
        if (out.contains("{created_files}")) {
            out = out.replace("{created_files}", String.join(" ", createdFiles(filePath, allowlistPattern)));
        }
        return expandBasic(out, filePath);
    }

    /**
     * The source file first, then every other file on disk matching the allowlist.
     */
    public List<String> allFiles(String filePath, String allowlistPattern) {
        List<String> files = new ArrayList<>(globMatches(allowlistGlob(filePath, allowlistPattern)));
        files.remove(filePath);
        files.add(0, filePath);
        return files;
    }

    public List<String> testFiles(String filePath, String allowlistPattern) {
        return allFiles(filePath, allowlistPattern).stream()
                .filter(f -> !f.equals(filePath))
                .filter(PatternResolver::looksLikeTest)
                .toList();
    }

    public List<String> createdFiles(String filePath, String allowlistPattern) {
        return globMatches(allowlistGlob(filePath, allowlistPattern)).stream()
                .filter(f -> !f.equals(filePath))
                .toList();
    }

    static boolean looksLikeTest(String path) {
        String lower = path.replace('\\', '/').toLowerCase(Locale.ROOT);
        for (String marker : TEST_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Allowlist expanded for the file; a pattern without a directory part is anchored in the file's directory.
     */
    static String allowlistGlob(String filePath, String allowlistPattern) {
        String dir = fileDir(filePath);
        String expanded = allowlistPattern
                .replace("{file}", filePath)
                .replace("{file_stem}", fileStem(filePath))
                .replace("{file_dir}", dir.isEmpty() ? "." : dir);
        if (expanded.contains("/") || expanded.contains("\\")) {
            return expanded;
        }
        if (dir.isEmpty() || ".".equals(dir)) {
            return expanded;
        }
        return dir + "/" + expanded;
    }

    private List<String> globMatches(String glob) {
        String normalized = glob.replace('\\', '/');
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        PathMatcher matcher;
        try {
            matcher = FileSystems.getDefault().getPathMatcher("glob:" + normalized);
        } catch (IllegalArgumentException e) {
            return List.of();
        }
        Path start = workingDir.resolve(staticPrefix(normalized));
        if (!Files.isDirectory(start)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(start)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> workingDir.relativize(p).toString().replace('\\', '/'))
                    .filter(rel -> matcher.matches(Path.of(rel)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + start, e);
        }
    }

    private static String staticPrefix(String glob) {
        int firstMeta = glob.length();
        for (int i = 0; i < glob.length(); i++) {
            char ch = glob.charAt(i);
            if (ch == '*' || ch == '?' || ch == '[' || ch == '{') {
                firstMeta = i;
                break;
            }
        }
        int slash = glob.lastIndexOf('/', firstMeta);
        return slash < 0 ? "" : glob.substring(0, slash);
    }

    private static String fileName(String filePath) {
        String normalized = filePath.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }
}
