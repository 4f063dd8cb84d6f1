package com.waypoint.core.temporal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waypoint.core.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Resolves artifacts by project convention.
 * <p>
 * Specification artifacts are {@code *.feature} files under the features directory carrying
 * the tag {@code @<ID>}. Test artifacts are files under the test roots whose name or content
 * mentions the id, plus any test file linked from a tagged feature's {@code .feature.coverage}
 * document ({@code scenarios[].testMappings[].file}).
 */
public class ConventionArtifactResolver implements ArtifactResolver {

    private static final Logger log = LoggerFactory.getLogger(ConventionArtifactResolver.class);

    /** Files larger than this are matched by name only. */
    private static final long MAX_CONTENT_SCAN_BYTES = 1024 * 1024;

    private final Path projectRoot;
    private final Path featuresDir;
    private final List<Path> testRoots;
    private final Set<String> ignoreDirs;
    private final ObjectMapper mapper;

    public ConventionArtifactResolver(Path projectRoot, String featuresDir, List<String> testRoots,
                                      Set<String> ignoreDirs, ObjectMapper mapper) {
        this.projectRoot = projectRoot;
        this.featuresDir = projectRoot.resolve(featuresDir);
        this.testRoots = testRoots.stream().map(projectRoot::resolve).toList();
        this.ignoreDirs = Set.copyOf(ignoreDirs);
        this.mapper = mapper;
    }

    @Override
    public List<Path> specificationArtifacts(WorkUnit workUnit) {
        Pattern tag = tagPattern(workUnit.id());
        return walk(featuresDir).stream()
                .filter(p -> p.getFileName().toString().endsWith(".feature"))
                .filter(p -> tag.matcher(readText(p)).find())
                .toList();
    }

    @Override
    public List<Path> testArtifacts(WorkUnit workUnit) {
        String id = workUnit.id();
        String lowerId = id.toLowerCase(Locale.ROOT);
        String underscored = lowerId.replace('-', '_');

        var result = new LinkedHashSet<Path>();
        for (Path root : testRoots) {
            for (Path file : walk(root)) {
                String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                if (name.contains(lowerId) || name.contains(underscored) || mentions(file, id)) {
                    result.add(file);
                }
            }
        }
        result.addAll(coverageLinkedTests(workUnit));
        return new ArrayList<>(result);
    }

    private List<Path> coverageLinkedTests(WorkUnit workUnit) {
        var linked = new ArrayList<Path>();
        for (Path feature : specificationArtifacts(workUnit)) {
            Path coverage = feature.resolveSibling(feature.getFileName() + ".coverage");
            if (!Files.isRegularFile(coverage)) {
                continue;
            }
            try {
                JsonNode root = mapper.readTree(coverage.toFile());
                for (JsonNode scenario : root.path("scenarios")) {
                    for (JsonNode mapping : scenario.path("testMappings")) {
                        String file = mapping.path("file").asText("");
                        // Mappings may carry a line range, e.g. "src/auth.test.ts:12-40"
                        int colon = file.indexOf(':');
                        if (colon > 0) {
                            file = file.substring(0, colon);
                        }
                        Path test = projectRoot.resolve(file).normalize();
                        if (!file.isEmpty() && test.startsWith(projectRoot) && Files.isRegularFile(test)) {
                            linked.add(test);
                        }
                    }
                }
            } catch (IOException e) {
                log.warn("Ignoring unreadable coverage file {}: {}", coverage, e.getMessage());
            }
        }
        return linked;
    }

    private boolean mentions(Path file, String id) {
        try {
            if (Files.size(file) > MAX_CONTENT_SCAN_BYTES) {
                return false;
            }
        } catch (IOException e) {
            throw new ArtifactAccessException("Cannot read size of", file, e);
        }
        return readText(file).contains(id);
    }

    private List<Path> walk(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !shouldIgnore(dir, p))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ArtifactAccessException("Failed to scan", dir, e);
        }
    }

    private boolean shouldIgnore(Path base, Path path) {
        for (Path segment : base.relativize(path)) {
            if (ignoreDirs.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    private static String readText(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactAccessException("Cannot read", file, e);
        }
    }

    static Pattern tagPattern(String id) {
        return Pattern.compile("(^|\\s)@" + Pattern.quote(id) + "(?=\\s|$)", Pattern.MULTILINE);
    }
}
