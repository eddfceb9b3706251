package dev.resumetailor.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumetailor.model.BulletRecord;
import dev.resumetailor.model.CandidateData;
import dev.resumetailor.model.SkillTaxonomy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads candidate bullets and skills from JSON, and job descriptions from text or HTML.
 * <p>
 * Candidate file layout:
 * <pre>
 * {
 *   "bullets": [{"role": "...", "bullet": "...", "lines": 2, "category": "...", "keywords": "a, b"}],
 *   "skills":  [{"skill": "Python", "category": "Programming Languages, Backend"}]
 * }
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateDataLoader {

    private static final Pattern HTML_TAG = Pattern.compile("<\\s*/?\\s*[a-zA-Z][a-zA-Z0-9]*[^>]*>");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final ObjectMapper objectMapper;

    public CandidateData loadCandidate(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CandidateDataException("Candidate file not found", path);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new CandidateDataException("Could not parse candidate file", path, e);
        }
        if (root == null || !root.isObject()) {
            throw new CandidateDataException("Candidate file must contain a JSON object", path);
        }

        Map<String, List<BulletRecord>> bulletsByRole = readBullets(root.path("bullets"));
        SkillTaxonomy skills = readSkills(root.path("skills"));

        log.info("Loaded {} bullet(s) across {} role(s) and {} skill(s) from {}",
                bulletsByRole.values().stream().mapToInt(List::size).sum(),
                bulletsByRole.size(), skills.skills().size(), path);

        return CandidateData.builder()
                .bulletsByRole(bulletsByRole)
                .skills(skills)
                .build();
    }

    /**
     * Read a job description; HTML is reduced to text, keeping block boundaries as line breaks.
     */
    public String loadJobDescription(Path path) {
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CandidateDataException("Could not read job description", path, e);
        }
        return HTML_TAG.matcher(raw).find() ? htmlToText(raw) : raw.strip();
    }

    static String htmlToText(String html) {
        Document doc = Jsoup.parse(html);
        doc.select("br, p, li, div, h1, h2, h3, h4, h5, h6, tr").after("\n");
        String text = doc.body().wholeText()
                .replace('\u00A0', ' ')
                .replaceAll("[ \\t]+\\n", "\n");
        return EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n").strip();
    }

    private Map<String, List<BulletRecord>> readBullets(JsonNode rows) {
        Map<String, List<BulletRecord>> byRole = new LinkedHashMap<>();
        if (!rows.isArray()) {
            log.warn("Candidate file has no 'bullets' array");
            return byRole;
        }

        int skipped = 0;
        for (JsonNode row : rows) {
            String role = text(row, "role");
            String bullet = text(row, "bullet");
            if (role.isEmpty() || bullet.isEmpty()) {
                skipped++;
                continue;
            }
            BulletRecord record = BulletRecord.builder()
                    .role(role)
                    .bullet(bullet)
                    .lines(lines(row.get("lines")))
                    .category(text(row, "category"))
                    .keywords(splitList(row.get("keywords")))
                    .build();
            byRole.computeIfAbsent(role, key -> new ArrayList<>()).add(record);
        }

        if (skipped > 0) {
            log.warn("Skipped {} bullet row(s) with a blank role or bullet", skipped);
        }
        byRole.replaceAll((role, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(byRole);
    }

    private SkillTaxonomy readSkills(JsonNode rows) {
        if (!rows.isArray()) {
            log.warn("Candidate file has no 'skills' array");
            return SkillTaxonomy.empty();
        }

        Map<String, Set<String>> mapping = new LinkedHashMap<>();
        for (JsonNode row : rows) {
            String skill = text(row, "skill");
            List<String> categories = splitList(row.get("category"));
            if (skill.isEmpty() || categories.isEmpty()) {
                continue;
            }
            mapping.computeIfAbsent(skill, key -> new LinkedHashSet<>()).addAll(categories);
        }
        return new SkillTaxonomy(mapping);
    }

    private static String text(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.asText("").strip();
    }

    private static int lines(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        try {
            return (int) Double.parseDouble(node.asText().strip());
        } catch (NumberFormatException e) {
            log.warn("Invalid line count '{}', using 0", node.asText());
            return 0;
        }
    }

    // Accepts "a, b, c" or ["a", "b"]
    private static List<String> splitList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText("")));
        } else {
            values.addAll(Arrays.asList(node.asText("").split(",")));
        }
        return values.stream()
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .distinct()
                .toList();
    }
}
