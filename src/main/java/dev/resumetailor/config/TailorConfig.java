package dev.resumetailor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inputs, outputs and page constraints of a tailoring run.
 * Loaded from application.yml under 'tailor' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tailor")
public class TailorConfig {

    private String candidateFile = "candidate.json";
    private String jobFile = "job.txt";
    private String outputFile;

    // Physical lines available for bullets on the page
    private int lineBudget = 21;

    private int bulletSlots = 5;
    private int skillSlots = 4;

    // role -> exact number of bullets to select
    private Map<String, Integer> selectionRequirements = new LinkedHashMap<>();

    // role -> template placeholder prefix, when it differs from the derived one
    private Map<String, String> rolePrefixes = new LinkedHashMap<>();

    private Map<String, String> roleTitles = new LinkedHashMap<>();
}
