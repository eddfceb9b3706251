package dev.resumetailor.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumetailor.model.BulletRecord;
import dev.resumetailor.model.CandidateData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateDataLoaderTest {

    @TempDir
    Path tempDir;

    private CandidateDataLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CandidateDataLoader(new ObjectMapper());
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Candidate file")
    class CandidateFileTests {

        @Test
        @DisplayName("Should group bullets by role in first-seen order and parse optional fields")
        void shouldLoadBullets() throws IOException {
            Path file = write("candidate.json", """
                    {
                      "bullets": [
                        {"role": "Nodelink", "bullet": "Built Kafka consumers", "lines": 2,
                         "category": "Backend", "keywords": "kafka, java , "},
                        {"role": "MAMM", "bullet": "Trained classifiers", "lines": "1"},
                        {"role": "Nodelink", "bullet": "Wrote docs", "keywords": ["docs", "writing"]},
                        {"role": "", "bullet": "Orphan bullet"},
                        {"role": "MAMM", "bullet": "   "},
                        {"role": "MAMM", "bullet": "Tuned models", "lines": "two"}
                      ],
                      "skills": []
                    }
                    """);

            CandidateData data = loader.loadCandidate(file);

            assertThat(data.getBulletsByRole()).containsOnlyKeys("Nodelink", "MAMM");
            assertThat(data.getBulletsByRole().keySet()).containsExactly("Nodelink", "MAMM");

            List<BulletRecord> nodelink = data.bulletsFor("Nodelink");
            assertThat(nodelink).extracting(BulletRecord::getBullet).containsExactly("Built Kafka consumers", "Wrote docs");
            assertThat(nodelink.get(0).getLines()).isEqualTo(2);
            assertThat(nodelink.get(0).getCategory()).isEqualTo("Backend");
            assertThat(nodelink.get(0).getKeywords()).containsExactly("kafka", "java");
            assertThat(nodelink.get(1).getLines()).isZero();
            assertThat(nodelink.get(1).getKeywords()).containsExactly("docs", "writing");

            List<BulletRecord> mamm = data.bulletsFor("MAMM");
            assertThat(mamm).extracting(BulletRecord::getLines).containsExactly(1, 0);
            assertThat(data.bulletsFor("Unknown")).isEmpty();
        }

        @Test
        @DisplayName("Should build the skill taxonomy from comma-separated categories")
        void shouldLoadSkills() throws IOException {
            Path file = write("candidate.json", """
                    {
                      "bullets": [],
                      "skills": [
                        {"skill": "Docker", "category": "Cloud Platforms, DevOps Tools"},
                        {"skill": "Python", "category": "Programming Languages"},
                        {"skill": "Docker", "category": "Containers"},
                        {"skill": "Fortran", "category": " "},
                        {"skill": "", "category": "Orphans"}
                      ]
                    }
                    """);

            CandidateData data = loader.loadCandidate(file);

            assertThat(data.getSkills().skills()).containsExactly("Docker", "Python");
            assertThat(data.getSkills().categoriesOf("Docker"))
                    .containsExactly("Cloud Platforms", "DevOps Tools", "Containers");
        }

        @Test
        @DisplayName("Should tolerate missing sections")
        void shouldTolerateMissingSections() throws IOException {
            CandidateData data = loader.loadCandidate(write("candidate.json", "{}"));

            assertThat(data.getBulletsByRole()).isEmpty();
            assertThat(data.getSkills().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Should fail with the path for a missing or malformed file")
        void shouldFailForBadFiles() throws IOException {
            Path missing = tempDir.resolve("missing.json");
            Path malformed = write("broken.json", "{\"bullets\": [");
            Path notObject = write("array.json", "[]");

            assertThatThrownBy(() -> loader.loadCandidate(missing))
                    .isInstanceOf(CandidateDataException.class)
                    .hasMessageContaining("missing.json");
            assertThatThrownBy(() -> loader.loadCandidate(malformed))
                    .isInstanceOf(CandidateDataException.class)
                    .hasCauseInstanceOf(IOException.class);
            assertThatThrownBy(() -> loader.loadCandidate(notObject))
                    .isInstanceOf(CandidateDataException.class);
        }
    }

    @Nested
    @DisplayName("Job description")
    class JobDescriptionTests {

        @Test
        @DisplayName("Should read plain text as is")
        void shouldReadPlainText() throws IOException {
            Path file = write("job.txt", "  Must have: Java.\nNice to have: Kafka.\n");

            assertThat(loader.loadJobDescription(file)).isEqualTo("Must have: Java.\nNice to have: Kafka.");
        }

        @Test
        @DisplayName("Should reduce HTML to text with one line per block")
        void shouldStripHtml() throws IOException {
            Path file = write("job.html", """
                    <h2>Requirements</h2>
                    <ul><li>Java &amp; Spring</li><li>Kafka</li></ul>
                    <p>Nice to have: <b>Terraform</b></p>
                    """);

            String text = loader.loadJobDescription(file);

            assertThat(text).doesNotContain("<", ">", "&amp;");
            assertThat(text.lines().map(String::strip).filter(line -> !line.isEmpty()))
                    .containsExactly("Requirements", "Java & Spring", "Kafka", "Nice to have: Terraform");
        }

        @Test
        @DisplayName("Should fail for a missing job file")
        void shouldFailForMissingFile() {
            assertThatThrownBy(() -> loader.loadJobDescription(tempDir.resolve("nope.txt")))
                    .isInstanceOf(CandidateDataException.class)
                    .hasMessageContaining("nope.txt");
        }
    }
}
