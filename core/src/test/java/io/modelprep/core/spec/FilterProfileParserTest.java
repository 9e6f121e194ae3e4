package io.modelprep.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.modelprep.core.error.RuleParseException;
import io.modelprep.core.model.CleanupIfEmpty;
import io.modelprep.core.model.DeleteKeys;
import io.modelprep.core.model.FilterProfile;
import io.modelprep.core.model.RulePath;
import io.modelprep.core.model.Scope;
import io.modelprep.core.model.SetValue;
import io.modelprep.core.model.SynthesizeFromSiblings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link FilterProfileParser}. */
@DisplayName("FilterProfileParser")
class FilterProfileParserTest {

    @TempDir
    Path tempDir;

    private final FilterProfileParser parser = new FilterProfileParser();

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("filter.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("Valid profiles")
    class ValidProfiles {

        @Test
        @DisplayName("parses every rule kind in declaration order")
        void parsesAllRuleKinds() {
            FilterProfile profile = parser.parse(Path.of("src/test/resources/profiles/all-rule-kinds.yaml"));

            assertThat(profile.id()).isEqualTo("all-kinds");
            assertThat(profile.version()).isEqualTo("2.0.0");
            assertThat(profile.description()).isEqualTo("One rule of each kind");
            assertThat(profile.rules()).hasSize(5);

            DeleteKeys delete = (DeleteKeys) profile.rules().get(0);
            assertThat(delete.path()).isEqualTo(RulePath.of("topology"));
            assertThat(delete.keys()).containsExactly("NMProperties", "Machine");
            assertThat(delete.scope()).isEqualTo(Scope.SECTION);

            DeleteKeys deleteEach = (DeleteKeys) profile.rules().get(1);
            assertThat(deleteEach.scope()).isEqualTo(Scope.EACH_INSTANCE);

            SetValue set = (SetValue) profile.rules().get(2);
            assertThat(set.key()).isEqualTo("AutoMigrationEnabled");
            assertThat(set.value().isBoolean()).isTrue();
            assertThat(set.value().booleanValue()).isFalse();

            SynthesizeFromSiblings synthesize = (SynthesizeFromSiblings) profile.rules().get(3);
            assertThat(synthesize.source()).isEqualTo(RulePath.of("topology", "Cluster"));
            assertThat(synthesize.target()).isEqualTo(RulePath.of("topology", "ServerTemplate"));
            assertThat(synthesize.nameField()).isEqualTo("Cluster");
            assertThat(synthesize.fields()).containsOnlyKeys("AutoMigrationEnabled", "ListenPort");
            assertThat(synthesize.fields().get("ListenPort").intValue()).isEqualTo(8001);

            assertThat(profile.rules().get(4)).isEqualTo(new CleanupIfEmpty(RulePath.of("topology", "SecurityConfiguration")));
        }

        @Test
        @DisplayName("list paths allow keys containing dots")
        void listPath() throws IOException {
            Path file = write("""
                    profile: dotted
                    version: "1"
                    rules:
                      - delete:
                          path: [resources, "jdbc.ds"]
                          keys: [Target]
                    """);

            FilterProfile profile = parser.parse(file);

            assertThat(profile.rules().get(0).path().segments()).containsExactly("resources", "jdbc.ds");
        }

        @Test
        @DisplayName("loads a profile from the classpath")
        void classpathResource() {
            FilterProfile profile = parser.parseResource("targets/vz/filter.yaml");

            assertThat(profile.id()).isEqualTo("vz");
            assertThat(profile.rules()).hasSize(8);
        }
    }

    @Nested
    @DisplayName("Invalid profiles")
    class InvalidProfiles {

        @Test
        @DisplayName("missing rules array is a schema violation")
        void missingRules() throws IOException {
            Path file = write("""
                    profile: broken
                    version: "1"
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("rules")
                    .satisfies(e -> {
                        RuleParseException ex = (RuleParseException) e;
                        assertThat(ex.profileId()).isEqualTo("broken");
                        assertThat(ex.source()).isEqualTo(file.toString());
                    });
        }

        @Test
        @DisplayName("unknown keys inside a rule are rejected")
        void unknownRuleKey() throws IOException {
            Path file = write("""
                    profile: typo
                    version: "1"
                    rules:
                      - delete:
                          path: topology
                          key: [Machine]
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageStartingWith("Invalid filter profile");
        }

        @Test
        @DisplayName("an entry with two rule kinds is rejected")
        void twoKindsInOneEntry() throws IOException {
            Path file = write("""
                    profile: double
                    version: "1"
                    rules:
                      - delete: {path: topology, keys: [Machine]}
                        cleanup-if-empty: {path: topology}
                    """);

            assertThatThrownBy(() -> parser.parse(file)).isInstanceOf(RuleParseException.class);
        }

        @Test
        @DisplayName("empty path segment names the rule index")
        void emptyPathSegment() throws IOException {
            Path file = write("""
                    profile: gaps
                    version: "1"
                    rules:
                      - cleanup-if-empty: {path: topology}
                      - delete: {path: "topology..Cluster", keys: [Machine]}
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("rules[1]")
                    .hasMessageContaining("blank");
        }

        @Test
        @DisplayName("synthesize with identical source and target is rejected")
        void synthesizeSameSourceAndTarget() throws IOException {
            Path file = write("""
                    profile: loop
                    version: "1"
                    rules:
                      - synthesize: {source: topology.Cluster, target: topology.Cluster, name-field: Cluster}
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("must differ");
        }

        @Test
        @DisplayName("malformed YAML and non-mapping documents are rejected")
        void notAMapping() throws IOException {
            Path list = write("- just\n- a list\n");
            assertThatThrownBy(() -> parser.parse(list))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("YAML mapping");

            Path broken = write("profile: [unclosed\n");
            assertThatThrownBy(() -> parser.parse(broken))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("Failed to parse");
        }

        @Test
        @DisplayName("missing file and missing resource are load errors")
        void missingSources() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.yaml")))
                    .isInstanceOf(RuleParseException.class);
            assertThatThrownBy(() -> parser.parseResource("targets/absent/filter.yaml"))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("not found");
        }
    }
}
