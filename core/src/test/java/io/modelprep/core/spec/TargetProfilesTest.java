package io.modelprep.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.modelprep.core.engine.FilterReport;
import io.modelprep.core.engine.TreeFilter;
import io.modelprep.core.error.ProfileResolveException;
import io.modelprep.core.model.FilterProfile;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/** Tests for {@link TargetProfiles} and the built-in target profiles. */
@DisplayName("TargetProfiles")
class TargetProfilesTest {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger profilesLogger;

    @BeforeEach
    void attachAppender() {
        profilesLogger = (Logger) LoggerFactory.getLogger(TargetProfiles.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        profilesLogger.addAppender(logAppender);
    }

    @AfterEach
    void detachAppender() {
        profilesLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static ObjectNode model(String resource) throws IOException {
        try (InputStream in = TargetProfilesTest.class.getClassLoader().getResourceAsStream(resource)) {
            return (ObjectNode) YAML.readTree(in);
        }
    }

    @Nested
    @DisplayName("Built-in vz profile")
    class VerrazzanoProfile {

        @Test
        @DisplayName("strips node manager, machine, partition and migration settings and adds templates")
        void filtersDomainModel() throws IOException {
            FilterProfile vz = TargetProfiles.builtIn().resolve("vz");
            ObjectNode domain = model("models/domain.yaml");

            FilterReport report = new TreeFilter().apply(domain, vz);

            assertThat(domain).isEqualTo(model("models/domain-vz.yaml"));
            assertThat(report.profileId()).isEqualTo("vz");
            assertThat(report.instancesSynthesized()).isEqualTo(2);
            assertThat(report.sectionsRemoved()).isEqualTo(1);
        }

        @Test
        @DisplayName("applying the profile to its own output changes nothing")
        void idempotent() throws IOException {
            FilterProfile vz = TargetProfiles.builtIn().resolve("vz");
            ObjectNode once = model("models/domain.yaml");
            TreeFilter filter = new TreeFilter();
            filter.apply(once, vz);
            ObjectNode twice = once.deepCopy();

            FilterReport second = filter.apply(twice, vz);

            assertThat(twice).isEqualTo(once);
            assertThat(second.keysRemoved()).isZero();
            assertThat(second.instancesSynthesized()).isZero();
        }

        @Test
        @DisplayName("wko profile applies the same clean-up")
        void wkoMatchesVz() throws IOException {
            ObjectNode domain = model("models/domain.yaml");

            new TreeFilter().apply(domain, TargetProfiles.builtIn().resolve("wko"));

            assertThat(domain).isEqualTo(model("models/domain-vz.yaml"));
        }

        @Test
        @DisplayName("wko and vz share one rule table")
        void wkoRulesEqualVzRules() {
            TargetProfiles profiles = TargetProfiles.builtIn();

            FilterProfile wko = profiles.resolve("wko");

            assertThat(wko.id()).isEqualTo("wko");
            assertThat(wko.rules()).isEqualTo(profiles.resolve("vz").rules());
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("profiles are parsed once per resolver and the load is logged")
        void cachesAndLogs() {
            TargetProfiles profiles = TargetProfiles.builtIn();

            FilterProfile first = profiles.resolve("vz");
            FilterProfile second = profiles.resolve("vz");

            assertThat(second).isSameAs(first);
            assertThat(logAppender.list)
                    .filteredOn(e -> e.getFormattedMessage().startsWith("Loaded built-in filter profile vz@1.0.0"))
                    .hasSize(1);
        }

        @Test
        @DisplayName("external targets directory overrides and extends the built-ins")
        void externalTargetsDir() throws IOException {
            Path custom = Files.createDirectories(tempDir.resolve("vz"));
            Files.writeString(custom.resolve("filter.yaml"), """
                    profile: vz
                    version: "9.0.0"
                    rules:
                      - delete: {path: topology, keys: [Name]}
                    """);
            Path extra = Files.createDirectories(tempDir.resolve("k8s"));
            Files.writeString(extra.resolve("filter.yaml"), """
                    profile: k8s
                    version: "1.0.0"
                    rules:
                      - cleanup-if-empty: {path: resources}
                    """);
            TargetProfiles profiles = new TargetProfiles(new FilterProfileParser(), tempDir);

            assertThat(profiles.resolve("vz").version()).isEqualTo("9.0.0");
            assertThat(profiles.resolve("k8s").id()).isEqualTo("k8s");
            assertThat(profiles.resolve("wko").version()).isEqualTo("1.0.0");
        }

        @Test
        @DisplayName("unknown target lists the built-in targets")
        void unknownTarget() {
            assertThatThrownBy(() -> TargetProfiles.builtIn().resolve("openshift"))
                    .isInstanceOf(ProfileResolveException.class)
                    .hasMessageContaining("Unknown target 'openshift'")
                    .hasMessageContaining("[vz, wko]");
        }

        @Test
        @DisplayName("target names cannot escape the targets directory")
        void rejectsPathLikeNames() {
            TargetProfiles profiles = new TargetProfiles(new FilterProfileParser(), tempDir);

            assertThatThrownBy(() -> profiles.resolve("../vz")).isInstanceOf(ProfileResolveException.class);
            assertThatThrownBy(() -> profiles.resolve("")).isInstanceOf(ProfileResolveException.class);
            assertThatThrownBy(() -> profiles.resolve(null)).isInstanceOf(ProfileResolveException.class);
        }
    }
}
