package io.modelprep.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RulePathTest {

    @Test
    void parsesDottedPath() {
        RulePath path = RulePath.parse("topology.SecurityConfiguration");

        assertThat(path.segments()).containsExactly("topology", "SecurityConfiguration");
        assertThat(path.leaf()).isEqualTo("SecurityConfiguration");
        assertThat(path.parent()).isEqualTo(RulePath.of("topology"));
        assertThat(path).hasToString("topology.SecurityConfiguration");
    }

    @Test
    void topLevelPathHasNoParentSection() {
        RulePath path = RulePath.parse("resources");

        assertThat(path.isTopLevel()).isTrue();
        assertThatThrownBy(path::parent).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void childAndPrefix() {
        RulePath cluster = RulePath.parse("topology.Cluster");

        assertThat(cluster.child("c1")).isEqualTo(RulePath.of("topology", "Cluster", "c1"));
        assertThat(cluster.child("c1").prefix(1)).isEqualTo(RulePath.of("topology"));
    }

    @Test
    void rejectsBlankPaths() {
        assertThatThrownBy(() -> RulePath.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RulePath.parse("topology.")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RulePath.parse(".topology")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RulePath(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void segmentsAreImmutable() {
        RulePath path = RulePath.parse("topology.Cluster");

        assertThatThrownBy(() -> path.segments().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
