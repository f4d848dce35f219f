/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreePathTest {

    private final TreeBranch doc = TreeBranch.builder()
            .put("spec", TreeBranch.builder()
                    .put("containers", TreeList.of(
                            TreeBranch.builder().put("image", "nginx").build(),
                            TreeBranch.builder().put("image", "redis").build()))
                    .build())
            .put("replicas", Scalar.of(3))
            .build();

    @Test
    void parse() {
        assertThat(TreePath.parse("[\"spec\"][0]['image']").steps())
                .containsExactly(new TreePath.KeyStep("spec"), new TreePath.IndexStep(0), new TreePath.KeyStep("image"));
    }

    @Test
    void keysMayContainBracketsAndOtherQuotes() {
        assertThat(TreePath.parse("['a\"b]']").steps()).containsExactly(new TreePath.KeyStep("a\"b]"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "spec", "[spec]", "[\"spec\"", "[-1]", "[\"a\"]x", "['a']['b'" })
    void rejectsMalformedPaths(String text) {
        assertThatThrownBy(() -> TreePath.parse(text)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void extract() {
        assertThat(TreePath.parse("[\"spec\"][\"containers\"][1][\"image\"]").extract(doc)).isEqualTo(Scalar.of("redis"));
        assertThat(TreePath.parse("[\"replicas\"]").extract(doc)).isEqualTo(Scalar.of(3));
    }

    @Test
    void extractMissing() {
        assertThatThrownBy(() -> TreePath.parse("[\"nope\"]").extract(doc))
                .isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> TreePath.parse("[\"spec\"][\"containers\"][2]").extract(doc))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("[\"spec\"][\"containers\"]");
        assertThatThrownBy(() -> TreePath.parse("[\"replicas\"][0]").extract(doc))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setReplaces() {
        TreeBranch updated = TreePath.parse("[\"spec\"][\"containers\"][0][\"image\"]").set(doc, Scalar.of("httpd"));

        assertThat(TreePath.parse("[\"spec\"][\"containers\"][0][\"image\"]").extract(updated)).isEqualTo(Scalar.of("httpd"));
        assertThat(TreePath.parse("[\"spec\"][\"containers\"][0][\"image\"]").extract(doc)).isEqualTo(Scalar.of("nginx"));
        assertThat(updated.items().get(0).name()).contains("spec");
    }

    @Test
    void setCreatesMissingBranches() {
        TreeBranch updated = TreePath.parse("[\"db\"][\"password\"]").set(doc, Scalar.of("secret"));

        assertThat(updated.get("db")).contains(TreeBranch.builder().put("password", "secret").build());
    }

    @Test
    void setAppendsOnePastTheEnd() {
        TreeBranch updated = TreePath.parse("[\"spec\"][\"containers\"][2]").set(doc, Scalar.of("sidecar"));

        assertThat(((TreeList) TreePath.parse("[\"spec\"][\"containers\"]").extract(updated)).values()).hasSize(3);
        assertThatThrownBy(() -> TreePath.parse("[\"spec\"][\"containers\"][5]").set(doc, Scalar.of("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void roundTripsThroughText() {
        TreePath path = TreePath.parse("['spec'][0]");
        assertThat(TreePath.parse(path.toString())).isEqualTo(path);
    }
}
