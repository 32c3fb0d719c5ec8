package com.bluequee.tabconfig.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for TabScope.
 *
 * <p>WHY: The read path and the write path share this one precedence table; a wrong priority would
 * silently let an organization setting beat a user's own preference.
 */
@DisplayName("TabScope")
class TabScopeTest {

    @Nested
    @DisplayName("precedence")
    class Precedence {

        @Test
        @DisplayName("priorities increase from system to user")
        void prioritiesIncrease() {
            assertThat(TabScope.SYSTEM.priority()).isEqualTo(1);
            assertThat(TabScope.ORGANIZATION.priority()).isEqualTo(2);
            assertThat(TabScope.ROLE.priority()).isEqualTo(3);
            assertThat(TabScope.USER.priority()).isEqualTo(4);
        }

        @Test
        @DisplayName("user outranks role, role outranks organization, organization outranks system")
        void outranksChain() {
            assertThat(TabScope.USER.outranks(TabScope.ROLE)).isTrue();
            assertThat(TabScope.ROLE.outranks(TabScope.ORGANIZATION)).isTrue();
            assertThat(TabScope.ORGANIZATION.outranks(TabScope.SYSTEM)).isTrue();
        }

        @Test
        @DisplayName("a scope never outranks itself or a more specific one")
        void notReflexive() {
            assertThat(TabScope.ROLE.outranks(TabScope.ROLE)).isFalse();
            assertThat(TabScope.SYSTEM.outranks(TabScope.USER)).isFalse();
        }
    }

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        @DisplayName("wire values parse case-insensitively")
        void parsesWireValues() {
            assertThat(TabScope.parse("organization")).isEqualTo(TabScope.ORGANIZATION);
            assertThat(TabScope.parse(" USER ")).isEqualTo(TabScope.USER);
            assertThat(TabScope.fromString("role")).contains(TabScope.ROLE);
        }

        @Test
        @DisplayName("unknown values are rejected")
        void unknownRejected() {
            assertThat(TabScope.fromString("tenant")).isEmpty();
            assertThat(TabScope.fromString(null)).isEmpty();
            assertThatThrownBy(() -> TabScope.parse("tenant"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tenant");
        }
    }
}
