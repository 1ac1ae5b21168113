package es.hargos.tenantguard.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LimitSetting")
class LimitSettingTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("explicit null is unlimited")
        void nullIsUnlimited() {
            assertThat(LimitSetting.normalize(null)).isEqualTo(LimitSetting.UNLIMITED);
        }

        @Test
        @DisplayName("positive integral numbers become ceilings")
        void positiveIntegers() {
            assertThat(LimitSetting.normalize(25).toLimit()).isEqualTo(25);
            assertThat(LimitSetting.normalize(25L).toLimit()).isEqualTo(25);
            assertThat(LimitSetting.normalize(3.0d).toLimit()).isEqualTo(3);
        }

        @Test
        @DisplayName("zero, negatives, fractions, strings and overflow are absent")
        void malformedIsAbsent() {
            assertThat(LimitSetting.normalize(0)).isEqualTo(LimitSetting.ABSENT);
            assertThat(LimitSetting.normalize(-4)).isEqualTo(LimitSetting.ABSENT);
            assertThat(LimitSetting.normalize(2.5d)).isEqualTo(LimitSetting.ABSENT);
            assertThat(LimitSetting.normalize("10")).isEqualTo(LimitSetting.ABSENT);
            assertThat(LimitSetting.normalize(Double.NaN)).isEqualTo(LimitSetting.ABSENT);
            assertThat(LimitSetting.normalize(Long.MAX_VALUE)).isEqualTo(LimitSetting.ABSENT);
        }

        @Test
        @DisplayName("of rejects non-positive ceilings")
        void ofRejectsZero() {
            assertThatThrownBy(() -> LimitSetting.of(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("fromMap")
    class FromMap {

        @Test
        @DisplayName("missing map and missing key are absent, explicit null is unlimited")
        void presenceSemantics() {
            Map<String, Object> source = new HashMap<>();
            source.put("maxAuthTokensPerUser", null);

            assertThat(LimitSetting.fromMap(null, "maxAuthTokensPerUser")).isEqualTo(LimitSetting.ABSENT);
            assertThat(LimitSetting.fromMap(source, "maxPendingInvitations")).isEqualTo(LimitSetting.ABSENT);
            assertThat(LimitSetting.fromMap(source, "maxAuthTokensPerUser").isUnlimited()).isTrue();
        }

        @Test
        @DisplayName("first matching key wins")
        void firstKeyWins() {
            Map<String, Object> source = Map.of("max_pending_invitations", 7);
            assertThat(LimitSetting.fromMap(source, "maxPendingInvitations", "max_pending_invitations").toLimit())
                    .isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("override beats tier default beats fallback")
        void priority() {
            assertThat(LimitSetting.resolve(LimitSetting.of(3), LimitSetting.of(10), LimitSetting.of(50))).isEqualTo(3);
            assertThat(LimitSetting.resolve(LimitSetting.ABSENT, LimitSetting.of(10), LimitSetting.of(50))).isEqualTo(10);
            assertThat(LimitSetting.resolve(LimitSetting.ABSENT, LimitSetting.ABSENT, LimitSetting.of(50))).isEqualTo(50);
        }

        @Test
        @DisplayName("explicit unlimited override stops resolution")
        void unlimitedOverride() {
            assertThat(LimitSetting.resolve(LimitSetting.UNLIMITED, LimitSetting.of(10), LimitSetting.of(50))).isNull();
        }

        @Test
        @DisplayName("all absent is unlimited")
        void allAbsent() {
            assertThat(LimitSetting.resolve(LimitSetting.ABSENT, LimitSetting.ABSENT, LimitSetting.ABSENT)).isNull();
        }
    }
}
