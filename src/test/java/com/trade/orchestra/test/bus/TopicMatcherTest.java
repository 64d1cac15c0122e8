package com.trade.orchestra.test.bus;

import com.trade.orchestra.bus.TopicMatcher;
import com.trade.orchestra.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicMatcherTest {

    @Test
    void matchesExactAndWildcardPatterns() {
        assertThat(TopicMatcher.matches("a.b.c", "a.b.c")).isTrue();
        assertThat(TopicMatcher.matches("a.b.c", "a.*.c")).isTrue();
        assertThat(TopicMatcher.matches("a.b.c", "a.>")).isTrue();
        assertThat(TopicMatcher.matches("a.b.c", "*.b.*")).isTrue();
        assertThat(TopicMatcher.matches("a.b.c", ">")).isTrue();
    }

    @Test
    void rejectsSegmentCountMismatch() {
        assertThat(TopicMatcher.matches("a.b.c", "a.b")).isFalse();
        assertThat(TopicMatcher.matches("a.b.c", "a.b.c.d")).isFalse();
        assertThat(TopicMatcher.matches("a.b", "a.b.*")).isFalse();
        assertThat(TopicMatcher.matches("a.b.c.d", "a.b.*")).isFalse();
    }

    @Test
    void tailWildcardMatchesRegardlessOfRemainingLength() {
        assertThat(TopicMatcher.matches("a", "a.>")).isTrue();
        assertThat(TopicMatcher.matches("a.b", "a.b.>")).isTrue();
        assertThat(TopicMatcher.matches("a", "a.*.>")).isTrue();
        assertThat(TopicMatcher.matches("a.b.c.d.e", "a.>")).isTrue();
        assertThat(TopicMatcher.matches("b", "a.>")).isFalse();
        assertThat(TopicMatcher.matches("a", "a.*.c.>")).isFalse();
    }

    @Test
    void tailWildcardMustBeLast() {
        assertThatThrownBy(() -> TopicMatcher.validate("a.>.c"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> TopicMatcher.validate("a..c"))
                .isInstanceOf(ValidationException.class);
        assertThat(TopicMatcher.validate("risk.alert.*")).isEqualTo("risk.alert.*");
    }

    @Test
    void regexFormAgreesWithMatcher() {
        assertThat(TopicMatcher.toRegex("trading.signal.*").matcher("trading.signal.generated").matches()).isTrue();
        assertThat(TopicMatcher.toRegex("trading.signal.*").matcher("trading.signal.generated.reply").matches()).isFalse();
        assertThat(TopicMatcher.toRegex("trading.>").matcher("trading.order.filled").matches()).isTrue();
        assertThat(TopicMatcher.toRegex("trading.>").matcher("trading").matches()).isTrue();
        assertThat(TopicMatcher.toRegex("trading.>").matcher("tradingX").matches()).isFalse();
        assertThat(TopicMatcher.toRegex("a.*.>").matcher("a").matches()).isTrue();
        assertThat(TopicMatcher.toRegex("a.*.c.>").matcher("a").matches()).isFalse();
        assertThat(TopicMatcher.toRegex("a.*.c.>").matcher("a.b.c.d").matches()).isTrue();
        assertThat(TopicMatcher.toRegex("*.>").matcher("risk").matches()).isTrue();
        assertThat(TopicMatcher.toRegex("risk.alert.critical").matcher("riskXalert.critical").matches()).isFalse();
    }

    @Test
    void regexFormAgreesWithMatcherAcrossPatterns() {
        String[] topics = {"a", "a.b", "a.b.c", "a.b.c.d", "b.b.c", "a.x.c"};
        String[] patterns = {"a", "a.b", "a.*", "a.>", "a.*.>", "a.*.c", "a.*.c.>", "*.b.*", ">", "*.>", "a.b.c.d"};
        for (String pattern : patterns) {
            for (String topic : topics) {
                assertThat(TopicMatcher.toRegex(pattern).matcher(topic).matches())
                        .as("%s vs %s", topic, pattern)
                        .isEqualTo(TopicMatcher.matches(topic, pattern));
            }
        }
    }
}
