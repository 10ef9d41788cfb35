package com.phillippitts.recallahead.service.trigger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InputTriggerPolicyTest {

    private final InputTriggerPolicy policy = new InputTriggerPolicy(5, 2, 3);

    @Test
    void rejectsShortOrLetterlessOrSingleWordText() {
        assertThat(policy.shouldTrigger(null)).isFalse();
        assertThat(policy.shouldTrigger("hi")).isFalse();
        assertThat(policy.shouldTrigger("12345 678")).isFalse();
        assertThat(policy.shouldTrigger("hello")).isFalse();
        assertThat(policy.shouldTrigger("wonderful.")).isFalse();
    }

    @Test
    void sentencePunctuationTriggersWithTwoWords() {
        assertThat(policy.shouldTrigger("hello there.")).isTrue();
        assertThat(policy.shouldTrigger("what now?")).isTrue();
        assertThat(policy.shouldTrigger("do it!")).isTrue();
    }

    @Test
    void withoutPunctuationThreeWordsAreNeeded() {
        assertThat(policy.shouldTrigger("hello there")).isFalse();
        assertThat(policy.shouldTrigger("explain react hooks")).isTrue();
        assertThat(policy.shouldTrigger("  explain   react   hooks  ")).isTrue();
    }

    @Test
    void dotEndingAUrlDoesNotCountAsSentenceEnd() {
        assertThat(policy.shouldTrigger("visit www.example.com.")).isFalse();
        assertThat(policy.shouldTrigger("see https://example.com/page.")).isFalse();
        assertThat(policy.shouldTrigger("see https://example.com .")).isTrue();
    }

    @Test
    void urlTextWithEnoughWordsStillTriggersWithoutPunctuation() {
        assertThat(policy.shouldTrigger("read about https://example.com today")).isTrue();
    }
}
