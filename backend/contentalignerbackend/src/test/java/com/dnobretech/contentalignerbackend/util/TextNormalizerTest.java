package com.dnobretech.contentalignerbackend.util;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer norm = new TextNormalizer();

    @Test
    void normalizeCollapsesSpacesAndAppliesNfkc() {
        assertThat(norm.normalize("  a \t\n b  ")).isEqualTo("a b");
        assertThat(norm.normalize("ｆｕｌｌ")).isEqualTo("full");
        assertThat(norm.normalize(null)).isEmpty();
    }

    @Test
    void cleanStripsHtmlAndDecodesEntities() {
        assertThat(norm.clean("<p>Hello <b>world</b></p>")).isEqualTo("Hello world");
        assertThat(norm.clean("Tom &amp; Jerry")).isEqualTo("Tom Jerry");
    }

    @Test
    void cleanKeepsCjkAndHangul() {
        assertThat(norm.clean("你好，世界！")).isEqualTo("你好 世界");
        assertThat(norm.clean("안녕하세요!")).isEqualTo("안녕하세요");
    }

    @Test
    void cleanKeepsAccentedLetters() {
        assertThat(norm.clean("Ação rápida, coração.")).isEqualTo("Ação rápida coração");
    }

    @Test
    void specialCharacterRemovalCanBeDisabled() {
        ReflectionTestUtils.setField(norm, "removeSpecialCharacters", false);
        assertThat(norm.clean("<i>Olá, mundo!</i>")).isEqualTo("Olá, mundo!");
    }

    @Test
    void blankInputCleansToEmpty() {
        assertThat(norm.clean(null)).isEmpty();
        assertThat(norm.clean("   ")).isEmpty();
        assertThat(norm.clean("<br/>")).isEmpty();
    }

    @Test
    void validityUsesConfiguredLengthBounds() {
        assertThat(norm.isContentValid("ab")).isFalse();
        assertThat(norm.isContentValid("abc")).isTrue();
        assertThat(norm.isContentValid("x".repeat(8000))).isTrue();
        assertThat(norm.isContentValid("x".repeat(8001))).isFalse();
        assertThat(norm.isContentValid("   ")).isFalse();
        assertThat(norm.isContentValid(null)).isFalse();

        ReflectionTestUtils.setField(norm, "minContentLength", 1);
        assertThat(norm.isContentValid("a")).isTrue();
    }
}
