package com.nnipa.admin.service;

import com.nnipa.admin.config.AdminProperties;
import com.nnipa.admin.dto.response.PasswordRequirementsResponse;
import com.nnipa.admin.enums.PasswordRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PasswordPolicyServiceTest {

    private final PasswordPolicyService policy = new PasswordPolicyService(new AdminProperties());

    @ParameterizedTest
    @ValueSource(strings = {"StrongPass1!", "Abcdefghij1#", "OldPass123!xyz", "XXXXXXXXXX9{"})
    @DisplayName("Passwords meeting every rule are accepted")
    void acceptsStrongPasswords(String candidate) {
        assertThat(policy.validate(candidate)).isTrue();
        assertThat(policy.check(candidate).getUnmetRules()).isEmpty();
    }

    @Test
    @DisplayName("Eleven characters is one too short")
    void rejectsShortPassword() {
        PasswordPolicyService.PasswordCheckResult result = policy.check("Short1!abcd");

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.getUnmetRules()).containsExactly(PasswordRule.MIN_LENGTH);
    }

    @Test
    @DisplayName("Exactly twelve characters is long enough")
    void acceptsMinimumLength() {
        assertThat(policy.validate("Abcdefghij1!")).isTrue();
    }

    @Test
    @DisplayName("Length counts characters, not UTF-16 units")
    void lengthCountsCodePoints() {
        String emoji = "\uD83D\uDE00";
        String eightCharacters = "Aa1!" + emoji.repeat(4);
        String twelveCharacters = "Aa1!" + emoji.repeat(8);

        assertThat(eightCharacters).hasSize(12);
        assertThat(policy.check(eightCharacters).getUnmetRules()).containsExactly(PasswordRule.MIN_LENGTH);
        assertThat(policy.validate(eightCharacters)).isFalse();
        assertThat(policy.validate(twelveCharacters)).isTrue();
    }

    @Test
    @DisplayName("Each missing character class is reported")
    void reportsMissingCharacterClasses() {
        assertThat(policy.check("lowercase123!").getUnmetRules()).containsExactly(PasswordRule.UPPERCASE);
        assertThat(policy.check("NoDigitsHere!!").getUnmetRules()).containsExactly(PasswordRule.DIGIT);
        assertThat(policy.check("NoSpecial1234").getUnmetRules()).containsExactly(PasswordRule.SPECIAL_CHARACTER);
    }

    @Test
    @DisplayName("Characters outside the special set do not count as special")
    void onlyListedSpecialCharactersCount() {
        assertThat(policy.validate("Password1234_")).isFalse();
        assertThat(policy.validate("Password1234-")).isFalse();
        assertThat(policy.validate("Password1234?")).isTrue();
    }

    @Test
    @DisplayName("Empty and null candidates fail every rule without throwing")
    void rejectsEmptyAndNull() {
        assertThat(policy.check("").getUnmetRules())
                .containsExactlyInAnyOrder(PasswordRule.values());
        assertThat(policy.check(null).getUnmetRules())
                .containsExactlyInAnyOrder(PasswordRule.values());
        assertThat(policy.validate(null)).isFalse();
    }

    @Test
    @DisplayName("Rejections carry a human readable message per unmet rule")
    void errorsDescribeUnmetRules() {
        PasswordPolicyService.PasswordCheckResult result = policy.check("short");

        assertThat(result.getErrors()).hasSameSizeAs(result.getUnmetRules());
        assertThat(result.getErrors()).contains(PasswordRule.MIN_LENGTH.getDescription());
    }

    @Test
    @DisplayName("Published requirements reflect the enforced rules")
    void requirementsMatchPolicy() {
        PasswordRequirementsResponse requirements = policy.requirements();

        assertThat(requirements.getMinLength()).isEqualTo(12);
        assertThat(requirements.getSpecialCharacters()).isEqualTo(PasswordPolicyService.SPECIAL_CHARACTERS);
        assertThat(requirements.getHistoryWindow()).isEqualTo(PasswordHistoryGuard.HISTORY_WINDOW);
        assertThat(requirements.getMaxAgeDays()).isEqualTo(90);
        assertThat(requirements.getRules()).hasSize(PasswordRule.values().length);
    }
}
