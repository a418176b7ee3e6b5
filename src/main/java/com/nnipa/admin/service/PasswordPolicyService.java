package com.nnipa.admin.service;

import com.nnipa.admin.config.AdminProperties;
import com.nnipa.admin.dto.response.PasswordRequirementsResponse;
import com.nnipa.admin.enums.PasswordRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.passay.CharacterData;
import org.passay.CharacterRule;
import org.passay.EnglishCharacterData;
import org.passay.LengthRule;
import org.passay.PasswordData;
import org.passay.PasswordValidator;
import org.passay.Rule;
import org.passay.RuleResult;
import org.passay.RuleResultDetail;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Password strength policy. The rule set is fixed in code; the constants below feed both
 * {@link #validate(String)} and {@link #requirements()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordPolicyService {

    public static final int MIN_LENGTH = 12;
    public static final String SPECIAL_CHARACTERS = "!@#$%^&*(),.?\":{}|<>";
    public static final String SPECIAL_ERROR_CODE = "INSUFFICIENT_SPECIAL";

    private static final CharacterData SPECIAL = new CharacterData() {
        @Override
        public String getErrorCode() {
            return SPECIAL_ERROR_CODE;
        }

        @Override
        public String getCharacters() {
            return SPECIAL_CHARACTERS;
        }
    };

    private static final PasswordValidator VALIDATOR = new PasswordValidator(List.of(
            new CodePointLengthRule(MIN_LENGTH),
            new CharacterRule(EnglishCharacterData.UpperCase, 1),
            new CharacterRule(EnglishCharacterData.Digit, 1),
            new CharacterRule(SPECIAL, 1)
    ));

    private final AdminProperties adminProperties;

    /**
     * @return true iff the candidate satisfies every {@link PasswordRule}
     */
    public boolean validate(String candidate) {
        return check(candidate).isAccepted();
    }

    /**
     * Evaluate the candidate and report every unmet rule. Never throws.
     */
    public PasswordCheckResult check(String candidate) {
        if (candidate == null) {
            return PasswordCheckResult.of(EnumSet.allOf(PasswordRule.class));
        }

        RuleResult result = VALIDATOR.validate(new PasswordData(candidate));
        if (result.isValid()) {
            return PasswordCheckResult.of(EnumSet.noneOf(PasswordRule.class));
        }

        Set<PasswordRule> unmet = EnumSet.noneOf(PasswordRule.class);
        for (RuleResultDetail detail : result.getDetails()) {
            PasswordRule.fromErrorCode(detail.getErrorCode()).ifPresent(unmet::add);
        }
        log.debug("Password rejected by policy, unmet rules: {}", unmet);
        return PasswordCheckResult.of(unmet);
    }

    public PasswordRequirementsResponse requirements() {
        List<PasswordRequirementsResponse.Requirement> rules = new ArrayList<>();
        for (PasswordRule rule : PasswordRule.values()) {
            rules.add(PasswordRequirementsResponse.Requirement.builder()
                    .code(rule.name())
                    .description(rule.getDescription())
                    .build());
        }

        return PasswordRequirementsResponse.builder()
                .minLength(MIN_LENGTH)
                .requireUppercase(true)
                .requireDigit(true)
                .requireSpecial(true)
                .specialCharacters(SPECIAL_CHARACTERS)
                .historyWindow(PasswordHistoryGuard.HISTORY_WINDOW)
                .maxAgeDays(adminProperties.getPassword().getMaxAgeDays())
                .rules(rules)
                .message("Password must be at least " + MIN_LENGTH
                        + " characters with uppercase, number, and special character")
                .build();
    }

    /**
     * Minimum length counted in code points. Passay's {@link LengthRule} counts UTF-16 units,
     * so a character outside the BMP would count twice there.
     */
    static final class CodePointLengthRule implements Rule {

        private final int minimumLength;

        CodePointLengthRule(int minimumLength) {
            this.minimumLength = minimumLength;
        }

        @Override
        public RuleResult validate(PasswordData passwordData) {
            String password = passwordData.getPassword();
            int length = password.codePointCount(0, password.length());
            RuleResult result = new RuleResult(true);
            if (length < minimumLength) {
                result.setValid(false);
                result.addError(LengthRule.ERROR_CODE_MIN, Map.of(
                        "minimumLength", minimumLength,
                        "length", length));
            }
            return result;
        }
    }

    /**
     * Outcome of a policy check.
     */
    @lombok.Value
    public static class PasswordCheckResult {
        boolean accepted;
        List<PasswordRule> unmetRules;
        List<String> errors;

        static PasswordCheckResult of(Set<PasswordRule> unmet) {
            List<PasswordRule> rules = List.copyOf(unmet);
            List<String> errors = rules.stream().map(PasswordRule::getDescription).toList();
            return new PasswordCheckResult(rules.isEmpty(), rules, errors);
        }
    }
}
