package com.hrplatform.infrastructure.crypto;

import com.hrplatform.domain.model.SensitiveFieldType;

/**
 * Display masks for decrypted sensitive values.
 *
 * <p>Every mask keeps a fixed number of leading and trailing characters and puts a
 * constant-width run of {@code *} in between, so the output shape does not reveal the input
 * length. Values too short to keep both ends come back fully masked. All functions are total:
 * {@code null} or blank input yields an empty string.
 *
 * <p>Masks must only be applied to values that were successfully decrypted.
 */
public final class MaskingPolicy {

    static final String PHONE_MASK = "****";
    static final String ID_NUMBER_MASK = "***********";
    static final String BANK_ACCOUNT_MASK = "**** **** **** ";
    static final String NAME_MASK = "**";
    static final String BIRTH_DATE_MASK = "-**-**";

    private MaskingPolicy() {
    }

    /**
     * {@code 13800138000 -> 138****8000}.
     */
    public static String maskPhone(String phone) {
        return keepEnds(phone, 3, 4, PHONE_MASK);
    }

    /**
     * {@code 110101199003071234 -> 110***********1234}.
     */
    public static String maskIdNumber(String idNumber) {
        return keepEnds(idNumber, 3, 4, ID_NUMBER_MASK);
    }

    /**
     * {@code 6222 0212 3456 7890 -> **** **** **** 7890}. Spaces and dashes are ignored.
     */
    public static String maskBankAccount(String bankAccount) {
        if (isBlank(bankAccount)) {
            return "";
        }
        String digits = bankAccount.replaceAll("[\\s-]", "");
        if (digits.length() < 8) {
            return placeholder(SensitiveFieldType.BANK_ACCOUNT);
        }
        return BANK_ACCOUNT_MASK + digits.substring(digits.length() - 4);
    }

    /**
     * {@code 张三丰 -> 张**}. Works on code points so surrogate pairs stay intact.
     */
    public static String maskName(String name) {
        if (isBlank(name)) {
            return "";
        }
        String trimmed = name.trim();
        if (trimmed.codePointCount(0, trimmed.length()) < 2) {
            return NAME_MASK;
        }
        int firstEnd = trimmed.offsetByCodePoints(0, 1);
        return trimmed.substring(0, firstEnd) + NAME_MASK;
    }

    /**
     * {@code 1990-03-07 -> 1990-**-**}.
     */
    public static String maskBirthDate(String birthDate) {
        if (isBlank(birthDate)) {
            return "";
        }
        String trimmed = birthDate.trim();
        if (trimmed.length() < 8) {
            return placeholder(SensitiveFieldType.BIRTH_DATE);
        }
        return trimmed.substring(0, 4) + BIRTH_DATE_MASK;
    }

    public static String mask(SensitiveFieldType type, String value) {
        switch (type) {
            case PHONE:
            case EMERGENCY_CONTACT_PHONE:
                return maskPhone(value);
            case ID_NUMBER:
                return maskIdNumber(value);
            case BANK_ACCOUNT:
                return maskBankAccount(value);
            case NAME:
                return maskName(value);
            case BIRTH_DATE:
                return maskBirthDate(value);
            default:
                return placeholder(type);
        }
    }

    /**
     * Fixed value shown when a field cannot be decrypted for masking.
     */
    public static String placeholder(SensitiveFieldType type) {
        switch (type) {
            case PHONE:
            case EMERGENCY_CONTACT_PHONE:
                return "***-****-****";
            case ID_NUMBER:
                return "***************";
            case BANK_ACCOUNT:
                return "**** **** **** ****";
            case NAME:
                return NAME_MASK;
            case BIRTH_DATE:
                return "****-**-**";
            default:
                return "****";
        }
    }

    private static String keepEnds(String value, int leading, int trailing, String mask) {
        if (isBlank(value)) {
            return "";
        }
        String trimmed = value.trim();
        if (trimmed.length() <= leading + trailing) {
            return "*".repeat(leading) + mask + "*".repeat(trailing);
        }
        return trimmed.substring(0, leading) + mask + trimmed.substring(trimmed.length() - trailing);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
