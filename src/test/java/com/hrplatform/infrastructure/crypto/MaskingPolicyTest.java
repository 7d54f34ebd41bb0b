package com.hrplatform.infrastructure.crypto;

import com.hrplatform.domain.model.SensitiveFieldType;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class MaskingPolicyTest {

    @Test
    void phone_keeps_first_three_and_last_four() {
        assertEquals("138****8000", MaskingPolicy.maskPhone("13800138000"));
    }

    @Test
    void phone_mask_width_does_not_depend_on_input_length() {
        assertEquals(11, MaskingPolicy.maskPhone("13800138000").length());
        assertEquals(11, MaskingPolicy.maskPhone("+8613800138000").length());
        assertEquals("+86****8000", MaskingPolicy.maskPhone("+8613800138000"));
    }

    @Test
    void phone_mask_is_locale_independent() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals("138****8000", MaskingPolicy.maskPhone("13800138000"));
            Locale.setDefault(Locale.CHINA);
            assertEquals("138****8000", MaskingPolicy.maskPhone("13800138000"));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void values_too_short_to_keep_ends_are_fully_masked() {
        assertEquals("***********", MaskingPolicy.maskPhone("1234567"));
        assertEquals("******************", MaskingPolicy.maskIdNumber("123"));
    }

    @Test
    void id_number_keeps_first_three_and_last_four() {
        assertEquals("110***********1234", MaskingPolicy.maskIdNumber("110101199003071234"));
        assertEquals("110***********7012", MaskingPolicy.maskIdNumber("110101900307012"));
    }

    @Test
    void bank_account_keeps_last_four_ignoring_separators() {
        assertEquals("**** **** **** 7890", MaskingPolicy.maskBankAccount("6222 0212 3456 7890"));
        assertEquals("**** **** **** 7890", MaskingPolicy.maskBankAccount("6222-0212-3456-7890"));
        assertEquals("**** **** **** ****", MaskingPolicy.maskBankAccount("1234567"));
    }

    @Test
    void name_keeps_first_character() {
        assertEquals("张**", MaskingPolicy.maskName("张三丰"));
        assertEquals("张**", MaskingPolicy.maskName("张三"));
        assertEquals("**", MaskingPolicy.maskName("张"));
        assertEquals("L**", MaskingPolicy.maskName("Li Wei"));
    }

    @Test
    void name_mask_keeps_surrogate_pairs_intact() {
        assertEquals("𠮷**", MaskingPolicy.maskName("𠮷野家"));
    }

    @Test
    void birth_date_keeps_year() {
        assertEquals("1990-**-**", MaskingPolicy.maskBirthDate("1990-03-07"));
        assertEquals("****-**-**", MaskingPolicy.maskBirthDate("1990"));
    }

    @Test
    void blank_input_yields_empty_string() {
        assertEquals("", MaskingPolicy.maskPhone(null));
        assertEquals("", MaskingPolicy.maskIdNumber("   "));
        assertEquals("", MaskingPolicy.maskBankAccount(""));
        assertEquals("", MaskingPolicy.maskName(null));
        assertEquals("", MaskingPolicy.maskBirthDate(null));
    }

    @Test
    void mask_dispatches_by_field_type() {
        assertEquals("139****0000", MaskingPolicy.mask(SensitiveFieldType.EMERGENCY_CONTACT_PHONE, "13900000000"));
        assertEquals("王**", MaskingPolicy.mask(SensitiveFieldType.NAME, "王五"));
        for (SensitiveFieldType type : SensitiveFieldType.values()) {
            assertFalse(MaskingPolicy.placeholder(type).isEmpty());
        }
    }
}
