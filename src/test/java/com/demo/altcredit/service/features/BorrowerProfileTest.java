package com.demo.altcredit.service.features;

import com.demo.altcredit.service.BorrowerValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BorrowerProfile")
class BorrowerProfileTest {

    @ParameterizedTest
    @ValueSource(strings = {"student", "STUDENT", "  Student ", "sTuDeNt"})
    @DisplayName("Tags are matched case-insensitively after trimming")
    void parsesLenientTags(String raw) {
        assertThat(BorrowerProfile.fromTag(raw)).isEqualTo(BorrowerProfile.STUDENT);
    }

    @Test
    @DisplayName("Unknown tag lists the accepted values")
    void rejectsUnknownTag() {
        assertThatThrownBy(() -> BorrowerProfile.fromTag("Retired"))
                .isInstanceOf(BorrowerValidationException.class)
                .hasMessage("profile_type must be one of [salaried, student, gig, shopkeeper, rural]. Got: 'retired'");
    }

    @Test
    @DisplayName("Missing tag is rejected")
    void rejectsNull() {
        assertThatThrownBy(() -> BorrowerProfile.fromTag(null))
                .isInstanceOf(BorrowerValidationException.class);
    }

    @Test
    @DisplayName("Only salaried has no one-hot slot")
    void flags() {
        assertThat(BorrowerProfile.SALARIED.flag()).isNull();
        assertThat(BorrowerProfile.RURAL.flag()).isEqualTo(Feature.IS_RURAL);
        assertThat(BorrowerProfile.tags()).containsExactly("salaried", "student", "gig", "shopkeeper", "rural");
    }
}
