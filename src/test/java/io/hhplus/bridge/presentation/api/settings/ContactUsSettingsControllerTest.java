package io.hhplus.bridge.presentation.api.settings;

import io.hhplus.bridge.config.PropertiesConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ContactUsSettingsController.class)
@Import(PropertiesConfig.class)
@TestPropertySource(properties = {
    "contact-us-bridge.enable-contact-request=false",
    "contact-us-bridge.consent-contact-reason=3"
})
class ContactUsSettingsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Contact Us 설정 조회 API - 전체 설정 키로 반환")
    void getContactUsSettings_성공() throws Exception {
        mockMvc.perform(get("/api/settings/contact-us"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enableContactRequest").value(false))
                .andExpect(jsonPath("$.consentContactReason").value(3))
                .andExpect(jsonPath("$.settings['contact_us_bridge.enable_contact_request']").value(false))
                .andExpect(jsonPath("$.settings['contact_us_bridge.consent_contact_reason']").value(3));
    }
}
