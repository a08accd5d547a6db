package io.hhplus.bridge.application.settings.dto;

import io.hhplus.bridge.config.ContactUsProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contact Us 설정 조회 응답
 *
 * @param settings 전체 설정 키 (contact_us_bridge.xxx) → 값, 미설정 값은 null
 */
public record ContactUsSettingsResponse(
    boolean enableContactRequest,
    Integer consentContactReason,
    Map<String, Object> settings
) {
    public static ContactUsSettingsResponse from(ContactUsProperties properties) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put(
            ContactUsProperties.getConfigKey(ContactUsProperties.ENABLE_CONTACT_REQUEST),
            properties.isEnableContactRequest()
        );
        settings.put(
            ContactUsProperties.getConfigKey(ContactUsProperties.CONSENT_CONTACT_REASON),
            properties.getConsentContactReason()
        );

        return new ContactUsSettingsResponse(
            properties.isEnableContactRequest(),
            properties.getConsentContactReason(),
            Collections.unmodifiableMap(settings)
        );
    }
}
