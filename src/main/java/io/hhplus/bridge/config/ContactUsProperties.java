package io.hhplus.bridge.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * "Contact Us" 설정 (contact-us-bridge.*)
 *
 * 생애 가치 계산과는 무관한 수동 설정값입니다.
 * 설정 키는 {@link #getConfigKey(String)}로 "contact_us_bridge.&lt;key&gt;" 형태로 노출합니다.
 */
@ConfigurationProperties(prefix = "contact-us-bridge")
@NoArgsConstructor
@Getter
@Setter
public class ContactUsProperties {

    public static final String ROOT_NODE = "contact_us_bridge";
    public static final String ENABLE_CONTACT_REQUEST = "enable_contact_request";
    public static final String CONSENT_CONTACT_REASON = "consent_contact_reason";

    public static final String SECTION_MODEL_SEPARATOR = ".";
    public static final String SECTION_VIEW_SEPARATOR = "___";

    /** 문의 요청 기능 사용 여부. Default true. */
    private boolean enableContactRequest = true;

    /** 동의 수집 시 사용할 문의 사유 ID. 미설정 시 null. */
    private Integer consentContactReason;

    public static String getConfigKey(String key) {
        return getConfigKey(key, SECTION_MODEL_SEPARATOR);
    }

    public static String getConfigKey(String key, String separator) {
        return String.format("%s%s%s", ROOT_NODE, separator, key);
    }
}
