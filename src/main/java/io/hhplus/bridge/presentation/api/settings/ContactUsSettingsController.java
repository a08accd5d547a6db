package io.hhplus.bridge.presentation.api.settings;

import io.hhplus.bridge.application.settings.dto.ContactUsSettingsResponse;
import io.hhplus.bridge.config.ContactUsProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class ContactUsSettingsController {

    private final ContactUsProperties contactUsProperties;

    @GetMapping("/contact-us")
    public ResponseEntity<ContactUsSettingsResponse> getContactUsSettings() {
        return ResponseEntity.ok(ContactUsSettingsResponse.from(contactUsProperties));
    }
}
