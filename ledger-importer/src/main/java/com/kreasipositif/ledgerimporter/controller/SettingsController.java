package com.kreasipositif.ledgerimporter.controller;

import com.kreasipositif.ledgerimporter.service.SettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/settings")
@RequiredArgsConstructor
@Tag(name = "Settings", description = "User preferences")
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping("/display-currency")
    @Operation(summary = "Current display currency", description = "CHF until one has been saved.")
    public ResponseEntity<DisplayCurrency> getDisplayCurrency() {
        return ResponseEntity.ok(new DisplayCurrency(settingsService.displayCurrency()));
    }

    @PutMapping("/display-currency")
    @Operation(summary = "Save the display currency", description = "Three-letter code, stored upper-cased.")
    public ResponseEntity<DisplayCurrency> updateDisplayCurrency(@RequestBody DisplayCurrency request) {
        return ResponseEntity.ok(new DisplayCurrency(settingsService.updateDisplayCurrency(request.displayCurrency())));
    }

    public record DisplayCurrency(String displayCurrency) {}
}
