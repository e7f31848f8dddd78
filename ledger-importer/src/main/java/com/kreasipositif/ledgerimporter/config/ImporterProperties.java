package com.kreasipositif.ledgerimporter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code importer} section from application.yml.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "importer")
public class ImporterProperties {

    /** Spring resource path of the workbook imported when no file is given explicitly. */
    private String workbookFile = "file:data/transactions_v3.xlsx";

    /** Sheets imported when the caller does not name any. */
    private List<String> defaultSheets = new ArrayList<>(List.of("crypto_transac", "stocks_transac"));

    /** Lower-case terms marking a row as a bank fee (matched against description and category). */
    private List<String> feeKeywords = new ArrayList<>(List.of("frais", "fee"));

    /** How transaction ids are assigned at extraction time. */
    private IdentityStrategy identityStrategy = IdentityStrategy.CONTENT_HASH;

    public enum IdentityStrategy {
        /** Same source row → same id on every import. */
        CONTENT_HASH,
        /** Fresh random id on every extraction. */
        RANDOM
    }
}
