package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.config.ImporterProperties.IdentityStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordIdentityGeneratorTest {

    private static final Map<String, String> ROW = Map.of(
            "account_id", "CH-001",
            "transac_date", "2024-04-03",
            "transac_nbr", "T-77",
            "debit", "45",
            "descr_1", "Coop");

    @Test
    @DisplayName("Same row content gets the same id on a fresh extraction pass")
    void contentHash_isStableAcrossPasses() {
        String first = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH).nextId("bank", ROW);
        String second = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH).nextId("bank", ROW);

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Identical rows within one pass get distinct, reproducible ids")
    void contentHash_duplicatesAreDisambiguated() {
        RecordIdentityGenerator pass1 = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH);
        String a1 = pass1.nextId("bank", ROW);
        String b1 = pass1.nextId("bank", ROW);

        RecordIdentityGenerator pass2 = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH);
        String a2 = pass2.nextId("bank", ROW);
        String b2 = pass2.nextId("bank", ROW);

        assertThat(a1).isNotEqualTo(b1);
        assertThat(a1).isEqualTo(a2);
        assertThat(b1).isEqualTo(b2);
    }

    @Test
    void contentHash_dependsOnSheetAndAmount() {
        RecordIdentityGenerator generator = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH);
        String base = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH).nextId("bank", ROW);

        assertThat(generator.nextId("other", ROW)).isNotEqualTo(base);
        assertThat(generator.nextId("bank", Map.of(
                "account_id", "CH-001",
                "transac_date", "2024-04-03",
                "transac_nbr", "T-77",
                "debit", "46"))).isNotEqualTo(base);
    }

    @Test
    void contentHash_ignoresDescriptionColumns() {
        String withDescription = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH).nextId("bank", ROW);
        String without = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH).nextId("bank", Map.of(
                "account_id", "CH-001",
                "transac_date", "2024-04-03",
                "transac_nbr", "T-77",
                "debit", "45"));

        assertThat(withDescription).isEqualTo(without);
    }

    @Test
    void rowWithoutDiscriminators_getsRandomId() {
        RecordIdentityGenerator generator = new RecordIdentityGenerator(IdentityStrategy.CONTENT_HASH);
        Map<String, String> onlyText = Map.of("descr_1", "note");

        assertThat(generator.nextId("bank", onlyText)).isNotEqualTo(generator.nextId("bank", onlyText));
    }

    @Test
    void randomStrategy_neverRepeats() {
        RecordIdentityGenerator generator = new RecordIdentityGenerator(IdentityStrategy.RANDOM);

        assertThat(generator.nextId("bank", ROW)).isNotEqualTo(generator.nextId("bank", ROW));
    }
}
