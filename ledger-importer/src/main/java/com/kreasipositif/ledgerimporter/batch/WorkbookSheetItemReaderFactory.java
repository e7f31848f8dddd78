package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.config.ImporterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Creates a {@link WorkbookSheetItemReader} per sheet, each with its own {@link SheetRowMapper}
 * and id generator so that identities are computed per extraction pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkbookSheetItemReaderFactory {

    private final ImporterProperties importerProperties;

    public WorkbookSheetItemReader create(Resource workbook, String sheetName) {
        log.debug("Creating WorkbookSheetItemReader for sheet '{}' ({} ids)",
                sheetName, importerProperties.getIdentityStrategy());

        RecordIdentityGenerator identityGenerator =
                new RecordIdentityGenerator(importerProperties.getIdentityStrategy());
        WorkbookSheetItemReader reader = new WorkbookSheetItemReader(
                workbook, sheetName, new SheetRowMapper(sheetName, identityGenerator));
        reader.setName("workbookReader-" + sheetName);
        return reader;
    }
}
