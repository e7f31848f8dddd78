package com.kreasipositif.ledgerimporter.batch;

import org.springframework.batch.item.ItemStreamException;

/**
 * Structural import failure: workbook missing or unreadable, or a requested sheet absent.
 * Aborts the whole import; nothing from the run is kept.
 */
public class WorkbookImportException extends ItemStreamException {

    public WorkbookImportException(String message) {
        super(message);
    }

    public WorkbookImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
