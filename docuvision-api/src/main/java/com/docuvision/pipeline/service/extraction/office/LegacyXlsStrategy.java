package com.docuvision.pipeline.service.extraction.office;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import org.apache.poi.hssf.eventusermodel.HSSFEventFactory;
import org.apache.poi.hssf.eventusermodel.HSSFListener;
import org.apache.poi.hssf.eventusermodel.HSSFRequest;
import org.apache.poi.hssf.record.BOFRecord;
import org.apache.poi.hssf.record.BoolErrRecord;
import org.apache.poi.hssf.record.FormulaRecord;
import org.apache.poi.hssf.record.LabelRecord;
import org.apache.poi.hssf.record.LabelSSTRecord;
import org.apache.poi.hssf.record.NumberRecord;
import org.apache.poi.hssf.record.RKRecord;
import org.apache.poi.hssf.record.Record;
import org.apache.poi.hssf.record.SSTRecord;
import org.apache.poi.hssf.record.StringRecord;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Fallback reader for legacy XLS workbooks. Walks the BIFF record stream with the HSSF event
 * model instead of building the user model, so workbooks with broken styles, names or drawing
 * records can still give up their cell values. Rows render like {@link WorkbookStrategy}.
 */
@Component
public class LegacyXlsStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(LegacyXlsStrategy.class);

    @Override
    public String name() {
        return "xls-events";
    }

    @Override
    public StrategyResult attempt(Path file) {
        log.info("Reading {} as a legacy record stream", file);
        try (POIFSFileSystem fs = new POIFSFileSystem(file.toFile(), true)) {
            RecordCollector collector = new RecordCollector();
            HSSFRequest request = new HSSFRequest();
            request.addListenerForAllRecords(collector);
            new HSSFEventFactory().processWorkbookEvents(request, fs);
            return StrategyResult.success(collector.finish());
        } catch (Exception e) {
            log.error("Legacy XLS reader failed on {}: {}", file, e.getMessage());
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, "Legacy XLS reader failed: " + e.getMessage());
        }
    }

    private static final class RecordCollector implements HSSFListener {

        private final StringBuilder text = new StringBuilder();
        private SheetTextRenderer sheet;
        private SSTRecord sharedStrings;
        private FormulaRecord pendingStringFormula;

        @Override
        public void processRecord(Record record) {
            if (record instanceof BOFRecord bof) {
                if (bof.getType() == BOFRecord.TYPE_WORKSHEET) {
                    flushSheet();
                    sheet = new SheetTextRenderer();
                }
            } else if (record instanceof SSTRecord sst) {
                sharedStrings = sst;
            } else if (record instanceof LabelSSTRecord label) {
                if (sharedStrings != null) {
                    put(label.getRow(), label.getColumn(), sharedStrings.getString(label.getSSTIndex()).getString());
                }
            } else if (record instanceof LabelRecord label) {
                put(label.getRow(), label.getColumn(), label.getValue());
            } else if (record instanceof NumberRecord number) {
                put(number.getRow(), number.getColumn(), NumberToTextConverter.toText(number.getValue()));
            } else if (record instanceof RKRecord rk) {
                put(rk.getRow(), rk.getColumn(), NumberToTextConverter.toText(rk.getRKNumber()));
            } else if (record instanceof BoolErrRecord boolErr) {
                put(boolErr.getRow(), boolErr.getColumn(), boolErr.isError()
                        ? FormulaError.forInt(boolErr.getErrorValue()).getString()
                        : boolErr.getBooleanValue() ? "TRUE" : "FALSE");
            } else if (record instanceof FormulaRecord formula) {
                renderFormula(formula);
            } else if (record instanceof StringRecord string && pendingStringFormula != null) {
                put(pendingStringFormula.getRow(), pendingStringFormula.getColumn(), string.getString());
                pendingStringFormula = null;
            }
        }

        private void renderFormula(FormulaRecord formula) {
            if (formula.hasCachedResultString()) {
                pendingStringFormula = formula;
                return;
            }
            switch (formula.getCachedResultTypeEnum()) {
                case NUMERIC -> put(formula.getRow(), formula.getColumn(), NumberToTextConverter.toText(formula.getValue()));
                case BOOLEAN -> put(formula.getRow(), formula.getColumn(), formula.getCachedBooleanValue() ? "TRUE" : "FALSE");
                case ERROR -> put(formula.getRow(), formula.getColumn(), FormulaError.forInt(formula.getCachedErrorValue()).getString());
                default -> {
                }
            }
        }

        private void put(int row, int column, String value) {
            if (sheet != null && value != null && !value.isEmpty()) {
                sheet.put(row, column, value);
            }
        }

        private void flushSheet() {
            if (sheet != null) {
                sheet.appendTo(text);
            }
        }

        String finish() {
            flushSheet();
            sheet = null;
            return text.toString();
        }
    }
}
