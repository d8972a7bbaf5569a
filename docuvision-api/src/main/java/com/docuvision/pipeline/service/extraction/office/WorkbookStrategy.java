package com.docuvision.pipeline.service.extraction.office;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Reads XLS and XLSX workbooks through the POI user model. Formula cells are rendered from
 * their cached results; nothing is recalculated.
 */
@Component
public class WorkbookStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(WorkbookStrategy.class);

    @Override
    public String name() {
        return "poi-workbook";
    }

    @Override
    public StrategyResult attempt(Path file) {
        log.info("Attempting to read workbook {}", file);
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            StringBuilder text = new StringBuilder();
            for (Sheet sheet : workbook) {
                SheetTextRenderer renderer = new SheetTextRenderer();
                for (Row row : sheet) {
                    for (Cell cell : row) {
                        String value = render(cell);
                        if (!value.isEmpty()) {
                            renderer.put(row.getRowNum(), cell.getColumnIndex(), value);
                        }
                    }
                }
                renderer.appendTo(text);
            }
            return StrategyResult.success(text.toString());
        } catch (Exception e) {
            log.warn("POI user model failed on {}: {}", file, e.getMessage());
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, "Workbook could not be read: " + e.getMessage());
        }
    }

    private String render(Cell cell) {
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> cell.getRichStringCellValue().getString();
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue().toString()
                    : NumberToTextConverter.toText(cell.getNumericCellValue());
            case BOOLEAN -> cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            case ERROR -> FormulaError.forInt(cell.getErrorCellValue()).getString();
            default -> "";
        };
    }
}
