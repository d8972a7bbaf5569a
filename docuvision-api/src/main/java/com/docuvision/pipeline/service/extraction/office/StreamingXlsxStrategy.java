package com.docuvision.pipeline.service.extraction.office;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.util.XMLHelper;
import org.apache.poi.xssf.eventusermodel.ReadOnlySharedStringsTable;
import org.apache.poi.xssf.eventusermodel.XSSFReader;
import org.apache.poi.xssf.eventusermodel.XSSFSheetXMLHandler;
import org.apache.poi.xssf.model.StylesTable;
import org.apache.poi.xssf.usermodel.XSSFComment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.InputSource;
import org.xml.sax.XMLReader;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Fallback spreadsheet reader working on the raw sheet XML. It tolerates workbooks the user
 * model rejects (oversized or partially broken styles) and renders rows the same way.
 */
@Component
public class StreamingXlsxStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(StreamingXlsxStrategy.class);

    @Override
    public String name() {
        return "xlsx-streaming";
    }

    @Override
    public StrategyResult attempt(Path file) {
        try (OPCPackage pkg = OPCPackage.open(file.toFile(), PackageAccess.READ)) {
            ReadOnlySharedStringsTable strings = new ReadOnlySharedStringsTable(pkg);
            XSSFReader reader = new XSSFReader(pkg);
            StylesTable styles = reader.getStylesTable();
            StringBuilder text = new StringBuilder();
            Iterator<InputStream> sheets = reader.getSheetsData();
            while (sheets.hasNext()) {
                SheetTextRenderer renderer = new SheetTextRenderer();
                try (InputStream sheet = sheets.next()) {
                    XMLReader parser = XMLHelper.newXMLReader();
                    parser.setContentHandler(new XSSFSheetXMLHandler(styles, strings, new CellCollector(renderer), false));
                    parser.parse(new InputSource(sheet));
                }
                renderer.appendTo(text);
            }
            return StrategyResult.success(text.toString());
        } catch (Exception e) {
            log.error("Streaming XLSX reader failed on {}: {}", file, e.getMessage());
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, "Streaming reader failed: " + e.getMessage());
        }
    }

    private static final class CellCollector implements XSSFSheetXMLHandler.SheetContentsHandler {

        private final SheetTextRenderer renderer;
        private int currentRow;

        private CellCollector(SheetTextRenderer renderer) {
            this.renderer = renderer;
        }

        @Override
        public void startRow(int rowNum) {
            currentRow = rowNum;
        }

        @Override
        public void endRow(int rowNum) {
        }

        @Override
        public void cell(String cellReference, String formattedValue, XSSFComment comment) {
            if (formattedValue == null || formattedValue.isEmpty()) {
                return;
            }
            int column = cellReference == null ? 0 : new CellReference(cellReference).getCol();
            renderer.put(currentRow, column, formattedValue);
        }
    }
}
