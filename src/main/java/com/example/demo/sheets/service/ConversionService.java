package com.example.demo.sheets.service;

import com.example.demo.sheets.core.Workbook;
import com.example.demo.sheets.core.Worksheet;
import com.example.demo.sheets.model.ConversionRequest;
import com.example.demo.sheets.model.ConversionResult;
import com.example.demo.sheets.model.OutputFormat;
import com.example.demo.sheets.writer.SheetWriterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts every sheet of a workbook into each requested format.
 * The workbook's package is held open only for the duration of one call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionService {

    private final SheetWriterRegistry writerRegistry;
    private final OutputPathResolver pathResolver;

    public ConversionResult convert(ConversionRequest request) {
        if (request.getFormats() == null || request.getFormats().isEmpty()) {
            throw new IllegalArgumentException("At least one output format is required");
        }
        ConversionResult result = new ConversionResult(request.getSource());
        try (Workbook workbook = Workbook.open(request.getSource(), request.isSanitize())) {
            Path directory = pathResolver.targetDirectory(workbook.getPath(), request.getOutputDirectory());
            pathResolver.prepareDirectory(directory);

            List<Worksheet> sheets = workbook.getSheets();
            result.setSheetCount(sheets.size());
            log.info("Converting {} sheet(s) of {} to {}", sheets.size(), workbook.getPath(), request.getFormats());

            for (Worksheet sheet : sheets) {
                log.debug("Sheet {} read from {}", sheet.getName(), sheet.getEntryName());
                for (OutputFormat format : request.getFormats()) {
                    Path target = pathResolver.resolve(workbook.getPath(), directory, sheet.getName(), format);
                    log.info("Saving {} as {}", sheet.getName(), format.getTag());
                    writerRegistry.getWriter(format).write(sheet, target);
                    result.addWrittenFile(target);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to convert " + request.getSource(), e);
        }
        return result;
    }
}
