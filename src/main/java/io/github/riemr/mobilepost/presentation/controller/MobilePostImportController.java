package io.github.riemr.mobilepost.presentation.controller;

import io.github.riemr.mobilepost.application.dto.ApiResponse;
import io.github.riemr.mobilepost.application.dto.ImportReport;
import io.github.riemr.mobilepost.application.exception.ApiException;
import io.github.riemr.mobilepost.application.exception.ErrorCode;
import io.github.riemr.mobilepost.application.service.MobilePostImportService;
import io.github.riemr.mobilepost.infrastructure.source.CsvBatchSource;
import io.github.riemr.mobilepost.infrastructure.source.JsonFeedBatchSource;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/mobileposts/import")
@RequiredArgsConstructor
public class MobilePostImportController {

    private final MobilePostImportService importService;
    private final JsonFeedBatchSource feedSource;

    @PostMapping
    public ApiResponse<ImportReport> importFeed() {
        return done(importService.importFrom(feedSource));
    }

    @PostMapping("/csv")
    public ApiResponse<ImportReport> importCsv(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new ApiException(ErrorCode.INVALID_PARAMETER_VALUE, "file must not be empty");
        }
        String name = file.getOriginalFilename() == null ? "upload.csv" : file.getOriginalFilename();
        return done(importService.importFrom(new CsvBatchSource(name, file.getInputStream())));
    }

    private static ApiResponse<ImportReport> done(ImportReport report) {
        String message = "Import completed: " + report.getImported() + " imported, "
                + report.getSkipped() + " skipped, " + report.getDuplicate() + " duplicate(s)";
        return ApiResponse.success(message, report);
    }
}
