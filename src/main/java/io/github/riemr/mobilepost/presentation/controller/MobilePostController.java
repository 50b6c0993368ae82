package io.github.riemr.mobilepost.presentation.controller;

import io.github.riemr.mobilepost.application.dto.ApiResponse;
import io.github.riemr.mobilepost.application.dto.MobilePostQueryParams;
import io.github.riemr.mobilepost.application.dto.MobilePostRequest;
import io.github.riemr.mobilepost.application.dto.MobilePostView;
import io.github.riemr.mobilepost.application.dto.PagedResult;
import io.github.riemr.mobilepost.application.service.MobilePostService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/mobileposts")
@RequiredArgsConstructor
public class MobilePostController {

    private final MobilePostService mobilePostService;

    @GetMapping
    public ApiResponse<List<MobilePostView>> list(@ModelAttribute MobilePostQueryParams params) {
        PagedResult<MobilePostView> page = mobilePostService.list(params);
        return ApiResponse.success("Found " + page.meta().getTotal() + " mobile post(s)", page.items(), page.meta());
    }

    @GetMapping("/{id}")
    public ApiResponse<MobilePostView> get(@PathVariable("id") Long id,
                                           @RequestParam(name = "lang", required = false) String lang) {
        return ApiResponse.success("Mobile post found", mobilePostService.get(id, lang));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<MobilePostView>> create(@Valid @RequestBody MobilePostRequest request) {
        MobilePostView created = mobilePostService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Mobile post created successfully", created));
    }

    @PutMapping("/{id}")
    public ApiResponse<MobilePostView> update(@PathVariable("id") Long id,
                                              @Valid @RequestBody(required = false) MobilePostRequest request) {
        return ApiResponse.success("Mobile post updated successfully", mobilePostService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Map<String, Long>> delete(@PathVariable("id") Long id) {
        mobilePostService.delete(id);
        return ApiResponse.success("Mobile post deleted successfully", Map.of("id", id));
    }
}
