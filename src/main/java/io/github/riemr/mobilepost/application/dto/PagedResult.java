package io.github.riemr.mobilepost.application.dto;

import java.util.List;

public record PagedResult<T>(List<T> items, PageMeta meta) {
}
