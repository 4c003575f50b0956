package dev.larder.api;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

public record ParseRequest(@NotEmpty List<@Valid Link> links) {

    public record Link(@NotBlank String url, String title) {
    }
}
