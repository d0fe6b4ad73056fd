package com.wayfarer.crm.api;

import jakarta.validation.constraints.NotBlank;

/** Body of the status-change endpoints. */
public record StatusUpdateRequest(@NotBlank String status) {}
