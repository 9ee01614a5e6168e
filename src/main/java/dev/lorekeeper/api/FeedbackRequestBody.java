package dev.lorekeeper.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.jspecify.annotations.Nullable;

/** JSON body of the feedback endpoint. */
public record FeedbackRequestBody(
    @NotNull @Min(1) @Max(5) Integer rating, @Nullable @Size(max = 500) String comment) {}
