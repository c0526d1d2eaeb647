package io.github.gitstore.api;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Reply envelope of every request: error messages, empty on success, and the handler's result. */
public record ApiResponse(List<String> errors, @Nullable Object result) {
    public static ApiResponse success(@Nullable Object result) {
        return new ApiResponse(List.of(), result);
    }

    public static ApiResponse failure(String error) {
        return new ApiResponse(List.of(error), null);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
