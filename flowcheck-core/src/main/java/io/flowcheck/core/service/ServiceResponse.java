package io.flowcheck.core.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Decoded answer from the task service.
///
/// @param statusCode HTTP status code
/// @param body decoded JSON body: a `Map`, a `List`, a scalar, the raw text of a
/// non-JSON body, or null for an empty body
public record ServiceResponse(int statusCode, Object body) {

    /// Returns whether the status code is in the `2xx` range.
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /// Returns whether the status code is in the `4xx` range.
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    /// Reads a top-level field of an object body.
    ///
    /// @param name field name, not null
    /// @return the field value, empty if absent or the body is not an object
    public Optional<Object> field(String name) {
        if (body instanceof Map<?, ?> map) {
            return Optional.ofNullable(map.get(name));
        }
        return Optional.empty();
    }

    /// Reads a top-level field of an object body as text.
    ///
    /// @param name field name, not null
    /// @return the value's string form, empty if absent
    public Optional<String> text(String name) {
        return field(name).map(String::valueOf);
    }

    /// Returns the list items of a collection body.
    ///
    /// Accepts a bare JSON array, or an object wrapping the array under `items` or `data`.
    ///
    /// @return the items, empty if the body holds no list, never null
    public List<?> items() {
        if (body instanceof List<?> list) {
            return list;
        }
        for (String key : List.of("items", "data")) {
            Optional<Object> wrapped = field(key);
            if (wrapped.isPresent() && wrapped.get() instanceof List<?> list) {
                return list;
            }
        }
        return List.of();
    }
}
