package io.flowcheck.core.check;

import io.flowcheck.core.exception.MalformedStructureException;
import java.util.List;
import java.util.Map;

/// Parses embedded-structure columns (serialized lists and maps stored as text).
///
/// The core module has no JSON library. The Jackson-backed implementation lives
/// in the serialization module.
public interface StructuredFieldParser {

    /// Parses text that must hold a list.
    ///
    /// @param text the stored text, not null
    /// @return the parsed elements, never null
    /// @throws MalformedStructureException if the text is not a well-formed list
    List<Object> parseList(String text) throws MalformedStructureException;

    /// Parses text that must hold an object.
    ///
    /// @param text the stored text, not null
    /// @return the parsed fields, never null
    /// @throws MalformedStructureException if the text is not a well-formed object
    Map<String, Object> parseObject(String text) throws MalformedStructureException;
}
