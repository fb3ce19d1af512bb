package io.stageflow.core.template;

import java.util.Map;

/// Resolves `{variable}` placeholders in strings. Pure utility, no dependencies.
public interface TemplateResolver {

    /// Substitutes placeholders from `context`.
    ///
    /// Placeholders whose variable is absent from the context are left as
    /// written; a variable present with a `null` value resolves to the empty
    /// string.
    ///
    /// @param template text with `{name}` placeholders, may be null
    /// @param context variable values, not null
    /// @return resolved text, never null
    String resolve(String template, Map<String, Object> context);
}
