package io.stageflow.core.process;

import io.stageflow.core.element.Element;
import io.stageflow.core.element.PropertyLookup;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Derives the history key for an element.
///
/// The first configured id property that resolves to a non-blank value
/// wins. Otherwise the id is a SHA-256 digest of a canonical rendering of
/// the element, in which map keys are sorted, so equal elements share an id.
public final class ElementIdResolver {

    static final String HASH_PREFIX = "element-";

    /// Id used when neither id properties nor element contents can be read.
    public static final String UNRESOLVED_ID = HASH_PREFIX + "unresolved";
    private static final int HASH_HEX_LENGTH = 16;

    private final List<String> idProperties;

    /// @param idProperties property paths tried in order, not null
    public ElementIdResolver(List<String> idProperties) {
        this.idProperties = List.copyOf(Objects.requireNonNull(idProperties, "idProperties"));
    }

    /// Returns the id for an element.
    ///
    /// @param element the record, not null
    /// @return id property value as a string, or a stable content hash
    public String resolve(Element element) {
        Objects.requireNonNull(element, "element must not be null");
        for (String path : idProperties) {
            PropertyLookup lookup = element.lookup(path);
            if (lookup.found() && lookup.value() != null) {
                String id = String.valueOf(lookup.value());
                if (!id.isBlank()) {
                    return id;
                }
            }
        }
        return contentHash(element);
    }

    /// Returns the content-hash id, ignoring id properties.
    ///
    /// @param element the record, not null
    /// @return `element-` followed by 16 hex digits of a SHA-256 digest, never null
    public String contentHash(Element element) {
        return HASH_PREFIX + hash(canonical(element.toMap()));
    }

    private static String hash(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String canonical(Object value) {
        StringBuilder sb = new StringBuilder();
        appendCanonical(sb, value);
        return sb.toString();
    }

    private static void appendCanonical(StringBuilder sb, Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append('"').append(entry.getKey()).append("\":");
                appendCanonical(sb, entry.getValue());
            }
            sb.append('}');
        } else if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection);
            sb.append('[');
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                appendCanonical(sb, items.get(i));
            }
            sb.append(']');
        } else if (value instanceof CharSequence text) {
            sb.append('"').append(text).append('"');
        } else {
            sb.append(value);
        }
    }
}
