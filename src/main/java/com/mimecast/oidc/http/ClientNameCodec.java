package com.mimecast.oidc.http;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Managed client name codec.
 *
 * <p>The client factory caches clients by name only and has no way to hand per-client
 * <br>context to the configuration callbacks. Properties are therefore carried in the name:
 * <pre>
 *     &lt;prefix&gt;:key1 PAIR_SEP value1 ENTRY_SEP key2 PAIR_SEP value2 ...
 * </pre>
 * <p>Two ASCII control characters are used as separators so they cannot clash with identifiers.
 *
 * <p>The codec does not validate input when encoding.
 * <br>Keys or values that are empty or contain a separator do not survive decoding.
 *
 * @see ClientProperties
 */
public class ClientNameCodec {

    /**
     * Entry separator, unit separator.
     */
    public static final char ENTRY_SEPARATOR = '\u001f';

    /**
     * Key/value separator, record separator.
     */
    public static final char PAIR_SEPARATOR = '\u001e';

    /**
     * Private constructor.
     */
    private ClientNameCodec() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Encodes properties into a client name.
     *
     * @param prefix     Name prefix.
     * @param properties Map of String, String.
     * @return Client name.
     */
    public static String encode(String prefix, Map<String, String> properties) {
        StringJoiner joiner = new StringJoiner(String.valueOf(ENTRY_SEPARATOR), prefix + ":", "");
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            joiner.add(entry.getKey() + PAIR_SEPARATOR + entry.getValue());
        }
        return joiner.toString();
    }

    /**
     * Decodes properties from a client name.
     * <p>Names that do not carry the prefix yield empty properties.
     * <br>Empty key or value parts are skipped. Entries not left with exactly one key and one value are dropped.
     * <br>Duplicate keys keep the last value.
     *
     * @param name   Client name.
     * @param prefix Name prefix.
     * @return ClientProperties instance.
     */
    public static ClientProperties decode(String name, String prefix) {
        if (!isManaged(name, prefix)) {
            return ClientProperties.empty();
        }

        Map<String, String> properties = new LinkedHashMap<>();
        String encoded = name.substring(prefix.length() + 1);
        for (String entry : encoded.split(String.valueOf(ENTRY_SEPARATOR))) {
            // Empty parts are ignored, the remaining ones must form a single pair.
            List<String> parts = new ArrayList<>(2);
            for (String part : entry.split(String.valueOf(PAIR_SEPARATOR))) {
                if (!part.isEmpty()) {
                    parts.add(part);
                }
            }
            if (parts.size() == 2) {
                properties.put(parts.get(0), parts.get(1));
            }
        }

        return new ClientProperties(properties);
    }

    /**
     * Checks if a client name is managed under the given prefix.
     *
     * @param name   Client name.
     * @param prefix Name prefix.
     * @return True if the name starts with prefix followed by a colon.
     */
    public static boolean isManaged(String name, String prefix) {
        return name != null && !name.isEmpty() && prefix != null && name.startsWith(prefix + ":");
    }
}
