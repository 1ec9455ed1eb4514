package com.docqueue.core;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;

/**
 * Abstract base class for processors providing common functionality.
 *
 * <p>This class handles:</p>
 * <ul>
 *   <li>The processor name</li>
 *   <li>JSON deserialization of the submitted metadata sidecar</li>
 * </ul>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * public class MyProcessor extends BaseProcessor {
 *     public void process(ProcessingContext context) throws Exception {
 *         MyOptions options = fromMetadata(context.readMetadata(), MyOptions.class);
 *         // ... process context.getPdfFile()
 *     }
 * }
 * }</pre>
 *
 * @see JobProcessor
 */
public abstract class BaseProcessor implements JobProcessor {
    // Shared Gson instance - thread-safe
    private static final Gson gson = new Gson();

    private final String name;

    protected BaseProcessor(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Deserialize the submitted metadata into a typed options object.
     *
     * @param metadata the metadata file content
     * @param clazz the target type
     * @return the parsed object, or null when the metadata is empty
     * @throws ProcessingException with code "invalid_metadata" if the JSON is malformed
     */
    protected <T> T fromMetadata(String metadata, Class<T> clazz) throws ProcessingException {
        if (metadata == null || metadata.isBlank()) {
            return null;
        }
        try {
            return gson.fromJson(metadata, clazz);
        } catch (JsonSyntaxException e) {
            throw new ProcessingException("invalid_metadata", "metadata is not valid JSON", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "'}";
    }
}
