package com.hrplatform.infrastructure.security;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.hrplatform.config.SensitiveDataProperties;
import com.hrplatform.domain.model.ProcessingMode;
import com.hrplatform.domain.model.SensitiveFieldType;
import com.hrplatform.domain.model.SensitiveRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Last line of defence for outbound payloads.
 *
 * <p>Walks an arbitrary response value and runs every sensitive record it finds through
 * {@link SensitiveFieldProcessor} in {@link ProcessingMode#MASK} mode:
 * <ul>
 *   <li>{@link SensitiveRecord} instances are recognised by type</li>
 *   <li>maps carrying any {@code *_encrypted} key are recognised by shape</li>
 *   <li>collections and arrays are walked element-wise, other maps value-wise; the values of a
 *       processed record are walked as well</li>
 *   <li>other objects are converted with Jackson and walked as their JSON tree; nested
 *       sensitive records are rendered in storage shape so the tree walk still finds them</li>
 * </ul>
 * When processing a sub-object fails, that sub-object is omitted from the result; the
 * unprocessed value is never returned in its place.
 *
 * @since 1.0.0
 */
@Component
@Slf4j
public class ResponseInterceptor {

    private static final Object OMITTED = new Object();

    private final SensitiveFieldProcessor processor;
    private final SensitiveDataProperties properties;
    private final ObjectMapper treeMapper;

    public ResponseInterceptor(SensitiveFieldProcessor processor,
                               SensitiveDataProperties properties,
                               ObjectMapper objectMapper) {
        this.processor = processor;
        this.properties = properties;
        this.treeMapper = objectMapper.copy()
            .registerModule(new SimpleModule("sensitive-record-attributes")
                .addSerializer(SensitiveRecord.class, new StorageShapeSerializer()));
    }

    /**
     * Intercept a payload produced for the given request path.
     */
    public Object intercept(Object payload, AccessContext context, String path) {
        if (isExcluded(path)) {
            log.debug("Skipping sensitive-data processing for excluded path {}", path);
            return payload;
        }
        return intercept(payload, context);
    }

    public Object intercept(Object payload, AccessContext context) {
        Object result = walk(payload, context);
        return result == OMITTED ? null : result;
    }

    public boolean isExcluded(String path) {
        if (path == null) {
            return false;
        }
        return properties.getExcludedPaths().stream().anyMatch(path::startsWith);
    }

    private Object walk(Object value, AccessContext context) {
        if (value == null || isScalar(value)) {
            return value;
        }

        try {
            if (value instanceof SensitiveRecord) {
                return processor.process((SensitiveRecord) value, context, ProcessingMode.MASK);
            }
            if (value instanceof Map) {
                return walkMap((Map<?, ?>) value, context);
            }
            if (value instanceof Collection) {
                return walkElements((Collection<?>) value, context);
            }
            if (value instanceof Object[]) {
                return walkElements(Arrays.asList((Object[]) value), context);
            }
            if (value.getClass().isArray()) {
                // Primitive arrays carry no records
                return value;
            }

            Object tree = treeMapper.convertValue(value, Object.class);
            if (tree == null || isScalar(tree)) {
                return tree;
            }
            return walk(tree, context);

        } catch (RuntimeException e) {
            log.error("Omitting {} from response after sensitive-data processing failed: {}",
                value.getClass().getSimpleName(), e.getClass().getSimpleName());
            return OMITTED;
        }
    }

    private Object walkMap(Map<?, ?> map, AccessContext context) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        map.forEach((key, value) -> attributes.put(key == null ? null : key.toString(), value));

        if (carriesEncryptedFields(attributes)) {
            // Values the processor copied through may hold further storage-shaped records
            return walkValues(processor.process(attributes, context, ProcessingMode.MASK), context);
        }
        return walkValues(attributes, context);
    }

    private Map<String, Object> walkValues(Map<String, Object> attributes, AccessContext context) {
        Map<String, Object> walked = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            Object result = walk(value, context);
            if (result != OMITTED) {
                walked.put(key, result);
            }
        });
        return walked;
    }

    private List<Object> walkElements(Collection<?> elements, AccessContext context) {
        List<Object> walked = new ArrayList<>(elements.size());
        for (Object element : elements) {
            Object result = walk(element, context);
            if (result != OMITTED) {
                walked.add(result);
            }
        }
        return walked;
    }

    private static boolean carriesEncryptedFields(Map<String, Object> attributes) {
        return attributes.keySet().stream()
            .anyMatch(key -> key != null && key.endsWith(SensitiveFieldType.ENCRYPTED_SUFFIX));
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Character
            || value instanceof Enum
            || value instanceof UUID
            || value instanceof TemporalAccessor;
    }

    /**
     * Writes a sensitive record as its storage attributes, ciphertext included. Only used for
     * the internal tree conversion; the result is processed before it is serialized for real.
     */
    private static final class StorageShapeSerializer extends StdSerializer<SensitiveRecord> {

        StorageShapeSerializer() {
            super(SensitiveRecord.class);
        }

        @Override
        public void serialize(SensitiveRecord value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            provider.defaultSerializeValue(value.toAttributes(), gen);
        }
    }
}
