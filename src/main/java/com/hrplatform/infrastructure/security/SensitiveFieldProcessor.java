package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.DataScope;
import com.hrplatform.domain.model.ProcessingMode;
import com.hrplatform.domain.model.SensitiveFieldType;
import com.hrplatform.domain.model.SensitiveRecord;
import com.hrplatform.infrastructure.crypto.CryptoService;
import com.hrplatform.infrastructure.crypto.EncryptionException;
import com.hrplatform.infrastructure.crypto.MaskingPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides, per sensitive field, whether a caller sees plaintext, a mask, or nothing.
 *
 * <p>This is the single enforcement point for sensitive-data visibility. Query-level scope
 * filters narrow which rows are loaded, but a row that reaches this processor is still checked
 * against the caller's scope before anything is decrypted for display.
 *
 * <p>Reveal rule:
 * <ol>
 *   <li>the caller's own record is always revealed</li>
 *   <li>otherwise the caller needs {@code canViewSensitive} and a scope covering the record:
 *       {@code all}, {@code department} with the same department, or {@code self} with the
 *       same identity</li>
 * </ol>
 * Fields that are not revealed are masked ({@link ProcessingMode#MASK}) or dropped
 * ({@link ProcessingMode#OMIT}). Storage keys ({@code *_encrypted}, {@code *_hash}) never
 * survive processing.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SensitiveFieldProcessor {

    private final CryptoService cryptoService;

    public Map<String, Object> process(SensitiveRecord record, AccessContext context, ProcessingMode mode) {
        Objects.requireNonNull(record, "Record must not be null");
        return process(record.toAttributes(), context, mode);
    }

    /**
     * Process a storage-shaped attribute map.
     *
     * @return a new map; the input is not modified
     * @throws EncryptionException if a field the caller may fully see cannot be decrypted
     */
    public Map<String, Object> process(Map<String, ?> record, AccessContext context, ProcessingMode mode) {
        Objects.requireNonNull(record, "Record must not be null");
        Objects.requireNonNull(context, "Access context must not be null");
        Objects.requireNonNull(mode, "Processing mode must not be null");

        String employeeId = asString(record.get(SensitiveRecord.EMPLOYEE_ID_KEY));
        String departmentId = asString(record.get(SensitiveRecord.DEPARTMENT_ID_KEY));
        boolean reveal = canReveal(context, departmentId, employeeId);

        Map<String, Object> processed = new LinkedHashMap<>();
        record.forEach((key, value) -> {
            if (!SensitiveFieldType.isInternalKey(key)) {
                processed.put(key, value);
            }
        });

        for (SensitiveFieldType type : SensitiveFieldType.values()) {
            Object stored = record.get(type.getEncryptedKey());
            if (stored != null && !stored.toString().isBlank()) {
                String ciphertext = stored.toString();
                if (reveal) {
                    processed.put(type.getFieldName(), reveal(type, ciphertext, employeeId));
                } else if (mode == ProcessingMode.MASK) {
                    processed.put(type.getFieldName(), mask(type, ciphertext, employeeId));
                } else {
                    processed.remove(type.getFieldName());
                }
            } else if (!reveal && processed.containsKey(type.getFieldName())) {
                // Plaintext copy under the public name gets the same treatment as a decrypted value
                Object plaintext = processed.get(type.getFieldName());
                if (mode == ProcessingMode.MASK && plaintext != null) {
                    processed.put(type.getFieldName(), MaskingPolicy.mask(type, plaintext.toString()));
                } else {
                    processed.remove(type.getFieldName());
                }
            }
        }

        return processed;
    }

    /**
     * Element-wise {@link #process(SensitiveRecord, AccessContext, ProcessingMode)}; order is
     * preserved.
     */
    public List<Map<String, Object>> processList(List<? extends SensitiveRecord> records,
                                                 AccessContext context,
                                                 ProcessingMode mode) {
        if (records == null) {
            return List.of();
        }
        List<Map<String, Object>> processed = new ArrayList<>(records.size());
        for (SensitiveRecord record : records) {
            processed.add(process(record, context, mode));
        }
        return processed;
    }

    /**
     * Whether the caller may see full plaintext of a record owned by the given department and
     * employee.
     */
    public boolean canReveal(AccessContext context, String departmentId, String employeeId) {
        if (context.isOwner(employeeId)) {
            return true;
        }
        if (!context.isCanViewSensitive()) {
            return false;
        }

        DataScope scope = context.getDataScope();
        switch (scope) {
            case ALL:
                return true;
            case DEPARTMENT:
                return context.isInDepartment(departmentId);
            case SELF:
            default:
                // Owner case handled above
                return false;
        }
    }

    private String reveal(SensitiveFieldType type, String ciphertext, String employeeId) {
        try {
            return cryptoService.decrypt(ciphertext);
        } catch (EncryptionException e) {
            log.error("Failed to decrypt {} for employee {}: {}", type.getFieldName(), employeeId, e.getMessage());
            throw e;
        }
    }

    private String mask(SensitiveFieldType type, String ciphertext, String employeeId) {
        try {
            return MaskingPolicy.mask(type, cryptoService.decrypt(ciphertext));
        } catch (EncryptionException e) {
            log.warn("Failed to decrypt {} for masking, employee {}: {}", type.getFieldName(), employeeId, e.getMessage());
            return MaskingPolicy.placeholder(type);
        }
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
